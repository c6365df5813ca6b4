package com.forensics.muling.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Final per-account verdict. This is what every downstream consumer (API, narrative, graph view)
 * reads; scores are 0–100.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AccountScore {

    String accountId;
    double ringInvolvementScore;
    double smurfingScore;
    double shellScore;
    double transactionPatternScore;
    double finalScore;
    RiskLevel riskLevel;
    List<RiskFactor> riskFactors;
}
