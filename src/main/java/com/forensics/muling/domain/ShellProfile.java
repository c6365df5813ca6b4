package com.forensics.muling.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Set;

/**
 * Shell/pass-through profile of one account. All sub-scores are on a 0–100 scale;
 * {@link #shellScore} is their weighted composite.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ShellProfile {

    String accountId;
    int totalTransactions;
    BigDecimal totalThroughput;
    BigDecimal totalIn;
    BigDecimal totalOut;
    double avgTransactionValue;
    int uniqueSources;
    int uniqueDestinations;

    double highValueScore;
    double passThroughScore;
    double connectionScore;
    double dormancyScore;
    double directionalityScore;
    double uniformityScore;

    double shellScore;
    RiskLevel riskLevel;
    Set<RiskFactor> riskFactors;
}
