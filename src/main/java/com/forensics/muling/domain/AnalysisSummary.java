package com.forensics.muling.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Headline numbers for one analysis run.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AnalysisSummary {

    int totalAccounts;
    int totalTransactions;
    BigDecimal totalVolume;
    BigDecimal avgTransaction;
    BigDecimal medianTransaction;
    BigDecimal minTransaction;
    BigDecimal maxTransaction;
    int cyclesDetected;
    double avgCycleLength;
    int accountsInRings;
    int smurfingAlertsCount;
    int shellAccountsCount;
    /** Accounts whose outflow matches their inflow, whatever their volume. */
    int passThroughAccounts;
    int highRiskAccounts;
    int criticalAccounts;
    int suspiciousAccounts;
    /** Share of accounts rated HIGH or CRITICAL, as a percentage. */
    double suspiciousPercent;
}
