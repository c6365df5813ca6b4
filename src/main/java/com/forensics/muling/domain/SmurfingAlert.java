package com.forensics.muling.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Set;

/**
 * Smurfing verdict for one account, built from its highest-scoring 72-hour window.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SmurfingAlert {

    String accountId;
    Instant windowStart;
    Instant windowEnd;
    /** Distinct senders in the window. */
    int fanIn;
    /** Distinct receivers in the window. */
    int fanOut;
    int transactionCount;
    BigDecimal totalAmount;
    double elapsedHours;
    /** Transactions per hour over the elapsed span. */
    double velocity;
    /** Share of amounts sitting just under a reporting threshold. */
    double structuringRatio;
    /** 0–100. */
    double riskScore;
    Set<SmurfingFlag> flags;
}
