package com.forensics.muling.smurfing;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Aggregates over one account's transactions inside a single time window.
 */
@Value
@Builder
public class WindowFeatures {

    String accountId;
    Instant windowStart;
    Instant windowEnd;
    int transactionCount;
    int fanIn;
    int fanOut;
    BigDecimal totalAmount;
    BigDecimal inboundAmount;
    /** Largest single outbound transfer, zero when the window has none. */
    BigDecimal maxOutboundAmount;
    /** Hours between first and last transaction, never below 1. */
    double elapsedHours;
    double velocity;
    /** Share of amounts just under a reporting threshold. */
    double structuringRatio;
}
