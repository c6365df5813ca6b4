package com.forensics.muling.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * A ring: closed directed walk over distinct accounts where funds return to the origin.
 * Accounts are stored in canonical rotation (lexicographically smallest id first, direction kept),
 * so two cycles are equal exactly when their account lists are equal.
 */
@Value
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Cycle {

    /** Assigned in rank order, e.g. RING_001 for the strongest ring. */
    String ringId;
    List<String> accounts;
    int length;
    /** Every transaction on every edge of the walk, in edge order then chronological order. */
    List<String> transactionIds;
    BigDecimal totalAmount;
    int transactionCount;
    double averageTransaction;
    /** Coefficient of variation of per-edge amounts, capped at 1. Lower is more suspicious. */
    double amountSpread;
    /** Ranking score only, not bounded above. */
    double strength;

    public boolean contains(String accountId) {
        return accounts.contains(accountId);
    }
}
