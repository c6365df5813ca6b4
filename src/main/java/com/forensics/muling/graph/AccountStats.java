package com.forensics.muling.graph;

import com.forensics.muling.domain.Transaction;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.SortedSet;

/**
 * Per-account aggregates computed once per run by {@link GraphBuilder}. A self-loop counts on both
 * the inbound and the outbound side, so it adds two to {@link #getSideCount()} while appearing once
 * in {@link #transactions}.
 */
@Value
@Builder
public class AccountStats {

    String accountId;
    BigDecimal totalIn;
    BigDecimal totalOut;
    int inboundCount;
    int outboundCount;
    SortedSet<String> sources;
    SortedSet<String> destinations;
    Instant firstSeen;
    Instant lastSeen;
    /** Every transaction touching the account, chronological. */
    List<Transaction> transactions;

    public int getTransactionCount() {
        return transactions.size();
    }

    /** Inbound plus outbound transactions; a self-loop counts once on each side. */
    public int getSideCount() {
        return inboundCount + outboundCount;
    }

    public BigDecimal getThroughput() {
        return totalIn.add(totalOut);
    }

    public int getUniqueSources() {
        return sources.size();
    }

    public int getUniqueDestinations() {
        return destinations.size();
    }
}
