package com.forensics.muling.graph;

import com.forensics.muling.domain.Transaction;
import com.forensics.muling.exception.DuplicateTransactionIdException;
import com.forensics.muling.exception.InvalidTransactionException;
import com.forensics.muling.exception.TransactionValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Validates the input batch and builds the {@link TransactionGraph} with per-account statistics.
 * Input order does not matter: transactions are sorted by (timestamp, id) first, so identical sets
 * always produce identical graphs.
 */
@Slf4j
@Component
public class GraphBuilder {

    public TransactionGraph build(List<Transaction> input) {
        if (input == null || input.isEmpty()) {
            return TransactionGraph.empty();
        }
        validate(input);

        List<Transaction> ordered = new ArrayList<>(input);
        ordered.sort(Transaction.CHRONOLOGICAL);

        Map<String, Accumulator> accumulators = new HashMap<>();
        Map<String, SortedMap<String, List<Transaction>>> adjacency = new HashMap<>();
        for (Transaction txn : ordered) {
            Accumulator sender = accumulators.computeIfAbsent(txn.getFromAccount(), Accumulator::new);
            Accumulator receiver = accumulators.computeIfAbsent(txn.getToAccount(), Accumulator::new);
            sender.recordOutbound(txn);
            receiver.recordInbound(txn);
            if (!txn.isSelfLoop()) {
                adjacency.computeIfAbsent(txn.getFromAccount(), k -> new TreeMap<>())
                        .computeIfAbsent(txn.getToAccount(), k -> new ArrayList<>())
                        .add(txn);
            }
        }

        SortedMap<String, AccountStats> stats = new TreeMap<>();
        accumulators.forEach((id, acc) -> stats.put(id, acc.toStats()));
        Map<String, SortedMap<String, List<Transaction>>> frozen = new HashMap<>();
        adjacency.forEach((from, edges) -> {
            SortedMap<String, List<Transaction>> copy = new TreeMap<>();
            edges.forEach((to, txns) -> copy.put(to, List.copyOf(txns)));
            frozen.put(from, Collections.unmodifiableSortedMap(copy));
        });

        log.debug("Built transaction graph: accounts={}, transactions={}, edgeSources={}",
                stats.size(), ordered.size(), frozen.size());
        return new TransactionGraph(List.copyOf(ordered), Collections.unmodifiableSortedMap(stats),
                Collections.unmodifiableMap(frozen));
    }

    private static void validate(List<Transaction> input) {
        Set<String> seenIds = new HashSet<>();
        for (int index = 0; index < input.size(); index++) {
            Transaction txn = input.get(index);
            if (txn == null) {
                throw new TransactionValidationException("Transaction at index " + index + " is null");
            }
            requireText(txn, "id", txn.getId());
            requireText(txn, "from_account", txn.getFromAccount());
            requireText(txn, "to_account", txn.getToAccount());
            if (txn.getAmount() == null) {
                throw new InvalidTransactionException(txn, "amount", "is missing");
            }
            if (txn.getAmount().signum() <= 0) {
                throw new InvalidTransactionException(txn, "amount", "must be positive but was " + txn.getAmount());
            }
            if (txn.getTimestamp() == null) {
                throw new InvalidTransactionException(txn, "timestamp", "is missing");
            }
            if (!seenIds.add(txn.getId())) {
                throw new DuplicateTransactionIdException(txn.getId());
            }
        }
    }

    private static void requireText(Transaction txn, String field, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidTransactionException(txn, field, "is missing or blank");
        }
    }

    private static final class Accumulator {
        private final String accountId;
        private BigDecimal totalIn = BigDecimal.ZERO;
        private BigDecimal totalOut = BigDecimal.ZERO;
        private int inboundCount;
        private int outboundCount;
        private final TreeSet<String> sources = new TreeSet<>();
        private final TreeSet<String> destinations = new TreeSet<>();
        private final List<Transaction> transactions = new ArrayList<>();
        private Instant firstSeen;
        private Instant lastSeen;

        private Accumulator(String accountId) {
            this.accountId = accountId;
        }

        void recordOutbound(Transaction txn) {
            totalOut = totalOut.add(txn.getAmount());
            outboundCount++;
            destinations.add(txn.getToAccount());
            touch(txn);
        }

        void recordInbound(Transaction txn) {
            totalIn = totalIn.add(txn.getAmount());
            inboundCount++;
            sources.add(txn.getFromAccount());
            if (!txn.isSelfLoop()) {
                touch(txn);
            }
        }

        // input arrives chronologically, so the first touch is the earliest
        private void touch(Transaction txn) {
            transactions.add(txn);
            if (firstSeen == null) firstSeen = txn.getTimestamp();
            lastSeen = txn.getTimestamp();
        }

        AccountStats toStats() {
            return AccountStats.builder()
                    .accountId(accountId)
                    .totalIn(totalIn)
                    .totalOut(totalOut)
                    .inboundCount(inboundCount)
                    .outboundCount(outboundCount)
                    .sources(Collections.unmodifiableSortedSet(sources))
                    .destinations(Collections.unmodifiableSortedSet(destinations))
                    .firstSeen(firstSeen)
                    .lastSeen(lastSeen)
                    .transactions(List.copyOf(transactions))
                    .build();
        }
    }
}
