package com.forensics.muling.graph;

import com.forensics.muling.domain.Transaction;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Directed multigraph of accounts (nodes) and transactions (edges). Parallel edges between the
 * same pair are kept as separate transactions. Self-loops are present in {@link #getTransactions()}
 * and in account statistics but not in the adjacency used for path search.
 * <p>
 * Instances are built by {@link GraphBuilder} and never change afterwards, so they can be shared
 * freely between detector threads.
 */
public final class TransactionGraph {

    private static final TransactionGraph EMPTY = new TransactionGraph(List.of(),
            Collections.emptySortedMap(), Map.of());

    private final List<Transaction> transactions;
    private final SortedMap<String, AccountStats> accounts;
    /** from -> (to -> transactions on that edge, chronological). */
    private final Map<String, SortedMap<String, List<Transaction>>> adjacency;

    TransactionGraph(List<Transaction> transactions,
                     SortedMap<String, AccountStats> accounts,
                     Map<String, SortedMap<String, List<Transaction>>> adjacency) {
        this.transactions = transactions;
        this.accounts = accounts;
        this.adjacency = adjacency;
    }

    public static TransactionGraph empty() {
        return EMPTY;
    }

    /** All input transactions in canonical order (timestamp, then id). */
    public List<Transaction> getTransactions() {
        return transactions;
    }

    /** Account ids in ascending order. */
    public Set<String> getAccountIds() {
        return accounts.keySet();
    }

    public Optional<AccountStats> getStats(String accountId) {
        return Optional.ofNullable(accounts.get(accountId));
    }

    public SortedMap<String, AccountStats> getAllStats() {
        return accounts;
    }

    public int getAccountCount() {
        return accounts.size();
    }

    public int getTransactionCount() {
        return transactions.size();
    }

    public boolean isEmpty() {
        return transactions.isEmpty();
    }

    /** Distinct receiving accounts reachable by one non-self-loop edge, ascending. */
    public Set<String> successors(String accountId) {
        SortedMap<String, List<Transaction>> out = adjacency.get(accountId);
        return out == null ? Collections.emptySortedSet() : out.keySet();
    }

    public int outDegree(String accountId) {
        return successors(accountId).size();
    }

    public boolean hasEdge(String from, String to) {
        SortedMap<String, List<Transaction>> out = adjacency.get(from);
        return out != null && out.containsKey(to);
    }

    /** Parallel transactions on the edge {@code from -> to}, chronological; empty if none. */
    public List<Transaction> transactionsBetween(String from, String to) {
        SortedMap<String, List<Transaction>> out = adjacency.get(from);
        if (out == null) return List.of();
        return out.getOrDefault(to, List.of());
    }

    /**
     * Accounts reachable from {@code accountId} within {@code depth} outgoing hops, excluding the
     * account itself.
     */
    public SortedSet<String> neighbours(String accountId, int depth) {
        SortedSet<String> found = new TreeSet<>();
        if (depth <= 0 || !accounts.containsKey(accountId)) return found;
        Set<String> visited = new TreeSet<>();
        Deque<Map.Entry<String, Integer>> queue = new ArrayDeque<>();
        queue.add(Map.entry(accountId, 0));
        visited.add(accountId);
        while (!queue.isEmpty()) {
            Map.Entry<String, Integer> current = queue.poll();
            if (current.getValue() >= depth) continue;
            for (String next : successors(current.getKey())) {
                if (visited.add(next)) {
                    found.add(next);
                    queue.add(Map.entry(next, current.getValue() + 1));
                }
            }
        }
        return found;
    }
}
