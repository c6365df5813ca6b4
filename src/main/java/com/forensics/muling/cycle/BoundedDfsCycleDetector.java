package com.forensics.muling.cycle;

import com.forensics.muling.config.DetectionConfig;
import com.forensics.muling.domain.Cycle;
import com.forensics.muling.domain.CycleOverlap;
import com.forensics.muling.domain.RingCluster;
import com.forensics.muling.domain.Transaction;
import com.forensics.muling.graph.TransactionGraph;
import com.forensics.muling.support.ParallelRunner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Bounded-length ring search. DFS starts only from the top-K accounts by out-degree: accounts
 * with few outgoing edges rarely originate meaningful flows, and the cap keeps dense graphs from
 * exploding. Rings are deduplicated by canonical rotation, scored by
 * {@code 0.40*volume/normalizer + 0.35*txns/10 + 0.25*length/3} and truncated to the strongest N.
 */
@Slf4j
@Component
public class BoundedDfsCycleDetector implements CycleDetectionStrategy {

    public static final String NAME = "v2";

    static final double VOLUME_WEIGHT = 0.40;
    static final double FREQUENCY_WEIGHT = 0.35;
    static final double COMPLEXITY_WEIGHT = 0.25;

    /** Strength descending, then shorter rings, then lexicographically smaller account tuple. */
    static final Comparator<Cycle> RANKING = Comparator.comparingDouble(Cycle::getStrength).reversed()
            .thenComparingInt(Cycle::getLength)
            .thenComparing(Cycle::getAccounts, BoundedDfsCycleDetector::compareAccounts);

    @Override
    public CycleDetectionResult detect(TransactionGraph graph, DetectionConfig.CycleSettings settings,
                                       ParallelRunner runner) {
        if (graph.isEmpty()) return CycleDetectionResult.empty();

        List<String> starts = startNodes(graph, settings.getMaxStartNodes());
        List<List<List<String>>> perStart = runner.mapInOrder(starts,
                start -> searchFrom(graph, start, settings.getMinLength(), settings.getMaxLength()));

        // serial merge: dedup by canonical rotation, first occurrence wins
        Map<List<String>, Boolean> unique = new LinkedHashMap<>();
        int rawCount = 0;
        for (List<List<String>> paths : perStart) {
            for (List<String> path : paths) {
                rawCount++;
                unique.putIfAbsent(canonicalRotation(path), Boolean.TRUE);
            }
        }

        List<Cycle> ranked = unique.keySet().stream()
                .map(accounts -> measure(graph, accounts, settings.getVolumeNormalizer()))
                .sorted(RANKING)
                .limit(settings.getMaxCycles())
                .collect(Collectors.toList());

        List<Cycle> cycles = new ArrayList<>(ranked.size());
        for (int i = 0; i < ranked.size(); i++) {
            cycles.add(ranked.get(i).toBuilder().ringId(String.format("RING_%03d", i + 1)).build());
        }

        List<CycleOverlap> overlaps = findOverlaps(cycles, settings.getMinSharedAccounts());
        log.debug("Cycle search: startNodes={}, rawPaths={}, unique={}, retained={}, overlaps={}",
                starts.size(), rawCount, unique.size(), cycles.size(), overlaps.size());
        return CycleDetectionResult.builder()
                .cycles(List.copyOf(cycles))
                .overlaps(overlaps)
                .clusters(buildClusters(cycles, overlaps))
                .participation(participation(cycles))
                .build();
    }

    @Override
    public String getStrategyName() {
        return NAME;
    }

    /** Accounts with outgoing edges, ordered by out-degree descending then id, capped at {@code limit}. */
    static List<String> startNodes(TransactionGraph graph, int limit) {
        return graph.getAccountIds().stream()
                .filter(id -> graph.outDegree(id) > 0)
                .sorted(Comparator.<String>comparingInt(graph::outDegree).reversed().thenComparing(Comparator.naturalOrder()))
                .limit(limit)
                .collect(Collectors.toList());
    }

    static List<List<String>> searchFrom(TransactionGraph graph, String start, int minLength, int maxLength) {
        List<List<String>> found = new ArrayList<>();
        List<String> path = new ArrayList<>();
        Set<String> onPath = new HashSet<>();
        path.add(start);
        onPath.add(start);
        extend(graph, start, path, onPath, minLength, maxLength, found);
        return found;
    }

    private static void extend(TransactionGraph graph, String start, List<String> path, Set<String> onPath,
                               int minLength, int maxLength, List<List<String>> found) {
        String current = path.get(path.size() - 1);
        Set<String> next = graph.successors(current);
        if (next.isEmpty()) return;
        for (String neighbour : next) {
            if (neighbour.equals(start)) {
                if (path.size() >= minLength) found.add(List.copyOf(path));
                continue;
            }
            if (path.size() >= maxLength || onPath.contains(neighbour)) continue;
            // the last slot must be able to close the ring
            if (path.size() == maxLength - 1 && !graph.hasEdge(neighbour, start)) continue;
            path.add(neighbour);
            onPath.add(neighbour);
            extend(graph, start, path, onPath, minLength, maxLength, found);
            path.remove(path.size() - 1);
            onPath.remove(neighbour);
        }
    }

    /** Rotation starting at the smallest account id; direction is preserved. */
    static List<String> canonicalRotation(List<String> cycle) {
        int pivot = 0;
        for (int i = 1; i < cycle.size(); i++) {
            if (cycle.get(i).compareTo(cycle.get(pivot)) < 0) pivot = i;
        }
        List<String> rotated = new ArrayList<>(cycle.size());
        for (int i = 0; i < cycle.size(); i++) {
            rotated.add(cycle.get((pivot + i) % cycle.size()));
        }
        return List.copyOf(rotated);
    }

    static Cycle measure(TransactionGraph graph, List<String> accounts, BigDecimal volumeNormalizer) {
        int length = accounts.size();
        BigDecimal total = BigDecimal.ZERO;
        List<String> transactionIds = new ArrayList<>();
        double[] edgeAmounts = new double[length];
        for (int i = 0; i < length; i++) {
            List<Transaction> edge = graph.transactionsBetween(accounts.get(i), accounts.get((i + 1) % length));
            BigDecimal edgeTotal = BigDecimal.ZERO;
            for (Transaction txn : edge) {
                edgeTotal = edgeTotal.add(txn.getAmount());
                transactionIds.add(txn.getId());
            }
            edgeAmounts[i] = edgeTotal.doubleValue();
            total = total.add(edgeTotal);
        }
        int count = transactionIds.size();
        double volume = total.divide(volumeNormalizer, MathContext.DECIMAL64).doubleValue();
        return Cycle.builder()
                .accounts(accounts)
                .length(length)
                .transactionIds(List.copyOf(transactionIds))
                .totalAmount(total)
                .transactionCount(count)
                .averageTransaction(count > 0 ? total.doubleValue() / count : 0.0)
                .amountSpread(Math.min(1.0, coefficientOfVariation(edgeAmounts)))
                .strength(strength(volume, count, length))
                .build();
    }

    /** Each term is computed on its own before summation; no upper clamp. */
    static double strength(double normalizedVolume, int transactionCount, int length) {
        double volumeTerm = VOLUME_WEIGHT * normalizedVolume;
        double frequencyTerm = FREQUENCY_WEIGHT * (transactionCount / 10.0);
        double complexityTerm = COMPLEXITY_WEIGHT * (length / 3.0);
        return volumeTerm + frequencyTerm + complexityTerm;
    }

    private static double coefficientOfVariation(double[] values) {
        if (values.length == 0) return 0.0;
        double mean = 0.0;
        for (double v : values) mean += v;
        mean /= values.length;
        if (mean <= 0) return 0.0;
        double variance = 0.0;
        for (double v : values) variance += (v - mean) * (v - mean);
        variance /= values.length;
        return Math.sqrt(variance) / mean;
    }

    private static List<CycleOverlap> findOverlaps(List<Cycle> cycles, int minShared) {
        List<CycleOverlap> overlaps = new ArrayList<>();
        for (int i = 0; i < cycles.size(); i++) {
            Set<String> first = new TreeSet<>(cycles.get(i).getAccounts());
            for (int j = i + 1; j < cycles.size(); j++) {
                Set<String> second = new TreeSet<>(cycles.get(j).getAccounts());
                Set<String> shared = new TreeSet<>(first);
                shared.retainAll(second);
                if (shared.size() < minShared) continue;
                boolean nested = first.size() != second.size()
                        && (first.containsAll(second) || second.containsAll(first));
                overlaps.add(CycleOverlap.builder()
                        .firstRingId(cycles.get(i).getRingId())
                        .secondRingId(cycles.get(j).getRingId())
                        .sharedAccounts(List.copyOf(shared))
                        .nested(nested)
                        .build());
            }
        }
        return List.copyOf(overlaps);
    }

    private static List<RingCluster> buildClusters(List<Cycle> cycles, List<CycleOverlap> overlaps) {
        if (overlaps.isEmpty()) return List.of();
        Map<String, Integer> index = new LinkedHashMap<>();
        for (int i = 0; i < cycles.size(); i++) index.put(cycles.get(i).getRingId(), i);
        int[] parent = new int[cycles.size()];
        for (int i = 0; i < parent.length; i++) parent[i] = i;
        for (CycleOverlap overlap : overlaps) {
            int a = find(parent, index.get(overlap.getFirstRingId()));
            int b = find(parent, index.get(overlap.getSecondRingId()));
            if (a != b) parent[Math.max(a, b)] = Math.min(a, b);
        }
        Map<Integer, List<Integer>> groups = new TreeMap<>();
        for (int i = 0; i < cycles.size(); i++) {
            groups.computeIfAbsent(find(parent, i), k -> new ArrayList<>()).add(i);
        }
        List<RingCluster> clusters = new ArrayList<>();
        for (List<Integer> members : groups.values()) {
            if (members.size() < 2) continue;
            Set<String> accounts = new TreeSet<>();
            Set<String> ringIds = new LinkedHashSet<>();
            for (int member : members) {
                ringIds.add(cycles.get(member).getRingId());
                accounts.addAll(cycles.get(member).getAccounts());
            }
            clusters.add(RingCluster.builder()
                    .clusterId(String.format("CLUSTER_%03d", clusters.size() + 1))
                    .ringIds(List.copyOf(ringIds))
                    .accounts(List.copyOf(accounts))
                    .build());
        }
        return List.copyOf(clusters);
    }

    private static int find(int[] parent, int i) {
        while (parent[i] != i) {
            parent[i] = parent[parent[i]];
            i = parent[i];
        }
        return i;
    }

    private static SortedMap<String, Integer> participation(List<Cycle> cycles) {
        SortedMap<String, Integer> counts = new TreeMap<>();
        for (Cycle cycle : cycles) {
            for (String account : cycle.getAccounts()) {
                counts.merge(account, 1, Integer::sum);
            }
        }
        return counts;
    }

    private static int compareAccounts(List<String> a, List<String> b) {
        for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
            int cmp = a.get(i).compareTo(b.get(i));
            if (cmp != 0) return cmp;
        }
        return Integer.compare(a.size(), b.size());
    }
}
