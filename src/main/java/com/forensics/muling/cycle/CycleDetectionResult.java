package com.forensics.muling.cycle;

import com.forensics.muling.domain.Cycle;
import com.forensics.muling.domain.CycleOverlap;
import com.forensics.muling.domain.RingCluster;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Ranked rings plus the relations between them and per-account participation counts.
 */
@Value
@Builder
public class CycleDetectionResult {

    /** Strongest first, already truncated to the configured maximum. */
    List<Cycle> cycles;
    List<CycleOverlap> overlaps;
    List<RingCluster> clusters;
    /** Account id -> number of retained rings containing it. */
    SortedMap<String, Integer> participation;

    public static CycleDetectionResult empty() {
        return CycleDetectionResult.builder()
                .cycles(List.of())
                .overlaps(List.of())
                .clusters(List.of())
                .participation(Collections.emptySortedMap())
                .build();
    }

    public int participationOf(String accountId) {
        return participation.getOrDefault(accountId, 0);
    }

    public List<Cycle> cyclesContaining(String accountId) {
        return cycles.stream().filter(c -> c.contains(accountId)).collect(Collectors.toList());
    }

    public List<Cycle> cyclesOfLength(int length) {
        return cycles.stream().filter(c -> c.getLength() == length).collect(Collectors.toList());
    }

    public SortedSet<String> accountsInCycles() {
        return new TreeSet<>(participation.keySet());
    }
}
