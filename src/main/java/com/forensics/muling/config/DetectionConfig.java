package com.forensics.muling.config;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Immutable tunables for one analysis run. Passed into the engine on every call, so two runs with
 * different settings never interfere. Defaults mirror {@link DetectionProperties}.
 */
@Value
@Builder(toBuilder = true)
public class DetectionConfig {

    CycleSettings cycle;
    SmurfingSettings smurfing;
    ShellSettings shell;
    ScoringSettings scoring;

    public static DetectionConfig defaults() {
        return new DetectionProperties().toConfig();
    }

    @Value
    @Builder(toBuilder = true)
    public static class CycleSettings {
        String strategy;
        int minLength;
        int maxLength;
        /** DFS start points: top-K accounts by out-degree. */
        int maxStartNodes;
        /** How many rings survive ranking. */
        int maxCycles;
        BigDecimal volumeNormalizer;
        /** Rings sharing at least this many accounts are recorded as overlapping. */
        int minSharedAccounts;
    }

    @Value
    @Builder(toBuilder = true)
    public static class SmurfingSettings {
        String strategy;
        int minTransactions;
        long windowHours;
        /** Alerts are raised for scores strictly above this value. */
        double alertThreshold;
        List<BigDecimal> structuringThresholds;
        /** Width of the zone just below each threshold, as a fraction of the threshold. */
        double structuringTolerance;
        /** Structuring is flagged when the in-zone share exceeds this. */
        double structuringMinRatio;
        /** Allowed relative gap between total inbound and the largest outbound. */
        double consolidationTolerance;
        int consolidationMinSources;
        BigDecimal amountNormalizer;
    }

    @Value
    @Builder(toBuilder = true)
    public static class ShellSettings {
        String strategy;
        /** Bulk pre-filter: at most this many transactions. */
        int maxTransactions;
        /** Bulk pre-filter: at least this much throughput (in + out). */
        BigDecimal minTotalValue;
        /** Profiles at or above this composite are reported. */
        double reportThreshold;
        BigDecimal highValueBaseline;
        double passThroughTolerance;
        double dormancyGapHours;
        double burstGapHours;
        double highValueWeight;
        double passThroughWeight;
        double connectionWeight;
        double dormancyWeight;
        double directionalityWeight;
        double uniformityWeight;
    }

    @Value
    @Builder(toBuilder = true)
    public static class ScoringSettings {
        double ringWeight;
        double smurfingWeight;
        double shellWeight;
        double patternWeight;
        /** Transactions per hour over an account's lifetime above which velocity is anomalous. */
        double velocityAnomalyThreshold;
        /** Max-to-median amount ratio at which an amount is unusual. */
        double unusualAmountRatio;
        BigDecimal throughputBaseline;
    }
}
