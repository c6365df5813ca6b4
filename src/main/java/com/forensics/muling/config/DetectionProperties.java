package com.forensics.muling.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Detection tunables bound from {@code muling.detection.*}. Field initializers are the
 * documented defaults; {@link #toConfig()} freezes them into a {@link DetectionConfig}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "muling.detection")
public class DetectionProperties {

    @Valid
    private Cycle cycle = new Cycle();
    @Valid
    private Smurfing smurfing = new Smurfing();
    @Valid
    private Shell shell = new Shell();
    @Valid
    private Scoring scoring = new Scoring();
    @Valid
    private Execution execution = new Execution();

    @Data
    public static class Cycle {
        @NotBlank
        private String strategy = "v2";
        @Min(3)
        private int minLength = 3;
        @Min(3)
        @Max(5)
        private int maxLength = 5;
        @Min(1)
        private int maxStartNodes = 50;
        @Min(1)
        private int maxCycles = 100;
        @DecimalMin("0.01")
        private BigDecimal volumeNormalizer = new BigDecimal("100000");
        @Min(1)
        private int minSharedAccounts = 2;

        @AssertTrue(message = "cycle min-length must not exceed max-length")
        public boolean isLengthRangeValid() {
            return minLength <= maxLength;
        }
    }

    @Data
    public static class Smurfing {
        @NotBlank
        private String strategy = "v2";
        @Min(1)
        private int minTransactions = 6;
        @Min(1)
        private long windowHours = 72;
        private double alertThreshold = 30.0;
        @NotEmpty
        private List<BigDecimal> structuringThresholds = new ArrayList<>(List.of(
                new BigDecimal("10000"), new BigDecimal("5000"), new BigDecimal("3000"), new BigDecimal("1000")));
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double structuringTolerance = 0.10;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double structuringMinRatio = 0.40;
        @DecimalMin("0.0")
        private double consolidationTolerance = 0.10;
        @Min(1)
        private int consolidationMinSources = 3;
        @DecimalMin("0.01")
        private BigDecimal amountNormalizer = new BigDecimal("100000");
    }

    @Data
    public static class Shell {
        @NotBlank
        private String strategy = "v2";
        @Min(1)
        private int maxTransactions = 5;
        @DecimalMin("0.0")
        private BigDecimal minTotalValue = new BigDecimal("50000");
        private double reportThreshold = 40.0;
        @DecimalMin("0.01")
        private BigDecimal highValueBaseline = new BigDecimal("10000");
        @DecimalMin("0.0")
        private double passThroughTolerance = 0.05;
        private double dormancyGapHours = 168.0;
        private double burstGapHours = 24.0;
        private double highValueWeight = 0.20;
        private double passThroughWeight = 0.25;
        private double connectionWeight = 0.20;
        private double dormancyWeight = 0.15;
        private double directionalityWeight = 0.15;
        private double uniformityWeight = 0.05;
    }

    @Data
    public static class Scoring {
        private double ringWeight = 0.30;
        private double smurfingWeight = 0.25;
        private double shellWeight = 0.25;
        private double patternWeight = 0.20;
        private double velocityAnomalyThreshold = 2.0;
        private double unusualAmountRatio = 2.0;
        @DecimalMin("0.01")
        private BigDecimal throughputBaseline = new BigDecimal("10000");
    }

    @Data
    public static class Execution {
        /** Worker threads for per-account and per-start-node work. */
        @Min(1)
        private int parallelism = Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    public DetectionConfig toConfig() {
        return DetectionConfig.builder()
                .cycle(DetectionConfig.CycleSettings.builder()
                        .strategy(cycle.getStrategy())
                        .minLength(cycle.getMinLength())
                        .maxLength(cycle.getMaxLength())
                        .maxStartNodes(cycle.getMaxStartNodes())
                        .maxCycles(cycle.getMaxCycles())
                        .volumeNormalizer(cycle.getVolumeNormalizer())
                        .minSharedAccounts(cycle.getMinSharedAccounts())
                        .build())
                .smurfing(DetectionConfig.SmurfingSettings.builder()
                        .strategy(smurfing.getStrategy())
                        .minTransactions(smurfing.getMinTransactions())
                        .windowHours(smurfing.getWindowHours())
                        .alertThreshold(smurfing.getAlertThreshold())
                        .structuringThresholds(List.copyOf(smurfing.getStructuringThresholds()))
                        .structuringTolerance(smurfing.getStructuringTolerance())
                        .structuringMinRatio(smurfing.getStructuringMinRatio())
                        .consolidationTolerance(smurfing.getConsolidationTolerance())
                        .consolidationMinSources(smurfing.getConsolidationMinSources())
                        .amountNormalizer(smurfing.getAmountNormalizer())
                        .build())
                .shell(DetectionConfig.ShellSettings.builder()
                        .strategy(shell.getStrategy())
                        .maxTransactions(shell.getMaxTransactions())
                        .minTotalValue(shell.getMinTotalValue())
                        .reportThreshold(shell.getReportThreshold())
                        .highValueBaseline(shell.getHighValueBaseline())
                        .passThroughTolerance(shell.getPassThroughTolerance())
                        .dormancyGapHours(shell.getDormancyGapHours())
                        .burstGapHours(shell.getBurstGapHours())
                        .highValueWeight(shell.getHighValueWeight())
                        .passThroughWeight(shell.getPassThroughWeight())
                        .connectionWeight(shell.getConnectionWeight())
                        .dormancyWeight(shell.getDormancyWeight())
                        .directionalityWeight(shell.getDirectionalityWeight())
                        .uniformityWeight(shell.getUniformityWeight())
                        .build())
                .scoring(DetectionConfig.ScoringSettings.builder()
                        .ringWeight(scoring.getRingWeight())
                        .smurfingWeight(scoring.getSmurfingWeight())
                        .shellWeight(scoring.getShellWeight())
                        .patternWeight(scoring.getPatternWeight())
                        .velocityAnomalyThreshold(scoring.getVelocityAnomalyThreshold())
                        .unusualAmountRatio(scoring.getUnusualAmountRatio())
                        .throughputBaseline(scoring.getThroughputBaseline())
                        .build())
                .build();
    }
}
