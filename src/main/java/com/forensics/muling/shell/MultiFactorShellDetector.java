package com.forensics.muling.shell;

import com.forensics.muling.config.DetectionConfig;
import com.forensics.muling.domain.RiskFactor;
import com.forensics.muling.domain.RiskLevel;
import com.forensics.muling.domain.ShellProfile;
import com.forensics.muling.domain.Transaction;
import com.forensics.muling.graph.AccountStats;
import com.forensics.muling.graph.TransactionGraph;
import com.forensics.muling.support.ParallelRunner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.stream.Collectors;

/**
 * Six-dimension shell account profile. Each dimension scores 0–100 on its own:
 * <ul>
 *   <li>high-value (20%): average transaction value against a baseline</li>
 *   <li>pass-through (25%): how closely money out matches money in</li>
 *   <li>connection (20%): few counterparties carrying all of the traffic</li>
 *   <li>dormancy (15%): long silence followed by a burst, or tightly clustered timing</li>
 *   <li>directionality (15%): pure sink or pure source behaviour</li>
 *   <li>uniformity (5%): near-identical amounts</li>
 * </ul>
 * The composite is the weighted sum, clipped to 0–100.
 */
@Slf4j
@Component
public class MultiFactorShellDetector implements ShellDetectionStrategy {

    public static final String NAME = "v2";

    private static final double MILLIS_PER_HOUR = 3_600_000.0;
    private static final double DORMANT_BURST_SCORE = 100.0;
    private static final double CLUSTERED_TIMING_SCORE = 80.0;

    @Override
    public List<ShellProfile> detect(TransactionGraph graph, DetectionConfig.ShellSettings settings,
                                     ParallelRunner runner) {
        List<String> candidates = graph.getAllStats().values().stream()
                .filter(s -> s.getSideCount() <= settings.getMaxTransactions())
                .filter(s -> s.getThroughput().compareTo(settings.getMinTotalValue()) >= 0)
                .map(AccountStats::getAccountId)
                .collect(Collectors.toList());

        SortedMap<String, ShellProfile> profiles = runner.mapByKey(candidates, accountId ->
                graph.getStats(accountId)
                        .map(stats -> profile(stats, settings))
                        .filter(p -> p.getShellScore() >= settings.getReportThreshold())
                        .orElse(null));

        log.debug("Shell scan: candidates={}, reported={}", candidates.size(), profiles.size());
        return profiles.values().stream()
                .sorted(Comparator.comparingDouble(ShellProfile::getShellScore).reversed()
                        .thenComparing(ShellProfile::getAccountId))
                .collect(Collectors.toUnmodifiableList());
    }

    @Override
    public Optional<ShellProfile> profile(TransactionGraph graph, String accountId,
                                          DetectionConfig.ShellSettings settings) {
        return graph.getStats(accountId).map(stats -> profile(stats, settings));
    }

    @Override
    public List<String> findPassThroughAccounts(TransactionGraph graph, DetectionConfig.ShellSettings settings) {
        return graph.getAllStats().values().stream()
                .filter(s -> passThroughScore(s.getTotalIn(), s.getTotalOut(), settings.getPassThroughTolerance()) >= 100.0)
                .map(AccountStats::getAccountId)
                .collect(Collectors.toUnmodifiableList());
    }

    @Override
    public String getStrategyName() {
        return NAME;
    }

    ShellProfile profile(AccountStats stats, DetectionConfig.ShellSettings settings) {
        int count = stats.getSideCount();
        BigDecimal throughput = stats.getThroughput();
        double avgValue = count > 0 ? throughput.doubleValue() / count : 0.0;

        double highValue = highValueScore(avgValue, settings.getHighValueBaseline());
        double passThrough = passThroughScore(stats.getTotalIn(), stats.getTotalOut(), settings.getPassThroughTolerance());
        double connection = connectionScore(stats.getInboundCount(), stats.getUniqueSources(),
                stats.getOutboundCount(), stats.getUniqueDestinations());
        double dormancy = dormancyScore(stats.getTransactions(), settings.getDormancyGapHours(), settings.getBurstGapHours());
        double directionality = directionalityScore(stats.getInboundCount(), stats.getOutboundCount());
        double uniformity = uniformityScore(stats.getTransactions());

        double composite = highValue * settings.getHighValueWeight()
                + passThrough * settings.getPassThroughWeight()
                + connection * settings.getConnectionWeight()
                + dormancy * settings.getDormancyWeight()
                + directionality * settings.getDirectionalityWeight()
                + uniformity * settings.getUniformityWeight();
        composite = Math.max(0.0, Math.min(100.0, composite));

        Set<RiskFactor> factors = EnumSet.noneOf(RiskFactor.class);
        if (composite >= 60.0) factors.add(RiskFactor.HIGH_SHELL_SCORE);
        if (passThrough >= 100.0) factors.add(RiskFactor.PASS_THROUGH);
        if (stats.getInboundCount() > 0 && stats.getUniqueSources() <= 2) factors.add(RiskFactor.LIMITED_SOURCES);
        if (stats.getOutboundCount() > 0 && stats.getUniqueDestinations() <= 2) factors.add(RiskFactor.LIMITED_DESTINATIONS);
        if (dormancy >= DORMANT_BURST_SCORE) factors.add(RiskFactor.DORMANT_THEN_ACTIVE);
        if (directionality >= 90.0) factors.add(RiskFactor.ONE_DIRECTIONAL_FLOW);
        if (uniformity >= 80.0) factors.add(RiskFactor.UNIFORM_AMOUNTS);
        if (highValue >= 100.0) factors.add(RiskFactor.HIGH_VALUE_TRANSACTIONS);

        return ShellProfile.builder()
                .accountId(stats.getAccountId())
                .totalTransactions(count)
                .totalThroughput(throughput)
                .totalIn(stats.getTotalIn())
                .totalOut(stats.getTotalOut())
                .avgTransactionValue(avgValue)
                .uniqueSources(stats.getUniqueSources())
                .uniqueDestinations(stats.getUniqueDestinations())
                .highValueScore(highValue)
                .passThroughScore(passThrough)
                .connectionScore(connection)
                .dormancyScore(dormancy)
                .directionalityScore(directionality)
                .uniformityScore(uniformity)
                .shellScore(composite)
                .riskLevel(RiskLevel.fromScore(composite))
                .riskFactors(Collections.unmodifiableSet(factors))
                .build();
    }

    static double highValueScore(double avgValue, BigDecimal baseline) {
        return Math.min(1.0, avgValue / baseline.doubleValue()) * 100.0;
    }

    /**
     * 100 when the in/out mismatch is under {@code tolerance} of the larger side, otherwise
     * {@code 100 * (1 - mismatch)}. Zero when money only moves one way.
     */
    static double passThroughScore(BigDecimal totalIn, BigDecimal totalOut, double tolerance) {
        if (totalIn.signum() <= 0 || totalOut.signum() <= 0) return 0.0;
        BigDecimal larger = totalIn.max(totalOut);
        double mismatch = totalIn.subtract(totalOut).abs().divide(larger, MathContext.DECIMAL64).doubleValue();
        if (mismatch < tolerance) return 100.0;
        return Math.max(0.0, 100.0 * (1.0 - mismatch));
    }

    /** Average over both directions of 1 / distinct counterparties, for directions that carry traffic. */
    static double connectionScore(int inboundCount, int uniqueSources, int outboundCount, int uniqueDestinations) {
        double in = inboundCount > 0 && uniqueSources > 0 ? 1.0 / uniqueSources : 0.0;
        double out = outboundCount > 0 && uniqueDestinations > 0 ? 1.0 / uniqueDestinations : 0.0;
        return 100.0 * (in + out) / 2.0;
    }

    static double dormancyScore(List<Transaction> chronological, double dormancyGapHours, double burstGapHours) {
        if (chronological.size() < 3) return 0.0;
        double[] gaps = new double[chronological.size() - 1];
        int maxIndex = 0;
        for (int i = 0; i < gaps.length; i++) {
            gaps[i] = Duration.between(chronological.get(i).getTimestamp(),
                    chronological.get(i + 1).getTimestamp()).toMillis() / MILLIS_PER_HOUR;
            if (gaps[i] > gaps[maxIndex]) maxIndex = i;
        }
        if (gaps[maxIndex] > dormancyGapHours && maxIndex + 1 < gaps.length) {
            double after = 0.0;
            for (int i = maxIndex + 1; i < gaps.length; i++) after += gaps[i];
            after /= gaps.length - maxIndex - 1;
            if (after < burstGapHours) return DORMANT_BURST_SCORE;
        }
        double mean = 0.0;
        for (double gap : gaps) mean += gap;
        mean /= gaps.length;
        if (mean <= 0.0) return 0.0;
        double cv = Math.sqrt(sampleVariance(gaps, mean)) / mean;
        return cv < 0.5 ? CLUSTERED_TIMING_SCORE : 0.0;
    }

    static double directionalityScore(int inboundCount, int outboundCount) {
        int total = inboundCount + outboundCount;
        if (total == 0) return 0.0;
        return 100.0 * Math.abs(inboundCount - outboundCount) / total;
    }

    static double uniformityScore(List<Transaction> transactions) {
        if (transactions.size() < 2) return 0.0;
        double[] amounts = new double[transactions.size()];
        double mean = 0.0;
        for (int i = 0; i < amounts.length; i++) {
            amounts[i] = transactions.get(i).getAmount().doubleValue();
            mean += amounts[i];
        }
        mean /= amounts.length;
        if (mean <= 0.0) return 0.0;
        double cv = Math.sqrt(sampleVariance(amounts, mean)) / mean;
        return 100.0 * Math.max(0.0, 1.0 - cv);
    }

    private static double sampleVariance(double[] values, double mean) {
        if (values.length < 2) return 0.0;
        double sum = 0.0;
        for (double v : values) sum += (v - mean) * (v - mean);
        return sum / (values.length - 1);
    }
}
