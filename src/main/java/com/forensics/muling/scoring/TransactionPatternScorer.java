package com.forensics.muling.scoring;

import com.forensics.muling.config.DetectionConfig;
import com.forensics.muling.domain.RiskFactor;
import com.forensics.muling.domain.Transaction;
import com.forensics.muling.graph.AccountStats;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Scores how unusual an account's own activity looks: lifetime velocity, outlier amounts and
 * throughput concentrated on few counterparties.
 */
@Component
public class TransactionPatternScorer {

    static final double VELOCITY_WEIGHT = 0.4;
    static final double AMOUNT_WEIGHT = 0.3;
    static final double THROUGHPUT_WEIGHT = 0.3;
    static final double CONCENTRATED_THROUGHPUT_LEVEL = 50.0;

    private static final int MIN_HISTORY = 3;
    private static final double MILLIS_PER_HOUR = 3_600_000.0;

    public PatternScore score(AccountStats stats, DetectionConfig.ScoringSettings settings) {
        Set<RiskFactor> flags = EnumSet.noneOf(RiskFactor.class);

        double velocity = velocityScore(stats, settings.getVelocityAnomalyThreshold());
        if (velocity > 0) flags.add(RiskFactor.VELOCITY_ANOMALY);

        double amount = amountScore(stats.getTransactions(), settings.getUnusualAmountRatio());
        if (amount > 0) flags.add(RiskFactor.UNUSUAL_AMOUNT);

        double throughput = throughputScore(stats, settings.getThroughputBaseline());
        if (throughput >= CONCENTRATED_THROUGHPUT_LEVEL) flags.add(RiskFactor.CONCENTRATED_THROUGHPUT);

        double blended = VELOCITY_WEIGHT * velocity + AMOUNT_WEIGHT * amount + THROUGHPUT_WEIGHT * throughput;
        return PatternScore.builder()
                .velocityScore(velocity)
                .amountScore(amount)
                .throughputScore(throughput)
                .score(Math.max(0.0, Math.min(100.0, blended)))
                .flags(Collections.unmodifiableSet(flags))
                .build();
    }

    /** Transactions per hour between first and last sighting; zero unless above {@code threshold}. */
    static double velocityScore(AccountStats stats, double threshold) {
        int n = stats.getTransactionCount();
        if (n < MIN_HISTORY) return 0.0;
        double spanHours = Duration.between(stats.getFirstSeen(), stats.getLastSeen()).toMillis() / MILLIS_PER_HOUR;
        if (spanHours <= 0) return 0.0;
        double velocity = n / spanHours;
        if (velocity <= threshold) return 0.0;
        return Math.min(100.0, 50.0 * velocity / threshold);
    }

    /** Largest amount against the median; zero below {@code ratioThreshold}. */
    static double amountScore(List<Transaction> transactions, double ratioThreshold) {
        if (transactions.size() < MIN_HISTORY) return 0.0;
        List<BigDecimal> sorted = transactions.stream()
                .map(Transaction::getAmount)
                .sorted()
                .collect(Collectors.toList());
        BigDecimal median = median(sorted);
        if (median.signum() <= 0) return 0.0;
        double ratio = sorted.get(sorted.size() - 1).divide(median, MathContext.DECIMAL64).doubleValue();
        if (ratio < ratioThreshold) return 0.0;
        return Math.min(100.0, 50.0 + 25.0 * (ratio - ratioThreshold));
    }

    /** High average value moved through few distinct counterparties. */
    static double throughputScore(AccountStats stats, BigDecimal baseline) {
        int n = stats.getTransactionCount();
        if (n == 0) return 0.0;
        double avg = stats.getThroughput().doubleValue() / n;
        Set<String> counterparties = new TreeSet<>(stats.getSources());
        counterparties.addAll(stats.getDestinations());
        counterparties.remove(stats.getAccountId());
        double valueFactor = Math.min(1.0, avg / baseline.doubleValue());
        double concentration = 1.0 - Math.min(1.0, (double) counterparties.size() / n);
        return valueFactor * concentration * 100.0;
    }

    /** Middle value, or the mean of the two middle values for an even count. Input must be sorted. */
    public static BigDecimal median(List<BigDecimal> sorted) {
        int size = sorted.size();
        if (size == 0) return BigDecimal.ZERO;
        if (size % 2 == 1) return sorted.get(size / 2);
        return sorted.get(size / 2 - 1).add(sorted.get(size / 2))
                .divide(BigDecimal.valueOf(2), MathContext.DECIMAL64);
    }
}
