package com.forensics.muling.smurfing;

import com.forensics.muling.config.DetectionConfig;
import com.forensics.muling.domain.SmurfingAlert;
import com.forensics.muling.domain.SmurfingFlag;
import com.forensics.muling.domain.Transaction;
import com.forensics.muling.graph.AccountStats;
import com.forensics.muling.graph.TransactionGraph;
import com.forensics.muling.support.ParallelRunner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.stream.Collectors;

/**
 * Sliding-window smurfing detection. Every transaction touching an account opens a candidate
 * window {@code [t, t + windowHours]}; only the best-scoring window per account is reported.
 * Accounts with fewer than {@code minTransactions} transactions are skipped entirely.
 */
@Slf4j
@Component
public class SlidingWindowSmurfingDetector implements SmurfingDetectionStrategy {

    public static final String NAME = "v2";

    private static final double MILLIS_PER_HOUR = 3_600_000.0;

    @Override
    public List<SmurfingAlert> detect(TransactionGraph graph, DetectionConfig.SmurfingSettings settings,
                                      ParallelRunner runner) {
        List<String> eligible = graph.getAllStats().values().stream()
                .filter(s -> s.getSideCount() >= settings.getMinTransactions())
                .map(AccountStats::getAccountId)
                .collect(Collectors.toList());

        SortedMap<String, SmurfingAlert> alerts = runner.mapByKey(eligible, accountId ->
                graph.getStats(accountId)
                        .flatMap(stats -> bestWindow(stats, settings))
                        .map(window -> toAlert(window, settings))
                        .filter(alert -> alert.getRiskScore() > settings.getAlertThreshold())
                        .orElse(null));

        log.debug("Smurfing scan: eligibleAccounts={}, alerts={}", eligible.size(), alerts.size());
        return alerts.values().stream()
                .sorted(Comparator.comparingDouble(SmurfingAlert::getRiskScore).reversed()
                        .thenComparing(SmurfingAlert::getAccountId))
                .collect(Collectors.toUnmodifiableList());
    }

    @Override
    public String getStrategyName() {
        return NAME;
    }

    /**
     * Highest-scoring window for the account; ties keep the earliest window.
     */
    Optional<WindowFeatures> bestWindow(AccountStats stats, DetectionConfig.SmurfingSettings settings) {
        List<Transaction> txns = stats.getTransactions();
        if (stats.getSideCount() < settings.getMinTransactions()) return Optional.empty();
        Duration length = Duration.ofHours(settings.getWindowHours());

        WindowFeatures best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        int end = 0;
        for (int start = 0; start < txns.size(); start++) {
            Instant windowStart = txns.get(start).getTimestamp();
            // same start instant as the previous candidate means the same window
            if (start > 0 && txns.get(start - 1).getTimestamp().equals(windowStart)) continue;
            Instant windowEnd = windowStart.plus(length);
            if (end < start) end = start;
            while (end + 1 < txns.size() && !txns.get(end + 1).getTimestamp().isAfter(windowEnd)) end++;

            WindowFeatures features = measure(stats.getAccountId(), txns.subList(start, end + 1),
                    windowStart, windowEnd, settings);
            double score = score(features, settings);
            if (score > bestScore) {
                bestScore = score;
                best = features;
            }
        }
        return Optional.ofNullable(best);
    }

    WindowFeatures measure(String accountId, List<Transaction> window, Instant windowStart, Instant windowEnd,
                           DetectionConfig.SmurfingSettings settings) {
        Set<String> senders = new HashSet<>();
        Set<String> receivers = new HashSet<>();
        BigDecimal total = BigDecimal.ZERO;
        BigDecimal inbound = BigDecimal.ZERO;
        BigDecimal maxOutbound = BigDecimal.ZERO;
        int count = 0;
        int structured = 0;
        for (Transaction txn : window) {
            // a self-loop is one transaction on each side of the account
            int sides = txn.isSelfLoop() ? 2 : 1;
            count += sides;
            total = total.add(txn.getAmount().multiply(BigDecimal.valueOf(sides)));
            if (accountId.equals(txn.getToAccount())) {
                senders.add(txn.getFromAccount());
                inbound = inbound.add(txn.getAmount());
            }
            if (accountId.equals(txn.getFromAccount())) {
                receivers.add(txn.getToAccount());
                if (txn.getAmount().compareTo(maxOutbound) > 0) maxOutbound = txn.getAmount();
            }
            if (isJustBelowThreshold(txn.getAmount(), settings)) structured += sides;
        }
        long spanMillis = Duration.between(window.get(0).getTimestamp(),
                window.get(window.size() - 1).getTimestamp()).toMillis();
        double elapsedHours = Math.max(1.0, spanMillis / MILLIS_PER_HOUR);
        return WindowFeatures.builder()
                .accountId(accountId)
                .windowStart(windowStart)
                .windowEnd(windowEnd)
                .transactionCount(count)
                .fanIn(senders.size())
                .fanOut(receivers.size())
                .totalAmount(total)
                .inboundAmount(inbound)
                .maxOutboundAmount(maxOutbound)
                .elapsedHours(elapsedHours)
                .velocity(count / elapsedHours)
                .structuringRatio((double) structured / count)
                .build();
    }

    /**
     * 0–100: +30 for ten or more transactions, +5 per distinct source and per distinct destination,
     * +20 above one transaction per hour (+10 above one per two hours), and up to +20 for volume.
     */
    static double score(WindowFeatures f, DetectionConfig.SmurfingSettings settings) {
        double score = 0.0;
        if (f.getTransactionCount() >= 10) score += 30;
        score += 5.0 * f.getFanIn();
        score += 5.0 * f.getFanOut();
        if (f.getVelocity() > 1.0) {
            score += 20;
        } else if (f.getVelocity() > 0.5) {
            score += 10;
        }
        double volume = f.getTotalAmount().divide(settings.getAmountNormalizer(), MathContext.DECIMAL64).doubleValue();
        score += Math.min(20.0, 20.0 * volume);
        return Math.max(0.0, Math.min(100.0, score));
    }

    static boolean isJustBelowThreshold(BigDecimal amount, DetectionConfig.SmurfingSettings settings) {
        BigDecimal lowerFactor = BigDecimal.ONE.subtract(BigDecimal.valueOf(settings.getStructuringTolerance()));
        for (BigDecimal threshold : settings.getStructuringThresholds()) {
            if (amount.compareTo(threshold) < 0 && amount.compareTo(threshold.multiply(lowerFactor)) >= 0) {
                return true;
            }
        }
        return false;
    }

    static boolean isConsolidation(WindowFeatures f, DetectionConfig.SmurfingSettings settings) {
        if (f.getFanIn() < settings.getConsolidationMinSources() || f.getFanOut() == 0) return false;
        if (f.getInboundAmount().signum() <= 0) return false;
        double ratio = f.getMaxOutboundAmount().divide(f.getInboundAmount(), MathContext.DECIMAL64).doubleValue();
        return Math.abs(1.0 - ratio) <= settings.getConsolidationTolerance();
    }

    private SmurfingAlert toAlert(WindowFeatures f, DetectionConfig.SmurfingSettings settings) {
        Set<SmurfingFlag> flags = EnumSet.noneOf(SmurfingFlag.class);
        if (f.getVelocity() > 1.0 || f.getTransactionCount() >= 10) flags.add(SmurfingFlag.HIGH_FREQUENCY);
        if (f.getStructuringRatio() > settings.getStructuringMinRatio()) flags.add(SmurfingFlag.STRUCTURING);
        if (isConsolidation(f, settings)) flags.add(SmurfingFlag.CONSOLIDATION);
        return SmurfingAlert.builder()
                .accountId(f.getAccountId())
                .windowStart(f.getWindowStart())
                .windowEnd(f.getWindowEnd())
                .fanIn(f.getFanIn())
                .fanOut(f.getFanOut())
                .transactionCount(f.getTransactionCount())
                .totalAmount(f.getTotalAmount())
                .elapsedHours(f.getElapsedHours())
                .velocity(f.getVelocity())
                .structuringRatio(f.getStructuringRatio())
                .riskScore(score(f, settings))
                .flags(Collections.unmodifiableSet(flags))
                .build();
    }
}
