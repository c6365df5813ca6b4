package com.forensics.muling.engine;

import com.forensics.muling.config.DetectionConfig;
import com.forensics.muling.cycle.CycleDetectionResult;
import com.forensics.muling.domain.AccountContext;
import com.forensics.muling.domain.AccountScore;
import com.forensics.muling.domain.AnalysisResults;
import com.forensics.muling.domain.AnalysisSummary;
import com.forensics.muling.domain.Cycle;
import com.forensics.muling.domain.RiskLevel;
import com.forensics.muling.domain.ShellProfile;
import com.forensics.muling.domain.SmurfingAlert;
import com.forensics.muling.domain.Transaction;
import com.forensics.muling.graph.GraphBuilder;
import com.forensics.muling.graph.TransactionGraph;
import com.forensics.muling.scoring.RiskScorer;
import com.forensics.muling.scoring.TransactionPatternScorer;
import com.forensics.muling.shell.ShellDetectionStrategy;
import com.forensics.muling.support.ParallelRunner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Runs the full pipeline: graph, then cycle, smurfing and shell detection, then scoring. Every
 * call is independent; nothing is cached between runs.
 */
@Slf4j
@Service
public class MuleDetectionEngine {

    /** Outgoing hops covered by {@link AccountContext#getNeighbourhood()}. */
    static final int NEIGHBOURHOOD_DEPTH = 2;

    private final GraphBuilder graphBuilder;
    private final DetectionStrategyRegistry registry;
    private final RiskScorer riskScorer;
    private final ParallelRunner runner;
    private final DetectionConfig defaultConfig;

    public MuleDetectionEngine(GraphBuilder graphBuilder,
                               DetectionStrategyRegistry registry,
                               RiskScorer riskScorer,
                               ParallelRunner runner,
                               DetectionConfig defaultConfig) {
        this.graphBuilder = graphBuilder;
        this.registry = registry;
        this.riskScorer = riskScorer;
        this.runner = runner;
        this.defaultConfig = defaultConfig;
    }

    public AnalysisResults analyze(List<Transaction> transactions) {
        return analyze(transactions, defaultConfig);
    }

    /**
     * Analyze one batch. Rejects the whole batch on the first invalid or duplicate transaction;
     * empty input gives an empty result.
     */
    public AnalysisResults analyze(List<Transaction> transactions, DetectionConfig config) {
        long started = System.nanoTime();
        TransactionGraph graph = graphBuilder.build(transactions);
        ShellDetectionStrategy shellStrategy = registry.shellStrategy(config.getShell().getStrategy());

        CycleDetectionResult cycles = registry.cycleStrategy(config.getCycle().getStrategy())
                .detect(graph, config.getCycle(), runner);
        List<SmurfingAlert> smurfingAlerts = registry.smurfingStrategy(config.getSmurfing().getStrategy())
                .detect(graph, config.getSmurfing(), runner);
        List<ShellProfile> shellAccounts = shellStrategy.detect(graph, config.getShell(), runner);
        int passThrough = shellStrategy.findPassThroughAccounts(graph, config.getShell()).size();

        List<AccountScore> scores = riskScorer.score(graph, cycles, smurfingAlerts, shellAccounts,
                config.getScoring(), runner);
        List<String> critical = accountsAt(scores, RiskLevel.CRITICAL);
        List<String> high = accountsAt(scores, RiskLevel.HIGH);

        AnalysisResults results = AnalysisResults.builder()
                .totalTransactions(graph.getTransactionCount())
                .totalAccounts(graph.getAccountCount())
                .ringsDetected(cycles.getCycles())
                .ringOverlaps(cycles.getOverlaps())
                .ringClusters(cycles.getClusters())
                .smurfingAlerts(smurfingAlerts)
                .shellAccounts(shellAccounts)
                .accountScores(scores)
                .criticalAccounts(critical)
                .highRiskAccounts(high)
                .summary(summarize(graph, cycles, smurfingAlerts, shellAccounts, passThrough, critical, high))
                .build();

        log.info("Analysis complete: transactions={}, accounts={}, rings={}, smurfingAlerts={}, shellAccounts={}, critical={}, high={}, elapsedMs={}",
                results.getTotalTransactions(), results.getTotalAccounts(), cycles.getCycles().size(),
                smurfingAlerts.size(), shellAccounts.size(), critical.size(), high.size(),
                (System.nanoTime() - started) / 1_000_000);
        return results;
    }

    /**
     * Shell profile for one account without the bulk pre-filter. Empty if the account never
     * appears in {@code transactions}.
     */
    public Optional<ShellProfile> profileAccount(List<Transaction> transactions, String accountId,
                                                 DetectionConfig config) {
        TransactionGraph graph = graphBuilder.build(transactions);
        return registry.shellStrategy(config.getShell().getStrategy())
                .profile(graph, accountId, config.getShell());
    }

    /**
     * Everything {@code results} says about one account plus its on-demand shell profile and the
     * accounts its money reaches within {@value #NEIGHBOURHOOD_DEPTH} hops.
     * {@code results} must come from analysing the same {@code transactions}.
     */
    public Optional<AccountContext> accountContext(List<Transaction> transactions, AnalysisResults results,
                                                   String accountId, DetectionConfig config) {
        Optional<AccountScore> score = results.findAccountScore(accountId);
        if (score.isEmpty()) return Optional.empty();

        List<Cycle> rings = results.getRingsDetected().stream()
                .filter(c -> c.contains(accountId))
                .collect(Collectors.toList());
        SmurfingAlert alert = results.getSmurfingAlerts().stream()
                .filter(a -> a.getAccountId().equals(accountId))
                .findFirst()
                .orElse(null);
        TransactionGraph graph = graphBuilder.build(transactions);
        ShellProfile profile = registry.shellStrategy(config.getShell().getStrategy())
                .profile(graph, accountId, config.getShell())
                .orElse(null);

        return Optional.of(AccountContext.builder()
                .accountScore(score.get())
                .rings(rings)
                .smurfingAlert(alert)
                .shellProfile(profile)
                .neighbourhood(graph.neighbours(accountId, NEIGHBOURHOOD_DEPTH))
                .build());
    }

    private static List<String> accountsAt(List<AccountScore> scores, RiskLevel level) {
        return scores.stream()
                .filter(s -> s.getRiskLevel() == level)
                .map(AccountScore::getAccountId)
                .collect(Collectors.toUnmodifiableList());
    }

    static AnalysisSummary summarize(TransactionGraph graph, CycleDetectionResult cycles,
                                     List<SmurfingAlert> smurfingAlerts, List<ShellProfile> shellAccounts,
                                     int passThroughAccounts, List<String> critical, List<String> high) {
        List<BigDecimal> amounts = graph.getTransactions().stream()
                .map(Transaction::getAmount)
                .sorted()
                .collect(Collectors.toList());
        BigDecimal total = amounts.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal avg = amounts.isEmpty()
                ? BigDecimal.ZERO
                : total.divide(BigDecimal.valueOf(amounts.size()), 2, RoundingMode.HALF_UP);

        double avgCycleLength = cycles.getCycles().stream().mapToInt(Cycle::getLength).average().orElse(0.0);
        int suspicious = critical.size() + high.size();
        double suspiciousPercent = graph.getAccountCount() == 0
                ? 0.0
                : Math.round(10_000.0 * suspicious / graph.getAccountCount()) / 100.0;

        return AnalysisSummary.builder()
                .totalAccounts(graph.getAccountCount())
                .totalTransactions(graph.getTransactionCount())
                .totalVolume(total)
                .avgTransaction(avg)
                .medianTransaction(TransactionPatternScorer.median(amounts))
                .minTransaction(amounts.isEmpty() ? BigDecimal.ZERO : amounts.get(0))
                .maxTransaction(amounts.isEmpty() ? BigDecimal.ZERO : amounts.get(amounts.size() - 1))
                .cyclesDetected(cycles.getCycles().size())
                .avgCycleLength(avgCycleLength)
                .accountsInRings(cycles.accountsInCycles().size())
                .smurfingAlertsCount(smurfingAlerts.size())
                .shellAccountsCount(shellAccounts.size())
                .passThroughAccounts(passThroughAccounts)
                .highRiskAccounts(high.size())
                .criticalAccounts(critical.size())
                .suspiciousAccounts(suspicious)
                .suspiciousPercent(suspiciousPercent)
                .build();
    }
}
