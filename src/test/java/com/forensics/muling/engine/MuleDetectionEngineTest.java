package com.forensics.muling.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.forensics.muling.config.DetectionConfig;
import com.forensics.muling.cycle.BoundedDfsCycleDetector;
import com.forensics.muling.domain.AccountContext;
import com.forensics.muling.domain.AccountScore;
import com.forensics.muling.domain.AnalysisResults;
import com.forensics.muling.domain.AnalysisSummary;
import com.forensics.muling.domain.Cycle;
import com.forensics.muling.domain.RiskFactor;
import com.forensics.muling.domain.RiskLevel;
import com.forensics.muling.domain.ShellProfile;
import com.forensics.muling.domain.SmurfingAlert;
import com.forensics.muling.domain.SmurfingFlag;
import com.forensics.muling.domain.Transaction;
import com.forensics.muling.exception.DuplicateTransactionIdException;
import com.forensics.muling.exception.InvalidTransactionException;
import com.forensics.muling.graph.GraphBuilder;
import com.forensics.muling.scoring.RiskScorer;
import com.forensics.muling.scoring.TransactionPatternScorer;
import com.forensics.muling.shell.MultiFactorShellDetector;
import com.forensics.muling.smurfing.SlidingWindowSmurfingDetector;
import com.forensics.muling.support.ParallelRunner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.forensics.muling.TransactionFixtures.hoursLater;
import static com.forensics.muling.TransactionFixtures.txn;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests for MuleDetectionEngine over the reference scenarios.
 */
class MuleDetectionEngineTest {

    private DetectionStrategyRegistry registry;
    private DetectionConfig config;
    private MuleDetectionEngine engine;

    @BeforeEach
    void setUp() {
        registry = new DetectionStrategyRegistry(
                List.of(new BoundedDfsCycleDetector()),
                List.of(new SlidingWindowSmurfingDetector()),
                List.of(new MultiFactorShellDetector()));
        config = DetectionConfig.defaults();
        engine = engineWith(ParallelRunner.sameThread());
    }

    private MuleDetectionEngine engineWith(ParallelRunner runner) {
        return new MuleDetectionEngine(new GraphBuilder(), registry,
                new RiskScorer(new TransactionPatternScorer()), runner, config);
    }

    private static List<Transaction> ring() {
        return List.of(
                hoursLater("r1", "A", "B", "1000", 0),
                hoursLater("r2", "B", "C", "1000", 1),
                hoursLater("r3", "C", "A", "1000", 2));
    }

    private static List<Transaction> fanOut() {
        List<Transaction> txns = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            txns.add(txn("f" + i, "X", "R" + i, "900", i * 20L));
        }
        return txns;
    }

    private static List<Transaction> passThrough() {
        return List.of(
                hoursLater("p1", "S", "Y", "50000", 0),
                hoursLater("p2", "Y", "D", "49800", 3));
    }

    private static List<Transaction> allScenarios() {
        List<Transaction> txns = new ArrayList<>(ring());
        txns.addAll(fanOut());
        txns.addAll(passThrough());
        return txns;
    }

    @Test
    void emptyInputGivesEmptyResults() {
        AnalysisResults results = engine.analyze(List.of());

        assertThat(results.getTotalTransactions()).isZero();
        assertThat(results.getTotalAccounts()).isZero();
        assertThat(results.getRingsDetected()).isEmpty();
        assertThat(results.getSmurfingAlerts()).isEmpty();
        assertThat(results.getShellAccounts()).isEmpty();
        assertThat(results.getAccountScores()).isEmpty();
        assertThat(results.getCriticalAccounts()).isEmpty();
        assertThat(results.getHighRiskAccounts()).isEmpty();
        assertThat(results.getSummary().getTotalVolume()).isEqualByComparingTo("0");
        assertThat(results.getSummary().getSuspiciousPercent()).isZero();
    }

    @Test
    void ringMembersReceiveRingInvolvement() {
        AnalysisResults results = engine.analyze(ring(), config);

        assertThat(results.getRingsDetected()).hasSize(1);
        assertThat(results.getRingsDetected().get(0).getTotalAmount()).isEqualByComparingTo("3000");
        for (String account : List.of("A", "B", "C")) {
            AccountScore score = results.findAccountScore(account).orElseThrow();
            assertThat(score.getRingInvolvementScore()).isPositive();
            assertThat(score.getRiskFactors()).contains(RiskFactor.RING_MEMBER);
        }

        AnalysisSummary summary = results.getSummary();
        assertThat(summary.getCyclesDetected()).isEqualTo(1);
        assertThat(summary.getAvgCycleLength()).isEqualTo(3.0);
        assertThat(summary.getAccountsInRings()).isEqualTo(3);
        assertThat(summary.getTotalVolume()).isEqualByComparingTo("3000");
        assertThat(summary.getAvgTransaction()).isEqualByComparingTo("1000");
        assertThat(summary.getMedianTransaction()).isEqualByComparingTo("1000");
    }

    @Test
    void fanOutBelowReportingThresholdIsSmurfing() {
        AnalysisResults results = engine.analyze(fanOut(), config);

        assertThat(results.getSmurfingAlerts()).extracting(SmurfingAlert::getAccountId).containsExactly("X");
        SmurfingAlert alert = results.getSmurfingAlerts().get(0);
        assertThat(alert.getFanOut()).isEqualTo(10);
        assertThat(alert.getFlags()).contains(SmurfingFlag.STRUCTURING);

        AccountScore x = results.findAccountScore("X").orElseThrow();
        assertThat(x.getSmurfingScore()).isEqualTo(alert.getRiskScore());
        assertThat(x.getRiskFactors()).contains(RiskFactor.STRUCTURING_DETECTED, RiskFactor.HIGH_FREQUENCY);
        assertThat(results.getSummary().getSmurfingAlertsCount()).isEqualTo(1);
    }

    @Test
    void receiveAndForwardIsShell() {
        AnalysisResults results = engine.analyze(passThrough(), config);

        ShellProfile y = results.getShellAccounts().stream()
                .filter(p -> p.getAccountId().equals("Y"))
                .findFirst()
                .orElseThrow();
        assertThat(y.getPassThroughScore()).isEqualTo(100.0);
        assertThat(y.getRiskLevel().isAtLeast(RiskLevel.HIGH)).isTrue();
        assertThat(results.findAccountScore("Y").orElseThrow().getShellScore()).isEqualTo(y.getShellScore());
        assertThat(results.getSummary().getPassThroughAccounts()).isEqualTo(1);
        assertThat(results.getSummary().getMaxTransaction()).isEqualByComparingTo("50000");
        assertThat(results.getSummary().getMinTransaction()).isEqualByComparingTo("49800");
    }

    @Test
    void everyAccountIsScoredWithinBounds() {
        AnalysisResults results = engine.analyze(allScenarios(), config);

        assertThat(results.getAccountScores()).hasSize(results.getTotalAccounts());
        assertThat(results.getTotalAccounts()).isEqualTo(3 + 11 + 3);
        for (AccountScore score : results.getAccountScores()) {
            assertThat(score.getFinalScore()).isBetween(0.0, 100.0);
            assertThat(score.getRiskLevel()).isEqualTo(RiskLevel.fromScore(score.getFinalScore()));
        }
        assertThat(results.getAccountScores()).extracting(AccountScore::getFinalScore)
                .isSortedAccordingTo((a, b) -> Double.compare(b, a));
    }

    @Test
    void outputIsIdenticalUnderInputReorderingAndParallelism() throws Exception {
        ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
        List<Transaction> shuffled = new ArrayList<>(allScenarios());
        Collections.shuffle(shuffled, new Random(42));

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            String sequential = mapper.writeValueAsString(engine.analyze(allScenarios(), config));
            String parallel = mapper.writeValueAsString(engineWith(new ParallelRunner(pool, 4)).analyze(shuffled, config));
            assertThat(parallel).isEqualTo(sequential);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void resultsSerializeWithSnakeCaseNames() throws Exception {
        ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();

        String json = mapper.writeValueAsString(engine.analyze(ring(), config));

        assertThat(json).contains("\"rings_detected\"", "\"account_scores\"", "\"ring_involvement_score\"",
                "\"ring_member\"", "\"total_amount\"", "\"suspicious_percent\"");
    }

    @Test
    void invalidTransactionRejectsWholeRun() {
        List<Transaction> txns = new ArrayList<>(ring());
        txns.add(txn("bad", "A", "B", "-5", 10));

        assertThatThrownBy(() -> engine.analyze(txns, config)).isInstanceOf(InvalidTransactionException.class);
    }

    @Test
    void duplicateIdRejectsWholeRun() {
        List<Transaction> txns = new ArrayList<>(ring());
        txns.add(txn("r1", "C", "D", "5", 10));

        assertThatThrownBy(() -> engine.analyze(txns, config)).isInstanceOf(DuplicateTransactionIdException.class);
    }

    @Test
    void unknownStrategyNameIsRejected() {
        DetectionConfig unknown = config.toBuilder()
                .cycle(config.getCycle().toBuilder().strategy("v9").build())
                .build();

        assertThatThrownBy(() -> engine.analyze(ring(), unknown))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("v9")
                .hasMessageContaining("Available");
    }

    @Test
    void accountContextGathersEverythingAboutOneAccount() {
        List<Transaction> txns = allScenarios();
        AnalysisResults results = engine.analyze(txns, config);

        AccountContext a = engine.accountContext(txns, results, "A", config).orElseThrow();
        assertThat(a.getAccountScore().getAccountId()).isEqualTo("A");
        assertThat(a.getRings()).extracting(Cycle::getRingId).containsExactly("RING_001");
        assertThat(a.getSmurfingAlert()).isNull();
        assertThat(a.getShellProfile()).isNotNull();
        assertThat(a.getNeighbourhood()).containsExactly("B", "C");

        AccountContext x = engine.accountContext(txns, results, "X", config).orElseThrow();
        assertThat(x.getSmurfingAlert()).isNotNull();
        assertThat(x.getRings()).isEmpty();
        assertThat(x.getNeighbourhood()).hasSize(10).doesNotContain("X");

        assertThat(engine.accountContext(txns, results, "nobody", config)).isEmpty();
    }

    @Test
    void profileAccountWorksBelowBulkThresholds() {
        ShellProfile d = engine.profileAccount(passThrough(), "D", config).orElseThrow();

        assertThat(d.getTotalIn()).isEqualByComparingTo("49800");
        assertThat(d.getDirectionalityScore()).isEqualTo(100.0);
    }
}
