package com.forensics.muling.cycle;

import com.forensics.muling.config.DetectionConfig;
import com.forensics.muling.domain.Cycle;
import com.forensics.muling.domain.CycleOverlap;
import com.forensics.muling.domain.RingCluster;
import com.forensics.muling.domain.Transaction;
import com.forensics.muling.graph.GraphBuilder;
import com.forensics.muling.graph.TransactionGraph;
import com.forensics.muling.support.ParallelRunner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.forensics.muling.TransactionFixtures.hoursLater;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for BoundedDfsCycleDetector: ring discovery, ranking and ring relations.
 */
class BoundedDfsCycleDetectorTest {

    private BoundedDfsCycleDetector detector;
    private GraphBuilder graphBuilder;
    private DetectionConfig.CycleSettings settings;

    @BeforeEach
    void setUp() {
        detector = new BoundedDfsCycleDetector();
        graphBuilder = new GraphBuilder();
        settings = DetectionConfig.defaults().getCycle();
    }

    private CycleDetectionResult detect(List<Transaction> txns) {
        return detector.detect(graphBuilder.build(txns), settings, ParallelRunner.sameThread());
    }

    @Test
    void threeAccountRingIsFoundExactlyOnce() {
        CycleDetectionResult result = detect(List.of(
                hoursLater("t1", "A", "B", "1000", 0),
                hoursLater("t2", "B", "C", "1000", 1),
                hoursLater("t3", "C", "A", "1000", 2)));

        assertThat(result.getCycles()).hasSize(1);
        Cycle ring = result.getCycles().get(0);
        assertThat(ring.getRingId()).isEqualTo("RING_001");
        assertThat(ring.getAccounts()).containsExactly("A", "B", "C");
        assertThat(ring.getLength()).isEqualTo(3);
        assertThat(ring.getTotalAmount()).isEqualByComparingTo("3000");
        assertThat(ring.getTransactionIds()).containsExactly("t1", "t2", "t3");
        assertThat(ring.getTransactionCount()).isEqualTo(3);
        assertThat(ring.getAmountSpread()).isEqualTo(0.0);
        assertThat(ring.getStrength()).isCloseTo(0.4 * 0.03 + 0.35 * 0.3 + 0.25, within(1e-9));
        assertThat(result.getParticipation()).containsOnlyKeys("A", "B", "C");
        assertThat(result.participationOf("B")).isEqualTo(1);
        assertThat(result.getOverlaps()).isEmpty();
        assertThat(result.getClusters()).isEmpty();
    }

    @Test
    void emptyGraphGivesEmptyResult() {
        CycleDetectionResult result = detector.detect(TransactionGraph.empty(), settings, ParallelRunner.sameThread());

        assertThat(result.getCycles()).isEmpty();
        assertThat(result.accountsInCycles()).isEmpty();
    }

    @Test
    void twoAccountLoopIsBelowMinimumLength() {
        CycleDetectionResult result = detect(List.of(
                hoursLater("t1", "A", "B", "500", 0),
                hoursLater("t2", "B", "A", "500", 1)));

        assertThat(result.getCycles()).isEmpty();
    }

    @Test
    void ringLongerThanMaximumIsIgnored() {
        CycleDetectionResult result = detect(List.of(
                hoursLater("t1", "A", "B", "10", 0),
                hoursLater("t2", "B", "C", "10", 1),
                hoursLater("t3", "C", "D", "10", 2),
                hoursLater("t4", "D", "E", "10", 3),
                hoursLater("t5", "E", "F", "10", 4),
                hoursLater("t6", "F", "A", "10", 5)));

        assertThat(result.getCycles()).isEmpty();
    }

    @Test
    void everyRingIsAClosedWalkOverDistinctAccountsInCanonicalRotation() {
        TransactionGraph graph = graphBuilder.build(List.of(
                hoursLater("t1", "D", "B", "100", 0),
                hoursLater("t2", "B", "C", "100", 1),
                hoursLater("t3", "C", "D", "100", 2),
                hoursLater("t4", "C", "E", "100", 3),
                hoursLater("t5", "E", "F", "100", 4),
                hoursLater("t6", "F", "D", "100", 5),
                hoursLater("t7", "B", "E", "100", 6)));

        CycleDetectionResult result = detector.detect(graph, settings, ParallelRunner.sameThread());

        assertThat(result.getCycles()).isNotEmpty();
        for (Cycle ring : result.getCycles()) {
            List<String> accounts = ring.getAccounts();
            assertThat(accounts).hasSizeBetween(3, 5);
            assertThat(new HashSet<>(accounts)).hasSameSizeAs(accounts);
            assertThat(accounts.get(0)).isEqualTo(accounts.stream().sorted().findFirst().orElseThrow());
            for (int i = 0; i < accounts.size(); i++) {
                assertThat(graph.hasEdge(accounts.get(i), accounts.get((i + 1) % accounts.size()))).isTrue();
            }
        }
        assertThat(result.getCycles()).extracting(Cycle::getAccounts).doesNotHaveDuplicates();
        assertThat(result.cyclesOfLength(3)).extracting(Cycle::getAccounts)
                .containsExactly(List.of("B", "C", "D"));
    }

    @Test
    void maxCyclesKeepsTheStrongestRing() {
        settings = settings.toBuilder().maxCycles(1).build();

        CycleDetectionResult result = detect(List.of(
                hoursLater("s1", "A", "B", "100", 0),
                hoursLater("s2", "B", "C", "100", 1),
                hoursLater("s3", "C", "A", "100", 2),
                hoursLater("b1", "X", "Y", "90000", 0),
                hoursLater("b2", "Y", "Z", "90000", 1),
                hoursLater("b3", "Z", "X", "90000", 2)));

        assertThat(result.getCycles()).hasSize(1);
        assertThat(result.getCycles().get(0).getAccounts()).containsExactly("X", "Y", "Z");
        assertThat(result.getCycles().get(0).getRingId()).isEqualTo("RING_001");
        assertThat(result.participationOf("A")).isZero();
    }

    private static List<Transaction> hubRingAndSideRing() {
        return List.of(
                hoursLater("h1", "H", "A", "100", 0),
                hoursLater("h2", "H", "B", "100", 0),
                hoursLater("h3", "A", "X", "100", 1),
                hoursLater("h4", "X", "H", "100", 2),
                hoursLater("p1", "P", "Q", "100", 0),
                hoursLater("p2", "Q", "R", "100", 1),
                hoursLater("p3", "R", "P", "100", 2));
    }

    @Test
    void startNodesAreOrderedByOutDegreeThenId() {
        TransactionGraph graph = graphBuilder.build(hubRingAndSideRing());

        assertThat(BoundedDfsCycleDetector.startNodes(graph, 10)).containsExactly("H", "A", "P", "Q", "R", "X");
        assertThat(BoundedDfsCycleDetector.startNodes(graph, 2)).containsExactly("H", "A");
    }

    @Test
    void searchOnlyStartsFromTopRankedAccounts() {
        settings = settings.toBuilder().maxStartNodes(1).build();

        CycleDetectionResult result = detect(hubRingAndSideRing());

        assertThat(result.getCycles()).extracting(Cycle::getAccounts).containsExactly(List.of("A", "X", "H"));
        assertThat(result.participationOf("P")).isZero();
    }

    @Test
    void equalStrengthRingsAreOrderedByAccountIds() {
        CycleDetectionResult result = detect(List.of(
                hoursLater("t1", "D", "E", "100", 0),
                hoursLater("t2", "E", "F", "100", 1),
                hoursLater("t3", "F", "D", "100", 2),
                hoursLater("t4", "A", "B", "100", 0),
                hoursLater("t5", "B", "C", "100", 1),
                hoursLater("t6", "C", "A", "100", 2)));

        assertThat(result.getCycles()).extracting(Cycle::getRingId).containsExactly("RING_001", "RING_002");
        assertThat(result.getCycles()).extracting(c -> c.getAccounts().get(0)).containsExactly("A", "D");
    }

    @Test
    void strengthGrowsWithVolumeAndTransactionCount() {
        double base = BoundedDfsCycleDetector.strength(0.5, 3, 3);

        assertThat(BoundedDfsCycleDetector.strength(0.6, 3, 3)).isGreaterThan(base);
        assertThat(BoundedDfsCycleDetector.strength(0.5, 4, 3)).isGreaterThan(base);
        assertThat(BoundedDfsCycleDetector.strength(0.5, 3, 4)).isGreaterThan(base);
    }

    @Test
    void canonicalRotationStartsAtSmallestIdAndKeepsDirection() {
        assertThat(BoundedDfsCycleDetector.canonicalRotation(List.of("C", "A", "B")))
                .containsExactly("A", "B", "C");
        assertThat(BoundedDfsCycleDetector.canonicalRotation(List.of("C", "B", "A")))
                .containsExactly("A", "C", "B");
    }

    @Test
    void sharedAccountsProduceOverlapsNestingAndClusters() {
        CycleDetectionResult result = detect(List.of(
                hoursLater("t1", "A", "B", "100", 0),
                hoursLater("t2", "B", "C", "100", 1),
                hoursLater("t3", "C", "A", "100", 2),
                hoursLater("t4", "C", "D", "100", 3),
                hoursLater("t5", "D", "A", "100", 4)));

        assertThat(result.getCycles()).extracting(Cycle::getAccounts)
                .containsExactlyInAnyOrder(List.of("A", "B", "C"), List.of("A", "B", "C", "D"));
        assertThat(result.getOverlaps()).hasSize(1);
        CycleOverlap overlap = result.getOverlaps().get(0);
        assertThat(overlap.getSharedAccounts()).containsExactly("A", "B", "C");
        assertThat(overlap.isNested()).isTrue();

        assertThat(result.getClusters()).hasSize(1);
        RingCluster cluster = result.getClusters().get(0);
        assertThat(cluster.getClusterId()).isEqualTo("CLUSTER_001");
        assertThat(cluster.getAccounts()).containsExactly("A", "B", "C", "D");
        assertThat(result.participationOf("A")).isEqualTo(2);
        assertThat(result.participationOf("D")).isEqualTo(1);
        assertThat(result.cyclesContaining("D")).hasSize(1);
    }

    @Test
    void parallelSearchMatchesSequentialSearch() {
        List<Transaction> txns = List.of(
                hoursLater("t1", "A", "B", "100", 0),
                hoursLater("t2", "B", "C", "200", 1),
                hoursLater("t3", "C", "A", "300", 2),
                hoursLater("t4", "C", "D", "100", 3),
                hoursLater("t5", "D", "A", "100", 4),
                hoursLater("t6", "D", "B", "50", 5));
        TransactionGraph graph = graphBuilder.build(txns);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            CycleDetectionResult parallel = detector.detect(graph, settings, new ParallelRunner(pool, 4));
            CycleDetectionResult sequential = detector.detect(graph, settings, ParallelRunner.sameThread());
            assertThat(parallel).isEqualTo(sequential);
        } finally {
            pool.shutdownNow();
        }
    }
}
