package com.forensics.muling.cycle;

import com.forensics.muling.config.DetectionConfig;
import com.forensics.muling.graph.TransactionGraph;
import com.forensics.muling.support.ParallelRunner;

/**
 * Strategy for finding money rings in a transaction graph. Implementations are selected by
 * name through {@code muling.detection.cycle.strategy}.
 */
public interface CycleDetectionStrategy {

    /**
     * Find, rank and relate the rings in {@code graph}. Never fails for lack of cycles; an
     * acyclic graph yields {@link CycleDetectionResult#empty()}.
     */
    CycleDetectionResult detect(TransactionGraph graph, DetectionConfig.CycleSettings settings, ParallelRunner runner);

    /**
     * Name used in configuration and logs.
     */
    String getStrategyName();
}
