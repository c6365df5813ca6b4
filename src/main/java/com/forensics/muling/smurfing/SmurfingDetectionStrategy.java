package com.forensics.muling.smurfing;

import com.forensics.muling.config.DetectionConfig;
import com.forensics.muling.domain.SmurfingAlert;
import com.forensics.muling.graph.TransactionGraph;
import com.forensics.muling.support.ParallelRunner;

import java.util.List;

/**
 * Strategy for spotting rapid splitting / consolidation of funds. Selected by
 * {@code muling.detection.smurfing.strategy}.
 */
public interface SmurfingDetectionStrategy {

    /**
     * At most one alert per account, highest risk first. Empty when nothing qualifies.
     */
    List<SmurfingAlert> detect(TransactionGraph graph, DetectionConfig.SmurfingSettings settings, ParallelRunner runner);

    String getStrategyName();
}
