package com.forensics.muling.shell;

import com.forensics.muling.config.DetectionConfig;
import com.forensics.muling.domain.ShellProfile;
import com.forensics.muling.graph.TransactionGraph;
import com.forensics.muling.support.ParallelRunner;

import java.util.List;
import java.util.Optional;

/**
 * Strategy for profiling shell / pass-through accounts. Selected by
 * {@code muling.detection.shell.strategy}.
 */
public interface ShellDetectionStrategy {

    /**
     * Population scan: profiles only accounts passing the low-activity / high-value pre-filter and
     * returns those at or above the report threshold, highest score first.
     */
    List<ShellProfile> detect(TransactionGraph graph, DetectionConfig.ShellSettings settings, ParallelRunner runner);

    /**
     * Profile a single account with no pre-filter. Empty if the account does not appear in the graph.
     */
    Optional<ShellProfile> profile(TransactionGraph graph, String accountId, DetectionConfig.ShellSettings settings);

    /**
     * Accounts whose outbound total matches their inbound total within the pass-through tolerance,
     * regardless of volume. Sorted by account id.
     */
    List<String> findPassThroughAccounts(TransactionGraph graph, DetectionConfig.ShellSettings settings);

    String getStrategyName();
}
