package com.forensics.muling.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Named flags raised by the detectors and reported on {@link AccountScore}. Declaration order is
 * the order in which factors are listed, so output is stable across runs.
 */
public enum RiskFactor {
    /** Member of at least one detected ring. */
    RING_MEMBER("ring_member"),
    /** Member of two or more detected rings. */
    MULTIPLE_RINGS("multiple_rings"),
    /** Burst of transactions faster than one per hour, or ten or more in a window. */
    HIGH_FREQUENCY("high_frequency"),
    /** Amounts clustered just under reporting thresholds. */
    STRUCTURING_DETECTED("structuring_detected"),
    /** Many inbound transfers collapsed into one matching outbound transfer. */
    CONSOLIDATION("consolidation"),
    HIGH_SHELL_SCORE("high_shell_score"),
    PASS_THROUGH("pass_through"),
    LIMITED_SOURCES("limited_sources"),
    LIMITED_DESTINATIONS("limited_destinations"),
    DORMANT_THEN_ACTIVE("dormant_then_active"),
    ONE_DIRECTIONAL_FLOW("one_directional_flow"),
    UNIFORM_AMOUNTS("uniform_amounts"),
    HIGH_VALUE_TRANSACTIONS("high_value_transactions"),
    VELOCITY_ANOMALY("velocity_anomaly"),
    UNUSUAL_AMOUNT("unusual_amount"),
    CONCENTRATED_THROUGHPUT("concentrated_throughput");

    private final String tag;

    RiskFactor(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }
}
