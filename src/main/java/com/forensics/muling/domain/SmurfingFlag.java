package com.forensics.muling.domain;

/**
 * Pattern flags attached to a {@link SmurfingAlert}.
 */
public enum SmurfingFlag {
    HIGH_FREQUENCY(RiskFactor.HIGH_FREQUENCY),
    STRUCTURING(RiskFactor.STRUCTURING_DETECTED),
    CONSOLIDATION(RiskFactor.CONSOLIDATION);

    private final RiskFactor riskFactor;

    SmurfingFlag(RiskFactor riskFactor) {
        this.riskFactor = riskFactor;
    }

    public RiskFactor toRiskFactor() {
        return riskFactor;
    }
}
