package com.forensics.muling.domain;

/**
 * Risk tier derived from a 0–100 score. Lower bounds are inclusive: exactly 80 is CRITICAL,
 * exactly 60 is HIGH, exactly 40 is MEDIUM.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public static RiskLevel fromScore(double score) {
        if (score >= 80.0) return CRITICAL;
        if (score >= 60.0) return HIGH;
        if (score >= 40.0) return MEDIUM;
        return LOW;
    }

    public boolean isAtLeast(RiskLevel other) {
        return compareTo(other) >= 0;
    }
}
