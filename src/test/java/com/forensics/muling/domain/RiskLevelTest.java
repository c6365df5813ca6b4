package com.forensics.muling.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RiskLevelTest {

    @Test
    void boundariesAreInclusive() {
        assertThat(RiskLevel.fromScore(100.0)).isEqualTo(RiskLevel.CRITICAL);
        assertThat(RiskLevel.fromScore(80.0)).isEqualTo(RiskLevel.CRITICAL);
        assertThat(RiskLevel.fromScore(79.999)).isEqualTo(RiskLevel.HIGH);
        assertThat(RiskLevel.fromScore(60.0)).isEqualTo(RiskLevel.HIGH);
        assertThat(RiskLevel.fromScore(59.999)).isEqualTo(RiskLevel.MEDIUM);
        assertThat(RiskLevel.fromScore(40.0)).isEqualTo(RiskLevel.MEDIUM);
        assertThat(RiskLevel.fromScore(39.999)).isEqualTo(RiskLevel.LOW);
        assertThat(RiskLevel.fromScore(0.0)).isEqualTo(RiskLevel.LOW);
    }

    @Test
    void isAtLeastFollowsSeverity() {
        assertThat(RiskLevel.CRITICAL.isAtLeast(RiskLevel.HIGH)).isTrue();
        assertThat(RiskLevel.MEDIUM.isAtLeast(RiskLevel.HIGH)).isFalse();
        assertThat(RiskLevel.LOW.isAtLeast(RiskLevel.LOW)).isTrue();
    }
}
