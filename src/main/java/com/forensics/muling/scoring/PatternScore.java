package com.forensics.muling.scoring;

import com.forensics.muling.domain.RiskFactor;
import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Account-level anomaly signal measured against the account's own history.
 */
@Value
@Builder
public class PatternScore {

    double velocityScore;
    double amountScore;
    double throughputScore;
    /** Weighted blend of the three, 0–100. */
    double score;
    Set<RiskFactor> flags;
}
