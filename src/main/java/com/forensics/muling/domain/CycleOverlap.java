package com.forensics.muling.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Two detected rings that share at least two accounts.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CycleOverlap {

    String firstRingId;
    String secondRingId;
    List<String> sharedAccounts;
    /** True when one ring's account set is a strict subset of the other's. */
    boolean nested;
}
