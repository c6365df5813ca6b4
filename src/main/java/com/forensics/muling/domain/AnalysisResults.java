package com.forensics.muling.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Complete output of one analysis run. Read-only for every consumer.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AnalysisResults {

    int totalTransactions;
    int totalAccounts;
    /** Ordered by strength, strongest first. */
    List<Cycle> ringsDetected;
    List<CycleOverlap> ringOverlaps;
    List<RingCluster> ringClusters;
    /** Ordered by risk score, highest first. */
    List<SmurfingAlert> smurfingAlerts;
    /** Ordered by shell score, highest first. */
    List<ShellProfile> shellAccounts;
    /** One per account, ordered by final score, highest first. */
    List<AccountScore> accountScores;
    List<String> criticalAccounts;
    List<String> highRiskAccounts;
    AnalysisSummary summary;

    public Optional<AccountScore> findAccountScore(String accountId) {
        return accountScores.stream().filter(s -> s.getAccountId().equals(accountId)).findFirst();
    }
}
