package com.forensics.muling.scoring;

import com.forensics.muling.config.DetectionConfig;
import com.forensics.muling.cycle.CycleDetectionResult;
import com.forensics.muling.domain.AccountScore;
import com.forensics.muling.domain.Cycle;
import com.forensics.muling.domain.RiskFactor;
import com.forensics.muling.domain.RiskLevel;
import com.forensics.muling.domain.ShellProfile;
import com.forensics.muling.domain.SmurfingAlert;
import com.forensics.muling.domain.SmurfingFlag;
import com.forensics.muling.graph.AccountStats;
import com.forensics.muling.graph.TransactionGraph;
import com.forensics.muling.support.ParallelRunner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Folds detector outputs into one {@link AccountScore} per account:
 * {@code final = w_ring * ring + w_smurf * smurf + w_shell * shell + w_pattern * pattern}.
 */
@Slf4j
@Component
public class RiskScorer {

    private static final double RING_BASE = 50.0;
    private static final double RING_AMOUNT_NORMALIZER = 1_000_000.0;
    private static final double RING_AMOUNT_CAP = 1.5;

    private final TransactionPatternScorer patternScorer;

    public RiskScorer(TransactionPatternScorer patternScorer) {
        this.patternScorer = patternScorer;
    }

    /**
     * Scores every account in the graph. Result is ordered by final score, highest first, ties by
     * account id.
     */
    public List<AccountScore> score(TransactionGraph graph,
                                    CycleDetectionResult cycles,
                                    List<SmurfingAlert> smurfingAlerts,
                                    List<ShellProfile> shellProfiles,
                                    DetectionConfig.ScoringSettings settings,
                                    ParallelRunner runner) {
        Map<String, SmurfingAlert> alertsByAccount = smurfingAlerts.stream()
                .collect(Collectors.toMap(SmurfingAlert::getAccountId, Function.identity()));
        Map<String, ShellProfile> shellsByAccount = shellProfiles.stream()
                .collect(Collectors.toMap(ShellProfile::getAccountId, Function.identity()));

        SortedMap<String, AccountScore> scores = runner.mapByKey(new ArrayList<>(graph.getAccountIds()), accountId ->
                graph.getStats(accountId)
                        .map(stats -> scoreAccount(stats, cycles, alertsByAccount.get(accountId),
                                shellsByAccount.get(accountId), settings))
                        .orElse(null));

        log.debug("Scored {} accounts", scores.size());
        return scores.values().stream()
                .sorted(Comparator.comparingDouble(AccountScore::getFinalScore).reversed()
                        .thenComparing(AccountScore::getAccountId))
                .collect(Collectors.toUnmodifiableList());
    }

    AccountScore scoreAccount(AccountStats stats, CycleDetectionResult cycles, SmurfingAlert alert,
                              ShellProfile shell, DetectionConfig.ScoringSettings settings) {
        String accountId = stats.getAccountId();
        Set<RiskFactor> factors = EnumSet.noneOf(RiskFactor.class);

        int participation = cycles.participationOf(accountId);
        double ring = ringInvolvementScore(participation, cycles.getCycles().size(), cycles.cyclesContaining(accountId));
        if (participation >= 1) factors.add(RiskFactor.RING_MEMBER);
        if (participation >= 2) factors.add(RiskFactor.MULTIPLE_RINGS);

        double smurf = 0.0;
        if (alert != null) {
            smurf = alert.getRiskScore();
            for (SmurfingFlag flag : alert.getFlags()) factors.add(flag.toRiskFactor());
        }

        double shellScore = 0.0;
        if (shell != null) {
            shellScore = shell.getShellScore();
            factors.addAll(shell.getRiskFactors());
        }

        PatternScore pattern = patternScorer.score(stats, settings);
        factors.addAll(pattern.getFlags());

        double finalScore = settings.getRingWeight() * clip(ring)
                + settings.getSmurfingWeight() * clip(smurf)
                + settings.getShellWeight() * clip(shellScore)
                + settings.getPatternWeight() * clip(pattern.getScore());
        finalScore = clip(finalScore);

        return AccountScore.builder()
                .accountId(accountId)
                .ringInvolvementScore(ring)
                .smurfingScore(smurf)
                .shellScore(shellScore)
                .transactionPatternScore(pattern.getScore())
                .finalScore(finalScore)
                .riskLevel(RiskLevel.fromScore(finalScore))
                .riskFactors(List.copyOf(factors))
                .build();
    }

    /**
     * Zero outside every ring. Otherwise a base of 50 plus up to 50 for the share of rings the
     * account sits in, boosted by up to 1.5x for large average ring volume.
     */
    static double ringInvolvementScore(int participation, int totalCycles, List<Cycle> rings) {
        if (participation == 0 || totalCycles == 0 || rings.isEmpty()) return 0.0;
        double share = RING_BASE + RING_BASE * participation / totalCycles;
        BigDecimal volume = BigDecimal.ZERO;
        for (Cycle ring : rings) volume = volume.add(ring.getTotalAmount());
        double avgAmount = volume.doubleValue() / rings.size();
        double multiplier = Math.min(RING_AMOUNT_CAP, 1.0 + avgAmount / RING_AMOUNT_NORMALIZER);
        return Math.min(100.0, share * multiplier);
    }

    private static double clip(double value) {
        return Math.max(0.0, Math.min(100.0, value));
    }
}
