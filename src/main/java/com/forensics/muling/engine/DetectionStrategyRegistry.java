package com.forensics.muling.engine;

import com.forensics.muling.cycle.CycleDetectionStrategy;
import com.forensics.muling.shell.ShellDetectionStrategy;
import com.forensics.muling.smurfing.SmurfingDetectionStrategy;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Looks up detector implementations by the strategy name carried in {@code DetectionConfig}.
 */
@Component
public class DetectionStrategyRegistry {

    private final Map<String, CycleDetectionStrategy> cycleStrategies;
    private final Map<String, SmurfingDetectionStrategy> smurfingStrategies;
    private final Map<String, ShellDetectionStrategy> shellStrategies;

    public DetectionStrategyRegistry(List<CycleDetectionStrategy> cycleStrategies,
                                     List<SmurfingDetectionStrategy> smurfingStrategies,
                                     List<ShellDetectionStrategy> shellStrategies) {
        this.cycleStrategies = index(cycleStrategies, CycleDetectionStrategy::getStrategyName);
        this.smurfingStrategies = index(smurfingStrategies, SmurfingDetectionStrategy::getStrategyName);
        this.shellStrategies = index(shellStrategies, ShellDetectionStrategy::getStrategyName);
    }

    public CycleDetectionStrategy cycleStrategy(String name) {
        return select("cycle", cycleStrategies, name);
    }

    public SmurfingDetectionStrategy smurfingStrategy(String name) {
        return select("smurfing", smurfingStrategies, name);
    }

    public ShellDetectionStrategy shellStrategy(String name) {
        return select("shell", shellStrategies, name);
    }

    private static <S> Map<String, S> index(List<S> strategies, Function<S, String> naming) {
        return strategies.stream().collect(Collectors.toMap(naming, Function.identity(), (a, b) -> {
            throw new IllegalStateException("Duplicate strategy name: " + naming.apply(a));
        }, TreeMap::new));
    }

    private static <S> S select(String detector, Map<String, S> strategies, String name) {
        S selected = name == null ? null : strategies.get(name);
        if (selected == null) {
            throw new IllegalArgumentException(
                    "Unknown " + detector + " strategy: " + name +
                    ". Available: " + strategies.keySet());
        }
        return selected;
    }
}
