package com.quantbacktest.factorbacktester.signal;

import com.quantbacktest.factorbacktester.config.BacktestProperties;
import com.quantbacktest.factorbacktester.domain.DataSnapshot;
import com.quantbacktest.factorbacktester.domain.FactorCombination;
import com.quantbacktest.factorbacktester.domain.FactorConfig;
import com.quantbacktest.factorbacktester.domain.SignalThresholds;
import com.quantbacktest.factorbacktester.domain.SignalType;
import com.quantbacktest.factorbacktester.domain.TradingSignal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a snapshot's factor readings into a BUY, SELL or HOLD signal.
 * <p>
 * Each factor value is squashed to [-1, 1] with tanh and the composite score is the weighted mean
 * over the active factors present in the snapshot. Absent and NaN factors are left out of both the
 * weighted sum and the total weight.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SignalGenerator {

    private static final double COMPLETENESS_WEIGHT = 0.3;
    private static final double CONSISTENCY_WEIGHT = 0.4;
    private static final double SCORE_WEIGHT = 0.3;

    private final BacktestProperties properties;

    /**
     * Thresholds from configuration, before any per-task override.
     */
    public SignalThresholds defaultThresholds() {
        BacktestProperties.Signal signal = properties.getSignal();
        return SignalThresholds.builder()
                .buyThreshold(signal.getBuyThreshold())
                .sellThreshold(signal.getSellThreshold())
                .minStrength(signal.getMinStrength())
                .maxPositionSize(signal.getMaxPositionSize())
                .build();
    }

    /**
     * Weighted composite score in [-1, 1]; 0 when no configured factor is usable.
     */
    public double score(Map<String, Double> factorData, FactorCombination combination) {
        double weightedSum = 0.0;
        double totalWeight = 0.0;

        for (FactorConfig factor : combination.getActiveFactors()) {
            Double value = factorData.get(factor.getName());
            if (!isUsable(value)) {
                continue;
            }
            weightedSum += Math.tanh(value) * factor.getWeight();
            totalWeight += factor.getWeight();
        }

        if (totalWeight <= 0.0) {
            return 0.0;
        }
        return clamp(weightedSum / totalWeight, -1.0, 1.0);
    }

    public TradingSignal generate(DataSnapshot snapshot, FactorCombination combination, SignalThresholds thresholds) {
        return generate(snapshot, combination, thresholds, snapshot.getStockCode(), snapshot.getTimestamp());
    }

    public TradingSignal generate(DataSnapshot snapshot, FactorCombination combination, SignalThresholds thresholds,
            String stockCode, LocalDate timestamp) {
        Map<String, Double> factorScores = factorScores(snapshot.getFactorData(), combination);
        double compositeScore = score(snapshot.getFactorData(), combination);

        SignalType signalType;
        double strength;
        if (compositeScore >= thresholds.getBuyThreshold()) {
            signalType = SignalType.BUY;
            strength = Math.min(Math.abs(compositeScore), 1.0);
        } else if (compositeScore <= thresholds.getSellThreshold()) {
            signalType = SignalType.SELL;
            strength = Math.min(Math.abs(compositeScore), 1.0);
        } else {
            signalType = SignalType.HOLD;
            strength = 0.0;
        }

        if (signalType != SignalType.HOLD && strength < thresholds.getMinStrength()) {
            signalType = SignalType.HOLD;
            strength = 0.0;
        }

        double maxPositionSize = Math.min(thresholds.getMaxPositionSize(), 1.0);
        double positionSize = signalType == SignalType.HOLD
                ? 0.0
                : Math.min(strength * maxPositionSize, maxPositionSize);

        double confidence = confidence(factorScores, combination.getActiveFactors().size(), compositeScore);

        TradingSignal signal = TradingSignal.builder()
                .stockCode(stockCode)
                .timestamp(timestamp)
                .signalType(signalType)
                .strength(strength)
                .positionSize(positionSize)
                .confidence(confidence)
                .compositeScore(compositeScore)
                .factorScores(factorScores)
                .build();

        log.debug("{} {} score={} strength={} confidence={}",
                timestamp, signalType, compositeScore, strength, confidence);
        return signal;
    }

    /**
     * Rewrites low-confidence signals and weak non-HOLD signals to HOLD, keeping confidence and score.
     */
    public TradingSignal applyFilters(TradingSignal signal) {
        BacktestProperties.Signal config = properties.getSignal();

        if (signal.getConfidence() < config.getMinConfidence()) {
            return signal.isHold() ? signal : signal.toHold();
        }
        if (!signal.isHold() && signal.getStrength() < config.getMinFilterStrength()) {
            return signal.toHold();
        }
        return signal;
    }

    /**
     * Position size scaled by confidence (floored at the minimum confidence) and a caller-supplied
     * risk multiplier, capped at the configured maximum.
     */
    public double calculatePositionSize(TradingSignal signal, double riskMultiplier) {
        if (signal.isHold()) {
            return 0.0;
        }
        BacktestProperties.Signal config = properties.getSignal();
        double confidenceMultiplier = Math.max(signal.getConfidence(), config.getMinConfidence());
        double size = signal.getPositionSize() * confidenceMultiplier * riskMultiplier;
        return clamp(size, 0.0, config.getMaxPositionSize());
    }

    Map<String, Double> factorScores(Map<String, Double> factorData, FactorCombination combination) {
        Map<String, Double> scores = new LinkedHashMap<>();
        for (FactorConfig factor : combination.getActiveFactors()) {
            Double value = factorData.get(factor.getName());
            if (isUsable(value)) {
                scores.put(factor.getName(), Math.tanh(value));
            }
        }
        return scores;
    }

    /**
     * 0.3 x completeness + 0.4 x directional consistency + 0.3 x |score|.
     */
    double confidence(Map<String, Double> factorScores, int expectedFactors, double compositeScore) {
        if (factorScores.isEmpty() || expectedFactors <= 0) {
            return 0.0;
        }

        double completeness = Math.min((double) factorScores.size() / expectedFactors, 1.0);

        List<Double> values = List.copyOf(factorScores.values());
        long positive = values.stream().filter(v -> v > 0).count();
        long negative = values.stream().filter(v -> v < 0).count();
        double consistency = (double) Math.max(positive, negative) / values.size();

        double scoreStrength = Math.min(Math.abs(compositeScore), 1.0);

        double confidence = COMPLETENESS_WEIGHT * completeness
                + CONSISTENCY_WEIGHT * consistency
                + SCORE_WEIGHT * scoreStrength;
        return clamp(confidence, 0.0, 1.0);
    }

    private static boolean isUsable(Double value) {
        return value != null && !value.isNaN() && !value.isInfinite();
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
