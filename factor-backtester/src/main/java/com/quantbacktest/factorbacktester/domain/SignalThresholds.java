package com.quantbacktest.factorbacktester.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Score cut-offs and sizing limits used when turning a composite score into a signal.
 */
@Value
@Builder(toBuilder = true)
public class SignalThresholds {

    @Builder.Default
    double buyThreshold = 0.6;

    @Builder.Default
    double sellThreshold = -0.6;

    @Builder.Default
    double minStrength = 0.1;

    @Builder.Default
    double maxPositionSize = 1.0;

    public static SignalThresholds defaults() {
        return SignalThresholds.builder().build();
    }

    /**
     * Applies the non-null overrides of a task config on top of these thresholds.
     */
    public SignalThresholds withOverrides(TaskConfig config) {
        if (config == null) {
            return this;
        }
        SignalThresholdsBuilder builder = toBuilder();
        if (config.getBuyThreshold() != null) {
            builder.buyThreshold(config.getBuyThreshold());
        }
        if (config.getSellThreshold() != null) {
            builder.sellThreshold(config.getSellThreshold());
        }
        if (config.getMinStrength() != null) {
            builder.minStrength(config.getMinStrength());
        }
        if (config.getMaxPositionSize() != null) {
            builder.maxPositionSize(config.getMaxPositionSize());
        }
        return builder.build();
    }
}
