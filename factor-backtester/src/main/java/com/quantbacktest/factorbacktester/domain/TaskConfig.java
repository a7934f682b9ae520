package com.quantbacktest.factorbacktester.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.quantbacktest.factorbacktester.exception.ValidationException;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Per-task overrides stored as JSON on the task row.
 * Unset fields fall back to the application defaults; unknown keys belong in {@code extensions}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TaskConfig {

    public static final int CURRENT_VERSION = 1;

    @Min(value = CURRENT_VERSION, message = "Unsupported task config version")
    @Max(value = CURRENT_VERSION, message = "Unsupported task config version")
    @Builder.Default
    private int version = CURRENT_VERSION;

    @NotNull(message = "Backtest mode is required")
    @Builder.Default
    private BacktestMode backtestMode = BacktestMode.HISTORICAL_SIMULATION;

    @DecimalMin("-1.0")
    @DecimalMax("1.0")
    private Double buyThreshold;

    @DecimalMin("-1.0")
    @DecimalMax("1.0")
    private Double sellThreshold;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double minStrength;

    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("1.0")
    private Double maxPositionSize;

    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("1.0")
    private Double maxPositionRatio;

    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax(value = "1.0", inclusive = false)
    private Double stopLossRatio;

    @Builder.Default
    private Map<String, Object> extensions = new HashMap<>();

    public static TaskConfig defaults() {
        return TaskConfig.builder().build();
    }

    /**
     * Checks the version and every override that is set. Thresholds lie in [-1, 1], strength in [0, 1],
     * position size and position ratio in (0, 1], stop-loss ratio in (0, 1).
     *
     * @throws ValidationException on the first value out of range
     */
    public void validate() {
        if (version != CURRENT_VERSION) {
            throw new ValidationException("Unsupported task config version " + version
                    + ", expected " + CURRENT_VERSION);
        }
        if (backtestMode == null) {
            throw new ValidationException("Backtest mode is required");
        }
        requireBetween("buyThreshold", buyThreshold, -1.0, true, 1.0, true);
        requireBetween("sellThreshold", sellThreshold, -1.0, true, 1.0, true);
        requireBetween("minStrength", minStrength, 0.0, true, 1.0, true);
        requireBetween("maxPositionSize", maxPositionSize, 0.0, false, 1.0, true);
        requireBetween("maxPositionRatio", maxPositionRatio, 0.0, false, 1.0, true);
        requireBetween("stopLossRatio", stopLossRatio, 0.0, false, 1.0, false);
    }

    private static void requireBetween(String field, Double value, double min, boolean minInclusive,
            double max, boolean maxInclusive) {
        if (value == null) {
            return;
        }
        boolean aboveMin = minInclusive ? value >= min : value > min;
        boolean belowMax = maxInclusive ? value <= max : value < max;
        // NaN fails both comparisons
        if (!aboveMin || !belowMax) {
            throw new ValidationException(String.format("%s %s is outside %s%s, %s%s",
                    field, value, minInclusive ? "[" : "(", min, max, maxInclusive ? "]" : ")"));
        }
    }
}
