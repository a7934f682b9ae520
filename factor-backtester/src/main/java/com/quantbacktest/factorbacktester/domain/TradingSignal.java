package com.quantbacktest.factorbacktester.domain;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Map;

/**
 * Trading decision for one snapshot. A HOLD always carries zero strength and zero position size.
 */
@Value
@Builder(toBuilder = true)
public class TradingSignal {

    String stockCode;
    LocalDate timestamp;
    SignalType signalType;
    double strength;
    double positionSize;
    double confidence;
    double compositeScore;
    Map<String, Double> factorScores;

    public boolean isHold() {
        return signalType == SignalType.HOLD;
    }

    /**
     * Same signal rewritten to HOLD; confidence, score and factor scores are kept for audit.
     */
    public TradingSignal toHold() {
        return toBuilder()
                .signalType(SignalType.HOLD)
                .strength(0.0)
                .positionSize(0.0)
                .build();
    }
}
