package com.quantbacktest.factorbacktester.portfolio;

import com.quantbacktest.factorbacktester.domain.TradingSignal;
import lombok.Value;

/**
 * Signal after risk controls, with the controls that changed it.
 */
@Value
public class RiskDecision {

    TradingSignal signal;
    boolean positionCapped;
    boolean stopLossTriggered;
    boolean capitalLimited;
}
