package com.quantbacktest.factorbacktester.domain;

/**
 * How a run is interpreted. Both modes replay history identically; the mode is part of the snapshot cache key.
 */
public enum BacktestMode {
    HISTORICAL_SIMULATION,
    MODEL_VALIDATION
}
