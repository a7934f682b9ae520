package com.quantbacktest.factorbacktester.domain;

public enum SignalType {
    BUY,
    SELL,
    HOLD
}
