package com.quantbacktest.factorbacktester.domain;

public enum FactorType {
    TECHNICAL,
    FUNDAMENTAL,
    MARKET,
    SENTIMENT,
    MACRO
}
