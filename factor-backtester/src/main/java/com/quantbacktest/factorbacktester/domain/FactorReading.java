package com.quantbacktest.factorbacktester.domain;

import lombok.Value;

import java.time.LocalDate;

/**
 * A factor value together with the date it became publicly known.
 */
@Value
public class FactorReading {

    double value;
    LocalDate knownOn;

    public static FactorReading of(double value, LocalDate knownOn) {
        return new FactorReading(value, knownOn);
    }
}
