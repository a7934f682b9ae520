package com.quantbacktest.factorbacktester.exception;

/**
 * Factor combination whose active weights do not sum to one, or which repeats a factor name.
 */
public class FactorWeightException extends ValidationException {

    public FactorWeightException(String message) {
        super("FACTOR_WEIGHT_ERROR", message);
    }
}
