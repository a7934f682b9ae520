package com.quantbacktest.factorbacktester.exception;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * A debit larger than the cash available. Orders are scaled down to what cash covers before they are
 * booked, so this only surfaces when a booking would leave cash negative.
 */
@Getter
public class InsufficientFundsException extends BacktestException {

    private final BigDecimal required;
    private final BigDecimal available;

    public InsufficientFundsException(BigDecimal required, BigDecimal available) {
        super("INSUFFICIENT_FUNDS", "Order requires " + required + " but only " + available + " is available");
        this.required = required;
        this.available = available;
    }
}
