package com.quantbacktest.factorbacktester.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class TransactionCost {

    BigDecimal commission;
    BigDecimal stampTax;
    BigDecimal transferFee;
    BigDecimal slippage;

    public BigDecimal getTotal() {
        return commission.add(stampTax).add(transferFee).add(slippage);
    }
}
