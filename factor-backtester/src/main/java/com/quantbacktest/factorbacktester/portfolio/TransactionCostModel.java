package com.quantbacktest.factorbacktester.portfolio;

import com.quantbacktest.factorbacktester.config.BacktestProperties;
import com.quantbacktest.factorbacktester.domain.Trade;
import com.quantbacktest.factorbacktester.domain.TransactionCost;
import lombok.Getter;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * A-share cost schedule: commission and transfer fee with minimums on both sides, stamp tax on sells,
 * proportional slippage.
 */
@Getter
public class TransactionCostModel {

    private static final int MONEY_SCALE = 4;

    private final BigDecimal commissionRate;
    private final BigDecimal minCommission;
    private final BigDecimal stampTaxRate;
    private final BigDecimal transferFeeRate;
    private final BigDecimal minTransferFee;
    private final BigDecimal slippageRate;

    public TransactionCostModel(BacktestProperties.Cost cost) {
        this.commissionRate = cost.getCommissionRate();
        this.minCommission = cost.getMinCommission();
        this.stampTaxRate = cost.getStampTaxRate();
        this.transferFeeRate = cost.getTransferFeeRate();
        this.minTransferFee = cost.getMinTransferFee();
        this.slippageRate = cost.getSlippageRate();
    }

    public TransactionCost calculate(Trade.TradeType side, BigDecimal price, long shares) {
        BigDecimal notional = price.multiply(BigDecimal.valueOf(shares));

        BigDecimal commission = notional.multiply(commissionRate).max(minCommission);
        BigDecimal stampTax = side == Trade.TradeType.SELL
                ? notional.multiply(stampTaxRate)
                : BigDecimal.ZERO;
        BigDecimal transferFee = notional.multiply(transferFeeRate).max(minTransferFee);
        BigDecimal slippage = notional.multiply(slippageRate);

        return TransactionCost.builder()
                .commission(money(commission))
                .stampTax(money(stampTax))
                .transferFee(money(transferFee))
                .slippage(money(slippage))
                .build();
    }

    private static BigDecimal money(BigDecimal value) {
        return value.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
