package com.quantbacktest.factorbacktester.portfolio;

import com.quantbacktest.factorbacktester.domain.PortfolioPosition;
import com.quantbacktest.factorbacktester.domain.SignalType;
import com.quantbacktest.factorbacktester.domain.TradingSignal;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;

/**
 * Pre-trade risk controls, applied in order: position cap, stop-loss, capital sufficiency.
 */
@Getter
@Slf4j
public class RiskControls {

    private final BigDecimal maxPositionRatio;
    private final BigDecimal stopLossRatio;
    private final BigDecimal costBuffer;

    public RiskControls(BigDecimal maxPositionRatio, BigDecimal stopLossRatio, TransactionCostModel costModel) {
        this.maxPositionRatio = maxPositionRatio;
        this.stopLossRatio = stopLossRatio;
        this.costBuffer = BigDecimal.ONE.add(costModel.getCommissionRate()).add(costModel.getSlippageRate());
    }

    /**
     * @param position current holding of the signal's stock, or null
     */
    public RiskDecision apply(TradingSignal signal, PortfolioPosition position, BigDecimal price, BigDecimal cash) {
        TradingSignal controlled = signal;
        boolean capped = false;
        boolean stopLoss = false;
        boolean capitalLimited = false;

        if (controlled.getSignalType() == SignalType.BUY
                && controlled.getPositionSize() > maxPositionRatio.doubleValue()) {
            controlled = controlled.toBuilder().positionSize(maxPositionRatio.doubleValue()).build();
            capped = true;
            log.debug("Position size for {} capped at {}", signal.getStockCode(), maxPositionRatio);
        }

        if (position != null && position.getShares() > 0) {
            BigDecimal stopPrice = position.getAvgCost().multiply(BigDecimal.ONE.subtract(stopLossRatio));
            if (price.compareTo(stopPrice) <= 0) {
                if (controlled.getSignalType() != SignalType.SELL) {
                    log.warn("Stop-loss triggered for {}: price {} <= stop price {}",
                            signal.getStockCode(), price, stopPrice);
                }
                controlled = controlled.toBuilder()
                        .signalType(SignalType.SELL)
                        .positionSize(1.0)
                        .build();
                stopLoss = true;
            }
        }

        if (controlled.getSignalType() == SignalType.BUY) {
            BigDecimal required = cash.multiply(BigDecimal.valueOf(controlled.getPositionSize()));
            BigDecimal estimatedCost = required.multiply(costBuffer);
            if (estimatedCost.compareTo(cash) > 0) {
                double affordable = Math.max(0.0, 1.0 / costBuffer.doubleValue());
                controlled = controlled.toBuilder().positionSize(affordable).build();
                capitalLimited = true;
                log.warn("Insufficient funds for {}: position size reduced to {}", signal.getStockCode(), affordable);
            }
        }

        return new RiskDecision(controlled, capped, stopLoss, capitalLimited);
    }
}
