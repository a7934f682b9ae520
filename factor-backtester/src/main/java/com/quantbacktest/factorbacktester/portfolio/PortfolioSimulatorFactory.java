package com.quantbacktest.factorbacktester.portfolio;

import com.quantbacktest.factorbacktester.config.BacktestProperties;
import com.quantbacktest.factorbacktester.domain.TaskConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Builds a fresh {@link PortfolioSimulator} per run from configuration and task overrides.
 */
@Component
@RequiredArgsConstructor
public class PortfolioSimulatorFactory {

    private final BacktestProperties properties;

    public PortfolioSimulator create(BigDecimal initialCapital, TaskConfig config) {
        BacktestProperties.Risk risk = properties.getRisk();
        BigDecimal maxPositionRatio = risk.getMaxPositionRatio();
        BigDecimal stopLossRatio = risk.getStopLossRatio();
        if (config != null && config.getMaxPositionRatio() != null) {
            maxPositionRatio = BigDecimal.valueOf(config.getMaxPositionRatio());
        }
        if (config != null && config.getStopLossRatio() != null) {
            stopLossRatio = BigDecimal.valueOf(config.getStopLossRatio());
        }

        TransactionCostModel costModel = new TransactionCostModel(properties.getCost());
        RiskControls riskControls = new RiskControls(maxPositionRatio, stopLossRatio, costModel);
        return new PortfolioSimulator(initialCapital, costModel, riskControls, properties.getMetrics(),
                properties.getCost().getLotSize());
    }
}
