package com.quantbacktest.factorbacktester.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantbacktest.factorbacktester.domain.BacktestResult;
import com.quantbacktest.factorbacktester.domain.BacktestTask;
import com.quantbacktest.factorbacktester.domain.FactorCombination;
import com.quantbacktest.factorbacktester.domain.PerformanceReport;
import com.quantbacktest.factorbacktester.domain.TaskConfig;
import com.quantbacktest.factorbacktester.domain.TaskStatus;
import com.quantbacktest.factorbacktester.exception.BacktestExecutionException;
import com.quantbacktest.factorbacktester.exception.DataNotFoundException;
import com.quantbacktest.factorbacktester.exception.ResourceNotFoundException;
import com.quantbacktest.factorbacktester.repository.FactorCombinationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Executes one claimed task and records its result.
 * <p>
 * The run, the result insert and the COMPLETED status write share one transaction. Any exception
 * rolls all of them back and propagates to the caller, which records the failure separately.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BacktestTaskExecutor {

    private final TaskStore taskStore;
    private final FactorCombinationRepository combinationRepository;
    private final BacktestRunner backtestRunner;
    private final ObjectMapper objectMapper;

    @Transactional(isolation = Isolation.READ_COMMITTED)
    public BacktestResult execute(String taskId) {
        long startTime = System.currentTimeMillis();

        BacktestTask task = taskStore.getTaskById(taskId)
                .orElseThrow(() -> new ResourceNotFoundException("Task", taskId));
        if (task.getStatus() != TaskStatus.RUNNING) {
            throw new BacktestExecutionException("Task " + taskId + " is " + task.getStatus() + ", expected RUNNING",
                    null);
        }

        FactorCombination combination = combinationRepository.findById(task.getFactorCombinationId())
                .orElseThrow(() -> new DataNotFoundException(
                        "Factor combination not found: " + task.getFactorCombinationId()));
        TaskConfig config = readConfig(task);

        log.info("Performing backtest - Stock: {}, Period: {} to {}, Combination: {}, Mode: {}",
                task.getStockCode(), task.getStartDate(), task.getEndDate(),
                combination.getName(), config.getBacktestMode());

        BacktestRun run = backtestRunner.run(task, combination, config, () -> taskStore.isCancelRequested(taskId));

        long executionTimeMs = System.currentTimeMillis() - startTime;
        BacktestResult result = taskStore.saveResult(toResult(task, combination, config, run, executionTimeMs));
        log.info("Backtest result saved");

        taskStore.updateTaskStatus(taskId, TaskStatus.COMPLETED, null, result.getId(), 100);
        log.info("Status changed to COMPLETED");
        log.info("Completed in {}s", String.format("%.2f", executionTimeMs / 1000.0));

        return result;
    }

    private TaskConfig readConfig(BacktestTask task) {
        if (task.getConfigJson() == null || task.getConfigJson().isBlank()) {
            return TaskConfig.defaults();
        }
        TaskConfig config;
        try {
            config = objectMapper.readValue(task.getConfigJson(), TaskConfig.class);
        } catch (JsonProcessingException e) {
            throw new BacktestExecutionException("Unreadable task config: " + e.getOriginalMessage(), e);
        }
        config.validate();
        return config;
    }

    private BacktestResult toResult(BacktestTask task, FactorCombination combination, TaskConfig config,
            BacktestRun run, long executionTimeMs) {
        PerformanceReport report = run.getReport();
        try {
            return BacktestResult.builder()
                    .taskId(task.getId())
                    .stockCode(task.getStockCode())
                    .startDate(task.getStartDate())
                    .endDate(task.getEndDate())
                    .backtestMode(config.getBacktestMode())
                    .initialCapital(task.getInitialCapital())
                    .finalValue(run.getFinalValue())
                    .totalReturn(report.getTotalReturn())
                    .annualReturn(report.getAnnualReturn())
                    .maxDrawdown(report.getMaxDrawdown())
                    .volatility(report.getVolatility())
                    .sharpeRatio(report.getSharpeRatio())
                    .sortinoRatio(report.getSortinoRatio())
                    .winRate(report.getWinRate())
                    .avgWin(report.getAvgWin())
                    .avgLoss(report.getAvgLoss())
                    .profitLossRatio(report.getProfitLossRatio())
                    .tradeCount(report.getTradeCount())
                    .var95(report.getVar95())
                    .executionTimeMs(executionTimeMs)
                    .dataPointCount(run.getDataPointCount())
                    .factorCombinationJson(objectMapper.writeValueAsString(combination.getFactors()))
                    .navSeriesJson(objectMapper.writeValueAsString(run.getNavSeries()))
                    .tradesJson(objectMapper.writeValueAsString(run.getTrades()))
                    .build();
        } catch (JsonProcessingException e) {
            throw new BacktestExecutionException("Failed to serialise backtest output", e);
        }
    }
}
