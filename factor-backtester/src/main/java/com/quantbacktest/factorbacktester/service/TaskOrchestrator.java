package com.quantbacktest.factorbacktester.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantbacktest.factorbacktester.config.BacktestProperties;
import com.quantbacktest.factorbacktester.controller.dto.TaskResponse;
import com.quantbacktest.factorbacktester.controller.dto.TaskResultResponse;
import com.quantbacktest.factorbacktester.controller.dto.TaskSubmissionRequest;
import com.quantbacktest.factorbacktester.domain.BacktestResult;
import com.quantbacktest.factorbacktester.domain.BacktestTask;
import com.quantbacktest.factorbacktester.domain.TaskConfig;
import com.quantbacktest.factorbacktester.domain.TaskStatus;
import com.quantbacktest.factorbacktester.exception.BacktestExecutionException;
import com.quantbacktest.factorbacktester.exception.ResourceNotFoundException;
import com.quantbacktest.factorbacktester.exception.TaskCancelledException;
import com.quantbacktest.factorbacktester.exception.ValidationException;
import com.quantbacktest.factorbacktester.repository.FactorCombinationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Submission, dispatch and lifecycle commands for backtest tasks.
 * <p>
 * Tasks are dispatched one at a time by the polling worker. A task is only executed after this
 * instance has won the atomic PENDING to RUNNING claim, so a task is never run twice concurrently.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TaskOrchestrator {

    static final int MAX_ERROR_LENGTH = 1000;

    private static final Pattern STOCK_CODE = Pattern.compile("^\\d{6}\\.(SH|SZ)$");

    private final TaskStore taskStore;
    private final FactorCombinationRepository combinationRepository;
    private final BacktestTaskExecutor taskExecutor;
    private final BacktestMetricsService metricsService;
    private final BacktestProperties properties;
    private final ObjectMapper objectMapper;

    /**
     * Validates and persists a new PENDING task.
     *
     * @throws ValidationException if any parameter is rejected; nothing is persisted in that case
     */
    public TaskResponse submit(TaskSubmissionRequest request) {
        validate(request);

        String taskId = TaskIds.newTaskId();
        String batchId = isBlank(request.getBatchId()) ? TaskIds.newBatchId() : request.getBatchId();
        String name = isBlank(request.getName())
                ? String.format("%s %s~%s", request.getStockCode(), request.getStartDate(), request.getEndDate())
                : request.getName();
        TaskConfig config = request.getConfig() == null ? TaskConfig.defaults() : request.getConfig();

        BacktestTask task = BacktestTask.builder()
                .id(taskId)
                .batchId(batchId)
                .name(name)
                .stockCode(request.getStockCode())
                .startDate(request.getStartDate())
                .endDate(request.getEndDate())
                .initialCapital(request.getInitialCapital())
                .factorCombinationId(request.getFactorCombinationId())
                .configJson(writeConfig(config))
                .build();

        BacktestTask saved = taskStore.createTask(task);
        metricsService.recordTaskSubmitted();
        log.info("Submitted task {} in batch {} - Stock: {}, Period: {} to {}",
                taskId, batchId, saved.getStockCode(), saved.getStartDate(), saved.getEndDate());

        return TaskResponse.from(saved);
    }

    /**
     * One scheduler tick: claims and runs up to {@code batch-size} pending tasks, oldest first.
     * Failures are recorded on the task and never escape the tick.
     *
     * @return number of tasks this tick claimed and ran
     */
    public int pollAndDispatch() {
        List<BacktestTask> pending = taskStore.listPendingTasks(properties.getScheduler().getBatchSize());
        if (pending.isEmpty()) {
            log.debug("No pending tasks");
            return 0;
        }

        log.info("Found {} pending tasks", pending.size());
        int dispatched = 0;
        for (BacktestTask task : pending) {
            if (!tryClaim(task.getId())) {
                continue;
            }
            dispatch(task);
            dispatched++;
        }

        log.info("Dispatched {} tasks. {}", dispatched, metricsService.getMetricsSummary());
        return dispatched;
    }

    private boolean tryClaim(String taskId) {
        try {
            if (taskStore.claimTask(taskId)) {
                return true;
            }
            log.debug("Task {} already claimed elsewhere, skipping", taskId);
        } catch (Exception e) {
            // Still PENDING, picked up again on the next tick
            log.error("Could not claim task {}: {}", taskId, e.getMessage(), e);
        }
        return false;
    }

    private void dispatch(BacktestTask task) {
        MDC.put("taskId", task.getId());
        MDC.put("batchId", task.getBatchId());

        try {
            log.info("Status changed to RUNNING");
            BacktestResult result = taskExecutor.execute(task.getId());
            metricsService.recordTaskCompleted(result.getExecutionTimeMs());
        } catch (TaskCancelledException e) {
            log.info("Backtest cancelled: {}", e.getMessage());
            if (markTerminal(task.getId(), TaskStatus.CANCELLED, e.getMessage())) {
                metricsService.recordTaskCancelled();
            }
        } catch (Exception e) {
            log.error("Backtest failed: {}", e.getMessage(), e);
            if (markTerminal(task.getId(), TaskStatus.FAILED, describe(e))) {
                metricsService.recordTaskFailed();
            }
        } finally {
            MDC.remove("taskId");
            MDC.remove("batchId");
        }
    }

    private boolean markTerminal(String taskId, TaskStatus status, String message) {
        try {
            taskStore.updateTaskStatus(taskId, status, truncate(message), null, null);
            log.info("Status changed to {}", status);
            return true;
        } catch (Exception e) {
            log.error("Could not record {} for task {}: {}", status, taskId, e.getMessage(), e);
            return false;
        }
    }

    /**
     * Cancels a PENDING task immediately or asks a RUNNING one to stop at its next snapshot.
     */
    public TaskResponse cancel(String taskId) {
        BacktestTask task = taskStore.cancelTask(taskId);
        if (task.getStatus() == TaskStatus.CANCELLED) {
            metricsService.recordTaskCancelled();
        }
        log.info("Cancel requested for task {} (status {})", taskId, task.getStatus());
        return TaskResponse.from(task);
    }

    /**
     * Moves a FAILED or CANCELLED task back to PENDING for another run.
     */
    public TaskResponse requeue(String taskId) {
        BacktestTask task = taskStore.updateTaskStatus(taskId, TaskStatus.PENDING, null, null, 0);
        metricsService.recordTaskRequeued();
        log.info("Task {} requeued", taskId);
        return TaskResponse.from(task);
    }

    public TaskResponse getTask(String taskId) {
        return taskStore.getTaskById(taskId)
                .map(TaskResponse::from)
                .orElseThrow(() -> new ResourceNotFoundException("Task", taskId));
    }

    public List<TaskResponse> getTasksByBatch(String batchId) {
        taskStore.getBatch(batchId).orElseThrow(() -> new ResourceNotFoundException("Batch", batchId));
        return taskStore.getTasksByBatch(batchId).stream()
                .map(TaskResponse::from)
                .toList();
    }

    public List<TaskResponse> listTasks(TaskStatus status) {
        return taskStore.listTasks(status).stream()
                .map(TaskResponse::from)
                .toList();
    }

    public TaskResultResponse getTaskResult(String taskId) {
        taskStore.getTaskById(taskId).orElseThrow(() -> new ResourceNotFoundException("Task", taskId));
        BacktestResult result = taskStore.getResultByTaskId(taskId)
                .orElseThrow(() -> new ResourceNotFoundException("Result for task", taskId));

        return TaskResultResponse.builder()
                .resultId(result.getId())
                .taskId(result.getTaskId())
                .stockCode(result.getStockCode())
                .startDate(result.getStartDate())
                .endDate(result.getEndDate())
                .backtestMode(result.getBacktestMode())
                .initialCapital(result.getInitialCapital())
                .finalValue(result.getFinalValue())
                .totalReturn(result.getTotalReturn())
                .annualReturn(result.getAnnualReturn())
                .maxDrawdown(result.getMaxDrawdown())
                .volatility(result.getVolatility())
                .sharpeRatio(result.getSharpeRatio())
                .sortinoRatio(result.getSortinoRatio())
                .winRate(result.getWinRate())
                .avgWin(result.getAvgWin())
                .avgLoss(result.getAvgLoss())
                .profitLossRatio(result.getProfitLossRatio())
                .tradeCount(result.getTradeCount())
                .var95(result.getVar95())
                .executionTimeMs(result.getExecutionTimeMs())
                .dataPointCount(result.getDataPointCount())
                .factorCombination(readTree(result.getFactorCombinationJson()))
                .navSeries(readTree(result.getNavSeriesJson()))
                .trades(readTree(result.getTradesJson()))
                .build();
    }

    private void validate(TaskSubmissionRequest request) {
        if (request.getStockCode() == null || !STOCK_CODE.matcher(request.getStockCode()).matches()) {
            throw new ValidationException("Invalid stock code: " + request.getStockCode()
                    + " (expected six digits followed by .SH or .SZ)");
        }
        if (request.getStartDate() == null || request.getEndDate() == null) {
            throw new ValidationException("Start and end dates are required");
        }
        if (!request.getEndDate().isAfter(request.getStartDate())) {
            throw new ValidationException("End date " + request.getEndDate()
                    + " must be after start date " + request.getStartDate());
        }
        if (request.getEndDate().isAfter(LocalDate.now())) {
            throw new ValidationException("End date " + request.getEndDate() + " is in the future");
        }
        if (request.getInitialCapital() == null || request.getInitialCapital().compareTo(BigDecimal.ZERO) <= 0) {
            throw new ValidationException("Initial capital must be positive");
        }
        if (request.getFactorCombinationId() == null
                || !combinationRepository.existsById(request.getFactorCombinationId())) {
            throw new ValidationException("Unknown factor combination: " + request.getFactorCombinationId());
        }
        if (!isBlank(request.getBatchId()) && request.getBatchId().length() > 64) {
            throw new ValidationException("Batch id is longer than 64 characters");
        }
        if (request.getConfig() != null) {
            validateConfig(request.getConfig());
        }
    }

    private void validateConfig(TaskConfig config) {
        config.validate();

        BacktestProperties.Signal defaults = properties.getSignal();
        double buyThreshold = config.getBuyThreshold() != null ? config.getBuyThreshold() : defaults.getBuyThreshold();
        double sellThreshold = config.getSellThreshold() != null
                ? config.getSellThreshold() : defaults.getSellThreshold();
        if (sellThreshold >= buyThreshold) {
            throw new ValidationException(String.format(
                    "Sell threshold %s must be below buy threshold %s", sellThreshold, buyThreshold));
        }
    }

    private String writeConfig(TaskConfig config) {
        try {
            return objectMapper.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Unserialisable task config: " + e.getOriginalMessage());
        }
    }

    private JsonNode readTree(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new BacktestExecutionException("Stored result payload is unreadable", e);
        }
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null ? e.getClass().getSimpleName() : message;
    }

    static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_LENGTH);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
