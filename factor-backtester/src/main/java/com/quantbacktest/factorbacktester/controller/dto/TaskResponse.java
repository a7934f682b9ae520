package com.quantbacktest.factorbacktester.controller.dto;

import com.quantbacktest.factorbacktester.domain.BacktestTask;
import com.quantbacktest.factorbacktester.domain.TaskStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Response DTO describing a task and its current status.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TaskResponse {

    private String taskId;
    private String batchId;
    private String name;
    private String stockCode;
    private LocalDate startDate;
    private LocalDate endDate;
    private BigDecimal initialCapital;
    private Long factorCombinationId;
    private TaskStatus status;
    private Integer progress;
    private String errorMessage;
    private Long resultId;
    private boolean cancelRequested;
    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    public static TaskResponse from(BacktestTask task) {
        return TaskResponse.builder()
                .taskId(task.getId())
                .batchId(task.getBatchId())
                .name(task.getName())
                .stockCode(task.getStockCode())
                .startDate(task.getStartDate())
                .endDate(task.getEndDate())
                .initialCapital(task.getInitialCapital())
                .factorCombinationId(task.getFactorCombinationId())
                .status(task.getStatus())
                .progress(task.getProgress())
                .errorMessage(task.getErrorMessage())
                .resultId(task.getResultId())
                .cancelRequested(task.isCancelRequested())
                .createdAt(task.getCreatedAt())
                .startedAt(task.getStartedAt())
                .completedAt(task.getCompletedAt())
                .build();
    }
}
