package com.quantbacktest.factorbacktester.controller.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.quantbacktest.factorbacktester.domain.TaskConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Request DTO for submitting a new backtest task.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TaskSubmissionRequest {

    private String name;

    @NotBlank(message = "Stock code is required")
    private String stockCode;

    @NotNull(message = "Start date is required")
    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate startDate;

    @NotNull(message = "End date is required")
    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate endDate;

    @NotNull(message = "Initial capital is required")
    @Positive(message = "Initial capital must be positive")
    private BigDecimal initialCapital;

    @NotNull(message = "Factor combination is required")
    private Long factorCombinationId;

    // Joins an existing batch when set
    private String batchId;

    @Valid
    private TaskConfig config;
}
