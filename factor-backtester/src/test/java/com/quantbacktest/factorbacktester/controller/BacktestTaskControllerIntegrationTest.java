package com.quantbacktest.factorbacktester.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantbacktest.factorbacktester.controller.dto.TaskResponse;
import com.quantbacktest.factorbacktester.controller.dto.TaskResultResponse;
import com.quantbacktest.factorbacktester.controller.dto.TaskSubmissionRequest;
import com.quantbacktest.factorbacktester.domain.TaskConfig;
import com.quantbacktest.factorbacktester.domain.TaskStatus;
import com.quantbacktest.factorbacktester.exception.InvalidTransitionException;
import com.quantbacktest.factorbacktester.exception.ResourceNotFoundException;
import com.quantbacktest.factorbacktester.exception.ValidationException;
import com.quantbacktest.factorbacktester.service.TaskOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Integration tests for BacktestTaskController REST endpoints.
 */
@WebMvcTest(BacktestTaskController.class)
class BacktestTaskControllerIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private TaskOrchestrator taskOrchestrator;

    @Test
    void testSubmitTask_Success() throws Exception {
        // Arrange
        when(taskOrchestrator.submit(any())).thenReturn(createResponse(TaskStatus.PENDING));

        // Act & Assert
        mockMvc.perform(post("/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(createValidRequest())))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.taskId").value("bt_20240102_093000_abcdef12"))
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.batchId").value("batch_1"));
    }

    @Test
    void testSubmitTask_MissingStockCode() throws Exception {
        TaskSubmissionRequest request = createValidRequest();
        request.setStockCode(null);

        mockMvc.perform(post("/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.reason").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.fields.stockCode").value("Stock code is required"));
    }

    @Test
    void testSubmitTask_NegativeCapital() throws Exception {
        TaskSubmissionRequest request = createValidRequest();
        request.setInitialCapital(new BigDecimal("-100"));

        mockMvc.perform(post("/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fields.initialCapital").exists());
    }

    @Test
    void testSubmitTask_ConfigOverrideOutOfRange() throws Exception {
        TaskSubmissionRequest request = createValidRequest();
        request.setConfig(TaskConfig.builder().maxPositionSize(2.0).stopLossRatio(-0.5).build());

        mockMvc.perform(post("/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.reason").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.fields['config.maxPositionSize']").exists())
                .andExpect(jsonPath("$.fields['config.stopLossRatio']").exists());
        verify(taskOrchestrator, never()).submit(any());
    }

    @Test
    void testSubmitTask_RejectedByOrchestrator() throws Exception {
        when(taskOrchestrator.submit(any())).thenThrow(new ValidationException("Invalid stock code: AAPL"));

        mockMvc.perform(post("/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(createValidRequest())))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.message").value("Invalid stock code: AAPL"));
    }

    @Test
    void testGetTask_NotFound() throws Exception {
        when(taskOrchestrator.getTask("missing")).thenThrow(new ResourceNotFoundException("Task", "missing"));

        mockMvc.perform(get("/tasks/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Task not found: missing"));
    }

    @Test
    void testGetTaskResult_Success() throws Exception {
        when(taskOrchestrator.getTaskResult("bt_1")).thenReturn(TaskResultResponse.builder()
                .taskId("bt_1")
                .totalReturn(new BigDecimal("0.052"))
                .tradeCount(4)
                .build());

        mockMvc.perform(get("/tasks/bt_1/result"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.taskId").value("bt_1"))
                .andExpect(jsonPath("$.totalReturn").value(0.052))
                .andExpect(jsonPath("$.tradeCount").value(4));
    }

    @Test
    void testRequeueTask_CompletedIsConflict() throws Exception {
        when(taskOrchestrator.requeue("bt_1"))
                .thenThrow(new InvalidTransitionException(TaskStatus.COMPLETED, TaskStatus.PENDING));

        mockMvc.perform(post("/tasks/bt_1/requeue"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.reason").value("INVALID_TRANSITION"));
    }

    @Test
    void testCancelTask_Success() throws Exception {
        when(taskOrchestrator.cancel("bt_1")).thenReturn(createResponse(TaskStatus.CANCELLED));

        mockMvc.perform(post("/tasks/bt_1/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELLED"));
    }

    @Test
    void testGetBatchTasks() throws Exception {
        when(taskOrchestrator.getTasksByBatch("batch_1"))
                .thenReturn(List.of(createResponse(TaskStatus.COMPLETED), createResponse(TaskStatus.FAILED)));

        mockMvc.perform(get("/batches/batch_1/tasks"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[1].status").value("FAILED"));
    }

    @Test
    void testListTasks_FilteredByStatus() throws Exception {
        when(taskOrchestrator.listTasks(TaskStatus.RUNNING)).thenReturn(List.of(createResponse(TaskStatus.RUNNING)));

        mockMvc.perform(get("/tasks").param("status", "RUNNING"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].status").value("RUNNING"));
    }

    private TaskSubmissionRequest createValidRequest() {
        return TaskSubmissionRequest.builder()
                .stockCode("600000.SH")
                .startDate(LocalDate.of(2024, 1, 2))
                .endDate(LocalDate.of(2024, 3, 29))
                .initialCapital(new BigDecimal("1000000"))
                .factorCombinationId(1L)
                .build();
    }

    private TaskResponse createResponse(TaskStatus status) {
        return TaskResponse.builder()
                .taskId("bt_20240102_093000_abcdef12")
                .batchId("batch_1")
                .stockCode("600000.SH")
                .status(status)
                .progress(0)
                .build();
    }
}
