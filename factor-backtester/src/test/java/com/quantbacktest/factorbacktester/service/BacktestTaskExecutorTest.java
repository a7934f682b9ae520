package com.quantbacktest.factorbacktester.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.quantbacktest.factorbacktester.domain.BacktestMode;
import com.quantbacktest.factorbacktester.domain.BacktestResult;
import com.quantbacktest.factorbacktester.domain.BacktestTask;
import com.quantbacktest.factorbacktester.domain.FactorCombination;
import com.quantbacktest.factorbacktester.domain.FactorConfig;
import com.quantbacktest.factorbacktester.domain.FactorType;
import com.quantbacktest.factorbacktester.domain.NavPoint;
import com.quantbacktest.factorbacktester.domain.PerformanceReport;
import com.quantbacktest.factorbacktester.domain.TaskConfig;
import com.quantbacktest.factorbacktester.domain.TaskStatus;
import com.quantbacktest.factorbacktester.exception.BacktestExecutionException;
import com.quantbacktest.factorbacktester.exception.DataNotFoundException;
import com.quantbacktest.factorbacktester.exception.TaskCancelledException;
import com.quantbacktest.factorbacktester.exception.ValidationException;
import com.quantbacktest.factorbacktester.repository.FactorCombinationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

/**
 * Unit tests for BacktestTaskExecutor result recording.
 */
@ExtendWith(MockitoExtension.class)
class BacktestTaskExecutorTest {

    @Mock
    private TaskStore taskStore;

    @Mock
    private FactorCombinationRepository combinationRepository;

    @Mock
    private BacktestRunner backtestRunner;

    private ObjectMapper objectMapper;
    private BacktestTaskExecutor taskExecutor;
    private FactorCombination combination;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        taskExecutor = new BacktestTaskExecutor(taskStore, combinationRepository, backtestRunner, objectMapper);
        combination = FactorCombination.builder()
                .id(1L)
                .name("momentum")
                .factors(List.of(FactorConfig.builder().name("momentum_20d").type(FactorType.TECHNICAL)
                        .weight(1.0).build()))
                .build();
    }

    @Test
    void testExecute_SavesResultThenCompletes() throws Exception {
        // Arrange
        BacktestTask task = createRunningTask("{\"version\":1,\"backtestMode\":\"MODEL_VALIDATION\",\"buyThreshold\":0.5}");
        when(taskStore.getTaskById("bt_1")).thenReturn(Optional.of(task));
        when(combinationRepository.findById(1L)).thenReturn(Optional.of(combination));
        when(backtestRunner.run(eq(task), eq(combination), any(), any())).thenReturn(createRun());
        when(taskStore.saveResult(any())).thenAnswer(invocation -> {
            BacktestResult result = invocation.getArgument(0);
            result.setId(42L);
            return result;
        });

        // Act
        BacktestResult result = taskExecutor.execute("bt_1");

        // Assert
        assertEquals(42L, result.getId());
        assertEquals("bt_1", result.getTaskId());
        assertEquals(BacktestMode.MODEL_VALIDATION, result.getBacktestMode());
        assertEquals(3, result.getDataPointCount());
        assertEquals(2, objectMapper.readTree(result.getNavSeriesJson()).size());
        assertEquals("momentum_20d", objectMapper.readTree(result.getFactorCombinationJson()).get(0)
                .get("name").asText());

        InOrder inOrder = inOrder(taskStore);
        inOrder.verify(taskStore).saveResult(any());
        inOrder.verify(taskStore).updateTaskStatus("bt_1", TaskStatus.COMPLETED, null, 42L, 100);

        ArgumentCaptor<TaskConfig> config = ArgumentCaptor.forClass(TaskConfig.class);
        verify(backtestRunner).run(eq(task), eq(combination), config.capture(), any());
        assertEquals(0.5, config.getValue().getBuyThreshold());
    }

    @Test
    void testExecute_BlankConfigUsesDefaults() {
        BacktestTask task = createRunningTask(null);
        when(taskStore.getTaskById("bt_1")).thenReturn(Optional.of(task));
        when(combinationRepository.findById(1L)).thenReturn(Optional.of(combination));
        when(backtestRunner.run(any(), any(), any(), any())).thenReturn(createRun());
        when(taskStore.saveResult(any())).thenAnswer(invocation -> invocation.getArgument(0));

        BacktestResult result = taskExecutor.execute("bt_1");

        assertEquals(BacktestMode.HISTORICAL_SIMULATION, result.getBacktestMode());
    }

    @Test
    void testExecute_UnsupportedStoredConfigVersion() {
        when(taskStore.getTaskById("bt_1")).thenReturn(Optional.of(createRunningTask("{\"version\":2}")));
        when(combinationRepository.findById(1L)).thenReturn(Optional.of(combination));

        assertThrows(ValidationException.class, () -> taskExecutor.execute("bt_1"));
        verify(backtestRunner, never()).run(any(), any(), any(), any());
        verify(taskStore, never()).saveResult(any());
    }

    @Test
    void testExecute_MissingCombination() {
        when(taskStore.getTaskById("bt_1")).thenReturn(Optional.of(createRunningTask(null)));
        when(combinationRepository.findById(1L)).thenReturn(Optional.empty());

        assertThrows(DataNotFoundException.class, () -> taskExecutor.execute("bt_1"));
        verify(taskStore, never()).saveResult(any());
    }

    @Test
    void testExecute_RunnerFailureLeavesNoResult() {
        // Arrange
        when(taskStore.getTaskById("bt_1")).thenReturn(Optional.of(createRunningTask(null)));
        when(combinationRepository.findById(1L)).thenReturn(Optional.of(combination));
        when(backtestRunner.run(any(), any(), any(), any())).thenThrow(new TaskCancelledException("bt_1"));

        // Act & Assert
        assertThrows(TaskCancelledException.class, () -> taskExecutor.execute("bt_1"));
        verify(taskStore, never()).saveResult(any());
        verify(taskStore, never()).updateTaskStatus(any(), any(), any(), any(), any());
    }

    @Test
    void testExecute_TaskNotRunning() {
        BacktestTask task = createRunningTask(null);
        task.setStatus(TaskStatus.PENDING);
        when(taskStore.getTaskById("bt_1")).thenReturn(Optional.of(task));

        assertThrows(BacktestExecutionException.class, () -> taskExecutor.execute("bt_1"));
        verify(backtestRunner, never()).run(any(), any(), any(), any());
    }

    @Test
    void testExecute_CancelCheckReadsStore() {
        // Arrange
        when(taskStore.getTaskById("bt_1")).thenReturn(Optional.of(createRunningTask(null)));
        when(combinationRepository.findById(1L)).thenReturn(Optional.of(combination));
        when(taskStore.isCancelRequested("bt_1")).thenReturn(true);
        when(backtestRunner.run(any(), any(), any(), any())).thenAnswer(invocation -> {
            BooleanSupplier cancelled = invocation.getArgument(3);
            if (cancelled.getAsBoolean()) {
                throw new TaskCancelledException("bt_1");
            }
            return createRun();
        });

        // Act & Assert
        assertThrows(TaskCancelledException.class, () -> taskExecutor.execute("bt_1"));
        verify(taskStore).isCancelRequested("bt_1");
        verify(taskStore, never()).updateTaskStatus(anyString(), eq(TaskStatus.COMPLETED), isNull(), any(), any());
    }

    private BacktestTask createRunningTask(String configJson) {
        return BacktestTask.builder()
                .id("bt_1")
                .batchId("batch_1")
                .name("test")
                .stockCode("600000.SH")
                .startDate(LocalDate.of(2024, 1, 2))
                .endDate(LocalDate.of(2024, 1, 5))
                .initialCapital(new BigDecimal("1000000"))
                .factorCombinationId(1L)
                .status(TaskStatus.RUNNING)
                .configJson(configJson)
                .build();
    }

    private BacktestRun createRun() {
        return BacktestRun.builder()
                .report(PerformanceReport.builder()
                        .totalReturn(new BigDecimal("0.01"))
                        .annualReturn(new BigDecimal("0.84"))
                        .maxDrawdown(BigDecimal.ZERO)
                        .volatility(BigDecimal.ZERO)
                        .tradeCount(0)
                        .build())
                .finalValue(new BigDecimal("1010000"))
                .navSeries(List.of(
                        new NavPoint(null, new BigDecimal("1000000"), new BigDecimal("1000000")),
                        new NavPoint(LocalDate.of(2024, 1, 2), new BigDecimal("1000000"), new BigDecimal("1010000"))))
                .trades(List.of())
                .dataPointCount(3)
                .build();
    }
}
