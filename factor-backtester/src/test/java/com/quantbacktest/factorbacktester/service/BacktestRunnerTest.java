package com.quantbacktest.factorbacktester.service;

import com.quantbacktest.factorbacktester.config.BacktestProperties;
import com.quantbacktest.factorbacktester.domain.BacktestMode;
import com.quantbacktest.factorbacktester.domain.BacktestTask;
import com.quantbacktest.factorbacktester.domain.DataSnapshot;
import com.quantbacktest.factorbacktester.domain.FactorCombination;
import com.quantbacktest.factorbacktester.domain.FactorConfig;
import com.quantbacktest.factorbacktester.domain.FactorType;
import com.quantbacktest.factorbacktester.domain.PriceBar;
import com.quantbacktest.factorbacktester.domain.TaskConfig;
import com.quantbacktest.factorbacktester.exception.BacktestExecutionException;
import com.quantbacktest.factorbacktester.exception.DataNotFoundException;
import com.quantbacktest.factorbacktester.exception.OrderingException;
import com.quantbacktest.factorbacktester.exception.TaskCancelledException;
import com.quantbacktest.factorbacktester.portfolio.PortfolioSimulatorFactory;
import com.quantbacktest.factorbacktester.replay.DataReplayer;
import com.quantbacktest.factorbacktester.signal.SignalGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

/**
 * Unit tests for the replay, signal and simulation pipeline of one task.
 */
@ExtendWith(MockitoExtension.class)
class BacktestRunnerTest {

    @Mock
    private DataReplayer dataReplayer;

    private BacktestRunner backtestRunner;
    private FactorCombination combination;
    private BacktestTask task;

    @BeforeEach
    void setUp() {
        BacktestProperties properties = new BacktestProperties();
        backtestRunner = new BacktestRunner(dataReplayer, new SignalGenerator(properties),
                new PortfolioSimulatorFactory(properties));
        combination = FactorCombination.builder()
                .name("momentum")
                .factors(List.of(FactorConfig.builder().name("momentum_20d").type(FactorType.TECHNICAL)
                        .weight(1.0).build()))
                .build();
        task = BacktestTask.builder()
                .id("bt_1")
                .stockCode("600000.SH")
                .startDate(LocalDate.of(2024, 1, 2))
                .endDate(LocalDate.of(2024, 1, 5))
                .initialCapital(new BigDecimal("1000000"))
                .build();
    }

    @Test
    void testRun_BuysOnStrongScoreAndCountsSnapshots() {
        // Arrange
        when(dataReplayer.replay(eq("600000.SH"), any(), any(), eq(combination),
                eq(BacktestMode.HISTORICAL_SIMULATION)))
                .thenReturn(Stream.of(snapshot(2, 3.0), snapshot(3, 0.0), snapshot(4, 0.0)));

        // Act
        BacktestRun run = backtestRunner.run(task, combination, TaskConfig.defaults(), () -> false);

        // Assert
        assertEquals(3, run.getDataPointCount());
        assertEquals(4, run.getNavSeries().size());
        assertEquals(1, run.getTrades().size());
        assertNotNull(run.getReport());
        assertEquals(1, run.getReport().getTradeCount());
    }

    @Test
    void testRun_CancellationObservedBetweenSnapshots() {
        // Arrange - cancel after the first snapshot has been processed
        AtomicInteger checks = new AtomicInteger();
        when(dataReplayer.replay(any(), any(), any(), any(), any()))
                .thenReturn(Stream.of(snapshot(2, 0.0), snapshot(3, 0.0), snapshot(4, 0.0)));

        // Act & Assert
        assertThrows(TaskCancelledException.class,
                () -> backtestRunner.run(task, combination, null, () -> checks.incrementAndGet() > 1));
        assertEquals(2, checks.get());
    }

    @Test
    void testRun_NoSnapshotsIsDataNotFound() {
        when(dataReplayer.replay(any(), any(), any(), any(), any())).thenReturn(Stream.empty());

        assertThrows(DataNotFoundException.class,
                () -> backtestRunner.run(task, combination, TaskConfig.defaults(), () -> false));
    }

    @Test
    void testRun_OrderingErrorPropagatesUnchanged() {
        when(dataReplayer.replay(any(), any(), any(), any(), any())).thenReturn(Stream.of(snapshot(2, 0.0))
                .peek(s -> {
                    throw new OrderingException("look-ahead");
                }));

        assertThrows(OrderingException.class,
                () -> backtestRunner.run(task, combination, TaskConfig.defaults(), () -> false));
    }

    @Test
    void testRun_UnexpectedErrorWrapped() {
        when(dataReplayer.replay(any(), any(), any(), any(), any())).thenThrow(new IllegalStateException("boom"));

        BacktestExecutionException ex = assertThrows(BacktestExecutionException.class,
                () -> backtestRunner.run(task, combination, TaskConfig.defaults(), () -> false));
        assertTrue(ex.getMessage().contains("boom"));
    }

    private static DataSnapshot snapshot(int day, double momentum) {
        LocalDate date = LocalDate.of(2024, 1, day);
        return DataSnapshot.builder()
                .timestamp(date)
                .stockCode("600000.SH")
                .price(PriceBar.builder()
                        .date(date)
                        .open(new BigDecimal("10.00"))
                        .high(new BigDecimal("10.50"))
                        .low(new BigDecimal("9.80"))
                        .close(new BigDecimal("10.00"))
                        .volume(100000L)
                        .build())
                .factorData(Map.of("momentum_20d", momentum))
                .build();
    }
}
