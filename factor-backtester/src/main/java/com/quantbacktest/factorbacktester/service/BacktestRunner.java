package com.quantbacktest.factorbacktester.service;

import com.quantbacktest.factorbacktester.domain.BacktestTask;
import com.quantbacktest.factorbacktester.domain.DataSnapshot;
import com.quantbacktest.factorbacktester.domain.FactorCombination;
import com.quantbacktest.factorbacktester.domain.SignalThresholds;
import com.quantbacktest.factorbacktester.domain.TaskConfig;
import com.quantbacktest.factorbacktester.domain.TradingSignal;
import com.quantbacktest.factorbacktester.exception.BacktestException;
import com.quantbacktest.factorbacktester.exception.BacktestExecutionException;
import com.quantbacktest.factorbacktester.exception.DataNotFoundException;
import com.quantbacktest.factorbacktester.exception.TaskCancelledException;
import com.quantbacktest.factorbacktester.portfolio.PortfolioSimulator;
import com.quantbacktest.factorbacktester.portfolio.PortfolioSimulatorFactory;
import com.quantbacktest.factorbacktester.replay.DataReplayer;
import com.quantbacktest.factorbacktester.signal.SignalGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;

/**
 * Replay, score and simulate pipeline for one task. Writes nothing to the task store.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BacktestRunner {

    private final DataReplayer dataReplayer;
    private final SignalGenerator signalGenerator;
    private final PortfolioSimulatorFactory simulatorFactory;

    /**
     * Runs the task to the end of its date range.
     * The cancellation check is evaluated before each snapshot, never in the middle of one.
     *
     * @throws TaskCancelledException   if cancellation was requested
     * @throws DataNotFoundException    if the range produced no usable snapshot
     * @throws BacktestExecutionException for any unexpected failure
     */
    public BacktestRun run(BacktestTask task, FactorCombination combination, TaskConfig config,
            BooleanSupplier cancelRequested) {
        TaskConfig effectiveConfig = config == null ? TaskConfig.defaults() : config;
        SignalThresholds thresholds = signalGenerator.defaultThresholds().withOverrides(effectiveConfig);
        PortfolioSimulator simulator = simulatorFactory.create(task.getInitialCapital(), effectiveConfig);

        int dataPoints = 0;
        try (Stream<DataSnapshot> snapshots = dataReplayer.replay(task.getStockCode(), task.getStartDate(),
                task.getEndDate(), combination, effectiveConfig.getBacktestMode())) {
            Iterator<DataSnapshot> iterator = snapshots.iterator();

            while (true) {
                if (cancelRequested.getAsBoolean()) {
                    log.info("Cancellation observed after {} snapshots", dataPoints);
                    throw new TaskCancelledException(task.getId());
                }
                if (!iterator.hasNext()) {
                    break;
                }

                DataSnapshot snapshot = iterator.next();
                TradingSignal signal = signalGenerator.applyFilters(
                        signalGenerator.generate(snapshot, combination, thresholds));
                simulator.onSignal(signal, snapshot.getPrice().getClose());
                dataPoints++;
            }
        } catch (BacktestException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new BacktestExecutionException("Pipeline failed for task " + task.getId() + ": " + e.getMessage(), e);
        }

        if (dataPoints == 0) {
            throw new DataNotFoundException(String.format("No usable snapshots for %s between %s and %s",
                    task.getStockCode(), task.getStartDate(), task.getEndDate()));
        }

        log.info("Replayed {} snapshots, {} trades, final value {}",
                dataPoints, simulator.getTrades().size(), simulator.getNetAssetValue());

        return BacktestRun.builder()
                .report(simulator.buildReport())
                .finalValue(simulator.getNetAssetValue())
                .navSeries(simulator.getNavSeries())
                .trades(simulator.getTrades())
                .dataPointCount(dataPoints)
                .build();
    }
}
