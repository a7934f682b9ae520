package com.quantbacktest.factorbacktester.replay;

import com.quantbacktest.factorbacktester.config.BacktestProperties;
import com.quantbacktest.factorbacktester.domain.BacktestMode;
import com.quantbacktest.factorbacktester.domain.DataSnapshot;
import com.quantbacktest.factorbacktester.domain.FactorCombination;
import com.quantbacktest.factorbacktester.domain.FactorReading;
import com.quantbacktest.factorbacktester.domain.PriceBar;
import com.quantbacktest.factorbacktester.domain.SnapshotOutcome;
import com.quantbacktest.factorbacktester.exception.OrderingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

/**
 * Replays daily snapshots for a stock in strictly increasing date order.
 * <p>
 * Every snapshot only contains data that was knowable on its own date: a price bar dated later than
 * the snapshot, or a factor value published later, aborts the replay with an {@link OrderingException}.
 * Days with missing or inconsistent data are skipped and logged. Validated snapshots are cached
 * by {@link SnapshotKey}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DataReplayer {

    private final FactorSnapshotProvider snapshotProvider;
    private final SnapshotCache snapshotCache;
    private final BacktestProperties properties;

    /**
     * Lazy, forward-only sequence of snapshots for {@code [start, end]}, restricted to the
     * combination's active factors. Each call derives a fresh sequence.
     *
     * @throws OrderingException while consuming the stream, if look-ahead data or a non-increasing date is found
     */
    public Stream<DataSnapshot> replay(String stockCode, LocalDate start, LocalDate end,
            FactorCombination combination, BacktestMode mode) {
        List<LocalDate> calendar = getTradingCalendar(start, end);
        Set<String> factorNames = combination.getActiveFactorNames();
        AtomicReference<LocalDate> previous = new AtomicReference<>();

        log.info("Replaying {} trading days for {} ({} to {}, mode {})",
                calendar.size(), stockCode, start, end, mode);

        return calendar.stream()
                .map(date -> getSnapshot(stockCode, date, mode))
                .map(outcome -> toSnapshot(outcome, factorNames))
                .flatMap(Optional::stream)
                .peek(snapshot -> {
                    LocalDate last = previous.getAndSet(snapshot.getTimestamp());
                    if (last != null && !snapshot.getTimestamp().isAfter(last)) {
                        throw new OrderingException("Snapshot " + snapshot.getTimestamp()
                                + " does not follow " + last);
                    }
                });
    }

    /**
     * Loads one validated snapshot holding every factor the provider knows for that day.
     * A cached value is returned without contacting the provider.
     */
    public SnapshotOutcome getSnapshot(String stockCode, LocalDate date, BacktestMode mode) {
        SnapshotKey key = new SnapshotKey(stockCode, date, mode);
        Optional<DataSnapshot> cached = snapshotCache.get(key);
        if (cached.isPresent()) {
            log.debug("Snapshot cache hit for {}", key.asString());
            return SnapshotOutcome.accepted(cached.get());
        }

        SnapshotOutcome outcome = loadSnapshot(stockCode, date);
        if (outcome.isAccepted()) {
            snapshotCache.put(key, outcome.getSnapshot());
        }
        return outcome;
    }

    /**
     * Trading days in {@code [start, end]}, ascending. Falls back to Monday to Friday when the
     * calendar source has nothing for the configured exchange.
     */
    public List<LocalDate> getTradingCalendar(LocalDate start, LocalDate end) {
        String exchange = properties.getReplay().getExchange();
        Optional<List<LocalDate>> calendar = snapshotProvider.getTradingCalendar(exchange, start, end);

        if (calendar.isEmpty()) {
            log.warn("Trading calendar for {} unavailable, falling back to business days", exchange);
            return businessDays(start, end);
        }

        TreeSet<LocalDate> dates = new TreeSet<>();
        for (LocalDate date : calendar.get()) {
            if (!date.isBefore(start) && !date.isAfter(end)) {
                dates.add(date);
            }
        }
        return new ArrayList<>(dates);
    }

    /**
     * Checks that every timestamp is strictly after its predecessor.
     *
     * @throws OrderingException on the first timestamp that does not advance
     */
    public void validateTimeline(List<LocalDate> timestamps) {
        for (int i = 1; i < timestamps.size(); i++) {
            if (!timestamps.get(i).isAfter(timestamps.get(i - 1))) {
                throw new OrderingException(String.format("Timestamp %s at position %d is not after %s",
                        timestamps.get(i), i, timestamps.get(i - 1)));
            }
        }
    }

    public void clearCache() {
        snapshotCache.clear();
        log.info("Snapshot cache cleared");
    }

    private SnapshotOutcome loadSnapshot(String stockCode, LocalDate date) {
        Optional<PriceBar> priceBar = snapshotProvider.getPriceOnDate(stockCode, date);
        if (priceBar.isEmpty()) {
            return SnapshotOutcome.skipped(date, "no price data");
        }

        PriceBar bar = priceBar.get();
        if (bar.getDate() == null) {
            return SnapshotOutcome.skipped(date, "price bar has no date");
        }
        if (bar.getDate().isAfter(date)) {
            return SnapshotOutcome.fatal(date, "price bar dated " + bar.getDate() + " is after " + date);
        }
        if (bar.getDate().isBefore(date)) {
            return SnapshotOutcome.skipped(date, "stale price bar dated " + bar.getDate());
        }
        if (!bar.isConsistent()) {
            return SnapshotOutcome.skipped(date, String.format("inconsistent OHLC open=%s high=%s low=%s close=%s",
                    bar.getOpen(), bar.getHigh(), bar.getLow(), bar.getClose()));
        }

        Map<String, FactorReading> readings = snapshotProvider.getFactorValues(stockCode, date, Collections.emptySet());
        Map<String, Double> factorData = new LinkedHashMap<>();
        for (Map.Entry<String, FactorReading> entry : readings.entrySet()) {
            FactorReading reading = entry.getValue();
            if (reading == null || reading.getKnownOn() == null) {
                log.debug("Ignoring factor {} on {} without publication date", entry.getKey(), date);
                continue;
            }
            if (reading.getKnownOn().isAfter(date)) {
                return SnapshotOutcome.fatal(date, "factor " + entry.getKey() + " published "
                        + reading.getKnownOn() + " is after " + date);
            }
            factorData.put(entry.getKey(), reading.getValue());
        }

        if (factorData.isEmpty()) {
            return SnapshotOutcome.skipped(date, "no factor values");
        }

        return SnapshotOutcome.accepted(DataSnapshot.builder()
                .timestamp(date)
                .stockCode(stockCode)
                .price(bar)
                .factorData(factorData)
                .build());
    }

    private Optional<DataSnapshot> toSnapshot(SnapshotOutcome outcome, Set<String> factorNames) {
        switch (outcome.getKind()) {
            case FATAL:
                throw new OrderingException("Look-ahead data on " + outcome.getDate() + ": " + outcome.getReason());
            case SKIPPED:
                log.warn("Skipping {}: {}", outcome.getDate(), outcome.getReason());
                return Optional.empty();
            default:
                DataSnapshot snapshot = outcome.getSnapshot().restrictTo(factorNames);
                if (snapshot.getFactorData().isEmpty()) {
                    log.warn("Skipping {}: none of the configured factors available", outcome.getDate());
                    return Optional.empty();
                }
                return Optional.of(snapshot);
        }
    }

    private static List<LocalDate> businessDays(LocalDate start, LocalDate end) {
        List<LocalDate> days = new ArrayList<>();
        for (LocalDate date = start; !date.isAfter(end); date = date.plusDays(1)) {
            DayOfWeek day = date.getDayOfWeek();
            if (day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY) {
                days.add(date);
            }
        }
        return days;
    }
}
