package com.quantbacktest.factorbacktester.replay;

import com.quantbacktest.factorbacktester.domain.FactorReading;
import com.quantbacktest.factorbacktester.domain.PriceBar;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Source of historical prices, factor values and trading calendars consumed by the {@link DataReplayer}.
 */
public interface FactorSnapshotProvider {

    /**
     * Daily bar for the stock on the given date.
     *
     * @return the bar, or empty when no data exists for that date
     */
    Optional<PriceBar> getPriceOnDate(String stockCode, LocalDate date);

    /**
     * Factor readings for the stock on the given date. Names without data are omitted.
     *
     * @param requestedFactorNames names to fetch; an empty set requests every available factor
     */
    Map<String, FactorReading> getFactorValues(String stockCode, LocalDate date, Set<String> requestedFactorNames);

    /**
     * Open trading days of the exchange within {@code [start, end]} in ascending order.
     *
     * @return empty when the calendar source is unavailable
     */
    Optional<List<LocalDate>> getTradingCalendar(String exchange, LocalDate start, LocalDate end);
}
