package com.quantbacktest.factorbacktester.replay;

import com.quantbacktest.factorbacktester.domain.FactorReading;
import com.quantbacktest.factorbacktester.domain.HistoricalFactorValue;
import com.quantbacktest.factorbacktester.domain.HistoricalMarketData;
import com.quantbacktest.factorbacktester.domain.PriceBar;
import com.quantbacktest.factorbacktester.domain.TradingCalendarDay;
import com.quantbacktest.factorbacktester.repository.HistoricalFactorValueRepository;
import com.quantbacktest.factorbacktester.repository.HistoricalMarketDataRepository;
import com.quantbacktest.factorbacktester.repository.TradingCalendarRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Provider backed by the historical price, factor and calendar tables.
 * Factor rows are only returned once their publication date has been reached.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaFactorSnapshotProvider implements FactorSnapshotProvider {

    private final HistoricalMarketDataRepository marketDataRepository;
    private final HistoricalFactorValueRepository factorValueRepository;
    private final TradingCalendarRepository tradingCalendarRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<PriceBar> getPriceOnDate(String stockCode, LocalDate date) {
        return marketDataRepository.findByStockCodeAndTradeDate(stockCode, date)
                .map(HistoricalMarketData::toPriceBar);
    }

    @Override
    @Transactional(readOnly = true)
    public Map<String, FactorReading> getFactorValues(String stockCode, LocalDate date,
            Set<String> requestedFactorNames) {
        List<HistoricalFactorValue> rows = requestedFactorNames == null || requestedFactorNames.isEmpty()
                ? factorValueRepository.findKnownOn(stockCode, date)
                : factorValueRepository.findKnownOn(stockCode, date, requestedFactorNames);

        Map<String, FactorReading> readings = new LinkedHashMap<>();
        for (HistoricalFactorValue row : rows) {
            double value = row.getFactorValue() == null ? Double.NaN : row.getFactorValue();
            readings.put(row.getFactorName(), FactorReading.of(value, row.getPublishedDate()));
        }

        log.debug("Loaded {} factor values for {} on {}", readings.size(), stockCode, date);
        return readings;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<List<LocalDate>> getTradingCalendar(String exchange, LocalDate start, LocalDate end) {
        if (!tradingCalendarRepository.existsByExchange(exchange)) {
            log.debug("No trading calendar stored for {}", exchange);
            return Optional.empty();
        }

        List<LocalDate> dates = tradingCalendarRepository
                .findByExchangeAndOpenTrueAndCalDateBetweenOrderByCalDateAsc(exchange, start, end)
                .stream()
                .map(TradingCalendarDay::getCalDate)
                .toList();
        return Optional.of(dates);
    }
}
