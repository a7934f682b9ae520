package com.quantbacktest.factorbacktester.repository;

import com.quantbacktest.factorbacktester.domain.HistoricalMarketData;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Repository for accessing stored daily price bars.
 */
@Repository
public interface HistoricalMarketDataRepository extends JpaRepository<HistoricalMarketData, Long> {

    Optional<HistoricalMarketData> findByStockCodeAndTradeDate(String stockCode, LocalDate tradeDate);
}
