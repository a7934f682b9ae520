package com.quantbacktest.factorbacktester.repository;

import com.quantbacktest.factorbacktester.domain.HistoricalFactorValue;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

/**
 * Repository for stored factor values. Queries only return values already published on the given date.
 */
@Repository
public interface HistoricalFactorValueRepository extends JpaRepository<HistoricalFactorValue, Long> {

    @Query("SELECT f FROM HistoricalFactorValue f WHERE f.stockCode = :stockCode "
            + "AND f.tradeDate = :tradeDate AND f.publishedDate <= :tradeDate")
    List<HistoricalFactorValue> findKnownOn(
            @Param("stockCode") String stockCode,
            @Param("tradeDate") LocalDate tradeDate);

    @Query("SELECT f FROM HistoricalFactorValue f WHERE f.stockCode = :stockCode "
            + "AND f.tradeDate = :tradeDate AND f.publishedDate <= :tradeDate AND f.factorName IN :names")
    List<HistoricalFactorValue> findKnownOn(
            @Param("stockCode") String stockCode,
            @Param("tradeDate") LocalDate tradeDate,
            @Param("names") Collection<String> names);
}
