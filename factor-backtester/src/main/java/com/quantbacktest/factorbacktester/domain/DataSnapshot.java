package com.quantbacktest.factorbacktester.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One trading day of price and factor data for a single stock. Immutable once built.
 */
@Value
@Builder
@Jacksonized
public class DataSnapshot {

    LocalDate timestamp;
    String stockCode;
    PriceBar price;
    Map<String, Double> factorData;

    /**
     * Copy restricted to the given factor names. Names absent from this snapshot stay absent.
     */
    public DataSnapshot restrictTo(Set<String> factorNames) {
        Map<String, Double> kept = new LinkedHashMap<>();
        factorData.forEach((name, value) -> {
            if (factorNames.contains(name)) {
                kept.put(name, value);
            }
        });
        return DataSnapshot.builder()
                .timestamp(timestamp)
                .stockCode(stockCode)
                .price(price)
                .factorData(kept)
                .build();
    }
}
