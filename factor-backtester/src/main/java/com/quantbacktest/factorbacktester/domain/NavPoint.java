package com.quantbacktest.factorbacktester.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Net asset value at the close of one simulated day. The first point of a run has no date.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NavPoint {

    private LocalDate date;
    private BigDecimal cash;
    private BigDecimal netAssetValue;
}
