package com.quantbacktest.factorbacktester.controller.dto;

import com.quantbacktest.factorbacktester.domain.FactorCombination;
import com.quantbacktest.factorbacktester.domain.FactorConfig;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FactorCombinationResponse {

    private Long id;
    private String name;
    private double totalWeight;
    private List<FactorConfig> factors;

    public static FactorCombinationResponse from(FactorCombination combination) {
        return FactorCombinationResponse.builder()
                .id(combination.getId())
                .name(combination.getName())
                .totalWeight(combination.getTotalWeight())
                .factors(combination.getFactors())
                .build();
    }
}
