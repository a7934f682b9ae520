package com.quantbacktest.factorbacktester.controller.dto;

import com.quantbacktest.factorbacktester.domain.FactorType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request DTO for creating a factor combination.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FactorCombinationRequest {

    @NotBlank(message = "Name is required")
    private String name;

    @NotEmpty(message = "At least one factor is required")
    @Valid
    private List<FactorItem> factors;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class FactorItem {

        @NotBlank(message = "Factor name is required")
        private String name;

        @NotNull(message = "Factor type is required")
        private FactorType type;

        @DecimalMin(value = "0.0", message = "Weight must be at least 0")
        @DecimalMax(value = "1.0", message = "Weight must be at most 1")
        private double weight;

        @Builder.Default
        private boolean active = true;
    }
}
