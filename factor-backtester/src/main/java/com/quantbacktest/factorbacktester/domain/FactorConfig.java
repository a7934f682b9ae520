package com.quantbacktest.factorbacktester.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One weighted factor inside a {@link FactorCombination}.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FactorConfig {

    @Column(name = "factor_name", nullable = false, length = 100)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "factor_type", nullable = false, length = 20)
    private FactorType type;

    @Column(name = "weight", nullable = false)
    private double weight;

    @Column(name = "active", nullable = false)
    @Builder.Default
    private boolean active = true;
}
