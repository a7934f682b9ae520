package com.quantbacktest.factorbacktester.domain;

import com.quantbacktest.factorbacktester.exception.FactorWeightException;
import com.quantbacktest.factorbacktester.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for FactorCombination validation.
 */
class FactorCombinationTest {

    @Test
    void testBuild_ValidCombination() {
        FactorCombination combination = FactorCombination.builder()
                .name("momentum-value")
                .factors(List.of(
                        factor("momentum_20d", 0.6, true),
                        factor("pe_ratio", 0.4, true)))
                .build();

        assertEquals(2, combination.getFactors().size());
        assertEquals(1.0, combination.getTotalWeight(), 1e-9);
        assertEquals(Set.of("momentum_20d", "pe_ratio"), combination.getActiveFactorNames());
    }

    @Test
    void testBuild_WeightsNotSummingToOne() {
        assertThrows(FactorWeightException.class, () -> FactorCombination.builder()
                .name("bad")
                .factors(List.of(factor("A", 0.5, true), factor("B", 0.6, true)))
                .build());
    }

    @Test
    void testBuild_WithinTolerance() {
        FactorCombination combination = FactorCombination.builder()
                .name("close-enough")
                .factors(List.of(factor("A", 0.3333, true), factor("B", 0.3333, true), factor("C", 0.3334, true)))
                .build();

        assertEquals(3, combination.getActiveFactors().size());
    }

    @Test
    void testBuild_InactiveFactorsExcludedFromSum() {
        FactorCombination combination = FactorCombination.builder()
                .name("with-inactive")
                .factors(List.of(factor("A", 1.0, true), factor("B", 0.8, false)))
                .build();

        assertEquals(Set.of("A"), combination.getActiveFactorNames());
        assertEquals(1, combination.getActiveFactors().size());
        assertEquals(2, combination.getFactors().size());
    }

    @Test
    void testBuild_DuplicateFactorName() {
        assertThrows(FactorWeightException.class, () -> FactorCombination.builder()
                .name("dup")
                .factors(List.of(factor("A", 0.5, true), factor("A", 0.5, true)))
                .build());
    }

    @Test
    void testBuild_WeightOutOfRange() {
        assertThrows(FactorWeightException.class, () -> FactorCombination.builder()
                .name("negative")
                .factors(List.of(factor("A", -0.2, true), factor("B", 1.0, true)))
                .build());
    }

    @Test
    void testBuild_EmptyFactorsRejected() {
        ValidationException ex = assertThrows(ValidationException.class, () -> FactorCombination.builder()
                .name("empty")
                .factors(List.of())
                .build());

        assertEquals(ValidationException.CODE, ex.getErrorCode());
    }

    @Test
    void testBuild_MissingName() {
        assertThrows(ValidationException.class, () -> FactorCombination.builder()
                .factors(List.of(factor("A", 1.0, true)))
                .build());
    }

    @Test
    void testGetFactors_ReturnsCopy() {
        FactorCombination combination = FactorCombination.builder()
                .name("single")
                .factors(List.of(factor("A", 1.0, true)))
                .build();

        assertThrows(UnsupportedOperationException.class,
                () -> combination.getFactors().add(factor("B", 0.0, true)));
    }

    private static FactorConfig factor(String name, double weight, boolean active) {
        return FactorConfig.builder()
                .name(name)
                .type(FactorType.TECHNICAL)
                .weight(weight)
                .active(active)
                .build();
    }
}
