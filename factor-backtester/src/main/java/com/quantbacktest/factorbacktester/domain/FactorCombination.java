package com.quantbacktest.factorbacktester.domain;

import com.quantbacktest.factorbacktester.exception.FactorWeightException;
import com.quantbacktest.factorbacktester.exception.ValidationException;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Named set of weighted factors used to score snapshots.
 * Instances are validated on construction and are read-only afterwards.
 */
@Entity
@Table(name = "factor_combinations")
@EntityListeners(AuditingEntityListener.class)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class FactorCombination {

    public static final double WEIGHT_TOLERANCE = 1e-3;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "factor_combination_items", joinColumns = @JoinColumn(name = "combination_id"))
    @OrderColumn(name = "item_index")
    private List<FactorConfig> factors = new ArrayList<>();

    @CreatedDate
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Builder
    public FactorCombination(Long id, String name, List<FactorConfig> factors) {
        validate(name, factors);
        this.id = id;
        this.name = name;
        this.factors = new ArrayList<>(factors);
    }

    public List<FactorConfig> getFactors() {
        return List.copyOf(factors);
    }

    public List<FactorConfig> getActiveFactors() {
        return factors.stream()
                .filter(FactorConfig::isActive)
                .toList();
    }

    public Set<String> getActiveFactorNames() {
        Set<String> names = new HashSet<>();
        for (FactorConfig factor : factors) {
            if (factor.isActive()) {
                names.add(factor.getName());
            }
        }
        return names;
    }

    public double getTotalWeight() {
        return sumActiveWeights(factors);
    }

    private static void validate(String name, List<FactorConfig> factors) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Factor combination name is required");
        }
        if (factors == null || factors.isEmpty()) {
            throw new ValidationException("Factor combination must contain at least one factor");
        }

        Set<String> seen = new HashSet<>();
        for (FactorConfig factor : factors) {
            if (factor.getName() == null || factor.getName().isBlank()) {
                throw new ValidationException("Factor name is required");
            }
            if (factor.getType() == null) {
                throw new ValidationException("Factor type is required for " + factor.getName());
            }
            if (factor.getWeight() < 0.0 || factor.getWeight() > 1.0 || Double.isNaN(factor.getWeight())) {
                throw new FactorWeightException("Weight of " + factor.getName() + " must be within [0, 1]");
            }
            if (!seen.add(factor.getName())) {
                throw new FactorWeightException("Duplicate factor name: " + factor.getName());
            }
        }

        double total = sumActiveWeights(factors);
        if (Math.abs(total - 1.0) > WEIGHT_TOLERANCE) {
            throw new FactorWeightException(String.format(
                    "Active factor weights must sum to 1.0 (tolerance %s), got %.4f", WEIGHT_TOLERANCE, total));
        }
    }

    private static double sumActiveWeights(List<FactorConfig> factors) {
        return factors.stream()
                .filter(FactorConfig::isActive)
                .mapToDouble(FactorConfig::getWeight)
                .sum();
    }
}
