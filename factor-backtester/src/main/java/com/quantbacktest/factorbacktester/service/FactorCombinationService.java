package com.quantbacktest.factorbacktester.service;

import com.quantbacktest.factorbacktester.controller.dto.FactorCombinationRequest;
import com.quantbacktest.factorbacktester.domain.FactorCombination;
import com.quantbacktest.factorbacktester.domain.FactorConfig;
import com.quantbacktest.factorbacktester.exception.ResourceNotFoundException;
import com.quantbacktest.factorbacktester.repository.FactorCombinationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Creation and lookup of factor combinations. Weight rules are enforced by {@link FactorCombination} itself.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FactorCombinationService {

    private final FactorCombinationRepository combinationRepository;

    @Transactional
    public FactorCombination createCombination(FactorCombinationRequest request) {
        List<FactorConfig> factors = request.getFactors().stream()
                .map(item -> FactorConfig.builder()
                        .name(item.getName())
                        .type(item.getType())
                        .weight(item.getWeight())
                        .active(item.isActive())
                        .build())
                .toList();

        FactorCombination combination = combinationRepository.save(FactorCombination.builder()
                .name(request.getName())
                .factors(factors)
                .build());

        log.info("Created factor combination {} '{}' with {} factors",
                combination.getId(), combination.getName(), factors.size());
        return combination;
    }

    @Transactional(readOnly = true)
    public FactorCombination getCombination(Long id) {
        return combinationRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Factor combination", id));
    }

    @Transactional(readOnly = true)
    public List<FactorCombination> listCombinations() {
        return combinationRepository.findAll();
    }
}
