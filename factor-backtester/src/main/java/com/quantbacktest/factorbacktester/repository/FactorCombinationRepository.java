package com.quantbacktest.factorbacktester.repository;

import com.quantbacktest.factorbacktester.domain.FactorCombination;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface FactorCombinationRepository extends JpaRepository<FactorCombination, Long> {
}
