package com.quantbacktest.factorbacktester.repository;

import com.quantbacktest.factorbacktester.domain.BacktestResult;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository interface for BacktestResult entity.
 */
@Repository
public interface BacktestResultRepository extends JpaRepository<BacktestResult, Long> {

    /**
     * Find result by task ID.
     *
     * @param taskId the task ID
     * @return Optional containing the result if found
     */
    Optional<BacktestResult> findByTaskId(String taskId);

    boolean existsByTaskId(String taskId);
}
