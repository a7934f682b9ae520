package com.quantbacktest.factorbacktester.repository;

import com.quantbacktest.factorbacktester.domain.TaskBatch;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for task batches.
 */
@Repository
public interface TaskBatchRepository extends JpaRepository<TaskBatch, String> {
}
