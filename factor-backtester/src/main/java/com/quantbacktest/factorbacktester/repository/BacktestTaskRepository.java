package com.quantbacktest.factorbacktester.repository;

import com.quantbacktest.factorbacktester.domain.BacktestTask;
import com.quantbacktest.factorbacktester.domain.TaskStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for BacktestTask entity.
 */
@Repository
public interface BacktestTaskRepository extends JpaRepository<BacktestTask, String> {

    /**
     * Find and lock a task by ID for update (pessimistic write lock).
     *
     * @param id the task ID
     * @return Optional containing the locked task if found
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM BacktestTask t WHERE t.id = :id")
    Optional<BacktestTask> findByIdForUpdate(@Param("id") String id);

    /**
     * Oldest tasks first for the given status.
     */
    List<BacktestTask> findByStatusOrderByCreatedAtAscIdAsc(TaskStatus status, Pageable pageable);

    List<BacktestTask> findByStatusOrderByCreatedAtDesc(TaskStatus status);

    List<BacktestTask> findAllByOrderByCreatedAtDesc();

    List<BacktestTask> findByBatchIdOrderByCreatedAtAscIdAsc(String batchId);

    long countByBatchId(String batchId);

    long countByBatchIdAndStatus(String batchId, TaskStatus status);

    /**
     * Conditional claim: moves the task to RUNNING only if it is still PENDING.
     *
     * @return number of rows updated, 1 if this caller won the claim
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE BacktestTask t SET t.status = :running, t.startedAt = :now, t.cancelRequested = false "
            + "WHERE t.id = :id AND t.status = :pending")
    int claim(@Param("id") String id,
            @Param("pending") TaskStatus pending,
            @Param("running") TaskStatus running,
            @Param("now") LocalDateTime now);

    /**
     * Flags a RUNNING task for cooperative cancellation without touching its version.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE BacktestTask t SET t.cancelRequested = true WHERE t.id = :id AND t.status = :running")
    int requestCancel(@Param("id") String id, @Param("running") TaskStatus running);

    @Query("SELECT t.cancelRequested FROM BacktestTask t WHERE t.id = :id")
    Optional<Boolean> findCancelRequestedById(@Param("id") String id);
}
