package com.quantbacktest.factorbacktester.service;

import com.quantbacktest.factorbacktester.domain.BacktestResult;
import com.quantbacktest.factorbacktester.domain.BacktestTask;
import com.quantbacktest.factorbacktester.domain.TaskBatch;
import com.quantbacktest.factorbacktester.domain.TaskStatus;
import com.quantbacktest.factorbacktester.exception.InvalidTransitionException;

import java.util.List;
import java.util.Optional;

/**
 * Durable record of tasks, batches and results used by the orchestrator.
 * <p>
 * Status writes made inside a caller's transaction join it, so a result and the status that
 * references it are committed or rolled back together.
 */
public interface TaskStore {

    /**
     * Persists a new PENDING task and registers it with its batch, creating the batch if needed.
     */
    BacktestTask createTask(BacktestTask task);

    Optional<BacktestTask> getTaskById(String taskId);

    /**
     * PENDING tasks, oldest first.
     */
    List<BacktestTask> listPendingTasks(int limit);

    /**
     * All tasks, newest first, optionally filtered by status.
     */
    List<BacktestTask> listTasks(TaskStatus status);

    /**
     * Applies a status change after checking it against the transition table.
     * Null {@code errorMessage}, {@code resultId} or {@code progress} leave the defaults for the target status.
     *
     * @throws InvalidTransitionException if the move is not allowed; the task is left unchanged
     */
    BacktestTask updateTaskStatus(String taskId, TaskStatus status, String errorMessage, Long resultId,
            Integer progress);

    List<BacktestTask> getTasksByBatch(String batchId);

    Optional<TaskBatch> getBatch(String batchId);

    /**
     * Atomically moves a task from PENDING to RUNNING.
     *
     * @return true only for the caller that performed the move
     */
    boolean claimTask(String taskId);

    /**
     * Cancels a PENDING task at once, or flags a RUNNING task so that the run stops at the next snapshot boundary.
     *
     * @throws InvalidTransitionException if the task is already in a terminal status
     */
    BacktestTask cancelTask(String taskId);

    boolean isCancelRequested(String taskId);

    BacktestResult saveResult(BacktestResult result);

    Optional<BacktestResult> getResultByTaskId(String taskId);
}
