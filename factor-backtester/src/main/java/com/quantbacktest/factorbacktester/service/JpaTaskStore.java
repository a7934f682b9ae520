package com.quantbacktest.factorbacktester.service;

import com.quantbacktest.factorbacktester.domain.BacktestResult;
import com.quantbacktest.factorbacktester.domain.BacktestTask;
import com.quantbacktest.factorbacktester.domain.TaskBatch;
import com.quantbacktest.factorbacktester.domain.TaskStatus;
import com.quantbacktest.factorbacktester.exception.InvalidTransitionException;
import com.quantbacktest.factorbacktester.exception.ResourceNotFoundException;
import com.quantbacktest.factorbacktester.repository.BacktestResultRepository;
import com.quantbacktest.factorbacktester.repository.BacktestTaskRepository;
import com.quantbacktest.factorbacktester.repository.TaskBatchRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * {@link TaskStore} on the relational task, batch and result tables.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaTaskStore implements TaskStore {

    private final BacktestTaskRepository taskRepository;
    private final TaskBatchRepository batchRepository;
    private final BacktestResultRepository resultRepository;

    @Override
    @Transactional
    public BacktestTask createTask(BacktestTask task) {
        if (!batchRepository.existsById(task.getBatchId())) {
            batchRepository.save(TaskBatch.builder().id(task.getBatchId()).build());
            log.info("Created batch {}", task.getBatchId());
        }

        task.setStatus(TaskStatus.PENDING);
        BacktestTask saved = taskRepository.save(task);
        refreshBatchCounts(saved.getBatchId());
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<BacktestTask> getTaskById(String taskId) {
        return taskRepository.findById(taskId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<BacktestTask> listPendingTasks(int limit) {
        return taskRepository.findByStatusOrderByCreatedAtAscIdAsc(TaskStatus.PENDING, PageRequest.of(0, limit));
    }

    @Override
    @Transactional(readOnly = true)
    public List<BacktestTask> listTasks(TaskStatus status) {
        return status == null
                ? taskRepository.findAllByOrderByCreatedAtDesc()
                : taskRepository.findByStatusOrderByCreatedAtDesc(status);
    }

    @Override
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public BacktestTask updateTaskStatus(String taskId, TaskStatus status, String errorMessage, Long resultId,
            Integer progress) {
        BacktestTask task = taskRepository.findByIdForUpdate(taskId)
                .orElseThrow(() -> new ResourceNotFoundException("Task", taskId));

        TaskStatus current = task.getStatus();
        current.checkTransition(status);

        LocalDateTime now = LocalDateTime.now();
        task.setStatus(status);

        switch (status) {
            case RUNNING -> task.setStartedAt(now);
            case COMPLETED -> {
                task.setCompletedAt(now);
                task.setErrorMessage(null);
                task.setProgress(100);
            }
            case FAILED, CANCELLED -> {
                task.setCompletedAt(now);
                task.setErrorMessage(errorMessage);
            }
            case PENDING -> {
                task.setErrorMessage(null);
                task.setProgress(0);
                task.setResultId(null);
                task.setStartedAt(null);
                task.setCompletedAt(null);
                task.setCancelRequested(false);
            }
        }

        if (resultId != null) {
            task.setResultId(resultId);
        }
        if (progress != null) {
            task.setProgress(progress);
        }

        BacktestTask saved = taskRepository.save(task);
        log.debug("Task {} moved {} -> {}", taskId, current, status);

        if (status.isTerminal() || status == TaskStatus.PENDING) {
            refreshBatchCounts(saved.getBatchId());
        }
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public List<BacktestTask> getTasksByBatch(String batchId) {
        return taskRepository.findByBatchIdOrderByCreatedAtAscIdAsc(batchId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<TaskBatch> getBatch(String batchId) {
        return batchRepository.findById(batchId);
    }

    @Override
    @Transactional
    public boolean claimTask(String taskId) {
        TaskStatus.PENDING.checkTransition(TaskStatus.RUNNING);
        int updated = taskRepository.claim(taskId, TaskStatus.PENDING, TaskStatus.RUNNING, LocalDateTime.now());
        return updated == 1;
    }

    @Override
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public BacktestTask cancelTask(String taskId) {
        BacktestTask task = taskRepository.findByIdForUpdate(taskId)
                .orElseThrow(() -> new ResourceNotFoundException("Task", taskId));

        TaskStatus current = task.getStatus();
        if (current == TaskStatus.PENDING) {
            return updateTaskStatus(taskId, TaskStatus.CANCELLED, "Cancelled before start", null, null);
        }
        if (current != TaskStatus.RUNNING) {
            throw new InvalidTransitionException(current, TaskStatus.CANCELLED);
        }

        // Bulk update leaves the version alone so the running executor can still commit
        taskRepository.requestCancel(taskId, TaskStatus.RUNNING);
        log.info("Cancellation requested for running task {}", taskId);
        return taskRepository.findById(taskId)
                .orElseThrow(() -> new ResourceNotFoundException("Task", taskId));
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isCancelRequested(String taskId) {
        return taskRepository.findCancelRequestedById(taskId).orElse(false);
    }

    @Override
    @Transactional
    public BacktestResult saveResult(BacktestResult result) {
        return resultRepository.save(result);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<BacktestResult> getResultByTaskId(String taskId) {
        return resultRepository.findByTaskId(taskId);
    }

    /**
     * Recounts batch members by status, the same way on every call.
     */
    private void refreshBatchCounts(String batchId) {
        Optional<TaskBatch> batchOptional = batchRepository.findById(batchId);
        if (batchOptional.isEmpty()) {
            log.warn("Batch {} not found", batchId);
            return;
        }

        TaskBatch batch = batchOptional.get();
        batch.setTotalTasks((int) taskRepository.countByBatchId(batchId));
        batch.setCompletedTasks((int) taskRepository.countByBatchIdAndStatus(batchId, TaskStatus.COMPLETED));
        batch.setFailedTasks((int) taskRepository.countByBatchIdAndStatus(batchId, TaskStatus.FAILED));
        batch.setUpdatedAt(LocalDateTime.now());
        batchRepository.save(batch);

        if (batch.isFinished()) {
            log.info("Batch {} finished. Total: {}, Completed: {}, Failed: {}",
                    batchId, batch.getTotalTasks(), batch.getCompletedTasks(), batch.getFailedTasks());
        }
    }
}
