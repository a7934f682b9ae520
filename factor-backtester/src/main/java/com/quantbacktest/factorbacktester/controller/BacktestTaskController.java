package com.quantbacktest.factorbacktester.controller;

import com.quantbacktest.factorbacktester.controller.dto.TaskResponse;
import com.quantbacktest.factorbacktester.controller.dto.TaskResultResponse;
import com.quantbacktest.factorbacktester.controller.dto.TaskSubmissionRequest;
import com.quantbacktest.factorbacktester.domain.TaskStatus;
import com.quantbacktest.factorbacktester.service.TaskOrchestrator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for backtest task operations.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class BacktestTaskController {

    private final TaskOrchestrator taskOrchestrator;

    /**
     * Submit a new backtest task.
     *
     * @param request the task submission request
     * @return the created task in PENDING status
     */
    @PostMapping("/tasks")
    public ResponseEntity<TaskResponse> submitTask(@Valid @RequestBody TaskSubmissionRequest request) {

        log.info("POST /tasks - Stock: {}, Period: {} to {}",
                request.getStockCode(), request.getStartDate(), request.getEndDate());

        TaskResponse response = taskOrchestrator.submit(request);

        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/tasks")
    public ResponseEntity<List<TaskResponse>> listTasks(@RequestParam(required = false) TaskStatus status) {
        return ResponseEntity.ok(taskOrchestrator.listTasks(status));
    }

    @GetMapping("/tasks/{taskId}")
    public ResponseEntity<TaskResponse> getTask(@PathVariable String taskId) {
        return ResponseEntity.ok(taskOrchestrator.getTask(taskId));
    }

    /**
     * Get the performance report of a completed task.
     *
     * @param taskId the task ID
     * @return metrics, NAV series and trade ledger
     */
    @GetMapping("/tasks/{taskId}/result")
    public ResponseEntity<TaskResultResponse> getTaskResult(@PathVariable String taskId) {

        log.info("GET /tasks/{}/result", taskId);

        return ResponseEntity.ok(taskOrchestrator.getTaskResult(taskId));
    }

    @PostMapping("/tasks/{taskId}/cancel")
    public ResponseEntity<TaskResponse> cancelTask(@PathVariable String taskId) {

        log.info("POST /tasks/{}/cancel", taskId);

        return ResponseEntity.ok(taskOrchestrator.cancel(taskId));
    }

    @PostMapping("/tasks/{taskId}/requeue")
    public ResponseEntity<TaskResponse> requeueTask(@PathVariable String taskId) {

        log.info("POST /tasks/{}/requeue", taskId);

        return ResponseEntity.ok(taskOrchestrator.requeue(taskId));
    }

    @GetMapping("/batches/{batchId}/tasks")
    public ResponseEntity<List<TaskResponse>> getBatchTasks(@PathVariable String batchId) {
        return ResponseEntity.ok(taskOrchestrator.getTasksByBatch(batchId));
    }
}
