package com.quantbacktest.factorbacktester.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Entity representing one backtest run requested by a client.
 * Status is only ever changed through the task store, which enforces {@link TaskStatus} transitions.
 */
@Entity
@Table(name = "backtest_tasks", indexes = {
                @Index(name = "idx_task_status_created", columnList = "status, created_at"),
                @Index(name = "idx_task_batch", columnList = "batch_id")
})
@EntityListeners(AuditingEntityListener.class)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BacktestTask {

        @Id
        @Column(name = "id", length = 64)
        private String id;

        @Version
        @Column(name = "version")
        private Long version;

        @Column(name = "batch_id", nullable = false, length = 64)
        private String batchId;

        @Column(name = "name", nullable = false, length = 255)
        private String name;

        @Column(name = "stock_code", nullable = false, length = 20)
        private String stockCode;

        @Column(name = "start_date", nullable = false)
        private LocalDate startDate;

        @Column(name = "end_date", nullable = false)
        private LocalDate endDate;

        @Column(name = "initial_capital", nullable = false, precision = 18, scale = 2)
        private BigDecimal initialCapital;

        @Column(name = "factor_combination_id", nullable = false)
        private Long factorCombinationId;

        @Enumerated(EnumType.STRING)
        @Column(name = "status", nullable = false, length = 20)
        private TaskStatus status;

        @Column(name = "progress", nullable = false)
        @Builder.Default
        private Integer progress = 0;

        @Column(name = "error_message", length = 1000)
        private String errorMessage;

        @Column(name = "result_id")
        private Long resultId;

        @Column(name = "cancel_requested", nullable = false)
        @Builder.Default
        private boolean cancelRequested = false;

        @Column(name = "config_json", columnDefinition = "TEXT")
        private String configJson;

        @CreatedDate
        @Column(name = "created_at", nullable = false, updatable = false)
        private LocalDateTime createdAt;

        @Column(name = "started_at")
        private LocalDateTime startedAt;

        @Column(name = "completed_at")
        private LocalDateTime completedAt;
}
