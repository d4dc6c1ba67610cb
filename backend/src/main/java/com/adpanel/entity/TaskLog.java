package com.adpanel.entity;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One execution of a pipeline job. */
@Entity
@Table(
        name = "task_logs",
        indexes = {
            @Index(name = "idx_task_logs_status_started", columnList = "status, started_at"),
            @Index(name = "idx_task_logs_name", columnList = "task_name")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "task_name", nullable = false, length = 100)
    private String taskName;

    @Column(name = "task_type", length = 50)
    private String taskType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private TaskStatus status = TaskStatus.RUNNING;

    @Column(name = "started_at", nullable = false)
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "duration_seconds", precision = 10, scale = 3)
    private BigDecimal durationSeconds;

    @Column(columnDefinition = "TEXT")
    private String message;

    @Column(name = "items_processed")
    @Builder.Default
    private Integer itemsProcessed = 0;

    @Column(name = "items_success")
    @Builder.Default
    private Integer itemsSuccess = 0;

    @Column(name = "items_failed")
    @Builder.Default
    private Integer itemsFailed = 0;

    @Column(name = "triggered_by", length = 50)
    @Builder.Default
    private String triggeredBy = "scheduler";
}
