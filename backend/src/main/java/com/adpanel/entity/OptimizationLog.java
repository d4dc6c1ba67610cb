package com.adpanel.entity;

import com.adpanel.dto.optimization.AllocationDecision;
import io.hypersistence.utils.hibernate.type.json.JsonBinaryType;
import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.Type;

/** Append-only record of one allocation run or one write-back attempt. Never updated. */
@Entity
@Immutable
@Table(
        name = "optimization_logs",
        indexes = {
            @Index(name = "idx_optimization_logs_date", columnList = "budget_date"),
            @Index(name = "idx_optimization_logs_allocation", columnList = "budget_allocation_id")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OptimizationLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "budget_plan_id")
    private Long budgetPlanId;

    @Column(name = "budget_allocation_id")
    private Long budgetAllocationId;

    @Column(name = "daily_budget_id")
    private Long dailyBudgetId;

    /** Source log when this entry records a write-back. */
    @Column(name = "source_log_id")
    private Long sourceLogId;

    @Column(name = "budget_date", nullable = false)
    private LocalDate budgetDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private AllocationStrategyType strategy;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private OptimizationStatus status;

    @Column(precision = 15, scale = 2)
    private BigDecimal envelope;

    @Column(name = "total_allocated", precision = 15, scale = 2)
    private BigDecimal totalAllocated;

    @Column(name = "changes_made")
    private Integer changesMade;

    @Type(JsonBinaryType.class)
    @Column(columnDefinition = "JSONB")
    @Builder.Default
    private List<AllocationDecision> decisions = new ArrayList<>();

    @Type(JsonBinaryType.class)
    @Column(columnDefinition = "JSONB")
    @Builder.Default
    private List<AllocationDecision> discarded = new ArrayList<>();

    @Column(columnDefinition = "TEXT")
    private String reason;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
