package com.adpanel.entity;

import io.hypersistence.utils.hibernate.type.json.JsonBinaryType;
import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.Type;
import org.hibernate.annotations.UpdateTimestamp;

/**
 * Planned and actual spend of one allocation on one day. The optimizer sets one processed flag per
 * strategy so a day is optimized at most once per strategy.
 */
@Entity
@Table(
        name = "daily_budget_allocations",
        uniqueConstraints =
                @UniqueConstraint(
                        name = "uq_daily_budget_allocation_date",
                        columnNames = {"budget_allocation_id", "budget_date"}),
        indexes = {@Index(name = "idx_daily_budget_date", columnList = "budget_date")})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
@ToString(exclude = "budgetAllocation")
public class DailyBudgetAllocation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "budget_allocation_id", nullable = false)
    private BudgetAllocation budgetAllocation;

    @Column(name = "budget_date", nullable = false)
    private LocalDate budgetDate;

    @Column(name = "planned_budget", nullable = false, precision = 15, scale = 2)
    @Builder.Default
    private BigDecimal plannedBudget = BigDecimal.ZERO;

    @Column(name = "actual_spend", nullable = false, precision = 15, scale = 2)
    @Builder.Default
    private BigDecimal actualSpend = BigDecimal.ZERO;

    @Column(name = "is_locked", nullable = false)
    @Builder.Default
    private Boolean locked = false;

    @Column(name = "is_ace_allocated", nullable = false)
    @Builder.Default
    private Boolean aceAllocated = false;

    @Column(name = "is_abx_allocated", nullable = false)
    @Builder.Default
    private Boolean abxAllocated = false;

    @Type(JsonBinaryType.class)
    @Column(name = "content_style_budgets", columnDefinition = "JSONB")
    @Builder.Default
    private Map<String, BigDecimal> contentStyleBudgets = new HashMap<>();

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /** Planned budget not yet spent, never negative. */
    public BigDecimal remainingEnvelope() {
        BigDecimal remaining = plannedBudget.subtract(actualSpend);
        return remaining.signum() > 0 ? remaining : BigDecimal.ZERO;
    }

    public boolean isProcessedFor(AllocationStrategyType strategy) {
        return strategy == AllocationStrategyType.SCORE_PROPORTIONAL
                ? Boolean.TRUE.equals(aceAllocated)
                : Boolean.TRUE.equals(abxAllocated);
    }

    public void markProcessed(AllocationStrategyType strategy) {
        if (strategy == AllocationStrategyType.SCORE_PROPORTIONAL) {
            this.aceAllocated = true;
        } else {
            this.abxAllocated = true;
        }
    }
}
