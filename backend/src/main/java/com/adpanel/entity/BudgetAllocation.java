package com.adpanel.entity;

import io.hypersistence.utils.hibernate.type.json.JsonBinaryType;
import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.Type;
import org.hibernate.annotations.UpdateTimestamp;

/** Share of a budget plan assigned to one product group. */
@Entity
@Table(
        name = "budget_allocations",
        uniqueConstraints =
                @UniqueConstraint(
                        name = "uq_budget_allocations_plan_product",
                        columnNames = {"budget_plan_id", "product_group"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
@ToString(exclude = "budgetPlan")
public class BudgetAllocation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "budget_plan_id", nullable = false)
    private BudgetPlan budgetPlan;

    @Column(name = "product_group", nullable = false, length = 100)
    private String productGroup;

    @Column(name = "allocated_budget", nullable = false, precision = 15, scale = 2)
    private BigDecimal allocatedBudget;

    @Column(name = "is_locked", nullable = false)
    @Builder.Default
    private Boolean locked = false;

    /** Content style to weight; weights are relative and need not sum to one. */
    @Type(JsonBinaryType.class)
    @Column(name = "content_style_weights", columnDefinition = "JSONB")
    @Builder.Default
    private Map<String, BigDecimal> contentStyleWeights = new HashMap<>();

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
