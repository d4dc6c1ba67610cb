package com.adpanel.entity;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

/** Platform ad group; belongs to exactly one campaign. */
@Data
@Entity
@Table(
        name = "ad_groups",
        uniqueConstraints =
                @UniqueConstraint(
                        name = "uq_ad_groups_platform_campaign_external",
                        columnNames = {"platform", "campaign_id", "external_adgroup_id"}),
        indexes = {
            @Index(name = "idx_ad_groups_campaign_id", columnList = "campaign_id"),
            @Index(name = "idx_ad_groups_product_group", columnList = "product_group, category")
        })
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
@ToString(exclude = "campaign")
public class AdGroup {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Platform platform;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "campaign_id", nullable = false)
    private Campaign campaign;

    @Column(name = "external_adgroup_id", nullable = false, length = 100)
    private String externalAdGroupId;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private EntityStatus status = EntityStatus.ACTIVE;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private AdCategory category = AdCategory.GENERAL;

    @Column(name = "optimization_goal", length = 100)
    private String optimizationGoal;

    @Column(name = "budget_mode", length = 50)
    private String budgetMode;

    @Column(precision = 15, scale = 2)
    private BigDecimal budget;

    @Column(name = "product_group", length = 100)
    private String productGroup;

    /** Content style this group delivers, keyed into an allocation's style budgets. */
    @Column(name = "group_style", length = 50)
    private String groupStyle;

    @Column(name = "performance_score", precision = 10, scale = 4)
    private BigDecimal performanceScore;

    @Column(name = "score_calculated_at")
    private LocalDateTime scoreCalculatedAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
