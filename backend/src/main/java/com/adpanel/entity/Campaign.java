package com.adpanel.entity;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

/** Platform campaign. Written only by the reconciler and never deleted, only status-flagged. */
@Data
@Entity
@Table(
        name = "campaigns",
        uniqueConstraints =
                @UniqueConstraint(
                        name = "uq_campaigns_platform_account_external",
                        columnNames = {"platform", "ad_account_id", "external_campaign_id"}),
        indexes = {@Index(name = "idx_campaigns_ad_account_id", columnList = "ad_account_id")})
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
@ToString(exclude = "adAccount")
public class Campaign {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Platform platform;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "ad_account_id", nullable = false)
    private AdAccount adAccount;

    @Column(name = "external_campaign_id", nullable = false, length = 100)
    private String externalCampaignId;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private EntityStatus status = EntityStatus.ACTIVE;

    @Column(name = "objective", length = 100)
    private String objective;

    @Column(name = "budget_mode", length = 50)
    private String budgetMode;

    @Column(precision = 15, scale = 2)
    private BigDecimal budget;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
