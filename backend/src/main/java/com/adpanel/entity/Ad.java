package com.adpanel.entity;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

/** Platform ad; belongs to one ad group and references at most one content item. */
@Data
@Entity
@Table(
        name = "ads",
        uniqueConstraints =
                @UniqueConstraint(
                        name = "uq_ads_platform_adgroup_external",
                        columnNames = {"platform", "ad_group_id", "external_ad_id"}),
        indexes = {
            @Index(name = "idx_ads_ad_group_id", columnList = "ad_group_id"),
            @Index(name = "idx_ads_content_id", columnList = "content_id"),
            @Index(name = "idx_ads_post_id", columnList = "platform_post_id")
        })
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
@ToString(exclude = {"adGroup", "content"})
public class Ad {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Platform platform;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "ad_group_id", nullable = false)
    private AdGroup adGroup;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "content_id")
    private Content content;

    @Column(name = "external_ad_id", nullable = false, length = 100)
    private String externalAdId;

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

    /** External post identifier carried in the ad payload; used to link content. */
    @Column(name = "platform_post_id", length = 100)
    private String platformPostId;

    /**
     * Lifetime spend snapshot; the spend sync job is its authoritative writer. Null until the
     * first spend report, which is stored as the baseline for growth.
     */
    @Column(precision = 15, scale = 2)
    private BigDecimal spend;

    @Column(name = "platform_created_at")
    private LocalDateTime platformCreatedAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
