package com.adpanel.entity;

import com.adpanel.dto.sync.AdSummary;
import io.hypersistence.utils.hibernate.type.json.JsonBinaryType;
import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.Type;
import org.hibernate.annotations.UpdateTimestamp;

/**
 * Unified content item across platforms, identified by (platform, external post id). Created by the
 * linker when first observed, scored by the scorer, never hard-deleted.
 */
@Data
@Entity
@Table(
        name = "contents",
        uniqueConstraints =
                @UniqueConstraint(
                        name = "uq_contents_platform_post",
                        columnNames = {"platform", "platform_post_id"}),
        indexes = {
            @Index(name = "idx_contents_product_group", columnList = "product_group"),
            @Index(name = "idx_contents_performance_score", columnList = "performance_score"),
            @Index(name = "idx_contents_platform_created_at", columnList = "platform_created_at")
        })
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class Content {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Platform platform;

    @Column(name = "platform_post_id", nullable = false, length = 100)
    private String platformPostId;

    @Column(name = "ad_account_id")
    private Long adAccountId;

    @Column(length = 500)
    private String url;

    @Column(columnDefinition = "TEXT")
    private String caption;

    @Column(name = "platform_created_at")
    private LocalDateTime platformCreatedAt;

    @Column(name = "product_group", length = 100)
    private String productGroup;

    // Engagement counters
    @Builder.Default private Long views = 0L;
    @Builder.Default private Long reach = 0L;
    @Builder.Default private Long impressions = 0L;
    @Builder.Default private Long likes = 0L;
    @Builder.Default private Long comments = 0L;
    @Builder.Default private Long shares = 0L;
    @Builder.Default private Long saves = 0L;
    @Builder.Default private Long clicks = 0L;

    @Column(name = "video_duration_seconds", precision = 10, scale = 2)
    private BigDecimal videoDurationSeconds;

    @Column(name = "avg_watch_time_seconds", precision = 10, scale = 2)
    private BigDecimal avgWatchTimeSeconds;

    // Ad aggregates
    @Column(name = "ads_count")
    @Builder.Default
    private Integer adsCount = 0;

    @Column(name = "ace_ad_count")
    @Builder.Default
    private Integer aceAdCount = 0;

    @Column(name = "abx_ad_count")
    @Builder.Default
    private Integer abxAdCount = 0;

    @Type(JsonBinaryType.class)
    @Column(name = "ace_details", columnDefinition = "JSONB")
    @Builder.Default
    private List<AdSummary> aceDetails = new ArrayList<>();

    @Type(JsonBinaryType.class)
    @Column(name = "abx_details", columnDefinition = "JSONB")
    @Builder.Default
    private List<AdSummary> abxDetails = new ArrayList<>();

    /** Total ad spend. Null until first known; afterwards owned by the spend sync job. */
    @Column(name = "ads_total_cost", precision = 15, scale = 2)
    private BigDecimal adsTotalCost;

    // Score fields
    @Column(name = "quality_score", precision = 10, scale = 4)
    private BigDecimal qualityScore;

    @Column(name = "cost_efficiency_factor", precision = 6, scale = 4)
    private BigDecimal costEfficiencyFactor;

    @Column(name = "content_bonus", precision = 6, scale = 4)
    private BigDecimal contentBonus;

    @Column(name = "performance_score", precision = 10, scale = 2)
    private BigDecimal performanceScore;

    @Column(name = "score_calculated_at")
    private LocalDateTime scoreCalculatedAt;

    @Column(name = "expires_at")
    private LocalDateTime expiresAt;

    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public void softDelete() {
        this.deletedAt = LocalDateTime.now();
    }
}
