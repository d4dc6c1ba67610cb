package com.adpanel.entity;

import jakarta.persistence.*;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.*;
import org.hibernate.annotations.UpdateTimestamp;

/**
 * Last completed backfill day per (account, platform). The next window always starts the day after
 * {@link #lastCompletedDate}.
 */
@Data
@Entity
@Table(
        name = "sync_cursors",
        uniqueConstraints =
                @UniqueConstraint(
                        name = "uq_sync_cursors_account_platform",
                        columnNames = {"ad_account_id", "platform"}))
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncCursor {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "ad_account_id", nullable = false)
    private Long adAccountId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Platform platform;

    @Column(name = "last_completed_date", nullable = false)
    private LocalDate lastCompletedDate;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
