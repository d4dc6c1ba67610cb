package com.adpanel.entity;

import jakarta.persistence.*;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

/** Advertiser account on an ad platform. Each account is synced independently. */
@Data
@Entity
@Table(
        name = "ad_accounts",
        uniqueConstraints =
                @UniqueConstraint(
                        name = "uq_ad_accounts_platform_external",
                        columnNames = {"platform", "external_account_id"}))
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class AdAccount {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Platform platform;

    @Column(name = "external_account_id", nullable = false, length = 100)
    private String externalAccountId;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private AdAccountStatus status = AdAccountStatus.ACTIVE;

    @Column(length = 10)
    @Builder.Default
    private String currency = "THB";

    /** First day this account's history is relevant; backfill starts here when set. */
    @Column(name = "start_date")
    private LocalDate startDate;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
