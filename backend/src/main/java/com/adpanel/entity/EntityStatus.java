package com.adpanel.entity;

import java.util.Locale;

/** Delivery status shared by campaigns, ad groups and ads. */
public enum EntityStatus {
    ACTIVE,
    PAUSED,
    PENDING,
    REJECTED,
    DELETED;

    /** Maps a platform operation status string; unknown or missing values count as ACTIVE. */
    public static EntityStatus fromPlatformStatus(String raw) {
        if (raw == null || raw.isBlank()) {
            return ACTIVE;
        }
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "disable":
            case "pause":
            case "paused":
            case "suspend":
                return PAUSED;
            case "delete":
            case "deleted":
                return DELETED;
            case "pending":
            case "under_review":
                return PENDING;
            case "rejected":
                return REJECTED;
            default:
                return ACTIVE;
        }
    }
}
