package com.adpanel.dto.platform;

import java.time.LocalDateTime;

/** Ad row with the names of its parents, as returned by the ad list endpoint. */
public record PlatformAd(
        String externalId,
        String adGroupId,
        String campaignId,
        String name,
        String adGroupName,
        String campaignName,
        String postId,
        String status,
        LocalDateTime createdAt)
        implements PlatformRecord {

    public boolean hasPost() {
        return postId != null && !postId.isBlank();
    }
}
