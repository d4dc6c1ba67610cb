package com.adpanel.dto.platform;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/** Published post with its engagement counters. */
public record PlatformPost(
        String externalId,
        String url,
        String caption,
        LocalDateTime createdAt,
        long views,
        long reach,
        long impressions,
        long likes,
        long comments,
        long shares,
        long saves,
        long clicks,
        BigDecimal durationSeconds,
        BigDecimal avgWatchSeconds)
        implements PlatformRecord {}
