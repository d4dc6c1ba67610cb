package com.adpanel.dto.scoring;

import com.adpanel.entity.Content;
import java.math.BigDecimal;

/** Signals the scorer reads from one content item. */
public record ScoreInput(
        long reach,
        long impressions,
        long likes,
        long comments,
        long shares,
        long saves,
        long clicks,
        BigDecimal spend,
        int adsCount,
        BigDecimal durationSeconds,
        BigDecimal avgWatchSeconds) {

    public static ScoreInput from(Content content) {
        long impressions = orZero(content.getImpressions());
        long reach = orZero(content.getReach());
        return new ScoreInput(
                reach > 0 ? reach : impressions,
                impressions,
                orZero(content.getLikes()),
                orZero(content.getComments()),
                orZero(content.getShares()),
                orZero(content.getSaves()),
                orZero(content.getClicks()),
                content.getAdsTotalCost() != null ? content.getAdsTotalCost() : BigDecimal.ZERO,
                content.getAdsCount() != null ? content.getAdsCount() : 0,
                content.getVideoDurationSeconds(),
                content.getAvgWatchTimeSeconds());
    }

    private static long orZero(Long value) {
        return value != null ? value : 0L;
    }
}
