package com.adpanel.service.scoring;

/**
 * Engagement-rate targets by reach bucket, as percentages of reach. Larger audiences get smaller
 * per-viewer targets because engagement does not grow linearly with reach.
 */
public enum EngagementBenchmark {
    MICRO(10_000, 0.30, 0.15, 0.10, 2.0),
    AVERAGE(50_000, 0.20, 0.10, 0.08, 1.5),
    HIGH(100_000, 0.15, 0.08, 0.06, 1.0),
    VIRAL(500_000, 0.10, 0.05, 0.04, 0.7),
    MEGA(Long.MAX_VALUE, 0.05, 0.03, 0.02, 0.5);

    /** Exclusive upper bound of reach */
    private final long reachBelow;

    private final double commentRate;
    private final double shareRate;
    private final double saveRate;
    private final double likeRate;

    EngagementBenchmark(
            long reachBelow, double commentRate, double shareRate, double saveRate, double likeRate) {
        this.reachBelow = reachBelow;
        this.commentRate = commentRate;
        this.shareRate = shareRate;
        this.saveRate = saveRate;
        this.likeRate = likeRate;
    }

    public static EngagementBenchmark forReach(long reach) {
        for (EngagementBenchmark bucket : values()) {
            if (reach < bucket.reachBelow) {
                return bucket;
            }
        }
        return MEGA;
    }

    public double targetComments(long reach) {
        return reach * commentRate / 100;
    }

    public double targetShares(long reach) {
        return reach * shareRate / 100;
    }

    public double targetSaves(long reach) {
        return reach * saveRate / 100;
    }

    public double targetLikes(long reach) {
        return reach * likeRate / 100;
    }
}
