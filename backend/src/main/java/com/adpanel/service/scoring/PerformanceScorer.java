package com.adpanel.service.scoring;

import com.adpanel.config.AppProperties;
import com.adpanel.dto.scoring.ScoreBreakdown;
import com.adpanel.dto.scoring.ScoreInput;
import java.math.BigDecimal;
import java.math.RoundingMode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Scores content by engagement against reach-dependent targets. The quality part has no upper
 * bound: content far above its benchmark scores correspondingly higher.
 */
@Component
@RequiredArgsConstructor
public class PerformanceScorer {

    private static final double SHARE_WEIGHT = 40;
    private static final double SAVE_WEIGHT = 30;
    private static final double COMMENT_WEIGHT = 20;
    private static final double LIKE_WEIGHT = 10;
    private static final double MAX_COST_FACTOR = 1.5;

    private final AppProperties appProperties;

    public ScoreBreakdown score(ScoreInput input) {
        AppProperties.Scoring config = appProperties.getScoring();
        EngagementBenchmark benchmark = EngagementBenchmark.forReach(input.reach());

        double quality = qualityScore(input, benchmark);
        double costFactor = costFactor(input, config);
        double bonus = contentBonus(input);

        double score = quality * costFactor + bonus;
        boolean organic =
                input.spend().signum() == 0 && quality > config.getHighQualityThreshold().doubleValue();
        if (organic) {
            score *= config.getOrganicMultiplier().doubleValue();
        }

        return new ScoreBreakdown(
                benchmark,
                scale(quality, 4),
                scale(costFactor, 4),
                scale(bonus, 4),
                organic,
                scale(score, 2));
    }

    /** Weighted actual/target ratios, shares highest. Targets below one count as one. */
    double qualityScore(ScoreInput input, EngagementBenchmark benchmark) {
        long reach = input.reach();
        double shares = input.shares() / Math.max(benchmark.targetShares(reach), 1);
        double saves = input.saves() / Math.max(benchmark.targetSaves(reach), 1);
        double comments = input.comments() / Math.max(benchmark.targetComments(reach), 1);
        double likes = input.likes() / Math.max(benchmark.targetLikes(reach), 1);

        return (shares * SHARE_WEIGHT
                        + saves * SAVE_WEIGHT
                        + comments * COMMENT_WEIGHT
                        + likes * LIKE_WEIGHT)
                / 100;
    }

    /**
     * Multiplier from spend per weighted engagement, within [min, 1.5]. Large spend with few
     * engagements per currency unit is penalised on top of the cost band.
     */
    double costFactor(ScoreInput input, AppProperties.Scoring config) {
        double spend = input.spend().doubleValue();
        if (spend <= 0) {
            return 1.0;
        }

        double minFactor = config.getMinCostMultiplier().doubleValue();
        double weighted =
                input.shares() * 10 + input.saves() * 5 + input.comments() * 1.5 + input.likes() * 0.1;
        if (weighted <= 0) {
            return minFactor;
        }

        double costPerEngagement = spend / weighted;
        double factor;
        if (costPerEngagement <= config.getCheapCostPerEngagement().doubleValue()) {
            factor = config.getCheapMultiplier().doubleValue();
        } else if (costPerEngagement <= config.getGoodCostPerEngagement().doubleValue()) {
            factor = config.getGoodMultiplier().doubleValue();
        } else if (costPerEngagement <= config.getFairCostPerEngagement().doubleValue()) {
            factor = 1.0;
        } else {
            double fair = config.getFairCostPerEngagement().doubleValue();
            factor = Math.max(minFactor, 1.0 - (costPerEngagement - fair));
        }

        double engagementPerUnit = weighted / spend;
        if (spend > config.getSpendPenaltyThreshold().doubleValue()
                && engagementPerUnit < config.getSpendPenaltyMinEngagementPerUnit().doubleValue()) {
            factor *= 0.7 + engagementPerUnit * 0.3;
        }
        if (spend > config.getHeavySpendThreshold().doubleValue()
                && engagementPerUnit < config.getHeavySpendMinEngagementPerUnit().doubleValue()) {
            factor *= config.getHeavySpendPenalty().doubleValue();
        }

        return Math.min(MAX_COST_FACTOR, Math.max(minFactor, factor));
    }

    /** Completion-rate bonus when watch data exists, otherwise click-through bonus. */
    double contentBonus(ScoreInput input) {
        double duration = input.durationSeconds() != null ? input.durationSeconds().doubleValue() : 0;
        double avgWatch = input.avgWatchSeconds() != null ? input.avgWatchSeconds().doubleValue() : 0;

        if (duration > 0 && avgWatch > 0) {
            double completion = Math.min(avgWatch / duration, 1.0);
            if (completion > 0.7) return 0.3;
            if (completion > 0.5) return 0.2;
            if (completion > 0.3) return 0.1;
            return 0;
        }

        if (input.impressions() > 0) {
            double ctr = (double) input.clicks() / input.impressions();
            if (ctr > 0.05) return 0.3;
            if (ctr > 0.03) return 0.2;
            if (ctr > 0.02) return 0.1;
        }
        return 0;
    }

    private static BigDecimal scale(double value, int digits) {
        return BigDecimal.valueOf(value).setScale(digits, RoundingMode.HALF_UP);
    }
}
