package com.adpanel.dto.scoring;

import com.adpanel.service.scoring.EngagementBenchmark;
import java.math.BigDecimal;

/** Components of a performance score: score = quality x costFactor + bonus, then organic boost. */
public record ScoreBreakdown(
        EngagementBenchmark benchmark,
        BigDecimal qualityScore,
        BigDecimal costFactor,
        BigDecimal contentBonus,
        boolean organicBoost,
        BigDecimal score) {}
