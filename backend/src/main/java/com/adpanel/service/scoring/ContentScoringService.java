package com.adpanel.service.scoring;

import com.adpanel.config.AppProperties;
import com.adpanel.dto.scoring.ScoreBreakdown;
import com.adpanel.dto.scoring.ScoreInput;
import com.adpanel.dto.task.JobReport;
import com.adpanel.entity.AdCategory;
import com.adpanel.entity.AdGroup;
import com.adpanel.entity.Content;
import com.adpanel.repository.jpa.AdGroupRepository;
import com.adpanel.repository.jpa.AdRepository;
import com.adpanel.repository.jpa.ContentRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

/** Scores all live content in batches, then rolls the scores up to ABX ad groups. */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContentScoringService {

    private final ContentRepository contentRepository;
    private final AdRepository adRepository;
    private final AdGroupRepository adGroupRepository;
    private final PerformanceScorer performanceScorer;
    private final AppProperties appProperties;
    private final Clock clock;

    public JobReport scoreAll() {
        int batchSize = appProperties.getScoring().getBatchSize();
        LocalDateTime now = LocalDateTime.now(clock);

        int processed = 0;
        int succeeded = 0;
        int failed = 0;
        int page = 0;
        List<Content> batch;
        do {
            batch = contentRepository.findLiveForScoring(PageRequest.of(page++, batchSize));
            for (Content content : batch) {
                processed++;
                try {
                    applyScore(content, performanceScorer.score(ScoreInput.from(content)), now);
                    contentRepository.save(content);
                    succeeded++;
                } catch (Exception e) {
                    failed++;
                    log.error("Scoring failed for content {}: {}", content.getId(), e.getMessage(), e);
                }
            }
        } while (batch.size() == batchSize);

        int adGroups = scoreAdGroups(now);
        log.info(
                "Scored {} of {} content items, {} ad groups updated", succeeded, processed, adGroups);
        return JobReport.of(
                processed, succeeded, failed, "Ad groups scored: " + adGroups);
    }

    /** Each ABX ad group gets the mean score of the scored content its ads reference. */
    int scoreAdGroups(LocalDateTime now) {
        int updated = 0;
        for (AdGroup adGroup : adGroupRepository.findByCategory(AdCategory.ABX)) {
            try {
                List<BigDecimal> scores =
                        adRepository.findContentByAdGroupId(adGroup.getId()).stream()
                                .map(Content::getPerformanceScore)
                                .filter(Objects::nonNull)
                                .collect(Collectors.toList());
                if (scores.isEmpty()) {
                    continue;
                }
                BigDecimal mean =
                        scores.stream()
                                .reduce(BigDecimal.ZERO, BigDecimal::add)
                                .divide(BigDecimal.valueOf(scores.size()), 2, RoundingMode.HALF_UP);
                adGroup.setPerformanceScore(mean);
                adGroup.setScoreCalculatedAt(now);
                adGroupRepository.save(adGroup);
                updated++;
            } catch (Exception e) {
                log.error("Scoring failed for ad group {}: {}", adGroup.getId(), e.getMessage(), e);
            }
        }
        return updated;
    }

    private static void applyScore(Content content, ScoreBreakdown breakdown, LocalDateTime now) {
        content.setQualityScore(breakdown.qualityScore());
        content.setCostEfficiencyFactor(breakdown.costFactor());
        content.setContentBonus(breakdown.contentBonus());
        content.setPerformanceScore(breakdown.score());
        content.setScoreCalculatedAt(now);
    }
}
