package com.adpanel.service.optimization;

import com.adpanel.config.AppProperties;
import com.adpanel.dto.optimization.AllocationDecision;
import com.adpanel.dto.optimization.AllocationOutcome;
import com.adpanel.entity.AllocationStrategyType;
import com.adpanel.entity.Content;
import com.adpanel.entity.DailyBudgetAllocation;
import com.adpanel.repository.jpa.ContentRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

/**
 * Top-N content of the product group gets envelope x score / sum(scores). Amounts under the
 * minimum-spend floor are dropped and not redistributed, so the envelope can be under-spent.
 */
@Component
@RequiredArgsConstructor
public class ScoreProportionalStrategy implements AllocationStrategy {

    private final ContentRepository contentRepository;
    private final AppProperties appProperties;
    private final Clock clock;

    @Override
    public AllocationStrategyType type() {
        return AllocationStrategyType.SCORE_PROPORTIONAL;
    }

    @Override
    public AllocationOutcome allocate(DailyBudgetAllocation dailyBudget, BigDecimal envelope) {
        AppProperties.Optimizer config = appProperties.getOptimizer();
        String productGroup = dailyBudget.getBudgetAllocation().getProductGroup();

        List<Content> ranked =
                contentRepository
                        .findTopScoredByProductGroup(
                                productGroup,
                                LocalDateTime.now(clock),
                                PageRequest.of(0, config.getMaxItemsPerRun()))
                        .stream()
                        .filter(c -> c.getPerformanceScore().signum() > 0)
                        .collect(Collectors.toList());
        if (ranked.isEmpty()) {
            return AllocationOutcome.empty("No scored content for product group " + productGroup);
        }

        BigDecimal totalScore =
                ranked.stream()
                        .map(Content::getPerformanceScore)
                        .reduce(BigDecimal.ZERO, BigDecimal::add);

        AllocationOutcome outcome = new AllocationOutcome();
        for (Content content : ranked) {
            BigDecimal share = content.getPerformanceScore().divide(totalScore, 8, RoundingMode.HALF_UP);
            // rounded down so the sum never exceeds the envelope
            BigDecimal amount = envelope.multiply(share).setScale(2, RoundingMode.DOWN);

            AllocationDecision decision =
                    AllocationDecision.builder()
                            .strategy(type())
                            .targetId(content.getId())
                            .externalTargetId(content.getPlatformPostId())
                            .targetName(content.getCaption())
                            .score(content.getPerformanceScore())
                            .multiplier(share)
                            .amount(amount)
                            .build();

            if (amount.compareTo(config.getMinimumSpendFloor()) < 0) {
                decision.setNote("below minimum spend floor " + config.getMinimumSpendFloor());
                outcome.getDiscarded().add(decision);
            } else {
                outcome.getDecisions().add(decision);
            }
        }
        return outcome;
    }
}
