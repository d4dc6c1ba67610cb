package com.adpanel.service.optimization;

import com.adpanel.config.AppProperties;
import com.adpanel.dto.optimization.AllocationDecision;
import com.adpanel.dto.optimization.AllocationOutcome;
import com.adpanel.entity.AdCategory;
import com.adpanel.entity.AdGroup;
import com.adpanel.entity.AllocationStrategyType;
import com.adpanel.entity.DailyBudgetAllocation;
import com.adpanel.repository.jpa.AdGroupRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * ABX ad groups of the product group get their style's share of the day, split evenly between the
 * groups of that style, times a score-tier multiplier.
 */
@Component
@RequiredArgsConstructor
public class GroupTierStrategy implements AllocationStrategy {

    static final String DEFAULT_STYLE = "other";

    private final AdGroupRepository adGroupRepository;
    private final AppProperties appProperties;

    @Override
    public AllocationStrategyType type() {
        return AllocationStrategyType.GROUP_TIER;
    }

    @Override
    public AllocationOutcome allocate(DailyBudgetAllocation dailyBudget, BigDecimal envelope) {
        AppProperties.Optimizer config = appProperties.getOptimizer();
        String productGroup = dailyBudget.getBudgetAllocation().getProductGroup();

        List<AdGroup> adGroups =
                adGroupRepository.findScoredByProductGroup(productGroup, AdCategory.ABX).stream()
                        .limit(config.getMaxItemsPerRun())
                        .collect(Collectors.toList());
        if (adGroups.isEmpty()) {
            return AllocationOutcome.empty("No scored ABX ad groups for product group " + productGroup);
        }

        Map<String, BigDecimal> styleBudgets = dailyBudget.getContentStyleBudgets();
        Map<String, Long> groupsPerStyle =
                adGroups.stream()
                        .collect(Collectors.groupingBy(GroupTierStrategy::styleOf, Collectors.counting()));
        BigDecimal evenShare =
                envelope.divide(BigDecimal.valueOf(adGroups.size()), 2, RoundingMode.DOWN);

        AllocationOutcome outcome = new AllocationOutcome();
        for (AdGroup adGroup : adGroups) {
            String style = styleOf(adGroup);
            BigDecimal base =
                    styleBudgets != null && styleBudgets.containsKey(style)
                            ? styleBudgets
                                    .get(style)
                                    .divide(
                                            BigDecimal.valueOf(groupsPerStyle.get(style)),
                                            2,
                                            RoundingMode.DOWN)
                            : evenShare;
            BigDecimal multiplier = tierMultiplier(adGroup.getPerformanceScore());

            outcome.getDecisions()
                    .add(
                            AllocationDecision.builder()
                                    .strategy(type())
                                    .targetId(adGroup.getId())
                                    .externalTargetId(adGroup.getExternalAdGroupId())
                                    .targetName(adGroup.getName())
                                    .score(adGroup.getPerformanceScore())
                                    .multiplier(multiplier)
                                    .amount(base.multiply(multiplier).setScale(2, RoundingMode.HALF_UP))
                                    .note("style " + style)
                                    .build());
        }
        return outcome;
    }

    /** First tier whose minimum the score reaches; tiers are checked highest first. */
    BigDecimal tierMultiplier(BigDecimal score) {
        AppProperties.Optimizer config = appProperties.getOptimizer();
        if (score == null) {
            return config.getBaseTierMultiplier();
        }
        return config.getScoreTiers().stream()
                .sorted((a, b) -> b.getMinScore().compareTo(a.getMinScore()))
                .filter(tier -> score.compareTo(tier.getMinScore()) >= 0)
                .map(AppProperties.ScoreTier::getMultiplier)
                .findFirst()
                .orElse(config.getBaseTierMultiplier());
    }

    private static String styleOf(AdGroup adGroup) {
        return adGroup.getGroupStyle() != null ? adGroup.getGroupStyle() : DEFAULT_STYLE;
    }
}
