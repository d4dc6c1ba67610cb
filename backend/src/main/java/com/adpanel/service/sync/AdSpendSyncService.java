package com.adpanel.service.sync;

import com.adpanel.client.AdPlatformConnector;
import com.adpanel.dto.platform.AdSpend;
import com.adpanel.dto.platform.FetchResult;
import com.adpanel.dto.task.JobReport;
import com.adpanel.entity.Ad;
import com.adpanel.entity.AdAccount;
import com.adpanel.entity.AdAccountStatus;
import com.adpanel.repository.jpa.AdAccountRepository;
import com.adpanel.repository.jpa.AdRepository;
import com.adpanel.service.budget.DailyBudgetService;
import com.adpanel.service.content.ContentService;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Authoritative writer of ad spend. Stores each linked ad's lifetime spend, recomputes the total
 * spend of the content it points to, and books spend growth on today's daily budget rows.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdSpendSyncService {

    private final List<AdPlatformConnector> connectors;
    private final AdAccountRepository adAccountRepository;
    private final AdRepository adRepository;
    private final ContentService contentService;
    private final DailyBudgetService dailyBudgetService;
    private final Clock clock;

    public JobReport syncSpend() {
        int processed = 0;
        int succeeded = 0;
        int failed = 0;
        Map<String, BigDecimal> growthByProductGroup = new HashMap<>();

        for (AdPlatformConnector connector : connectors) {
            for (AdAccount account :
                    adAccountRepository.findByPlatformAndStatusOrderByIdAsc(
                            connector.platform(), AdAccountStatus.ACTIVE)) {
                processed++;
                try {
                    if (syncAccount(account, connector, growthByProductGroup)) {
                        succeeded++;
                    } else {
                        failed++;
                    }
                } catch (Exception e) {
                    failed++;
                    log.error("Spend sync failed for account {}: {}", account.getId(), e.getMessage(), e);
                }
            }
        }

        if (!growthByProductGroup.isEmpty()) {
            dailyBudgetService.recordSpend(LocalDate.now(clock), growthByProductGroup);
        }
        return JobReport.of(
                processed, succeeded, failed, "Spend growth by product group: " + growthByProductGroup);
    }

    /** @return false when the spend report was incomplete; the rows that did arrive are kept */
    boolean syncAccount(
            AdAccount account,
            AdPlatformConnector connector,
            Map<String, BigDecimal> growthByProductGroup) {
        List<Ad> ads = adRepository.findLinkedByAccount(account.getId());
        if (ads.isEmpty()) {
            return true;
        }

        List<String> adIds = ads.stream().map(Ad::getExternalAdId).collect(Collectors.toList());
        FetchResult<AdSpend> report =
                connector.fetchLifetimeSpend(account.getExternalAccountId(), adIds);
        Map<String, BigDecimal> spendByAd =
                report.getItems().stream()
                        .collect(
                                Collectors.toMap(
                                        AdSpend::externalId, AdSpend::spend, (a, b) -> b));

        Set<Long> touchedContent = new LinkedHashSet<>();
        for (Ad ad : ads) {
            BigDecimal spend = spendByAd.get(ad.getExternalAdId());
            if (spend == null) {
                continue;
            }
            BigDecimal previous = ad.getSpend();
            if (previous == null) {
                // first report is the baseline, nothing is booked
                ad.setSpend(spend);
                adRepository.save(ad);
            } else if (spend.compareTo(previous) != 0) {
                ad.setSpend(spend);
                adRepository.save(ad);

                BigDecimal growth = spend.subtract(previous);
                String productGroup = productGroupOf(ad);
                if (growth.signum() > 0 && productGroup != null) {
                    growthByProductGroup.merge(productGroup, growth, BigDecimal::add);
                }
            }
            touchedContent.add(ad.getContent().getId());
        }

        int updated = 0;
        for (Long contentId : touchedContent) {
            if (contentService.updateTotalCost(contentId, adRepository.sumSpendByContentId(contentId))) {
                updated++;
            }
        }

        log.info(
                "Spend of account {}: {} of {} ads reported, {} content totals changed",
                account.getId(),
                spendByAd.size(),
                ads.size(),
                updated);

        if (report.hasError()) {
            log.warn("Spend report of account {} incomplete: {}", account.getId(), report.getErrorMessage());
            return false;
        }
        return true;
    }

    private static String productGroupOf(Ad ad) {
        if (ad.getContent() != null && ad.getContent().getProductGroup() != null) {
            return ad.getContent().getProductGroup();
        }
        return ad.getAdGroup() != null ? ad.getAdGroup().getProductGroup() : null;
    }
}
