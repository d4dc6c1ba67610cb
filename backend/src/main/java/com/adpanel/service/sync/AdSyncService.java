package com.adpanel.service.sync;

import com.adpanel.client.AdPlatformConnector;
import com.adpanel.config.AppProperties;
import com.adpanel.dto.platform.DateWindow;
import com.adpanel.dto.platform.EntityKind;
import com.adpanel.dto.platform.FetchResult;
import com.adpanel.dto.platform.PlatformAd;
import com.adpanel.dto.platform.PlatformAdGroup;
import com.adpanel.dto.platform.PlatformCampaign;
import com.adpanel.dto.sync.AccountSyncResult;
import com.adpanel.dto.sync.LinkResult;
import com.adpanel.dto.sync.ReconcileResult;
import com.adpanel.dto.task.JobReport;
import com.adpanel.entity.AdAccount;
import com.adpanel.entity.AdAccountStatus;
import com.adpanel.repository.jpa.AdAccountRepository;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Fetch, reconcile and link the ads of one account for one creation-date window. */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdSyncService {

    private final List<AdPlatformConnector> connectors;
    private final AdAccountRepository adAccountRepository;
    private final EntityReconciler entityReconciler;
    private final ContentLinker contentLinker;
    private final AppProperties appProperties;
    private final Clock clock;

    /** Syncs ads created within the recent window for every active account. */
    public JobReport syncRecent() {
        int recentDays = appProperties.getSync().getRecentDays();
        DateWindow window = DateWindow.lastDays(LocalDate.now(clock), recentDays);

        int processed = 0;
        int succeeded = 0;
        int failed = 0;
        int unresolved = 0;

        for (AdPlatformConnector connector : connectors) {
            for (AdAccount account :
                    adAccountRepository.findByPlatformAndStatusOrderByIdAsc(
                            connector.platform(), AdAccountStatus.ACTIVE)) {
                processed++;
                try {
                    AccountSyncResult result = syncAccount(account, connector, window);
                    if (result.isSuccess()) {
                        succeeded++;
                    } else {
                        failed++;
                    }
                    unresolved += result.getLink() != null ? result.getLink().getUnresolved() : 0;
                } catch (Exception e) {
                    failed++;
                    log.error("Ad sync failed for account {}: {}", account.getId(), e.getMessage(), e);
                }
            }
        }

        return JobReport.of(
                processed,
                succeeded,
                failed,
                "Window " + window + ", unresolved post ids: " + unresolved);
    }

    /**
     * Runs one account through fetch, reconcile, link and parent enrichment. A fetch error keeps
     * the rows read so far and marks the result unsuccessful so cursors do not move.
     */
    public AccountSyncResult syncAccount(
            AdAccount account, AdPlatformConnector connector, DateWindow window) {
        FetchResult<PlatformAd> fetched =
                connector.fetchEntities(account.getExternalAccountId(), EntityKind.AD, window, null);

        String error = null;
        if (fetched.hasError()) {
            error = fetched.getErrorMessage();
        } else if (fetched.isCeilingHit()) {
            error = "page ceiling reached after " + fetched.getPagesFetched() + " pages";
        }

        ReconcileResult reconciled = new ReconcileResult();
        LinkResult linked = new LinkResult();
        if (!fetched.getItems().isEmpty()) {
            reconciled = entityReconciler.reconcile(account, fetched.getItems());
            linked = contentLinker.link(account, reconciled.getAds(), connector);
            enrichParents(account, connector, fetched.getItems());
        }

        AccountSyncResult result =
                AccountSyncResult.builder()
                        .accountId(account.getId())
                        .window(window)
                        .adsFetched(fetched.getItems().size())
                        .skippedRows(fetched.getSkipped())
                        .reconcile(reconciled)
                        .link(linked)
                        .error(error)
                        .build();

        if (result.isSuccess()) {
            log.info(
                    "Synced account {} window {}: {} ads, {} linked",
                    account.getId(),
                    window,
                    result.getAdsFetched(),
                    linked.getLinked());
        } else {
            log.warn(
                    "Partial sync of account {} window {}: {} ads kept, error: {}",
                    account.getId(),
                    window,
                    result.getAdsFetched(),
                    error);
        }
        return result;
    }

    /** Refreshes objective, budget and status of the campaigns and ad groups seen in the rows. */
    private void enrichParents(
            AdAccount account, AdPlatformConnector connector, List<PlatformAd> rows) {
        List<String> campaignIds = new ArrayList<>();
        List<String> adGroupIds = new ArrayList<>();
        for (PlatformAd row : rows) {
            campaignIds.add(row.campaignId());
            adGroupIds.add(row.adGroupId());
        }

        try {
            FetchResult<PlatformCampaign> campaigns =
                    connector.fetchByIds(
                            account.getExternalAccountId(), EntityKind.CAMPAIGN, campaignIds);
            FetchResult<PlatformAdGroup> adGroups =
                    connector.fetchByIds(
                            account.getExternalAccountId(), EntityKind.AD_GROUP, adGroupIds);

            int updated =
                    entityReconciler.applyCampaignDetails(account, campaigns.getItems())
                            + entityReconciler.applyAdGroupDetails(account, adGroups.getItems());
            log.debug("Enriched {} campaigns and ad groups of account {}", updated, account.getId());

            if (campaigns.hasError() || adGroups.hasError()) {
                log.warn("Parent enrichment of account {} was incomplete", account.getId());
            }
        } catch (Exception e) {
            log.warn("Parent enrichment of account {} failed: {}", account.getId(), e.getMessage());
        }
    }
}
