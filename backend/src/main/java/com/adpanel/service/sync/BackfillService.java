package com.adpanel.service.sync;

import com.adpanel.client.AdPlatformConnector;
import com.adpanel.config.AppProperties;
import com.adpanel.dto.platform.DateWindow;
import com.adpanel.dto.sync.AccountSyncResult;
import com.adpanel.dto.task.JobReport;
import com.adpanel.entity.AdAccount;
import com.adpanel.entity.AdAccountStatus;
import com.adpanel.repository.jpa.AdAccountRepository;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Works through account history one cursor window at a time. The cursor moves only after a
 * window was fetched completely, including windows with no ads.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BackfillService {

    private final List<AdPlatformConnector> connectors;
    private final AdAccountRepository adAccountRepository;
    private final AdSyncService adSyncService;
    private final BackfillCursorService cursorService;
    private final AppProperties appProperties;

    public JobReport runBackfill() {
        AppProperties.Sync.Backfill config = appProperties.getSync().getBackfill();
        int budget = config.getMaxAccountsPerRun();
        int processed = 0;
        int succeeded = 0;
        int failed = 0;
        int caughtUp = 0;

        for (AdPlatformConnector connector : connectors) {
            for (AdAccount account :
                    adAccountRepository.findByPlatformAndStatusOrderByIdAsc(
                            connector.platform(), AdAccountStatus.ACTIVE)) {
                if (processed >= budget) {
                    break;
                }
                try {
                    Optional<DateWindow> window =
                            cursorService.nextWindow(account, config.getMaxChunkDays());
                    if (window.isEmpty()) {
                        caughtUp++;
                        continue;
                    }
                    processed++;
                    if (backfillWindow(account, connector, window.get())) {
                        succeeded++;
                    } else {
                        failed++;
                    }
                } catch (Exception e) {
                    processed++;
                    failed++;
                    log.error("Backfill failed for account {}: {}", account.getId(), e.getMessage(), e);
                }
            }
        }

        return JobReport.of(
                processed, succeeded, failed, caughtUp + " accounts already caught up");
    }

    /** Syncs one window and advances the cursor on success; false leaves the cursor in place. */
    public boolean backfillWindow(AdAccount account, AdPlatformConnector connector, DateWindow window) {
        AccountSyncResult result = adSyncService.syncAccount(account, connector, window);
        if (!result.isSuccess()) {
            log.warn(
                    "Backfill window {} of account {} will be retried: {}",
                    window,
                    account.getId(),
                    result.getError());
            return false;
        }
        cursorService.advance(account, window);
        return true;
    }
}
