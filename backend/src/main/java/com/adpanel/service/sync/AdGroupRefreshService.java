package com.adpanel.service.sync;

import com.adpanel.client.AdPlatformConnector;
import com.adpanel.dto.platform.EntityKind;
import com.adpanel.dto.platform.FetchResult;
import com.adpanel.dto.platform.PlatformAdGroup;
import com.adpanel.dto.task.JobReport;
import com.adpanel.entity.AdAccount;
import com.adpanel.entity.AdAccountStatus;
import com.adpanel.entity.AdGroup;
import com.adpanel.entity.EntityStatus;
import com.adpanel.repository.jpa.AdAccountRepository;
import com.adpanel.repository.jpa.AdGroupRepository;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Re-reads status and budget of known active ad groups by id, far cheaper than a full list. */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdGroupRefreshService {

    private final List<AdPlatformConnector> connectors;
    private final AdAccountRepository adAccountRepository;
    private final AdGroupRepository adGroupRepository;
    private final EntityReconciler entityReconciler;

    public JobReport refreshActiveAdGroups() {
        int processed = 0;
        int succeeded = 0;
        int failed = 0;
        int updated = 0;

        for (AdPlatformConnector connector : connectors) {
            for (AdAccount account :
                    adAccountRepository.findByPlatformAndStatusOrderByIdAsc(
                            connector.platform(), AdAccountStatus.ACTIVE)) {
                processed++;
                try {
                    List<String> ids =
                            adGroupRepository
                                    .findByAccountAndStatus(account.getId(), EntityStatus.ACTIVE)
                                    .stream()
                                    .map(AdGroup::getExternalAdGroupId)
                                    .collect(Collectors.toList());
                    if (ids.isEmpty()) {
                        succeeded++;
                        continue;
                    }

                    FetchResult<PlatformAdGroup> details =
                            connector.fetchByIds(
                                    account.getExternalAccountId(), EntityKind.AD_GROUP, ids);
                    updated += entityReconciler.applyAdGroupDetails(account, details.getItems());

                    if (details.hasError()) {
                        failed++;
                    } else {
                        succeeded++;
                    }
                } catch (Exception e) {
                    failed++;
                    log.error(
                            "Ad group refresh failed for account {}: {}",
                            account.getId(),
                            e.getMessage(),
                            e);
                }
            }
        }

        return JobReport.of(processed, succeeded, failed, updated + " ad groups changed");
    }
}
