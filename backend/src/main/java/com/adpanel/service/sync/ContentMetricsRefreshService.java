package com.adpanel.service.sync;

import com.adpanel.client.AdPlatformConnector;
import com.adpanel.config.AppProperties;
import com.adpanel.dto.platform.FetchResult;
import com.adpanel.dto.platform.PlatformPost;
import com.adpanel.dto.task.JobReport;
import com.adpanel.entity.AdAccount;
import com.adpanel.entity.Content;
import com.adpanel.repository.jpa.AdAccountRepository;
import com.adpanel.repository.jpa.ContentRepository;
import com.adpanel.service.content.ContentService;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

/** Pulls fresh engagement counters for recently published content before it is scored. */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContentMetricsRefreshService {

    private final List<AdPlatformConnector> connectors;
    private final ContentRepository contentRepository;
    private final AdAccountRepository adAccountRepository;
    private final ContentService contentService;
    private final AppProperties appProperties;
    private final Clock clock;

    public JobReport refreshRecentContent() {
        AppProperties.Sync.ContentRefresh config = appProperties.getSync().getContentRefresh();
        LocalDateTime since = LocalDateTime.now(clock).minusDays(config.getMaxAgeDays());

        int processed = 0;
        int refreshed = 0;
        int failed = 0;

        for (AdPlatformConnector connector : connectors) {
            List<Content> recent =
                    contentRepository.findRecentByPlatform(
                            connector.platform(), since, PageRequest.of(0, config.getMaxItems()));

            // Post detail lookups are scoped to the owning account
            Map<Long, List<String>> postIdsByAccount =
                    recent.stream()
                            .filter(content -> content.getAdAccountId() != null)
                            .collect(
                                    Collectors.groupingBy(
                                            Content::getAdAccountId,
                                            LinkedHashMap::new,
                                            Collectors.mapping(
                                                    Content::getPlatformPostId,
                                                    Collectors.toList())));

            for (Map.Entry<Long, List<String>> entry : postIdsByAccount.entrySet()) {
                AdAccount account = adAccountRepository.findById(entry.getKey()).orElse(null);
                processed += entry.getValue().size();
                if (account == null) {
                    failed += entry.getValue().size();
                    continue;
                }
                try {
                    FetchResult<PlatformPost> posts =
                            connector.fetchPostDetails(
                                    account.getExternalAccountId(), entry.getValue());
                    for (PlatformPost post : posts.getItems()) {
                        if (contentService.refreshFromPost(connector.platform(), post)) {
                            refreshed++;
                        }
                    }
                    if (posts.hasError()) {
                        failed += entry.getValue().size() - posts.getItems().size();
                    }
                } catch (Exception e) {
                    failed += entry.getValue().size();
                    log.error(
                            "Content refresh failed for account {}: {}",
                            account.getId(),
                            e.getMessage(),
                            e);
                }
            }
        }

        log.info("Refreshed {} of {} recent content items", refreshed, processed);
        return JobReport.of(processed, refreshed, failed, "Content published since " + since.toLocalDate());
    }
}
