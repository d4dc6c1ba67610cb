package com.adpanel.service.sync;

import com.adpanel.client.AdPlatformConnector;
import com.adpanel.dto.platform.FetchResult;
import com.adpanel.dto.platform.PlatformAd;
import com.adpanel.dto.platform.PlatformPost;
import com.adpanel.dto.sync.AdSummary;
import com.adpanel.dto.sync.LinkResult;
import com.adpanel.dto.sync.ReconciledAd;
import com.adpanel.entity.Ad;
import com.adpanel.entity.AdAccount;
import com.adpanel.entity.Content;
import com.adpanel.repository.jpa.AdRepository;
import com.adpanel.service.content.ContentService;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Links reconciled ads to content by the post id carried in the ad row. Posts without content are
 * fetched once in a batch and created; ids still missing afterwards are counted, not fatal.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContentLinker {

    private final ContentService contentService;
    private final AdRepository adRepository;
    private final AdNameParser adNameParser;

    public LinkResult link(AdAccount account, List<ReconciledAd> ads, AdPlatformConnector connector) {
        LinkResult result = new LinkResult();

        Set<String> postIds = new LinkedHashSet<>();
        for (ReconciledAd reconciled : ads) {
            if (reconciled.source().hasPost()) {
                postIds.add(reconciled.source().postId());
            } else {
                result.setWithoutPost(result.getWithoutPost() + 1);
            }
        }
        if (postIds.isEmpty()) {
            return result;
        }

        Map<String, Content> contents =
                new HashMap<>(contentService.findByExternalPostIds(account.getPlatform(), postIds));
        List<String> missing = missingIds(postIds, contents);
        if (!missing.isEmpty()) {
            result.setContentCreated(createFromDetails(account, missing, connector));
            contents.putAll(contentService.findByExternalPostIds(account.getPlatform(), missing));
            List<String> unresolved = missingIds(postIds, contents);
            result.setUnresolved(unresolved.size());
            if (!unresolved.isEmpty()) {
                log.warn(
                        "{} post ids of account {} still have no content: {}",
                        unresolved.size(),
                        account.getId(),
                        unresolved);
            }
        }

        Map<Long, String> touched = new LinkedHashMap<>();
        for (ReconciledAd reconciled : ads) {
            PlatformAd source = reconciled.source();
            Content content = source.hasPost() ? contents.get(source.postId()) : null;
            if (content == null) {
                continue;
            }
            try {
                linkAd(reconciled, content);
                result.setLinked(result.getLinked() + 1);
                touched.putIfAbsent(
                        content.getId(),
                        adNameParser.firstProductGroup(
                                source.name(), source.adGroupName(), source.campaignName()));
            } catch (RuntimeException e) {
                result.setFailed(result.getFailed() + 1);
                log.error(
                        "Linking ad {} to post {} failed: {}",
                        source.externalId(),
                        source.postId(),
                        e.getMessage(),
                        e);
            }
        }

        touched.forEach(
                (contentId, productGroup) -> {
                    try {
                        contentService.refreshAdAggregates(contentId, productGroup);
                    } catch (RuntimeException e) {
                        result.setFailed(result.getFailed() + 1);
                        log.error("Refreshing aggregates of content {} failed", contentId, e);
                    }
                });

        log.info(
                "Linked {} ads for account {} ({} without post, {} content created, {} unresolved,"
                        + " {} failed)",
                result.getLinked(),
                account.getId(),
                result.getWithoutPost(),
                result.getContentCreated(),
                result.getUnresolved(),
                result.getFailed());
        return result;
    }

    private void linkAd(ReconciledAd reconciled, Content content) {
        Ad ad = reconciled.ad();
        if (ad.getContent() == null || !Objects.equals(ad.getContent().getId(), content.getId())) {
            ad.setContent(content);
            adRepository.save(ad);
        }

        PlatformAd source = reconciled.source();
        AdSummary summary =
                AdSummary.builder()
                        .adId(source.externalId())
                        .adGroupId(source.adGroupId())
                        .campaignId(source.campaignId())
                        .adName(ad.getName())
                        .adGroupName(source.adGroupName())
                        .campaignName(source.campaignName())
                        .status(ad.getStatus().name())
                        .cost(ad.getSpend())
                        .build();
        contentService.attachAdSummary(content.getId(), summary, reconciled.category());
    }

    private int createFromDetails(
            AdAccount account, List<String> postIds, AdPlatformConnector connector) {
        FetchResult<PlatformPost> details =
                connector.fetchPostDetails(account.getExternalAccountId(), postIds);
        if (details.hasError()) {
            log.warn(
                    "Detail fetch for {} posts of account {} incomplete: {}",
                    postIds.size(),
                    account.getId(),
                    details.getErrorMessage());
        }

        int created = 0;
        for (PlatformPost post : details.getItems()) {
            try {
                contentService.createFromPost(account.getPlatform(), account.getId(), post);
                created++;
            } catch (RuntimeException e) {
                log.error("Creating content for post {} failed", post.externalId(), e);
            }
        }
        return created;
    }

    private static List<String> missingIds(Set<String> postIds, Map<String, Content> found) {
        List<String> missing = new ArrayList<>();
        for (String postId : postIds) {
            if (!found.containsKey(postId)) {
                missing.add(postId);
            }
        }
        return missing;
    }
}
