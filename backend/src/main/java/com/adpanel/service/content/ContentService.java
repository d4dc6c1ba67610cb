package com.adpanel.service.content;

import com.adpanel.dto.platform.PlatformPost;
import com.adpanel.dto.sync.AdSummary;
import com.adpanel.entity.AdCategory;
import com.adpanel.entity.Content;
import com.adpanel.entity.Platform;
import com.adpanel.exception.ResourceNotFoundException;
import com.adpanel.repository.jpa.AdRepository;
import com.adpanel.repository.jpa.ContentRepository;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Content lookups and the ad aggregates kept on each content item. */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContentService {

    private final ContentRepository contentRepository;
    private final AdRepository adRepository;

    @Transactional(readOnly = true)
    public Optional<Content> findByExternalPostId(Platform platform, String externalPostId) {
        return contentRepository.findByPlatformAndPlatformPostId(platform, externalPostId);
    }

    @Transactional(readOnly = true)
    public Map<String, Content> findByExternalPostIds(
            Platform platform, Collection<String> externalPostIds) {
        if (externalPostIds.isEmpty()) {
            return Map.of();
        }
        return contentRepository.findByPlatformAndPlatformPostIdIn(platform, externalPostIds).stream()
                .collect(Collectors.toMap(Content::getPlatformPostId, Function.identity()));
    }

    /** Creates an empty content row for a post, or returns the one that already exists. */
    @Transactional
    public Content createMinimal(String externalPostId, Platform platform) {
        return contentRepository
                .findByPlatformAndPlatformPostId(platform, externalPostId)
                .orElseGet(
                        () -> {
                            log.info("Creating content for {} post {}", platform, externalPostId);
                            return contentRepository.save(
                                    Content.builder()
                                            .platform(platform)
                                            .platformPostId(externalPostId)
                                            .build());
                        });
    }

    /** Creates (if needed) and fills a content row from fetched post details. */
    @Transactional
    public Content createFromPost(Platform platform, Long adAccountId, PlatformPost post) {
        Content content = createMinimal(post.externalId(), platform);
        if (content.getAdAccountId() == null) {
            content.setAdAccountId(adAccountId);
        }
        applyPost(content, post);
        return contentRepository.save(content);
    }

    /** Refreshes counters of known content from a post detail; false when the post is unknown. */
    @Transactional
    public boolean refreshFromPost(Platform platform, PlatformPost post) {
        Optional<Content> content =
                contentRepository.findByPlatformAndPlatformPostId(platform, post.externalId());
        if (content.isEmpty()) {
            return false;
        }
        applyPost(content.get(), post);
        contentRepository.save(content.get());
        return true;
    }

    /**
     * Puts an ad's summary into the bucket of its category, replacing any earlier entry for the
     * same ad in either bucket. GENERAL ads are kept out of both buckets.
     *
     * @return true when a bucket changed
     */
    @Transactional
    public boolean attachAdSummary(Long contentId, AdSummary summary, AdCategory category) {
        Content content =
                contentRepository
                        .findById(contentId)
                        .orElseThrow(() -> new ResourceNotFoundException("Content", contentId));

        List<AdSummary> ace = withSummary(content.getAceDetails(), summary, category == AdCategory.ACE);
        List<AdSummary> abx = withSummary(content.getAbxDetails(), summary, category == AdCategory.ABX);

        boolean changed =
                !ace.equals(nullToEmpty(content.getAceDetails()))
                        || !abx.equals(nullToEmpty(content.getAbxDetails()));
        if (!changed) {
            return false;
        }

        content.setAceDetails(ace);
        content.setAbxDetails(abx);
        content.setAceAdCount(ace.size());
        content.setAbxAdCount(abx.size());
        contentRepository.save(content);
        return true;
    }

    /**
     * Recounts linked ads and fills the product group when unknown. Total spend is only seeded
     * when the content has no figure yet; afterwards the spend job owns it.
     */
    @Transactional
    public void refreshAdAggregates(Long contentId, String productGroup) {
        Content content =
                contentRepository
                        .findById(contentId)
                        .orElseThrow(() -> new ResourceNotFoundException("Content", contentId));

        boolean changed = false;
        int adsCount = (int) adRepository.countByContentId(contentId);
        if (!Objects.equals(content.getAdsCount(), adsCount)) {
            content.setAdsCount(adsCount);
            changed = true;
        }
        if (content.getAdsTotalCost() == null) {
            content.setAdsTotalCost(adRepository.sumSpendByContentId(contentId));
            changed = true;
        }
        if (content.getProductGroup() == null && productGroup != null) {
            content.setProductGroup(productGroup);
            changed = true;
        }
        if (changed) {
            contentRepository.save(content);
        }
    }

    /** Authoritative total spend write, used by the spend job only. */
    @Transactional
    public boolean updateTotalCost(Long contentId, BigDecimal totalCost) {
        Content content =
                contentRepository
                        .findById(contentId)
                        .orElseThrow(() -> new ResourceNotFoundException("Content", contentId));
        if (content.getAdsTotalCost() != null && content.getAdsTotalCost().compareTo(totalCost) == 0) {
            return false;
        }
        content.setAdsTotalCost(totalCost);
        contentRepository.save(content);
        return true;
    }

    private static List<AdSummary> withSummary(
            List<AdSummary> bucket, AdSummary summary, boolean include) {
        List<AdSummary> updated = new ArrayList<>();
        for (AdSummary existing : nullToEmpty(bucket)) {
            if (Objects.equals(existing.getAdId(), summary.getAdId())) {
                if (include) {
                    updated.add(summary);
                }
            } else {
                updated.add(existing);
            }
        }
        if (include && !updated.contains(summary)) {
            updated.add(summary);
        }
        return updated;
    }

    private static List<AdSummary> nullToEmpty(List<AdSummary> list) {
        return list != null ? list : List.of();
    }

    private static void applyPost(Content content, PlatformPost post) {
        if (post.url() != null) content.setUrl(post.url());
        if (post.caption() != null) content.setCaption(post.caption());
        if (post.createdAt() != null) content.setPlatformCreatedAt(post.createdAt());
        content.setViews(post.views());
        content.setReach(post.reach());
        content.setImpressions(post.impressions());
        content.setLikes(post.likes());
        content.setComments(post.comments());
        content.setShares(post.shares());
        content.setSaves(post.saves());
        content.setClicks(post.clicks());
        if (post.durationSeconds() != null) content.setVideoDurationSeconds(post.durationSeconds());
        if (post.avgWatchSeconds() != null) content.setAvgWatchTimeSeconds(post.avgWatchSeconds());
    }
}
