package com.adpanel.service.sync;

import com.adpanel.dto.platform.PlatformAd;
import com.adpanel.dto.platform.PlatformAdGroup;
import com.adpanel.dto.platform.PlatformCampaign;
import com.adpanel.dto.sync.ReconcileResult;
import com.adpanel.dto.sync.ReconciledAd;
import com.adpanel.entity.Ad;
import com.adpanel.entity.AdAccount;
import com.adpanel.entity.AdCategory;
import com.adpanel.entity.AdGroup;
import com.adpanel.entity.Campaign;
import com.adpanel.entity.EntityStatus;
import com.adpanel.entity.Platform;
import com.adpanel.repository.jpa.AdGroupRepository;
import com.adpanel.repository.jpa.AdRepository;
import com.adpanel.repository.jpa.CampaignRepository;
import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Merges fetched ads into Campaign, AdGroup and Ad rows keyed by (platform, parent, external id).
 * A field is written only when its value differs, so reconciling the same rows again changes
 * nothing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EntityReconciler {

    private final CampaignRepository campaignRepository;
    private final AdGroupRepository adGroupRepository;
    private final AdRepository adRepository;
    private final AdClassifier adClassifier;
    private final AdNameParser adNameParser;

    /**
     * Resolves or creates campaign, ad group and ad for every row in a single transaction, so an
     * ad is never committed without its parents.
     */
    @Transactional
    public ReconcileResult reconcile(AdAccount account, List<PlatformAd> rows) {
        ReconcileResult result = new ReconcileResult();
        Map<String, Campaign> campaigns = new HashMap<>();
        Map<String, AdGroup> adGroups = new HashMap<>();

        for (PlatformAd row : rows) {
            Campaign campaign =
                    campaigns.computeIfAbsent(
                            row.campaignId(), id -> resolveCampaign(account, row, result));
            AdGroup adGroup =
                    adGroups.computeIfAbsent(
                            row.campaignId() + "/" + row.adGroupId(),
                            key -> resolveAdGroup(campaign, row, result));

            AdCategory category =
                    adClassifier.classify(row.name(), row.campaignName(), row.adGroupName());
            Ad ad = resolveAd(adGroup, row, category, result);
            result.getAds().add(new ReconciledAd(ad, row, category));
        }

        log.info(
                "Reconciled {} ads for account {}: campaigns +{}/~{}, ad groups +{}/~{}, ads"
                        + " +{}/~{}/={}",
                rows.size(),
                account.getId(),
                result.getCampaignsCreated(),
                result.getCampaignsUpdated(),
                result.getAdGroupsCreated(),
                result.getAdGroupsUpdated(),
                result.getAdsCreated(),
                result.getAdsUpdated(),
                result.getAdsUnchanged());
        return result;
    }

    /** Refreshes objective, budget and status of known campaigns. Unknown ids are ignored. */
    @Transactional
    public int applyCampaignDetails(AdAccount account, List<PlatformCampaign> details) {
        int updated = 0;
        for (PlatformCampaign detail : details) {
            Campaign campaign =
                    campaignRepository
                            .findByPlatformAndAdAccountIdAndExternalCampaignId(
                                    account.getPlatform(), account.getId(), detail.externalId())
                            .orElse(null);
            if (campaign == null) {
                continue;
            }
            boolean changed = false;
            changed |= setIfChanged(campaign.getObjective(), detail.objective(), campaign::setObjective);
            changed |= setIfChanged(campaign.getBudgetMode(), detail.budgetMode(), campaign::setBudgetMode);
            changed |= setIfChanged(campaign.getBudget(), detail.budget(), campaign::setBudget);
            changed |=
                    setIfChanged(
                            campaign.getStatus(),
                            EntityStatus.fromPlatformStatus(detail.status()),
                            campaign::setStatus);
            if (changed) {
                campaignRepository.save(campaign);
                updated++;
            }
        }
        return updated;
    }

    /** Refreshes optimization goal, budget and status of known ad groups. */
    @Transactional
    public int applyAdGroupDetails(AdAccount account, List<PlatformAdGroup> details) {
        int updated = 0;
        for (PlatformAdGroup detail : details) {
            AdGroup adGroup = findAdGroup(account, detail.campaignId(), detail.externalId());
            if (adGroup == null) {
                continue;
            }
            boolean changed = false;
            changed |=
                    setIfChanged(
                            adGroup.getOptimizationGoal(),
                            detail.optimizationGoal(),
                            adGroup::setOptimizationGoal);
            changed |= setIfChanged(adGroup.getBudgetMode(), detail.budgetMode(), adGroup::setBudgetMode);
            changed |= setIfChanged(adGroup.getBudget(), detail.budget(), adGroup::setBudget);
            changed |=
                    setIfChanged(
                            adGroup.getStatus(),
                            EntityStatus.fromPlatformStatus(detail.status()),
                            adGroup::setStatus);
            if (changed) {
                adGroupRepository.save(adGroup);
                updated++;
            }
        }
        return updated;
    }

    private AdGroup findAdGroup(AdAccount account, String campaignId, String adGroupId) {
        return campaignRepository
                .findByPlatformAndAdAccountIdAndExternalCampaignId(
                        account.getPlatform(), account.getId(), campaignId)
                .flatMap(
                        campaign ->
                                adGroupRepository.findByPlatformAndCampaignIdAndExternalAdGroupId(
                                        account.getPlatform(), campaign.getId(), adGroupId))
                .orElse(null);
    }

    private Campaign resolveCampaign(AdAccount account, PlatformAd row, ReconcileResult result) {
        Platform platform = account.getPlatform();
        String name = nameOrDefault(row.campaignName(), "Campaign " + row.campaignId());
        Campaign existing =
                campaignRepository
                        .findByPlatformAndAdAccountIdAndExternalCampaignId(
                                platform, account.getId(), row.campaignId())
                        .orElse(null);

        if (existing == null) {
            result.setCampaignsCreated(result.getCampaignsCreated() + 1);
            return campaignRepository.save(
                    Campaign.builder()
                            .platform(platform)
                            .adAccount(account)
                            .externalCampaignId(row.campaignId())
                            .name(name)
                            .build());
        }

        // A missing name in the row never overwrites a known one
        if (row.campaignName() != null && setIfChanged(existing.getName(), name, existing::setName)) {
            result.setCampaignsUpdated(result.getCampaignsUpdated() + 1);
            return campaignRepository.save(existing);
        }
        return existing;
    }

    private AdGroup resolveAdGroup(Campaign campaign, PlatformAd row, ReconcileResult result) {
        String name = nameOrDefault(row.adGroupName(), "AdGroup " + row.adGroupId());
        AdCategory category = adClassifier.classify(row.adGroupName(), row.campaignName());
        String productGroup = adNameParser.firstProductGroup(row.adGroupName(), row.campaignName());
        String style = adNameParser.groupStyle(row.adGroupName());

        AdGroup existing =
                adGroupRepository
                        .findByPlatformAndCampaignIdAndExternalAdGroupId(
                                campaign.getPlatform(), campaign.getId(), row.adGroupId())
                        .orElse(null);

        if (existing == null) {
            result.setAdGroupsCreated(result.getAdGroupsCreated() + 1);
            return adGroupRepository.save(
                    AdGroup.builder()
                            .platform(campaign.getPlatform())
                            .campaign(campaign)
                            .externalAdGroupId(row.adGroupId())
                            .name(name)
                            .category(category)
                            .productGroup(productGroup)
                            .groupStyle(style)
                            .build());
        }

        if (row.adGroupName() == null) {
            return existing;
        }
        boolean changed = false;
        changed |= setIfChanged(existing.getName(), name, existing::setName);
        changed |= setIfChanged(existing.getCategory(), category, existing::setCategory);
        if (productGroup != null) {
            changed |= setIfChanged(existing.getProductGroup(), productGroup, existing::setProductGroup);
        }
        if (style != null) {
            changed |= setIfChanged(existing.getGroupStyle(), style, existing::setGroupStyle);
        }
        if (changed) {
            result.setAdGroupsUpdated(result.getAdGroupsUpdated() + 1);
            return adGroupRepository.save(existing);
        }
        return existing;
    }

    private Ad resolveAd(
            AdGroup adGroup, PlatformAd row, AdCategory category, ReconcileResult result) {
        String name = nameOrDefault(row.name(), "Ad " + row.externalId());
        EntityStatus status = EntityStatus.fromPlatformStatus(row.status());
        String postId = row.hasPost() ? row.postId() : null;

        Ad existing =
                adRepository
                        .findByPlatformAndAdGroupIdAndExternalAdId(
                                adGroup.getPlatform(), adGroup.getId(), row.externalId())
                        .orElse(null);

        if (existing == null) {
            result.setAdsCreated(result.getAdsCreated() + 1);
            return adRepository.save(
                    Ad.builder()
                            .platform(adGroup.getPlatform())
                            .adGroup(adGroup)
                            .externalAdId(row.externalId())
                            .name(name)
                            .status(status)
                            .category(category)
                            .platformPostId(postId)
                            .platformCreatedAt(row.createdAt())
                            .build());
        }

        boolean changed = false;
        changed |= setIfChanged(existing.getName(), name, existing::setName);
        changed |= setIfChanged(existing.getStatus(), status, existing::setStatus);
        changed |= setIfChanged(existing.getCategory(), category, existing::setCategory);
        if (postId != null) {
            changed |= setIfChanged(existing.getPlatformPostId(), postId, existing::setPlatformPostId);
        }
        if (row.createdAt() != null) {
            changed |=
                    setIfChanged(
                            existing.getPlatformCreatedAt(),
                            row.createdAt(),
                            existing::setPlatformCreatedAt);
        }

        if (changed) {
            result.setAdsUpdated(result.getAdsUpdated() + 1);
            return adRepository.save(existing);
        }
        result.setAdsUnchanged(result.getAdsUnchanged() + 1);
        return existing;
    }

    private static String nameOrDefault(String name, String fallback) {
        if (name == null || name.isBlank()) {
            return fallback;
        }
        return name.length() > 255 ? name.substring(0, 255) : name;
    }

    /** Writes the value only when it differs; decimals compare by value, not scale. */
    private static <T> boolean setIfChanged(
            T current, T value, Consumer<T> setter) {
        boolean same =
                current instanceof BigDecimal && value instanceof BigDecimal
                        ? ((BigDecimal) current).compareTo((BigDecimal) value) == 0
                        : Objects.equals(current, value);
        if (same) {
            return false;
        }
        setter.accept(value);
        return true;
    }
}
