package com.adpanel.service.sync;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.adpanel.dto.platform.PlatformAd;
import com.adpanel.dto.platform.PlatformAdGroup;
import com.adpanel.dto.sync.ReconcileResult;
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
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

/** Runs the reconciler against mocked repositories backed by in-memory maps. */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class EntityReconcilerTest {

    @Mock private CampaignRepository campaignRepository;
    @Mock private AdGroupRepository adGroupRepository;
    @Mock private AdRepository adRepository;

    private final Map<Long, Campaign> campaigns = new LinkedHashMap<>();
    private final Map<Long, AdGroup> adGroups = new LinkedHashMap<>();
    private final Map<Long, Ad> ads = new LinkedHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    private EntityReconciler reconciler;
    private AdAccount account;

    @BeforeEach
    void setUp() {
        reconciler =
                new EntityReconciler(
                        campaignRepository,
                        adGroupRepository,
                        adRepository,
                        new AdClassifier(),
                        new AdNameParser());
        account =
                AdAccount.builder()
                        .id(1L)
                        .platform(Platform.TIKTOK)
                        .externalAccountId("7000000001")
                        .name("Main")
                        .build();

        when(campaignRepository.findByPlatformAndAdAccountIdAndExternalCampaignId(any(), anyLong(), anyString()))
                .thenAnswer(
                        inv ->
                                campaigns.values().stream()
                                        .filter(c -> c.getAdAccount().getId().equals(inv.getArgument(1)))
                                        .filter(c -> c.getExternalCampaignId().equals(inv.getArgument(2)))
                                        .findFirst());
        when(campaignRepository.save(any(Campaign.class)))
                .thenAnswer(
                        inv -> {
                            Campaign c = inv.getArgument(0);
                            if (c.getId() == null) c.setId(sequence.incrementAndGet());
                            campaigns.put(c.getId(), c);
                            return c;
                        });

        when(adGroupRepository.findByPlatformAndCampaignIdAndExternalAdGroupId(any(), anyLong(), anyString()))
                .thenAnswer(
                        inv ->
                                adGroups.values().stream()
                                        .filter(g -> g.getCampaign().getId().equals(inv.getArgument(1)))
                                        .filter(g -> g.getExternalAdGroupId().equals(inv.getArgument(2)))
                                        .findFirst());
        when(adGroupRepository.save(any(AdGroup.class)))
                .thenAnswer(
                        inv -> {
                            AdGroup g = inv.getArgument(0);
                            if (g.getId() == null) g.setId(sequence.incrementAndGet());
                            adGroups.put(g.getId(), g);
                            return g;
                        });

        when(adRepository.findByPlatformAndAdGroupIdAndExternalAdId(any(), anyLong(), anyString()))
                .thenAnswer(
                        inv ->
                                ads.values().stream()
                                        .filter(a -> a.getAdGroup().getId().equals(inv.getArgument(1)))
                                        .filter(a -> a.getExternalAdId().equals(inv.getArgument(2)))
                                        .findFirst());
        when(adRepository.save(any(Ad.class)))
                .thenAnswer(
                        inv -> {
                            Ad a = inv.getArgument(0);
                            if (a.getId() == null) a.setId(sequence.incrementAndGet());
                            ads.put(a.getId(), a);
                            return a;
                        });
    }

    @Test
    @DisplayName("reconciling the same rows twice creates nothing new and changes nothing")
    void reconcile_isIdempotent() {
        // Arrange
        List<PlatformAd> rows = sampleRows();

        // Act
        ReconcileResult first = reconciler.reconcile(account, rows);
        Map<Long, String> namesAfterFirst = snapshotAdNames();
        ReconcileResult second = reconciler.reconcile(account, rows);

        // Assert
        assertEquals(1, first.getCampaignsCreated());
        assertEquals(2, first.getAdGroupsCreated());
        assertEquals(3, first.getAdsCreated());

        assertEquals(0, second.getCampaignsCreated());
        assertEquals(0, second.getAdGroupsCreated());
        assertEquals(0, second.getAdsCreated());
        assertEquals(0, second.getAdsUpdated());
        assertEquals(3, second.getAdsUnchanged());

        assertEquals(1, campaigns.size());
        assertEquals(2, adGroups.size());
        assertEquals(3, ads.size());
        assertEquals(namesAfterFirst, snapshotAdNames());
    }

    @Test
    @DisplayName("ad groups get category, product group and style from their names")
    void reconcile_classifiesAdGroups() {
        // Act
        ReconcileResult result = reconciler.reconcile(account, sampleRows());

        // Assert
        AdGroup abx =
                adGroups.values().stream()
                        .filter(g -> g.getExternalAdGroupId().equals("g-1"))
                        .findFirst()
                        .orElseThrow();
        assertEquals(AdCategory.ABX, abx.getCategory());
        assertEquals("J3", abx.getProductGroup());
        assertEquals("SALE", abx.getGroupStyle());

        assertEquals(AdCategory.ABX, result.getAds().get(0).category());
        assertEquals(AdCategory.GENERAL, result.getAds().get(2).category());
    }

    @Test
    @DisplayName("a changed field updates only the affected ad")
    void reconcile_updatesChangedAd() {
        // Arrange
        reconciler.reconcile(account, sampleRows());
        List<PlatformAd> changed =
                List.of(ad("a-1", "g-1", "[J3]_ABX_VV_SALE#01", "[J3]_ABX_VV_SALE#01 v2", "DISABLE"));

        // Act
        ReconcileResult result = reconciler.reconcile(account, changed);

        // Assert
        assertEquals(1, result.getAdsUpdated());
        Ad updated = result.getAds().get(0).ad();
        assertEquals("[J3]_ABX_VV_SALE#01 v2", updated.getName());
        assertEquals(EntityStatus.PAUSED, updated.getStatus());
        assertEquals(3, ads.size());
    }

    @Test
    @DisplayName("ad group details update known groups only, comparing budgets by value")
    void applyAdGroupDetails_updatesKnownGroups() {
        // Arrange
        reconciler.reconcile(account, sampleRows());
        AdGroup known =
                adGroups.values().stream()
                        .filter(g -> g.getExternalAdGroupId().equals("g-1"))
                        .findFirst()
                        .orElseThrow();
        known.setBudget(new BigDecimal("100"));
        known.setBudgetMode("BUDGET_MODE_DAY");
        known.setOptimizationGoal("CLICK");

        List<PlatformAdGroup> details =
                List.of(
                        new PlatformAdGroup(
                                "g-1", "c-1", null, "ENABLE", "CLICK", "BUDGET_MODE_DAY", new BigDecimal("100.00")),
                        new PlatformAdGroup(
                                "g-2", "c-1", null, "DISABLE", "REACH", "BUDGET_MODE_DAY", new BigDecimal("50")),
                        new PlatformAdGroup("g-404", "c-1", null, "ENABLE", null, null, null));

        // Act
        int updated = reconciler.applyAdGroupDetails(account, details);

        // Assert
        assertEquals(1, updated);
        AdGroup second =
                adGroups.values().stream()
                        .filter(g -> g.getExternalAdGroupId().equals("g-2"))
                        .findFirst()
                        .orElseThrow();
        assertEquals(EntityStatus.PAUSED, second.getStatus());
        assertEquals("REACH", second.getOptimizationGoal());
    }

    private Map<Long, String> snapshotAdNames() {
        Map<Long, String> names = new LinkedHashMap<>();
        ads.forEach((id, ad) -> names.put(id, ad.getName() + "|" + ad.getStatus() + "|" + ad.getCategory()));
        return names;
    }

    private static List<PlatformAd> sampleRows() {
        return List.of(
                ad("a-1", "g-1", "[J3]_ABX_VV_SALE#01", "[J3]_ABX_VV_SALE#01", "ENABLE"),
                ad("a-2", "g-1", "[J3]_ABX_VV_SALE#01", "[J3]_ABX_VV_SALE#01 b", "ENABLE"),
                ad("a-3", "g-2", "Retarget", "Summer Sale", "ENABLE"));
    }

    private static PlatformAd ad(
            String id, String adGroupId, String adGroupName, String name, String status) {
        return new PlatformAd(
                id,
                adGroupId,
                "c-1",
                name,
                adGroupName,
                "J3 March",
                "post-" + id,
                status,
                LocalDateTime.of(2024, 3, 2, 8, 30));
    }
}
