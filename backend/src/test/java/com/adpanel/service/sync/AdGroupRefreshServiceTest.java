package com.adpanel.service.sync;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.adpanel.client.AdPlatformConnector;
import com.adpanel.dto.platform.EntityKind;
import com.adpanel.dto.platform.FetchResult;
import com.adpanel.dto.platform.PlatformAdGroup;
import com.adpanel.dto.task.JobReport;
import com.adpanel.entity.AdAccount;
import com.adpanel.entity.AdAccountStatus;
import com.adpanel.entity.AdGroup;
import com.adpanel.entity.EntityStatus;
import com.adpanel.entity.Platform;
import com.adpanel.repository.jpa.AdAccountRepository;
import com.adpanel.repository.jpa.AdGroupRepository;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class AdGroupRefreshServiceTest {

    @Mock private AdPlatformConnector connector;
    @Mock private AdAccountRepository adAccountRepository;
    @Mock private AdGroupRepository adGroupRepository;
    @Mock private EntityReconciler entityReconciler;

    private AdGroupRefreshService refreshService;
    private AdAccount first;
    private AdAccount second;

    @BeforeEach
    void setUp() {
        refreshService =
                new AdGroupRefreshService(
                        List.of(connector), adAccountRepository, adGroupRepository, entityReconciler);
        first = AdAccount.builder().id(1L).platform(Platform.TIKTOK).externalAccountId("acc-1").build();
        second = AdAccount.builder().id(2L).platform(Platform.TIKTOK).externalAccountId("acc-2").build();

        when(connector.platform()).thenReturn(Platform.TIKTOK);
        when(adAccountRepository.findByPlatformAndStatusOrderByIdAsc(Platform.TIKTOK, AdAccountStatus.ACTIVE))
                .thenReturn(List.of(first, second));
    }

    @Test
    @DisplayName("active ad groups are re-read by id and applied")
    void refreshActiveAdGroups_appliesDetails() {
        // Arrange
        when(adGroupRepository.findByAccountAndStatus(1L, EntityStatus.ACTIVE))
                .thenReturn(List.of(group("ag-1"), group("ag-2")));
        when(adGroupRepository.findByAccountAndStatus(2L, EntityStatus.ACTIVE)).thenReturn(List.of());
        FetchResult<PlatformAdGroup> details = FetchResult.empty();
        details.add(
                new PlatformAdGroup("ag-1", "c-1", "group", "DISABLE", "REACH", "BUDGET_MODE_DAY", BigDecimal.TEN));
        when(connector.fetchByIds("acc-1", EntityKind.AD_GROUP, List.of("ag-1", "ag-2"))).thenReturn(details);
        when(entityReconciler.applyAdGroupDetails(first, details.getItems())).thenReturn(1);

        // Act
        JobReport report = refreshService.refreshActiveAdGroups();

        // Assert
        assertEquals(2, report.processed());
        assertEquals(2, report.succeeded());
        assertEquals("1 ad groups changed", report.message());
        verify(connector, never()).fetchByIds(eq("acc-2"), any(), anyList());
    }

    @Test
    @DisplayName("a failing account is counted and the next one still runs")
    void refreshActiveAdGroups_isolatesAccounts() {
        // Arrange
        when(adGroupRepository.findByAccountAndStatus(1L, EntityStatus.ACTIVE))
                .thenThrow(new IllegalStateException("db down"));
        when(adGroupRepository.findByAccountAndStatus(2L, EntityStatus.ACTIVE))
                .thenReturn(List.of(group("ag-9")));
        FetchResult<PlatformAdGroup> details = FetchResult.empty();
        details.fail("HTTP 500", null);
        when(connector.fetchByIds("acc-2", EntityKind.AD_GROUP, List.of("ag-9"))).thenReturn(details);

        // Act
        JobReport report = refreshService.refreshActiveAdGroups();

        // Assert
        assertEquals(2, report.processed());
        assertEquals(0, report.succeeded());
        assertEquals(2, report.failed());
        verify(entityReconciler).applyAdGroupDetails(second, List.of());
    }

    private static AdGroup group(String externalId) {
        return AdGroup.builder().externalAdGroupId(externalId).name(externalId).build();
    }
}
