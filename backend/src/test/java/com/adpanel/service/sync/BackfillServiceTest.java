package com.adpanel.service.sync;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.adpanel.client.AdPlatformConnector;
import com.adpanel.config.AppProperties;
import com.adpanel.dto.platform.DateWindow;
import com.adpanel.dto.sync.AccountSyncResult;
import com.adpanel.dto.task.JobReport;
import com.adpanel.entity.AdAccount;
import com.adpanel.entity.AdAccountStatus;
import com.adpanel.entity.Platform;
import com.adpanel.repository.jpa.AdAccountRepository;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
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
class BackfillServiceTest {

    private static final DateWindow WINDOW =
            new DateWindow(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 7));

    @Mock private AdPlatformConnector connector;
    @Mock private AdAccountRepository adAccountRepository;
    @Mock private AdSyncService adSyncService;
    @Mock private BackfillCursorService cursorService;

    private AppProperties appProperties;
    private BackfillService backfillService;
    private AdAccount account;

    @BeforeEach
    void setUp() {
        appProperties = new AppProperties();
        backfillService =
                new BackfillService(
                        List.of(connector), adAccountRepository, adSyncService, cursorService, appProperties);
        account = AdAccount.builder().id(1L).platform(Platform.TIKTOK).externalAccountId("acc-1").build();
        when(connector.platform()).thenReturn(Platform.TIKTOK);
    }

    @Test
    @DisplayName("a failed window leaves the cursor where it was")
    void backfillWindow_failureDoesNotAdvance() {
        // Arrange
        when(adSyncService.syncAccount(account, connector, WINDOW))
                .thenReturn(AccountSyncResult.builder().accountId(1L).window(WINDOW).error("HTTP 500").build());

        // Act
        boolean advanced = backfillService.backfillWindow(account, connector, WINDOW);

        // Assert
        assertFalse(advanced);
        verify(cursorService, never()).advance(any(), any());
    }

    @Test
    @DisplayName("a window without ads still advances the cursor")
    void backfillWindow_zeroRowsAdvances() {
        // Arrange
        when(adSyncService.syncAccount(account, connector, WINDOW))
                .thenReturn(AccountSyncResult.builder().accountId(1L).window(WINDOW).adsFetched(0).build());

        // Act
        boolean advanced = backfillService.backfillWindow(account, connector, WINDOW);

        // Assert
        assertTrue(advanced);
        verify(cursorService).advance(account, WINDOW);
    }

    @Test
    @DisplayName("caught-up accounts are skipped and the per-run account cap is honoured")
    void runBackfill_skipsCaughtUpAndCapsAccounts() {
        // Arrange
        appProperties.getSync().getBackfill().setMaxAccountsPerRun(2);
        AdAccount caughtUp = AdAccount.builder().id(2L).platform(Platform.TIKTOK).build();
        AdAccount second = AdAccount.builder().id(3L).platform(Platform.TIKTOK).build();
        AdAccount third = AdAccount.builder().id(4L).platform(Platform.TIKTOK).build();
        when(adAccountRepository.findByPlatformAndStatusOrderByIdAsc(Platform.TIKTOK, AdAccountStatus.ACTIVE))
                .thenReturn(List.of(account, caughtUp, second, third));
        when(cursorService.nextWindow(any(AdAccount.class), anyInt())).thenReturn(Optional.of(WINDOW));
        when(cursorService.nextWindow(eq(caughtUp), anyInt())).thenReturn(Optional.empty());
        when(adSyncService.syncAccount(any(), eq(connector), eq(WINDOW)))
                .thenReturn(AccountSyncResult.builder().window(WINDOW).build());

        // Act
        JobReport report = backfillService.runBackfill();

        // Assert
        assertEquals(2, report.processed());
        assertEquals(2, report.succeeded());
        verify(adSyncService, never()).syncAccount(eq(third), any(), any());
        verify(cursorService, times(2)).advance(any(), eq(WINDOW));
    }

    @Test
    @DisplayName("an exception in one account does not stop the others")
    void runBackfill_isolatesAccountFailures() {
        // Arrange
        AdAccount other = AdAccount.builder().id(3L).platform(Platform.TIKTOK).build();
        when(adAccountRepository.findByPlatformAndStatusOrderByIdAsc(Platform.TIKTOK, AdAccountStatus.ACTIVE))
                .thenReturn(List.of(account, other));
        when(cursorService.nextWindow(any(AdAccount.class), anyInt())).thenReturn(Optional.of(WINDOW));
        when(adSyncService.syncAccount(eq(account), any(), any())).thenThrow(new IllegalStateException("db down"));
        when(adSyncService.syncAccount(eq(other), any(), any()))
                .thenReturn(AccountSyncResult.builder().window(WINDOW).build());

        // Act
        JobReport report = backfillService.runBackfill();

        // Assert
        assertEquals(2, report.processed());
        assertEquals(1, report.succeeded());
        assertEquals(1, report.failed());
        verify(cursorService).advance(other, WINDOW);
    }
}
