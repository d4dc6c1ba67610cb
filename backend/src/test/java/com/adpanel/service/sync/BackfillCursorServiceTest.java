package com.adpanel.service.sync;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.adpanel.config.AppProperties;
import com.adpanel.dto.platform.DateWindow;
import com.adpanel.entity.AdAccount;
import com.adpanel.entity.Platform;
import com.adpanel.entity.SyncCursor;
import com.adpanel.repository.jpa.SyncCursorRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
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
class BackfillCursorServiceTest {

    private static final LocalDate DAY_1 = LocalDate.of(2024, 3, 1);
    private static final LocalDate DAY_30 = LocalDate.of(2024, 3, 30);

    @Mock private SyncCursorRepository syncCursorRepository;

    private final AtomicReference<SyncCursor> stored = new AtomicReference<>();
    private BackfillCursorService cursorService;
    private AdAccount account;

    @BeforeEach
    void setUp() {
        AppProperties appProperties = new AppProperties();
        appProperties.getSync().getBackfill().setDefaultLookbackDays(30);
        // today is day 31, so yesterday is day 30
        Clock clock = Clock.fixed(Instant.parse("2024-03-31T10:00:00Z"), ZoneOffset.UTC);
        cursorService = new BackfillCursorService(syncCursorRepository, appProperties, clock);
        account = AdAccount.builder().id(1L).platform(Platform.TIKTOK).build();

        when(syncCursorRepository.findByAdAccountIdAndPlatform(1L, Platform.TIKTOK))
                .thenAnswer(inv -> Optional.ofNullable(stored.get()));
        when(syncCursorRepository.save(any(SyncCursor.class)))
                .thenAnswer(
                        inv -> {
                            stored.set(inv.getArgument(0));
                            return inv.getArgument(0);
                        });
    }

    @Test
    @DisplayName("without a cursor the first window starts at the default lookback")
    void nextWindow_firstWindowFromLookback() {
        Optional<DateWindow> window = cursorService.nextWindow(account, 7);

        assertEquals(Optional.of(new DateWindow(DAY_1, LocalDate.of(2024, 3, 7))), window);
    }

    @Test
    @DisplayName("five successful chunks catch up to yesterday, then the account is skipped")
    void nextWindow_catchesUpInFiveRuns() {
        for (int run = 1; run <= 5; run++) {
            DateWindow window = cursorService.nextWindow(account, 7).orElseThrow();
            cursorService.advance(account, window);
        }

        assertEquals(DAY_30, stored.get().getLastCompletedDate());
        assertTrue(cursorService.nextWindow(account, 7).isEmpty());
    }

    @Test
    @DisplayName("the last chunk is cut at yesterday and today is never included")
    void nextWindow_endsAtYesterday() {
        stored.set(cursorAt(DAY_30.minusDays(3)));

        DateWindow window = cursorService.nextWindow(account, 7).orElseThrow();

        assertEquals(LocalDate.of(2024, 3, 28), window.start());
        assertEquals(DAY_30, window.end());
    }

    @Test
    @DisplayName("the account's start date wins over the default lookback")
    void nextWindow_usesAccountStartDate() {
        account.setStartDate(LocalDate.of(2024, 3, 20));

        DateWindow window = cursorService.nextWindow(account, 7).orElseThrow();

        assertEquals(LocalDate.of(2024, 3, 20), window.start());
        assertEquals(LocalDate.of(2024, 3, 26), window.end());
    }

    @Test
    @DisplayName("the cursor never moves backwards")
    void advance_ignoresBackwardMove() {
        stored.set(cursorAt(DAY_30));

        cursorService.advance(account, new DateWindow(DAY_1, LocalDate.of(2024, 3, 7)));

        assertEquals(DAY_30, stored.get().getLastCompletedDate());
        verify(syncCursorRepository, never()).save(any());
    }

    private static SyncCursor cursorAt(LocalDate lastCompleted) {
        return SyncCursor.builder()
                .adAccountId(1L)
                .platform(Platform.TIKTOK)
                .lastCompletedDate(lastCompleted)
                .build();
    }
}
