package com.adpanel.service.sync;

import com.adpanel.config.AppProperties;
import com.adpanel.dto.platform.DateWindow;
import com.adpanel.entity.AdAccount;
import com.adpanel.entity.SyncCursor;
import com.adpanel.repository.jpa.SyncCursorRepository;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Per (account, platform) pointer to the last fully processed day. Windows start the day after
 * the pointer and never include today, whose data is still incomplete.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BackfillCursorService {

    private final SyncCursorRepository syncCursorRepository;
    private final AppProperties appProperties;
    private final Clock clock;

    /** Next window to process, or empty when the account is caught up to yesterday. */
    @Transactional(readOnly = true)
    public Optional<DateWindow> nextWindow(AdAccount account, int maxChunkDays) {
        LocalDate yesterday = LocalDate.now(clock).minusDays(1);
        LocalDate start =
                syncCursorRepository
                        .findByAdAccountIdAndPlatform(account.getId(), account.getPlatform())
                        .map(cursor -> cursor.getLastCompletedDate().plusDays(1))
                        .orElseGet(() -> initialStart(account));

        LocalDate end = start.plusDays(maxChunkDays - 1L);
        if (end.isAfter(yesterday)) {
            end = yesterday;
        }
        if (start.isAfter(end)) {
            return Optional.empty();
        }
        return Optional.of(new DateWindow(start, end));
    }

    /** Moves the pointer to the window's end; call only after the window was fully processed. */
    @Transactional
    public void advance(AdAccount account, DateWindow window) {
        SyncCursor cursor =
                syncCursorRepository
                        .findByAdAccountIdAndPlatform(account.getId(), account.getPlatform())
                        .orElseGet(
                                () ->
                                        SyncCursor.builder()
                                                .adAccountId(account.getId())
                                                .platform(account.getPlatform())
                                                .build());

        if (cursor.getLastCompletedDate() != null
                && !window.end().isAfter(cursor.getLastCompletedDate())) {
            log.warn(
                    "Ignoring cursor move of account {} back to {} (at {})",
                    account.getId(),
                    window.end(),
                    cursor.getLastCompletedDate());
            return;
        }
        cursor.setLastCompletedDate(window.end());
        syncCursorRepository.save(cursor);
        log.info("Backfill cursor of account {} advanced to {}", account.getId(), window.end());
    }

    private LocalDate initialStart(AdAccount account) {
        if (account.getStartDate() != null) {
            return account.getStartDate();
        }
        int lookback = appProperties.getSync().getBackfill().getDefaultLookbackDays();
        return LocalDate.now(clock).minusDays(lookback);
    }
}
