package com.adpanel.dto.platform;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/** Inclusive range of calendar days. */
public record DateWindow(LocalDate start, LocalDate end) {

    public DateWindow {
        if (start == null || end == null || start.isAfter(end)) {
            throw new IllegalArgumentException("Invalid date window: " + start + " .. " + end);
        }
    }

    public static DateWindow lastDays(LocalDate today, int days) {
        return new DateWindow(today.minusDays(days), today);
    }

    public long days() {
        return ChronoUnit.DAYS.between(start, end) + 1;
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
