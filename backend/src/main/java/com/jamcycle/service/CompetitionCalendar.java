package com.jamcycle.service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.IsoFields;

/**
 * UTC calendar rules of the weekly competition.
 */
public final class CompetitionCalendar {

    private CompetitionCalendar() {
    }

    public static ZonedDateTime utc(Instant instant) {
        return instant.atZone(ZoneOffset.UTC);
    }

    /**
     * Period identifier of the ISO week containing {@code instant}, e.g. {@code 2026-W07}.
     */
    public static String cycleKeyFor(Instant instant) {
        ZonedDateTime time = utc(instant);
        int isoYear = time.get(IsoFields.WEEK_BASED_YEAR);
        int isoWeek = time.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
        return String.format("%d-W%02d", isoYear, isoWeek);
    }

    /**
     * In bi-weekly mode only odd ISO weeks run a competition.
     */
    public static boolean isCompetitionWeek(Instant instant, boolean biweeklyMode) {
        if (!biweeklyMode) {
            return true;
        }
        return utc(instant).get(IsoFields.WEEK_OF_WEEK_BASED_YEAR) % 2 != 0;
    }

    public static Instant startOfNextDay(Instant instant) {
        LocalDate nextDay = utc(instant).toLocalDate().plusDays(1);
        return nextDay.atStartOfDay(ZoneOffset.UTC).toInstant();
    }
}
