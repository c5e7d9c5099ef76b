package com.commandcenter.backend.service.history;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.IsoFields;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** ISO-8601 week keys ({@code 2026-W06}) and their display labels. All dates are taken in UTC. */
final class IsoWeeks {

    static final String UNKNOWN = "Unknown";

    private static final Pattern KEY = Pattern.compile("(\\d{4})-W(\\d{2})");
    private static final DateTimeFormatter MONTH_DAY = DateTimeFormatter.ofPattern("MMM d", Locale.ENGLISH);

    private IsoWeeks() {}

    static String keyOf(LocalDate date) {
        return String.format(Locale.ROOT, "%d-W%02d",
                date.get(IsoFields.WEEK_BASED_YEAR), date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
    }

    static String keyOf(Instant instant) {
        return keyOf(instant.atZone(ZoneOffset.UTC).toLocalDate());
    }

    static Optional<LocalDate> mondayOf(String key) {
        Matcher m = KEY.matcher(key == null ? "" : key);
        if (!m.matches()) return Optional.empty();
        int year = Integer.parseInt(m.group(1));
        int week = Integer.parseInt(m.group(2));
        LocalDate jan4 = LocalDate.of(year, 1, 4);
        LocalDate monday = jan4.with(DayOfWeek.MONDAY).plusWeeks(week - 1L);
        return Optional.of(monday);
    }

    /** "Feb 2 – Feb 8, 2026"; the key itself when it is not a week key. */
    static String label(String key) {
        return mondayOf(key)
                .map(monday -> {
                    LocalDate sunday = monday.plusDays(6);
                    return MONTH_DAY.format(monday) + " – " + MONTH_DAY.format(sunday) + ", " + key.substring(0, 4);
                })
                .orElse(key);
    }
}
