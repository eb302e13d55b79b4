package com.kidsactivity.ingest.utils;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonical text forms for times and the numeric US date style the provider prints.
 */
public final class ScheduleFormats {

    private static final Pattern TIME = Pattern.compile("(\\d{1,2})(?::(\\d{2}))?\\s*([ap])\\.?\\s?m\\.?", Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMERIC_DATE = Pattern.compile("(\\d{1,2})/(\\d{1,2})/(\\d{2}|\\d{4})");

    private ScheduleFormats() {
    }

    /** "10", "00", "a" → "10:00 AM". */
    public static String formatTime(String hour, String minute, String meridiem) {
        int h = Integer.parseInt(hour);
        String mm = minute == null ? "00" : minute;
        return h + ":" + mm + " " + meridiem.toUpperCase(Locale.ROOT) + "M";
    }

    /** "10:00am", "10 a.m." → "10:00 AM"; anything else comes back trimmed. */
    public static String normalizeTime(String raw) {
        if (raw == null) return null;
        Matcher m = TIME.matcher(raw.trim());
        return m.matches() ? formatTime(m.group(1), m.group(2), m.group(3)) : raw.trim();
    }

    /**
     * MM/DD/YY or MM/DD/YYYY. Two-digit years are 20YY.
     *
     * @return null when the text is not a valid date
     */
    public static LocalDate parseNumericDate(String raw) {
        if (raw == null) return null;
        Matcher m = NUMERIC_DATE.matcher(raw.trim());
        if (!m.matches()) return null;
        try {
            return LocalDate.of(year(m.group(3)), Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
        } catch (DateTimeException e) {
            return null;
        }
    }

    public static int year(String yy) {
        int y = Integer.parseInt(yy);
        return yy.length() == 2 ? 2000 + y : y;
    }
}
