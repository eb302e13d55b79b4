package com.kidsactivity.ingest.extractor;

import com.kidsactivity.ingest.enums.RegistrationStatus;
import com.kidsactivity.ingest.model.ActivityCandidate;
import com.kidsactivity.ingest.model.AgeRange;
import com.kidsactivity.ingest.model.ListingLink;
import com.kidsactivity.ingest.model.RawListing;
import com.kidsactivity.ingest.utils.ScheduleFormats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a harvested listing entry into an {@link ActivityCandidate}.
 *
 * <p>Pure: the output depends only on the entry and the injected clock (used to infer the year
 * of dates that omit it).
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FieldExtractor {

    private static final String MONTHS = "Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Sept|Oct|Nov|Dec";

    private static final Pattern NAMED_DATE_RANGE = Pattern.compile(
            "\\b(" + MONTHS + ")[a-z]*\\.?\\s+(\\d{1,2})(?:,?\\s+(\\d{4}))?\\s*(?:-|–|to)\\s*(" + MONTHS + ")[a-z]*\\.?\\s+(\\d{1,2})(?:,?\\s+(\\d{4}))?\\b");
    private static final Pattern NUMERIC_DATE_RANGE = Pattern.compile(
            "\\b(\\d{1,2})/(\\d{1,2})/(\\d{2}|\\d{4})\\s*(?:-|–|to)\\s*(\\d{1,2})/(\\d{1,2})/(\\d{2}|\\d{4})\\b");

    private static final Pattern TIME_RANGE = Pattern.compile(
            "\\b(\\d{1,2})(?::(\\d{2}))?\\s*([ap])\\.?\\s?m\\.?\\s*(?:-|–|to)\\s*(\\d{1,2})(?::(\\d{2}))?\\s*([ap])\\.?\\s?m\\.?",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern DAY_TOKEN = Pattern.compile(
            "\\b(Mon|Tue|Wed|Thu|Fri|Sat|Sun)(?:day|sday|nesday|rsday|rs|r|s|urday)?s?\\b(?:\\s*(?:-|–|to)\\s*\\b(Mon|Tue|Wed|Thu|Fri|Sat|Sun)(?:day|sday|nesday|rsday|rs|r|s|urday)?s?\\b)?");

    private static final Pattern PRICE = Pattern.compile("\\$\\s?([0-9,]+(?:\\.\\d{2})?)");
    private static final Pattern PLUS_TAX = Pattern.compile("\\b(?:plus|\\+)\\s*(?:tax|gst|hst|pst)\\b", Pattern.CASE_INSENSITIVE);

    private static final List<Pattern> SPOTS_PATTERNS = List.of(
            Pattern.compile("Sign\\s*Up\\s*\\((\\d+)\\)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(\\d+)\\s*spot\\(s\\)\\s*(?:left|available|remaining)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(\\d+)\\s*spots?\\s*(?:left|available|remaining)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\((\\d+)\\s*(?:spot|seat)s?\\)", Pattern.CASE_INSENSITIVE)
    );

    private static final Pattern WAITLIST = Pattern.compile("\\bwait\\s*-?\\s*list", Pattern.CASE_INSENSITIVE);
    private static final Pattern FULL = Pattern.compile("\\b(?:full|closed)\\b(?![\\s-]*day)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SIGN_UP = Pattern.compile("\\bsign\\s*up\\b", Pattern.CASE_INSENSITIVE);

    private static final List<String> VENUE_KEYWORDS =
            List.of("Centre", "Center", "Park", "Arena", "Pool", "Field", "Gym", "Studio", "Complex");
    private static final Pattern BOOKING_LINK = Pattern.compile("BookMe4|courseId|register|enroll", Pattern.CASE_INSENSITIVE);
    private static final Pattern HASH_ID = Pattern.compile("#\\s?\\d{4,}");

    private static final int MAX_LOCATION_LENGTH = 100;
    private static final int MAX_RAW_TEXT_LENGTH = 2000;
    /** A start date this far behind today is read as next year's session. */
    private static final int STALE_START_DAYS = 180;

    private final ExternalIdExtractor externalIdExtractor;
    private final AgeRangeParser ageRangeParser;
    private final Clock clock;

    public Optional<ActivityCandidate> extract(RawListing listing) {
        String text = listing.getText() == null ? "" : listing.getText();

        Optional<String> externalId = externalIdExtractor.extract(listing);
        if (externalId.isEmpty()) {
            log.debug("Discarding entry without identifier: {}", abbreviate(text, 80));
            return Optional.empty();
        }

        String registrationUrl = pickRegistrationUrl(listing.getLinks());
        List<String> days = extractDays(text);
        String[] times = extractTimes(text);
        LocalDate[] dates = extractDates(text);
        Optional<AgeRange> age = ageRangeParser.parse(text);

        ActivityCandidate candidate = ActivityCandidate.builder()
                .externalId(externalId.get())
                .name(extractName(listing))
                .category(listing.getCategory())
                .subcategory(listing.getSubcategory())
                .daysOfWeek(days)
                .startTime(times[0])
                .endTime(times[1])
                .schedule(buildSchedule(days, times))
                .dateStart(dates[0])
                .dateEnd(dates[1])
                .ageMin(age.map(AgeRange::min).orElse(null))
                .ageMax(age.map(AgeRange::max).orElse(null))
                .cost(extractCost(text))
                .costIncludesTax(!PLUS_TAX.matcher(text).find())
                .spotsAvailable(extractSpots(text))
                .registrationStatus(extractStatus(text, registrationUrl))
                .locationName(extractLocation(text))
                .registrationUrl(registrationUrl)
                .rawSnapshot(snapshot(listing))
                .build();

        return Optional.of(candidate);
    }

    // ==================== NAME ====================

    String extractName(RawListing listing) {
        if (listing.getNameText() != null && !listing.getNameText().isBlank()) {
            return collapse(listing.getNameText());
        }
        String text = listing.getText() == null ? "" : listing.getText();
        for (String line : text.split("\\R")) {
            String cleaned = collapse(HASH_ID.matcher(line).replaceAll(""));
            if (!cleaned.isEmpty()) {
                return cleaned;
            }
        }
        return listing.getSubcategory() != null ? listing.getSubcategory() : "Untitled activity";
    }

    // ==================== SCHEDULE ====================

    List<String> extractDays(String text) {
        Set<DayOfWeek> found = EnumSet.noneOf(DayOfWeek.class);
        Matcher m = DAY_TOKEN.matcher(text);
        while (m.find()) {
            DayOfWeek from = dayOf(m.group(1));
            if (m.group(2) == null) {
                found.add(from);
                continue;
            }
            DayOfWeek to = dayOf(m.group(2));
            DayOfWeek d = from;
            found.add(d);
            while (d != to) {
                d = d.plus(1);
                found.add(d);
            }
        }
        List<String> days = new ArrayList<>(found.size());
        for (DayOfWeek d : found) {
            days.add(d.getDisplayName(TextStyle.FULL, Locale.ENGLISH));
        }
        return days;
    }

    String[] extractTimes(String text) {
        Matcher m = TIME_RANGE.matcher(text);
        if (!m.find()) {
            return new String[]{null, null};
        }
        return new String[]{
                ScheduleFormats.formatTime(m.group(1), m.group(2), m.group(3)),
                ScheduleFormats.formatTime(m.group(4), m.group(5), m.group(6))
        };
    }

    private String buildSchedule(List<String> days, String[] times) {
        StringBuilder sb = new StringBuilder(String.join(", ", days));
        if (times[0] != null) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(times[0]).append(" - ").append(times[1]);
        }
        return sb.length() == 0 ? null : sb.toString();
    }

    /**
     * Dates without a year take the clock's year, except that a start more than
     * {@value #STALE_START_DAYS} days back moves to next year, and a range that placed in the
     * previous year is still running today keeps that previous year.
     */
    LocalDate[] extractDates(String text) {
        LocalDate today = LocalDate.now(clock);
        try {
            Matcher m = NAMED_DATE_RANGE.matcher(text);
            if (m.find()) {
                if (m.group(3) != null) {
                    return namedRange(m, Integer.parseInt(m.group(3)));
                }
                LocalDate[] range = namedRange(m, today.getYear());
                if (range[0].isBefore(today.minusDays(STALE_START_DAYS))) {
                    return namedRange(m, today.getYear() + 1);
                }
                LocalDate[] previous = previousYearRange(m, today.getYear() - 1);
                if (previous != null && !previous[1].isBefore(today)) {
                    return previous;
                }
                return range;
            }

            m = NUMERIC_DATE_RANGE.matcher(text);
            if (m.find()) {
                LocalDate start = LocalDate.of(ScheduleFormats.year(m.group(3)), Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
                LocalDate end = LocalDate.of(ScheduleFormats.year(m.group(6)), Integer.parseInt(m.group(4)), Integer.parseInt(m.group(5)));
                return rollEnd(start, end);
            }
        } catch (DateTimeException e) {
            log.debug("Unparseable date range in '{}': {}", abbreviate(text, 80), e.getMessage());
        }
        return new LocalDate[]{null, null};
    }

    private static LocalDate[] namedRange(Matcher m, int startYear) {
        LocalDate start = LocalDate.of(startYear, monthOf(m.group(1)), Integer.parseInt(m.group(2)));
        int endYear = m.group(6) != null ? Integer.parseInt(m.group(6)) : startYear;
        LocalDate end = LocalDate.of(endYear, monthOf(m.group(4)), Integer.parseInt(m.group(5)));
        return rollEnd(start, end);
    }

    // Feb 29 has no counterpart in most previous years
    private static LocalDate[] previousYearRange(Matcher m, int startYear) {
        try {
            return namedRange(m, startYear);
        } catch (DateTimeException e) {
            return null;
        }
    }

    private static LocalDate[] rollEnd(LocalDate start, LocalDate end) {
        while (end.isBefore(start)) {
            end = end.plusYears(1);
        }
        return new LocalDate[]{start, end};
    }

    // ==================== PRICE / CAPACITY / STATUS ====================

    BigDecimal extractCost(String text) {
        Matcher m = PRICE.matcher(text);
        if (!m.find()) {
            return null;
        }
        return new BigDecimal(m.group(1).replace(",", "")).setScale(2, RoundingMode.HALF_UP);
    }

    Integer extractSpots(String text) {
        for (Pattern pattern : SPOTS_PATTERNS) {
            Matcher m = pattern.matcher(text);
            if (m.find()) {
                return Integer.parseInt(m.group(1));
            }
        }
        return null;
    }

    RegistrationStatus extractStatus(String text, String registrationUrl) {
        if (WAITLIST.matcher(text).find()) return RegistrationStatus.WAITLIST;
        if (FULL.matcher(text).find()) return RegistrationStatus.FULL;
        if (SIGN_UP.matcher(text).find()) return RegistrationStatus.OPEN;
        if (registrationUrl != null && BOOKING_LINK.matcher(registrationUrl).find()) return RegistrationStatus.OPEN;
        return RegistrationStatus.UNKNOWN;
    }

    // ==================== LOCATION / LINKS ====================

    String extractLocation(String text) {
        for (String keyword : VENUE_KEYWORDS) {
            Matcher m = Pattern.compile("([^,\\n]*\\b" + keyword + "\\b[^,\\n]*)", Pattern.CASE_INSENSITIVE).matcher(text);
            if (m.find()) {
                return abbreviate(collapse(m.group(1)), MAX_LOCATION_LENGTH);
            }
        }
        return null;
    }

    String pickRegistrationUrl(List<ListingLink> links) {
        if (links == null || links.isEmpty()) {
            return null;
        }
        for (ListingLink link : links) {
            if (link.getHref() != null && BOOKING_LINK.matcher(link.getHref()).find()) {
                return link.getHref();
            }
        }
        return links.get(0).getHref();
    }

    private Map<String, Object> snapshot(RawListing listing) {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("category", listing.getCategory());
        raw.put("subcategory", listing.getSubcategory());
        raw.put("nameText", listing.getNameText());
        raw.put("idElementText", listing.getIdElementText());
        raw.put("text", abbreviate(listing.getText(), MAX_RAW_TEXT_LENGTH));
        List<Map<String, String>> links = new ArrayList<>();
        if (listing.getLinks() != null) {
            for (ListingLink link : listing.getLinks()) {
                Map<String, String> l = new LinkedHashMap<>();
                l.put("text", link.getText());
                l.put("href", link.getHref());
                links.add(l);
            }
        }
        raw.put("links", links);
        return raw;
    }

    // ==================== HELPERS ====================

    private static DayOfWeek dayOf(String abbrev) {
        switch (abbrev) {
            case "Mon": return DayOfWeek.MONDAY;
            case "Tue": return DayOfWeek.TUESDAY;
            case "Wed": return DayOfWeek.WEDNESDAY;
            case "Thu": return DayOfWeek.THURSDAY;
            case "Fri": return DayOfWeek.FRIDAY;
            case "Sat": return DayOfWeek.SATURDAY;
            case "Sun": return DayOfWeek.SUNDAY;
            default: throw new IllegalArgumentException("Unknown day token: " + abbrev);
        }
    }

    private static Month monthOf(String token) {
        String prefix = token.substring(0, 3).toUpperCase(Locale.ROOT);
        for (Month month : Month.values()) {
            if (month.name().startsWith(prefix)) {
                return month;
            }
        }
        throw new DateTimeException("Unknown month token: " + token);
    }

    private static String collapse(String s) {
        return s == null ? "" : s.replaceAll("\\s+", " ").trim();
    }

    private static String abbreviate(String s, int max) {
        if (s == null) return null;
        return s.length() <= max ? s : s.substring(0, max);
    }
}
