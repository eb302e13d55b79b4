package com.kidsactivity.ingest.enricher;

import com.kidsactivity.ingest.model.DetailInfo;
import com.kidsactivity.ingest.model.DetailPage;
import com.kidsactivity.ingest.model.ListingLink;
import com.kidsactivity.ingest.model.PrerequisiteInfo;
import com.kidsactivity.ingest.model.SessionInfo;
import com.kidsactivity.ingest.utils.ScheduleFormats;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls structured fields out of a captured detail page. Pure and side-effect free.
 *
 * <p>Sections are located by their headings in the page's rendered text; tables come through
 * as tab-separated lines.
 */
@Component
public class DetailPageParser {

    static final String ABOUT_HEADING = "about this course";
    static final String WHAT_TO_BRING_HEADING = "what to bring";
    static final String PREREQUISITE_HEADING = "prerequisite events";
    static final String COURSE_DATES_HEADING = "course dates";
    static final String FEES_HEADING = "fees";
    static final String INSTRUCTOR_HEADING = "instructor";

    private static final Set<String> HEADINGS = Set.of(
            ABOUT_HEADING, WHAT_TO_BRING_HEADING, PREREQUISITE_HEADING, COURSE_DATES_HEADING, FEES_HEADING,
            INSTRUCTOR_HEADING, "location", "required extras", "restrictions", "course details", "show map");

    private static final Pattern COURSE_ID = Pattern.compile("Course ID[:\\s]*([A-Z0-9-]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern COURSE_ID_PARAM = Pattern.compile("[?&]courseId=([^&#\\s]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern DATE_RANGE = Pattern.compile("(\\d{1,2}/\\d{1,2}/\\d{2,4})\\s*-\\s*(\\d{1,2}/\\d{1,2}/\\d{2,4})");
    private static final Pattern TIME_RANGE = Pattern.compile("(\\d{1,2}:\\d{2}\\s*[AP]M)\\s*-\\s*(\\d{1,2}:\\d{2}\\s*[AP]M)", Pattern.CASE_INSENSITIVE);
    private static final Pattern REGISTRATION_END = Pattern.compile(
            "Registration ends on\\s+(\\d{1,2}/\\d{1,2}/\\d{2,4})(?:\\s+at\\s+(\\d{1,2}:\\d{2}\\s*[AP]M))?", Pattern.CASE_INSENSITIVE);
    private static final Pattern PRICE = Pattern.compile("\\$([0-9,]+(?:\\.\\d{2})?)");
    private static final Pattern TAX = Pattern.compile("\\b(?:tax|gst|pst|hst)\\b[^$\\n]{0,20}\\$([0-9,]+\\.\\d{2})", Pattern.CASE_INSENSITIVE);
    private static final Pattern SPOTS_LEFT = Pattern.compile("(\\d+)\\s*(?:spot\\(s\\)|spots?)\\s*(?:left|remaining|available)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SPOTS_OF_TOTAL = Pattern.compile("(\\d+)\\s*of\\s*(\\d+)\\s*(?:spots|spaces)", Pattern.CASE_INSENSITIVE);
    private static final Pattern CAPACITY = Pattern.compile("\\b(?:capacity|max(?:imum)?\\s+(?:participants|enrolment|enrollment))\\s*:?\\s*(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SESSION_COUNT = Pattern.compile("(\\d+)\\s+sessions?\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern JSON_LATITUDE = Pattern.compile("[\"']Latitude[\"']\\s*:\\s*(-?\\d+\\.\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern JSON_LONGITUDE = Pattern.compile("[\"']Longitude[\"']\\s*:\\s*(-?\\d+\\.\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern JSON_CITY = Pattern.compile("[\"']City[\"']\\s*:\\s*[\"']([^\"']+)[\"']", Pattern.CASE_INSENSITIVE);
    private static final Pattern JSON_POSTAL = Pattern.compile("[\"']PostalCode[\"']\\s*:\\s*[\"']([A-Z]\\d[A-Z]\\s?\\d[A-Z]\\d)", Pattern.CASE_INSENSITIVE);
    private static final Pattern JSON_STREET = Pattern.compile("[\"']Street[\"']\\s*:\\s*[\"']([^\"']+)[\"']", Pattern.CASE_INSENSITIVE);
    private static final Pattern STREET = Pattern.compile(
            "(\\d+\\s+.+?\\b(?:Road|Rd|Street|St|Avenue|Ave|Way|Drive|Dr|Blvd|Boulevard|Lane|Crescent|Cres|Place|Court)\\b\\.?)", Pattern.CASE_INSENSITIVE);
    private static final Pattern POSTAL = Pattern.compile("\\b([A-Z]\\d[A-Z]\\s?\\d[A-Z]\\d)\\b");

    public DetailInfo parse(DetailPage page) {
        String text = page.getBodyText() == null ? "" : page.getBodyText();
        String html = page.getHtml() == null ? "" : page.getHtml();
        List<String> lines = lines(text);

        DetailInfo info = DetailInfo.builder()
                .name(blankToNull(page.getTitle()))
                .courseId(courseId(text, page.getUrl()))
                .instructor(instructor(lines))
                .fullDescription(section(lines, ABOUT_HEADING))
                .whatToBring(section(lines, WHAT_TO_BRING_HEADING))
                .build();

        Matcher m = DATE_RANGE.matcher(text);
        if (m.find()) {
            info.setDateStart(ScheduleFormats.parseNumericDate(m.group(1)));
            info.setDateEnd(ScheduleFormats.parseNumericDate(m.group(2)));
        }
        m = TIME_RANGE.matcher(text);
        if (m.find()) {
            info.setStartTime(ScheduleFormats.normalizeTime(m.group(1)));
            info.setEndTime(ScheduleFormats.normalizeTime(m.group(2)));
        }
        m = REGISTRATION_END.matcher(text);
        if (m.find()) {
            info.setRegistrationEndDate(ScheduleFormats.parseNumericDate(m.group(1)));
            info.setRegistrationEndTime(m.group(2) == null ? null : ScheduleFormats.normalizeTime(m.group(2)));
        }

        parseFees(lines, text, info);
        parseCapacity(text, info);
        parseLocation(page.getVenueLines(), html, info);

        info.setPrerequisites(prerequisites(lines, page.getLinks()));
        if (!info.getPrerequisites().isEmpty()) {
            info.setPrerequisitesText(String.join(", ", info.getPrerequisites().stream().map(PrerequisiteInfo::getName).toList()));
        }

        List<SessionInfo> sessions = sessions(lines, info.getLocationName());
        if (sessions.isEmpty()) {
            m = SESSION_COUNT.matcher(text);
            if (m.find()) {
                info.setCourseDetails(m.group(0) + " total");
            }
            if (info.getDateStart() != null || info.getStartTime() != null) {
                sessions.add(SessionInfo.builder()
                        .sessionNumber(1)
                        .date(info.getDateStart() == null ? null : info.getDateStart().toString())
                        .startTime(info.getStartTime())
                        .endTime(info.getEndTime())
                        .location(info.getLocationName())
                        .instructor(info.getInstructor())
                        .build());
            }
        }
        info.setSessions(sessions);
        return info;
    }

    // ==================== SECTIONS ====================

    private String courseId(String text, String url) {
        Matcher m = COURSE_ID.matcher(text);
        if (m.find()) return m.group(1);
        if (url != null) {
            m = COURSE_ID_PARAM.matcher(url);
            if (m.find()) return m.group(1);
        }
        return null;
    }

    private String instructor(List<String> lines) {
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            String lower = line.toLowerCase(Locale.ROOT);
            if (lower.equals(INSTRUCTOR_HEADING) || lower.equals(INSTRUCTOR_HEADING + ":")) {
                return i + 1 < lines.size() ? lines.get(i + 1) : null;
            }
            if (lower.startsWith(INSTRUCTOR_HEADING + ":")) {
                return blankToNull(line.substring(INSTRUCTOR_HEADING.length() + 1));
            }
        }
        return null;
    }

    /**
     * Lines between the given heading and the next known heading, joined with newlines.
     */
    String section(List<String> lines, String heading) {
        int start = indexOfHeading(lines, heading);
        if (start < 0) return null;

        List<String> body = new ArrayList<>();
        for (int i = start + 1; i < lines.size(); i++) {
            String line = lines.get(i);
            if (isHeading(line)) break;
            if (line.contains("Course ID")) continue;
            body.add(line);
        }
        return body.isEmpty() ? null : String.join("\n", body);
    }

    private List<PrerequisiteInfo> prerequisites(List<String> lines, List<ListingLink> links) {
        List<PrerequisiteInfo> result = new ArrayList<>();
        int start = indexOfHeading(lines, PREREQUISITE_HEADING);
        if (start < 0) return result;

        for (int i = start + 1; i < lines.size(); i++) {
            String name = lines.get(i);
            if (isHeading(name)) break;
            if (name.equalsIgnoreCase("Prerequisite Event(s)")) continue;

            String url = null;
            if (links != null) {
                url = links.stream()
                        .filter(l -> name.equalsIgnoreCase(l.getText() == null ? "" : l.getText().trim()))
                        .map(ListingLink::getHref)
                        .findFirst()
                        .orElse(null);
            }
            String courseId = null;
            if (url != null) {
                Matcher m = COURSE_ID_PARAM.matcher(url);
                courseId = m.find() ? m.group(1) : null;
            }
            result.add(PrerequisiteInfo.builder().name(name).url(url).courseId(courseId).build());
        }
        return result;
    }

    private List<SessionInfo> sessions(List<String> lines, String location) {
        List<SessionInfo> sessions = new ArrayList<>();
        int start = indexOfHeading(lines, COURSE_DATES_HEADING);
        if (start < 0) return sessions;

        for (int i = start + 1; i < lines.size(); i++) {
            String line = lines.get(i);
            if (isHeading(line)) break;
            String[] cells = line.split("\\t");
            if (cells.length < 3) continue;
            // Header row
            if (cells[0].trim().equalsIgnoreCase("day") || cells[1].trim().equalsIgnoreCase("date")) continue;

            SessionInfo session = SessionInfo.builder()
                    .sessionNumber(sessions.size() + 1)
                    .dayOfWeek(blankToNull(cells[0]))
                    .date(blankToNull(cells[1]))
                    .location(cells.length > 3 && !cells[3].isBlank() ? cells[3].trim() : location)
                    .build();
            Matcher m = TIME_RANGE.matcher(cells[2]);
            if (m.find()) {
                session.setStartTime(ScheduleFormats.normalizeTime(m.group(1)));
                session.setEndTime(ScheduleFormats.normalizeTime(m.group(2)));
            }
            sessions.add(session);
        }
        return sessions;
    }

    private void parseFees(List<String> lines, String text, DetailInfo info) {
        int feesAt = indexOfHeading(lines, FEES_HEADING);
        String feeText = feesAt < 0 ? text : String.join("\n", lines.subList(feesAt, lines.size()));

        Matcher m = PRICE.matcher(feeText);
        if (m.find()) {
            info.setCost(money(m.group(1)));
        }
        if (feeText.toLowerCase(Locale.ROOT).contains("plus tax")) {
            info.setCostIncludesTax(false);
        } else if (info.getCost() != null) {
            info.setCostIncludesTax(true);
        }
        m = TAX.matcher(feeText);
        if (m.find()) {
            info.setTaxAmount(money(m.group(1)));
        }
    }

    private void parseCapacity(String text, DetailInfo info) {
        Matcher m = SPOTS_OF_TOTAL.matcher(text);
        if (m.find()) {
            info.setSpotsAvailable(Integer.parseInt(m.group(1)));
            info.setTotalSpots(Integer.parseInt(m.group(2)));
            return;
        }
        m = SPOTS_LEFT.matcher(text);
        if (m.find()) {
            info.setSpotsAvailable(Integer.parseInt(m.group(1)));
        }
        m = CAPACITY.matcher(text);
        if (m.find()) {
            info.setTotalSpots(Integer.parseInt(m.group(1)));
        }
    }

    private void parseLocation(List<String> venueLines, String html, DetailInfo info) {
        List<String> venue = new ArrayList<>();
        if (venueLines != null) {
            for (String block : venueLines) {
                venue.addAll(lines(block));
            }
        }
        if (!venue.isEmpty()) {
            info.setLocationName(venue.get(0));
        }
        String venueText = String.join("\n", venue);

        String street = find(JSON_STREET, html);
        if (street == null) street = find(STREET, venueText);
        String city = find(JSON_CITY, html);
        String postal = find(JSON_POSTAL, html);
        if (postal == null) postal = find(POSTAL, venueText);

        info.setCity(city);
        info.setPostalCode(postal == null ? null : postal.toUpperCase(Locale.ROOT));
        info.setFullAddress(joinAddress(street, city, info.getPostalCode()));

        String lat = find(JSON_LATITUDE, html);
        String lng = find(JSON_LONGITUDE, html);
        if (lat != null && lng != null) {
            info.setLatitude(Double.parseDouble(lat));
            info.setLongitude(Double.parseDouble(lng));
        }
    }

    // ==================== HELPERS ====================

    private static String joinAddress(String street, String city, String postal) {
        StringBuilder sb = new StringBuilder();
        if (street != null) sb.append(street.trim());
        if (city != null) {
            if (sb.length() > 0) sb.append(", ");
            sb.append(city.trim());
        }
        if (postal != null) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(postal);
        }
        return sb.length() == 0 ? null : sb.toString();
    }

    private static int indexOfHeading(List<String> lines, String heading) {
        for (int i = 0; i < lines.size(); i++) {
            if (normalizeHeading(lines.get(i)).equals(heading)) {
                return i;
            }
        }
        return -1;
    }

    private static boolean isHeading(String line) {
        return HEADINGS.contains(normalizeHeading(line)) || line.startsWith("Registration ends on");
    }

    private static String normalizeHeading(String line) {
        return line.toLowerCase(Locale.ROOT).replaceAll("[:\\s]+$", "").trim();
    }

    private static List<String> lines(String text) {
        List<String> lines = new ArrayList<>();
        if (text == null) return lines;
        for (String raw : text.split("\\R")) {
            String line = raw.replaceAll("[ \\u00A0]+", " ").trim();
            if (!line.isEmpty()) {
                lines.add(line);
            }
        }
        return lines;
    }

    private static String find(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        return m.find() ? m.group(1).trim() : null;
    }

    private static BigDecimal money(String raw) {
        return new BigDecimal(raw.replace(",", "")).setScale(2, RoundingMode.HALF_UP);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
