package com.kidsactivity.ingest.extractor;

import com.kidsactivity.ingest.model.AgeRange;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads an age range out of free text. Month ranges become whole years: the lower bound
 * rounds down and the upper bound rounds up, so "18-36 mos" is 1 to 3.
 */
@Component
public class AgeRangeParser {

    private static final String DASH = "\\s*(?:-|–|—|to)\\s*";
    private static final String YEARS = "\\s*(?:yrs?|years?)\\b";
    private static final String MONTHS = "\\s*(?:mos?|months?)\\b";

    private static final Pattern MIXED = Pattern.compile("(\\d{1,3})" + MONTHS + DASH + "(\\d{1,2})" + YEARS, Pattern.CASE_INSENSITIVE);
    private static final Pattern MONTH_RANGE = Pattern.compile("(\\d{1,3})" + DASH + "(\\d{1,3})" + MONTHS, Pattern.CASE_INSENSITIVE);
    private static final Pattern YEAR_RANGE = Pattern.compile("(\\d{1,2})" + DASH + "(\\d{1,2})" + YEARS, Pattern.CASE_INSENSITIVE);
    private static final Pattern LABELLED_RANGE = Pattern.compile("\\bages?\\s*:?\\s*(\\d{1,2})" + DASH + "(\\d{1,2})\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern PLUS = Pattern.compile("(\\d{1,2})\\s*\\+\\s*(?:yrs?|years?)\\b|\\bages?\\s*:?\\s*(\\d{1,2})\\s*\\+", Pattern.CASE_INSENSITIVE);
    private static final Pattern AND_UP = Pattern.compile("(\\d{1,2})(?:" + YEARS + ")?\\s*(?:&|and)\\s*(?:up|over|older)\\b", Pattern.CASE_INSENSITIVE);

    public Optional<AgeRange> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }

        Matcher m = MIXED.matcher(text);
        if (m.find()) {
            return Optional.of(new AgeRange(monthsFloor(m.group(1)), Integer.parseInt(m.group(2))));
        }

        m = MONTH_RANGE.matcher(text);
        if (m.find()) {
            return Optional.of(new AgeRange(monthsFloor(m.group(1)), monthsCeil(m.group(2))));
        }

        m = YEAR_RANGE.matcher(text);
        if (m.find()) {
            return Optional.of(ordered(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2))));
        }

        m = LABELLED_RANGE.matcher(text);
        if (m.find()) {
            return Optional.of(ordered(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2))));
        }

        m = PLUS.matcher(text);
        if (m.find()) {
            String min = m.group(1) != null ? m.group(1) : m.group(2);
            return Optional.of(AgeRange.atLeast(Integer.parseInt(min)));
        }

        m = AND_UP.matcher(text);
        if (m.find()) {
            return Optional.of(AgeRange.atLeast(Integer.parseInt(m.group(1))));
        }

        return Optional.empty();
    }

    private static AgeRange ordered(int a, int b) {
        return a <= b ? new AgeRange(a, b) : new AgeRange(b, a);
    }

    private static int monthsFloor(String months) {
        return Integer.parseInt(months) / 12;
    }

    private static int monthsCeil(String months) {
        int m = Integer.parseInt(months);
        return (m + 11) / 12;
    }
}
