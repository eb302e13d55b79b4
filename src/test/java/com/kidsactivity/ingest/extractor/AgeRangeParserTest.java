package com.kidsactivity.ingest.extractor;

import com.kidsactivity.ingest.model.AgeRange;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class AgeRangeParserTest {

    private final AgeRangeParser parser = new AgeRangeParser();

    static Stream<Arguments> ranges() {
        return Stream.of(
                Arguments.of("Ages 3-5 yrs", 3, 5),
                Arguments.of("3 – 5 years", 3, 5),
                Arguments.of("6 to 12 yrs", 6, 12),
                Arguments.of("12-8 yrs", 8, 12),
                Arguments.of("Ages 4-6", 4, 6),
                Arguments.of("18-36 mos", 1, 3),
                Arguments.of("6-18 months", 0, 2),
                Arguments.of("6 mos - 5 yrs", 0, 5),
                Arguments.of("13+ yrs", 13, null),
                Arguments.of("Ages 16+", 16, null),
                Arguments.of("8 yrs & up", 8, null),
                Arguments.of("19 and over", 19, null)
        );
    }

    @ParameterizedTest(name = "{0} -> {1}..{2}")
    @MethodSource("ranges")
    void parse_supportedForms(String text, Integer min, Integer max) {
        assertThat(parser.parse(text)).contains(new AgeRange(min, max));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "Adult drop-in", "Level 2"})
    void parse_noAgeInformation_returnsEmpty(String text) {
        assertThat(parser.parse(text)).isEmpty();
    }

    @Test
    void parse_monthRangeBeforeYearRange_inSameText() {
        assertThat(parser.parse("Parent & Tot 18-36 mos (siblings 3-5 yrs welcome)")).contains(new AgeRange(1, 3));
    }
}
