package com.kidsactivity.ingest.extractor;

import com.kidsactivity.ingest.model.ListingLink;
import com.kidsactivity.ingest.model.RawListing;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExternalIdExtractorTest {

    private final ExternalIdExtractor extractor = new ExternalIdExtractor();

    @Test
    void extract_idElement_winsOverTextAndLink() {
        RawListing raw = RawListing.builder()
                .idElementText(" #98765 ")
                .text("Pottery #111111")
                .links(List.of(new ListingLink("Register", "https://x/BookMe4?courseId=222222")))
                .build();

        assertThat(extractor.extract(raw)).contains("98765");
    }

    @Test
    void extract_unusableIdElement_fallsBackToHashToken() {
        RawListing raw = RawListing.builder()
                .idElementText("Course ID: n/a")
                .text("Pottery # 111111 Wed")
                .build();

        assertThat(extractor.extract(raw)).contains("111111");
    }

    @Test
    void extract_shortHashToken_isNotAnIdentifier() {
        RawListing raw = RawListing.builder().text("Room #12").build();

        assertThat(extractor.extract(raw)).isEmpty();
    }

    @Test
    void extract_onlyLink_usesCourseIdParameter() {
        RawListing raw = RawListing.builder()
                .text("Pottery")
                .links(List.of(
                        new ListingLink("Map", "https://maps.example.org/?q=centre"),
                        new ListingLink("Register", "https://x/BookMe4?widgetId=w&courseId=c-42#top")))
                .build();

        assertThat(extractor.extract(raw)).contains("c-42");
    }

    @Test
    void fromUrl_withoutParameter_isEmpty() {
        assertThat(extractor.fromUrl("https://x/BookMe4?widgetId=w")).isEmpty();
        assertThat(extractor.fromUrl(null)).isEmpty();
    }
}
