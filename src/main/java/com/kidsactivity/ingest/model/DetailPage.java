package com.kidsactivity.ingest.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * What the reader captured from one detail page, before any parsing.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class DetailPage {
    private String url;
    private String title;
    private String bodyText;
    private String html;

    @Builder.Default
    private List<ListingLink> links = new ArrayList<>();

    @Builder.Default
    private List<String> venueLines = new ArrayList<>();
}
