package com.kidsactivity.ingest.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One leaf entry harvested from the listing tree, before any parsing.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class RawListing {
    private String category;
    private String subcategory;
    /** Text of the entry's dedicated name element, if the row has one. */
    private String nameText;
    /** Text of the entry's dedicated id element, if the row has one. */
    private String idElementText;
    private String text;

    @Builder.Default
    private List<ListingLink> links = new ArrayList<>();
}
