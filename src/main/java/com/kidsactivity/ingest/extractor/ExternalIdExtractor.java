package com.kidsactivity.ingest.extractor;

import com.kidsactivity.ingest.model.ListingLink;
import com.kidsactivity.ingest.model.RawListing;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the provider's own identifier for a listing entry.
 * Order: dedicated id element, then a {@code #NNNN} token in the text, then the
 * {@code courseId} query parameter of an entry link.
 */
@Component
public class ExternalIdExtractor {

    private static final Pattern HASH_TOKEN = Pattern.compile("#\\s?(\\d{4,})\\b");
    private static final Pattern COURSE_ID_PARAM = Pattern.compile("[?&]courseId=([^&#\\s]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern ID_ELEMENT = Pattern.compile("^#?\\s*([A-Za-z0-9][A-Za-z0-9_-]*)$");

    public Optional<String> extract(RawListing listing) {
        Optional<String> fromElement = fromIdElement(listing.getIdElementText());
        if (fromElement.isPresent()) {
            return fromElement;
        }

        if (listing.getText() != null) {
            Matcher m = HASH_TOKEN.matcher(listing.getText());
            if (m.find()) {
                return Optional.of(m.group(1));
            }
        }

        if (listing.getLinks() != null) {
            for (ListingLink link : listing.getLinks()) {
                Optional<String> courseId = fromUrl(link.getHref());
                if (courseId.isPresent()) {
                    return courseId;
                }
            }
        }
        return Optional.empty();
    }

    public Optional<String> fromUrl(String url) {
        if (url == null) {
            return Optional.empty();
        }
        Matcher m = COURSE_ID_PARAM.matcher(url);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }

    private Optional<String> fromIdElement(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Matcher m = ID_ELEMENT.matcher(text.trim());
        return m.matches() ? Optional.of(m.group(1)) : Optional.empty();
    }
}
