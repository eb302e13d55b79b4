package com.kidsactivity.ingest.enums;

import java.util.List;
import java.util.Locale;

/**
 * Coarse venue category inferred from keywords in the venue name.
 * Declaration order is the match order.
 */
public enum FacilityType {
    POOL(List.of("pool", "aquatic")),
    ARENA(List.of("arena", "rink")),
    RECREATION_CENTRE(List.of("recreation centre", "recreation center", "rec centre", "rec center")),
    COMMUNITY_CENTRE(List.of("community centre", "community center", "comm centre")),
    PARK(List.of("park")),
    FIELD(List.of("field", "turf", "diamond")),
    GYM(List.of("gym")),
    OTHER(List.of());

    private final List<String> keywords;

    FacilityType(List<String> keywords) {
        this.keywords = keywords;
    }

    public static FacilityType fromName(String venueName) {
        if (venueName == null || venueName.isBlank()) {
            return OTHER;
        }
        String lower = venueName.toLowerCase(Locale.ROOT);
        for (FacilityType type : values()) {
            for (String keyword : type.keywords) {
                if (lower.contains(keyword)) {
                    return type;
                }
            }
        }
        return OTHER;
    }
}
