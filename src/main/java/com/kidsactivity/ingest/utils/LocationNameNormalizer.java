package com.kidsactivity.ingest.utils;

import java.util.Locale;

/**
 * Collapses venue names so spelling variants compare equal:
 * "Harry Jerome Community Center" and "harry jerome comm. centre" both become "harry jerome comm centre".
 */
public final class LocationNameNormalizer {

    private LocationNameNormalizer() {
    }

    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        return name.toLowerCase(Locale.ROOT)
                .replaceAll("[^\\p{L}\\p{N}\\s]", " ")
                .replaceAll("\\bcenter\\b", "centre")
                .replaceAll("\\brecreation\\b", "rec")
                .replaceAll("\\bcommunity\\b", "comm")
                .replaceAll("\\s+", " ")
                .trim();
    }
}
