package com.starscape.photolog.features.metadata.domain;

import java.util.Locale;

public enum SortDirection {
    ASC,
    DESC;

    /**
     * Anything other than "asc" (any case) sorts descending.
     */
    public static SortDirection resolve(String value) {
        if (value != null && value.trim().toUpperCase(Locale.ROOT).equals("ASC")) {
            return ASC;
        }
        return DESC;
    }
}
