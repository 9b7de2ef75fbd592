package com.starscape.photolog.features.thumbnail.domain;

import java.util.regex.Pattern;

/**
 * A named derived size. The name becomes part of the blob name, so it is restricted
 * to letters, digits, underscore and hyphen.
 */
public record ThumbnailSpec(String name, int width, int height) {

    private static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z0-9_-]+");

    public ThumbnailSpec {
        if (!isValidName(name)) {
            throw new IllegalArgumentException("Invalid thumbnail name: " + name);
        }
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException(
                "Thumbnail dimensions must be positive: " + name + " " + width + "x" + height);
        }
    }

    public static boolean isValidName(String name) {
        return name != null && NAME_PATTERN.matcher(name).matches();
    }
}
