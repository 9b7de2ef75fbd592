package com.starscape.photolog.features.thumbnail.domain;

/**
 * Encoded JPEG bytes plus the pixel size they decode to.
 */
public record DerivedThumbnail(byte[] data, int width, int height) {
}
