package com.starscape.photolog.features.uploadphoto.app;

/**
 * @param extension lower-case, with the leading dot
 * @param contentType MIME type detected from the bytes, not the one the caller claimed
 */
public record ValidatedImage(String extension, String contentType, int width, int height) {
}
