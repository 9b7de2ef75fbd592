package com.starscape.photolog.common.exception;

/**
 * Uploaded content is not an acceptable image (empty, too large, unsupported type or undecodable).
 */
public class ImageValidationException extends IllegalArgumentException {

    public ImageValidationException(String message) {
        super(message);
    }

    public ImageValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
