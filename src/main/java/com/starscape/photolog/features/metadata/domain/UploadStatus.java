package com.starscape.photolog.features.metadata.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a photo record. The lower-case wire values are what both metadata backends persist.
 */
public enum UploadStatus {
    UPLOADING("uploading"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String wireValue;

    UploadStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static UploadStatus fromWireValue(String value) {
        for (UploadStatus status : values()) {
            if (status.wireValue.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown upload status: " + value);
    }
}
