package com.starscape.photolog.common.config;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The backend pairs a deployment can run on. Selected once at start-up from app.storage.type.
 */
public enum StorageType {
    /** Filesystem blobs, embedded relational metadata table. */
    LOCAL,
    /** S3-compatible object store, DynamoDB metadata table. */
    CLOUD;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
