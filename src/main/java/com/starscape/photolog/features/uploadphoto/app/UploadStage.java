package com.starscape.photolog.features.uploadphoto.app;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where an upload got to. A failed result names the stage that failed.
 */
public enum UploadStage {
    VALIDATION("validation"),
    METADATA_RESERVE("metadata_reserve"),
    FILE_UPLOAD("file_upload"),
    THUMBNAIL_GENERATION("thumbnail_generation"),
    THUMBNAIL_UPLOAD("thumbnail_upload"),
    METADATA_FINALIZE("metadata_finalize"),
    COMPLETED("completed");

    private final String wireValue;

    UploadStage(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /**
     * Whether a metadata row exists once this stage has been entered.
     */
    boolean isAfterReserve() {
        return ordinal() > METADATA_RESERVE.ordinal();
    }
}
