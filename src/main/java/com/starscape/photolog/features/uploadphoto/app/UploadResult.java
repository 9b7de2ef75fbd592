package com.starscape.photolog.features.uploadphoto.app;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.starscape.photolog.common.config.StorageType;

import java.util.Map;

/**
 * Outcome of one upload.
 *
 * @param inconsistent true when the original is stored but the metadata record could not be finalized;
 *                     {@code fileUrl} then points at the stored blob and the record stays {@code uploading}
 *                     until the stale-upload sweep marks it failed
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UploadResult(
    boolean success,
    String photoId,
    String fileUrl,
    Map<String, String> thumbnailUrls,
    long fileSize,
    StorageType storageType,
    String error,
    UploadStage stage,
    boolean inconsistent
) {

    public UploadResult {
        thumbnailUrls = thumbnailUrls == null ? Map.of() : thumbnailUrls;
    }

    static UploadResult completed(String photoId, String fileUrl, Map<String, String> thumbnailUrls,
                                  long fileSize, StorageType storageType) {
        return new UploadResult(true, photoId, fileUrl, thumbnailUrls, fileSize, storageType,
                null, UploadStage.COMPLETED, false);
    }

    static UploadResult failed(String photoId, UploadStage stage, String error, long fileSize,
                               StorageType storageType) {
        return new UploadResult(false, photoId, null, Map.of(), fileSize, storageType,
                error, stage, false);
    }

    static UploadResult inconsistent(String photoId, String fileUrl, Map<String, String> thumbnailUrls,
                                     long fileSize, StorageType storageType, String error) {
        return new UploadResult(false, photoId, fileUrl, thumbnailUrls, fileSize, storageType,
                error, UploadStage.METADATA_FINALIZE, true);
    }
}
