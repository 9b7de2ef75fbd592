package com.starscape.photolog.features.metadata.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Descriptive metadata of one stored photo. Immutable; state changes produce copies.
 * <p>
 * {@code thumbnailUrls} keeps insertion order and may hold fewer sizes than were requested.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PhotoRecord(
    String id,
    String filename,
    String description,
    String fileUrl,
    Map<String, String> thumbnailUrls,
    long fileSize,
    String contentType,
    UploadStatus uploadStatus,
    PhotoLocation location,
    ExifInfo exif,
    List<String> tags,
    Instant uploadTimestamp
) {

    public PhotoRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(uploadStatus, "uploadStatus");
        Objects.requireNonNull(uploadTimestamp, "uploadTimestamp");
        fileUrl = fileUrl == null ? "" : fileUrl;
        thumbnailUrls = thumbnailUrls == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(thumbnailUrls));
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    /**
     * A new record in {@link UploadStatus#UPLOADING} with no URLs yet.
     */
    public static PhotoRecord reserved(
            String id,
            String filename,
            String description,
            long fileSize,
            String contentType,
            PhotoLocation location,
            ExifInfo exif,
            List<String> tags,
            Instant uploadTimestamp) {
        return new PhotoRecord(id, filename, description, "", Map.of(), fileSize, contentType,
                UploadStatus.UPLOADING, location, exif, tags, uploadTimestamp);
    }

    public PhotoRecord withUrls(String newFileUrl, Map<String, String> newThumbnailUrls) {
        return new PhotoRecord(id, filename, description, newFileUrl, newThumbnailUrls, fileSize, contentType,
                uploadStatus, location, exif, tags, uploadTimestamp);
    }

    public PhotoRecord withStatus(UploadStatus newStatus) {
        return new PhotoRecord(id, filename, description, fileUrl, thumbnailUrls, fileSize, contentType,
                newStatus, location, exif, tags, uploadTimestamp);
    }

    /**
     * EXIF capture time when known, otherwise the upload time.
     */
    @JsonIgnore
    public Instant takenTimestamp() {
        if (exif != null && exif.takenAt() != null) {
            return exif.takenAt();
        }
        return uploadTimestamp;
    }
}
