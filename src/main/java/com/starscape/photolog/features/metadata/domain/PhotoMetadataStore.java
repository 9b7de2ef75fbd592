package com.starscape.photolog.features.metadata.domain;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keyed store of {@link PhotoRecord}s. Implementations are thread-safe and do not retry;
 * backend failures surface as {@link com.starscape.photolog.common.exception.StorageUnavailableException}.
 */
public interface PhotoMetadataStore {

    /**
     * Insert the record, or replace the one with the same id.
     */
    void upsert(PhotoRecord record);

    /**
     * Replace only the file URL and thumbnail URLs of an existing record.
     *
     * @return false if no record has that id
     */
    boolean updateUrls(String id, String fileUrl, Map<String, String> thumbnailUrls);

    /**
     * Replace only the status of an existing record.
     *
     * @return false if no record has that id
     */
    boolean updateStatus(String id, UploadStatus status);

    Optional<PhotoRecord> get(String id);

    PhotoPage list(PageQuery query);

    /**
     * Records with coordinates within {@code radiusKm} of the given point, nearest first.
     */
    List<PhotoRecord> searchByLocation(double latitude, double longitude, double radiusKm, int limit);

    boolean delete(String id);

    /**
     * Mark every record still {@code uploading} whose upload time is older than {@code hoursOld}
     * hours as {@code failed}. Records that left {@code uploading} in the meantime are untouched.
     *
     * @return ids of the records that were transitioned
     */
    List<String> cleanupStale(int hoursOld);
}
