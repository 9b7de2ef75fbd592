package com.starscape.photolog.features.metadata.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.photolog.common.exception.StorageUnavailableException;
import com.starscape.photolog.features.metadata.domain.ExifInfo;
import com.starscape.photolog.features.metadata.domain.PageQuery;
import com.starscape.photolog.features.metadata.domain.PhotoLocation;
import com.starscape.photolog.features.metadata.domain.PhotoMetadataStore;
import com.starscape.photolog.features.metadata.domain.PhotoPage;
import com.starscape.photolog.features.metadata.domain.PhotoRecord;
import com.starscape.photolog.features.metadata.domain.SortDirection;
import com.starscape.photolog.features.metadata.domain.UploadStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Metadata store over the embedded relational database.
 */
public class JpaPhotoMetadataStore implements PhotoMetadataStore {

    private static final Logger log = LoggerFactory.getLogger(JpaPhotoMetadataStore.class);

    private static final TypeReference<LinkedHashMap<String, String>> URL_MAP = new TypeReference<>() {};
    private static final TypeReference<List<String>> TAG_LIST = new TypeReference<>() {};

    private final JpaPhotoEntityRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JpaPhotoMetadataStore(JpaPhotoEntityRepository repository, ObjectMapper objectMapper, Clock clock) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public void upsert(PhotoRecord record) {
        PhotoEntity entity = toEntity(record);
        call("upsert " + record.id(), () -> repository.saveAndFlush(entity));
        log.debug("Upserted photo record: id={}, status={}", record.id(), record.uploadStatus().wireValue());
    }

    @Override
    public boolean updateUrls(String id, String fileUrl, Map<String, String> thumbnailUrls) {
        String json = writeJson(thumbnailUrls == null ? Map.of() : thumbnailUrls);
        int updated = call("update URLs of " + id, () -> repository.updateUrls(id, fileUrl == null ? "" : fileUrl, json));
        return updated > 0;
    }

    @Override
    public boolean updateStatus(String id, UploadStatus status) {
        int updated = call("update status of " + id, () -> repository.updateStatus(id, status));
        return updated > 0;
    }

    @Override
    public Optional<PhotoRecord> get(String id) {
        return call("get " + id, () -> repository.findById(id)).map(this::toRecord);
    }

    @Override
    public PhotoPage list(PageQuery query) {
        Sort.Direction direction = query.direction() == SortDirection.ASC ? Sort.Direction.ASC : Sort.Direction.DESC;
        Sort sort = Sort.by(direction, sortProperty(query)).and(Sort.by(Sort.Direction.ASC, "id"));
        Page<PhotoEntity> page = call("list photos",
                () -> repository.findAll(PageRequest.of(query.page() - 1, query.limit(), sort)));
        List<PhotoRecord> records = page.getContent().stream().map(this::toRecord).toList();
        return PhotoPage.of(records, query, page.getTotalElements());
    }

    @Override
    public List<PhotoRecord> searchByLocation(double latitude, double longitude, double radiusKm, int limit) {
        return call("search by location",
                () -> repository.findWithinRadius(latitude, longitude, radiusKm, limit))
                .stream()
                .map(this::toRecord)
                .toList();
    }

    @Override
    public boolean delete(String id) {
        return call("delete " + id, () -> repository.deleteByIdReturningCount(id)) > 0;
    }

    @Override
    public List<String> cleanupStale(int hoursOld) {
        Instant cutoff = clock.instant().minus(Duration.ofHours(hoursOld));
        List<String> candidates = call("find stale uploads",
                () -> repository.findIdsByStatusUploadedBefore(UploadStatus.UPLOADING, cutoff));

        List<String> transitioned = new ArrayList<>();
        for (String id : candidates) {
            int updated = call("mark " + id + " failed",
                    () -> repository.transitionStatus(id, UploadStatus.UPLOADING, UploadStatus.FAILED));
            if (updated > 0) {
                transitioned.add(id);
            }
        }
        return transitioned;
    }

    private String sortProperty(PageQuery query) {
        return switch (query.orderBy()) {
            case UPLOAD_TIMESTAMP -> "uploadTimestamp";
            case FILENAME -> "filename";
            case FILE_SIZE -> "fileSize";
            case TAKEN_TIMESTAMP -> "takenTimestamp";
        };
    }

    private PhotoEntity toEntity(PhotoRecord record) {
        PhotoEntity entity = new PhotoEntity(record.id());
        entity.setFilename(record.filename());
        entity.setDescription(record.description());
        entity.setFileUrl(record.fileUrl());
        entity.setThumbnailUrlsJson(writeJson(record.thumbnailUrls()));
        entity.setFileSize(record.fileSize());
        entity.setContentType(record.contentType());
        entity.setUploadStatus(record.uploadStatus());
        PhotoLocation location = record.location();
        if (location != null) {
            entity.setLatitude(location.latitude());
            entity.setLongitude(location.longitude());
            entity.setLocationJson(writeJson(location));
        }
        entity.setExifJson(record.exif() == null ? null : writeJson(record.exif()));
        entity.setTagsJson(writeJson(record.tags()));
        entity.setUploadTimestamp(record.uploadTimestamp());
        entity.setTakenTimestamp(record.takenTimestamp());
        return entity;
    }

    private PhotoRecord toRecord(PhotoEntity entity) {
        return new PhotoRecord(
                entity.getId(),
                entity.getFilename(),
                entity.getDescription(),
                entity.getFileUrl(),
                readJson(entity.getThumbnailUrlsJson(), URL_MAP),
                entity.getFileSize(),
                entity.getContentType(),
                entity.getUploadStatus(),
                readJson(entity.getLocationJson(), PhotoLocation.class),
                readJson(entity.getExifJson(), ExifInfo.class),
                readJson(entity.getTagsJson(), TAG_LIST),
                entity.getUploadTimestamp());
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize column value", e);
        }
    }

    private <T> T readJson(String json, Class<T> type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt JSON column for " + type.getSimpleName(), e);
        }
    }

    private <T> T readJson(String json, TypeReference<T> type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt JSON column", e);
        }
    }

    private <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException | TransactionException e) {
            throw new StorageUnavailableException("Metadata store failed to " + operation, e);
        }
    }
}
