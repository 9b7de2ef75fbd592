package com.starscape.photolog.features.metadata.infra;

import com.starscape.photolog.common.exception.StorageUnavailableException;
import com.starscape.photolog.features.metadata.domain.GeoDistance;
import com.starscape.photolog.features.metadata.domain.PageQuery;
import com.starscape.photolog.features.metadata.domain.PhotoLocation;
import com.starscape.photolog.features.metadata.domain.PhotoMetadataStore;
import com.starscape.photolog.features.metadata.domain.PhotoPage;
import com.starscape.photolog.features.metadata.domain.PhotoRecord;
import com.starscape.photolog.features.metadata.domain.UploadStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemResponse;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.ReturnValue;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Metadata store over a DynamoDB table keyed by {@code id}.
 * <p>
 * The table has no secondary indexes, so listing and location search scan the table and
 * sort in memory.
 */
public class DynamoDbPhotoMetadataStore implements PhotoMetadataStore {

    private static final Logger log = LoggerFactory.getLogger(DynamoDbPhotoMetadataStore.class);

    private final DynamoDbClient dynamoDbClient;
    private final String tableName;
    private final Clock clock;

    public DynamoDbPhotoMetadataStore(DynamoDbClient dynamoDbClient, String tableName, Clock clock) {
        this.dynamoDbClient = dynamoDbClient;
        this.tableName = tableName;
        this.clock = clock;
    }

    @Override
    public void upsert(PhotoRecord record) {
        call("upsert " + record.id(), () -> dynamoDbClient.putItem(b -> b
                .tableName(tableName)
                .item(PhotoItemMapper.toItem(record))));
        log.debug("Upserted photo item: id={}, status={}", record.id(), record.uploadStatus().wireValue());
    }

    @Override
    public boolean updateUrls(String id, String fileUrl, Map<String, String> thumbnailUrls) {
        Map<String, AttributeValue> values = Map.of(
                ":fu", PhotoItemMapper.s(fileUrl == null ? "" : fileUrl),
                ":tu", AttributeValue.fromM(toAttributeMap(thumbnailUrls)));
        return conditionalUpdate(id, "SET #fu = :fu, #tu = :tu", "attribute_exists(#id)",
                Map.of("#id", PhotoItemMapper.ID,
                        "#fu", PhotoItemMapper.FILE_URL,
                        "#tu", PhotoItemMapper.THUMBNAIL_URLS),
                values);
    }

    @Override
    public boolean updateStatus(String id, UploadStatus status) {
        return conditionalUpdate(id, "SET #st = :st", "attribute_exists(#id)",
                Map.of("#id", PhotoItemMapper.ID, "#st", PhotoItemMapper.UPLOAD_STATUS),
                Map.of(":st", PhotoItemMapper.s(status.wireValue())));
    }

    @Override
    public Optional<PhotoRecord> get(String id) {
        GetItemResponse response = call("get " + id, () -> dynamoDbClient.getItem(b -> b
                .tableName(tableName)
                .key(key(id))
                .consistentRead(true)));
        if (!response.hasItem() || response.item().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(PhotoItemMapper.fromItem(response.item()));
    }

    @Override
    public PhotoPage list(PageQuery query) {
        List<PhotoRecord> all = scan(ScanRequest.builder().tableName(tableName).build());
        all.sort(query.orderBy().comparator(query.direction()));

        int from = (int) Math.min(query.offset(), all.size());
        int to = Math.min(from + query.limit(), all.size());
        return PhotoPage.of(all.subList(from, to), query, all.size());
    }

    @Override
    public List<PhotoRecord> searchByLocation(double latitude, double longitude, double radiusKm, int limit) {
        ScanRequest request = ScanRequest.builder()
                .tableName(tableName)
                .filterExpression("attribute_exists(#loc.#lat) AND attribute_exists(#loc.#lon)")
                .expressionAttributeNames(Map.of(
                        "#loc", PhotoItemMapper.LOCATION,
                        "#lat", PhotoItemMapper.LATITUDE,
                        "#lon", PhotoItemMapper.LONGITUDE))
                .build();

        double latDelta = GeoDistance.latitudeDelta(radiusKm);
        double lonDelta = GeoDistance.longitudeDelta(latitude, radiusKm);

        record Candidate(PhotoRecord photo, double distanceKm) {}

        return scan(request).stream()
                .filter(photo -> {
                    PhotoLocation loc = photo.location();
                    return Math.abs(loc.latitude() - latitude) <= latDelta
                            && longitudeGap(loc.longitude(), longitude) <= lonDelta;
                })
                .map(photo -> new Candidate(photo, GeoDistance.haversineKm(
                        latitude, longitude, photo.location().latitude(), photo.location().longitude())))
                .filter(candidate -> candidate.distanceKm() <= radiusKm)
                .sorted(Comparator.comparingDouble(Candidate::distanceKm)
                        .thenComparing(candidate -> candidate.photo().id()))
                .limit(limit)
                .map(Candidate::photo)
                .toList();
    }

    @Override
    public boolean delete(String id) {
        DeleteItemResponse response = call("delete " + id, () -> dynamoDbClient.deleteItem(b -> b
                .tableName(tableName)
                .key(key(id))
                .returnValues(ReturnValue.ALL_OLD)));
        return response.hasAttributes() && !response.attributes().isEmpty();
    }

    @Override
    public List<String> cleanupStale(int hoursOld) {
        String cutoff = PhotoItemMapper.formatTimestamp(clock.instant().minus(Duration.ofHours(hoursOld)));
        ScanRequest request = ScanRequest.builder()
                .tableName(tableName)
                .filterExpression("#st = :uploading AND #ts < :cutoff")
                .expressionAttributeNames(Map.of(
                        "#st", PhotoItemMapper.UPLOAD_STATUS,
                        "#ts", PhotoItemMapper.UPLOAD_TIMESTAMP))
                .expressionAttributeValues(Map.of(
                        ":uploading", PhotoItemMapper.s(UploadStatus.UPLOADING.wireValue()),
                        ":cutoff", PhotoItemMapper.s(cutoff)))
                .build();

        List<String> transitioned = new ArrayList<>();
        for (PhotoRecord stale : scan(request)) {
            boolean updated = conditionalUpdate(stale.id(), "SET #st = :failed", "#st = :uploading",
                    Map.of("#st", PhotoItemMapper.UPLOAD_STATUS),
                    Map.of(":failed", PhotoItemMapper.s(UploadStatus.FAILED.wireValue()),
                            ":uploading", PhotoItemMapper.s(UploadStatus.UPLOADING.wireValue())));
            if (updated) {
                transitioned.add(stale.id());
            }
        }
        return transitioned;
    }

    private boolean conditionalUpdate(
            String id,
            String updateExpression,
            String conditionExpression,
            Map<String, String> names,
            Map<String, AttributeValue> values) {
        try {
            dynamoDbClient.updateItem(b -> b
                    .tableName(tableName)
                    .key(key(id))
                    .updateExpression(updateExpression)
                    .conditionExpression(conditionExpression)
                    .expressionAttributeNames(names)
                    .expressionAttributeValues(values));
            return true;
        } catch (ConditionalCheckFailedException e) {
            return false;
        } catch (SdkException e) {
            throw new StorageUnavailableException("Metadata store failed to update " + id, e);
        }
    }

    private List<PhotoRecord> scan(ScanRequest request) {
        return call("scan " + tableName, () -> {
            List<PhotoRecord> records = new ArrayList<>();
            dynamoDbClient.scanPaginator(request).items()
                    .forEach(item -> records.add(PhotoItemMapper.fromItem(item)));
            return records;
        });
    }

    private static double longitudeGap(double a, double b) {
        double gap = Math.abs(a - b) % 360.0;
        return gap > 180.0 ? 360.0 - gap : gap;
    }

    private static Map<String, AttributeValue> key(String id) {
        return Map.of(PhotoItemMapper.ID, PhotoItemMapper.s(id));
    }

    private static Map<String, AttributeValue> toAttributeMap(Map<String, String> urls) {
        Map<String, AttributeValue> m = new HashMap<>();
        if (urls != null) {
            urls.forEach((name, url) -> m.put(name, PhotoItemMapper.s(url)));
        }
        return m;
    }

    private <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (SdkException e) {
            throw new StorageUnavailableException("Metadata store failed to " + operation, e);
        }
    }
}
