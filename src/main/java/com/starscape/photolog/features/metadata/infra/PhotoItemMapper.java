package com.starscape.photolog.features.metadata.infra;

import com.starscape.photolog.features.metadata.domain.ExifInfo;
import com.starscape.photolog.features.metadata.domain.PhotoLocation;
import com.starscape.photolog.features.metadata.domain.PhotoRecord;
import com.starscape.photolog.features.metadata.domain.UploadStatus;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between {@link PhotoRecord} and DynamoDB items. Nested values use native map and list
 * attributes; timestamps are fixed-width UTC strings so they compare correctly as strings.
 */
final class PhotoItemMapper {

    static final String ID = "id";
    static final String FILENAME = "filename";
    static final String DESCRIPTION = "description";
    static final String FILE_URL = "file_url";
    static final String THUMBNAIL_URLS = "thumbnail_urls";
    static final String FILE_SIZE = "file_size";
    static final String CONTENT_TYPE = "content_type";
    static final String UPLOAD_STATUS = "upload_status";
    static final String LOCATION = "location";
    static final String LATITUDE = "latitude";
    static final String LONGITUDE = "longitude";
    static final String EXIF = "exif";
    static final String TAGS = "tags";
    static final String UPLOAD_TIMESTAMP = "upload_timestamp";
    static final String TAKEN_TIMESTAMP = "taken_timestamp";

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private PhotoItemMapper() {
    }

    static String formatTimestamp(Instant instant) {
        return TIMESTAMP_FORMAT.format(instant);
    }

    static Instant parseTimestamp(String value) {
        return Instant.parse(value);
    }

    static Map<String, AttributeValue> toItem(PhotoRecord record) {
        Map<String, AttributeValue> item = new HashMap<>();
        item.put(ID, s(record.id()));
        putIfPresent(item, FILENAME, record.filename());
        putIfPresent(item, DESCRIPTION, record.description());
        item.put(FILE_URL, s(record.fileUrl()));
        item.put(THUMBNAIL_URLS, urlMap(record.thumbnailUrls()));
        item.put(FILE_SIZE, n(record.fileSize()));
        putIfPresent(item, CONTENT_TYPE, record.contentType());
        item.put(UPLOAD_STATUS, s(record.uploadStatus().wireValue()));
        if (record.location() != null) {
            item.put(LOCATION, location(record.location()));
        }
        if (record.exif() != null) {
            item.put(EXIF, exif(record.exif()));
        }
        item.put(TAGS, AttributeValue.fromL(record.tags().stream().map(PhotoItemMapper::s).toList()));
        item.put(UPLOAD_TIMESTAMP, s(formatTimestamp(record.uploadTimestamp())));
        item.put(TAKEN_TIMESTAMP, s(formatTimestamp(record.takenTimestamp())));
        return item;
    }

    static PhotoRecord fromItem(Map<String, AttributeValue> item) {
        Map<String, String> thumbnailUrls = new LinkedHashMap<>();
        AttributeValue urls = item.get(THUMBNAIL_URLS);
        if (urls != null && urls.hasM()) {
            urls.m().entrySet().stream()
                    .sorted(Map.Entry.comparingByKey())
                    .forEach(e -> thumbnailUrls.put(e.getKey(), e.getValue().s()));
        }
        AttributeValue tags = item.get(TAGS);
        List<String> tagList = tags != null && tags.hasL()
                ? tags.l().stream().map(AttributeValue::s).toList()
                : List.of();

        return new PhotoRecord(
                string(item, ID),
                string(item, FILENAME),
                string(item, DESCRIPTION),
                string(item, FILE_URL),
                thumbnailUrls,
                item.containsKey(FILE_SIZE) ? Long.parseLong(item.get(FILE_SIZE).n()) : 0L,
                string(item, CONTENT_TYPE),
                UploadStatus.fromWireValue(string(item, UPLOAD_STATUS)),
                item.containsKey(LOCATION) ? toLocation(item.get(LOCATION).m()) : null,
                item.containsKey(EXIF) ? toExif(item.get(EXIF).m()) : null,
                tagList,
                parseTimestamp(string(item, UPLOAD_TIMESTAMP)));
    }

    private static AttributeValue urlMap(Map<String, String> urls) {
        Map<String, AttributeValue> m = new HashMap<>();
        urls.forEach((name, url) -> m.put(name, s(url)));
        return AttributeValue.fromM(m);
    }

    private static AttributeValue location(PhotoLocation location) {
        Map<String, AttributeValue> m = new HashMap<>();
        putIfPresent(m, LATITUDE, location.latitude());
        putIfPresent(m, LONGITUDE, location.longitude());
        putIfPresent(m, "address", location.address());
        putIfPresent(m, "city", location.city());
        putIfPresent(m, "country", location.country());
        return AttributeValue.fromM(m);
    }

    private static PhotoLocation toLocation(Map<String, AttributeValue> m) {
        return new PhotoLocation(
                number(m, LATITUDE),
                number(m, LONGITUDE),
                string(m, "address"),
                string(m, "city"),
                string(m, "country"));
    }

    private static AttributeValue exif(ExifInfo exif) {
        Map<String, AttributeValue> m = new HashMap<>();
        putIfPresent(m, "camera_make", exif.cameraMake());
        putIfPresent(m, "camera_model", exif.cameraModel());
        if (exif.takenAt() != null) {
            m.put("taken_at", s(formatTimestamp(exif.takenAt())));
        }
        if (exif.iso() != null) {
            m.put("iso", n((long) exif.iso()));
        }
        putIfPresent(m, "aperture", exif.aperture());
        putIfPresent(m, "shutter_speed", exif.shutterSpeed());
        putIfPresent(m, "focal_length", exif.focalLength());
        return AttributeValue.fromM(m);
    }

    private static ExifInfo toExif(Map<String, AttributeValue> m) {
        String takenAt = string(m, "taken_at");
        Double iso = number(m, "iso");
        return new ExifInfo(
                string(m, "camera_make"),
                string(m, "camera_model"),
                takenAt == null ? null : parseTimestamp(takenAt),
                iso == null ? null : iso.intValue(),
                number(m, "aperture"),
                string(m, "shutter_speed"),
                number(m, "focal_length"));
    }

    private static void putIfPresent(Map<String, AttributeValue> m, String key, String value) {
        if (value != null) {
            m.put(key, s(value));
        }
    }

    private static void putIfPresent(Map<String, AttributeValue> m, String key, Double value) {
        if (value != null) {
            m.put(key, n(value));
        }
    }

    private static String string(Map<String, AttributeValue> m, String key) {
        AttributeValue value = m.get(key);
        return value == null ? null : value.s();
    }

    private static Double number(Map<String, AttributeValue> m, String key) {
        AttributeValue value = m.get(key);
        return value == null || value.n() == null ? null : Double.valueOf(value.n());
    }

    static AttributeValue s(String value) {
        return AttributeValue.fromS(value);
    }

    static AttributeValue n(long value) {
        return AttributeValue.fromN(Long.toString(value));
    }

    static AttributeValue n(double value) {
        return AttributeValue.fromN(BigDecimal.valueOf(value).toPlainString());
    }
}
