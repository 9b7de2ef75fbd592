package com.starscape.photolog.features.metadata.infra;

import com.starscape.photolog.features.metadata.domain.ExifInfo;
import com.starscape.photolog.features.metadata.domain.PhotoLocation;
import com.starscape.photolog.features.metadata.domain.PhotoRecord;
import com.starscape.photolog.features.metadata.domain.UploadStatus;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PhotoItemMapperTest {

    @Test
    void timestampsAreFixedWidthSoTheyCompareAsStrings() {
        String whole = PhotoItemMapper.formatTimestamp(Instant.parse("2024-05-01T10:00:00Z"));
        String fraction = PhotoItemMapper.formatTimestamp(Instant.parse("2024-05-01T09:59:59.5Z"));

        assertEquals("2024-05-01T10:00:00.000Z", whole);
        assertEquals("2024-05-01T09:59:59.500Z", fraction);
        assertTrue(fraction.compareTo(whole) < 0);
        assertEquals(Instant.parse("2024-05-01T10:00:00Z"), PhotoItemMapper.parseTimestamp(whole));
    }

    @Test
    void nestedLocationExifAndTagsUseNativeAttributes() {
        Map<String, String> thumbnails = new LinkedHashMap<>();
        thumbnails.put("small", "https://host/o/thumbnails/p1_small.jpg");
        thumbnails.put("large", "https://host/o/thumbnails/p1_large.jpg");
        PhotoRecord record = new PhotoRecord("p1", "a.jpg", "beach", "https://host/o/photos/p1.jpg", thumbnails,
                2048, "image/jpeg", UploadStatus.COMPLETED,
                new PhotoLocation(35.1796, 129.0756, null, "Busan", "KR"),
                new ExifInfo("Sony", "A7", Instant.parse("2023-08-15T06:30:00Z"), 100, 4.0, "1/500", 24.0),
                List.of("sea", "summer"),
                Instant.parse("2024-05-01T10:00:00Z"));

        Map<String, AttributeValue> item = PhotoItemMapper.toItem(record);

        assertEquals("completed", item.get(PhotoItemMapper.UPLOAD_STATUS).s());
        assertEquals("2048", item.get(PhotoItemMapper.FILE_SIZE).n());
        assertEquals("35.1796", item.get(PhotoItemMapper.LOCATION).m().get(PhotoItemMapper.LATITUDE).n());
        assertEquals("Sony", item.get(PhotoItemMapper.EXIF).m().get("camera_make").s());
        assertEquals("2023-08-15T06:30:00.000Z", item.get(PhotoItemMapper.TAKEN_TIMESTAMP).s());
        assertEquals(2, item.get(PhotoItemMapper.TAGS).l().size());
        assertFalse(item.get(PhotoItemMapper.LOCATION).m().containsKey("address"));

        PhotoRecord back = PhotoItemMapper.fromItem(item);
        assertEquals(record.location(), back.location());
        assertEquals(record.exif(), back.exif());
        assertEquals(record.tags(), back.tags());
        assertEquals(List.of("large", "small"), List.copyOf(back.thumbnailUrls().keySet()));
    }

    @Test
    void optionalFieldsAreOmitted() {
        PhotoRecord record = PhotoRecord.reserved("p2", "b.png", null, 10, "image/png", null, null, null,
                Instant.parse("2024-05-01T10:00:00Z"));

        Map<String, AttributeValue> item = PhotoItemMapper.toItem(record);

        assertFalse(item.containsKey(PhotoItemMapper.DESCRIPTION));
        assertFalse(item.containsKey(PhotoItemMapper.LOCATION));
        assertFalse(item.containsKey(PhotoItemMapper.EXIF));
        assertEquals("", item.get(PhotoItemMapper.FILE_URL).s());
        assertEquals(item.get(PhotoItemMapper.UPLOAD_TIMESTAMP), item.get(PhotoItemMapper.TAKEN_TIMESTAMP));

        PhotoRecord back = PhotoItemMapper.fromItem(item);
        assertNull(back.description());
        assertNull(back.location());
        assertTrue(back.thumbnailUrls().isEmpty());
        assertEquals(UploadStatus.UPLOADING, back.uploadStatus());
    }
}
