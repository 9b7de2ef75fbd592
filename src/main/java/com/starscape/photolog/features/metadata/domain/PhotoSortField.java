package com.starscape.photolog.features.metadata.domain;

import java.util.Comparator;
import java.util.Locale;

/**
 * The only columns a listing may be ordered by. Unknown names fall back to upload time,
 * so caller input never reaches a query as a column name.
 */
public enum PhotoSortField {
    UPLOAD_TIMESTAMP("upload_timestamp", Comparator.comparing(PhotoRecord::uploadTimestamp)),
    FILENAME("filename", Comparator.comparing(PhotoRecord::filename,
            Comparator.nullsFirst(Comparator.<String>naturalOrder()))),
    FILE_SIZE("file_size", Comparator.comparingLong(PhotoRecord::fileSize)),
    TAKEN_TIMESTAMP("taken_timestamp", Comparator.comparing(PhotoRecord::takenTimestamp));

    private final String fieldName;
    private final Comparator<PhotoRecord> comparator;

    PhotoSortField(String fieldName, Comparator<PhotoRecord> comparator) {
        this.fieldName = fieldName;
        this.comparator = comparator;
    }

    public String fieldName() {
        return fieldName;
    }

    /**
     * In-memory ordering for backends that cannot sort server-side. Ties are broken by id.
     */
    public Comparator<PhotoRecord> comparator(SortDirection direction) {
        Comparator<PhotoRecord> ordered = direction == SortDirection.ASC ? comparator : comparator.reversed();
        return ordered.thenComparing(PhotoRecord::id);
    }

    public static PhotoSortField resolve(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (PhotoSortField field : values()) {
                if (field.fieldName.equals(normalized)) {
                    return field;
                }
            }
        }
        return UPLOAD_TIMESTAMP;
    }
}
