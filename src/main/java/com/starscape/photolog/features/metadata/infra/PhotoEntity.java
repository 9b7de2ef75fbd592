package com.starscape.photolog.features.metadata.infra;

import com.starscape.photolog.features.metadata.domain.UploadStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * Relational row for a photo. Nested values (thumbnail URLs, location, EXIF, tags) are JSON text;
 * coordinates are also stored as plain columns so distance can be computed in SQL.
 */
@Entity
@Table(name = "photos", indexes = {
    @Index(name = "idx_photos_status_uploaded", columnList = "upload_status, upload_timestamp"),
    @Index(name = "idx_photos_location", columnList = "latitude, longitude")
})
public class PhotoEntity {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "filename", length = 512)
    private String filename;

    @Column(name = "description", length = 2000)
    private String description;

    @Column(name = "file_url", nullable = false, length = 2048)
    private String fileUrl;

    @Column(name = "thumbnail_urls", length = 4000)
    private String thumbnailUrlsJson;

    @Column(name = "file_size", nullable = false)
    private long fileSize;

    @Column(name = "content_type", length = 128)
    private String contentType;

    @Convert(converter = UploadStatusConverter.class)
    @Column(name = "upload_status", nullable = false, length = 16)
    private UploadStatus uploadStatus;

    @Column(name = "latitude")
    private Double latitude;

    @Column(name = "longitude")
    private Double longitude;

    @Column(name = "location", length = 4000)
    private String locationJson;

    @Column(name = "exif", length = 4000)
    private String exifJson;

    @Column(name = "tags", length = 4000)
    private String tagsJson;

    @Column(name = "upload_timestamp", nullable = false, updatable = false)
    private Instant uploadTimestamp;

    @Column(name = "taken_timestamp", nullable = false)
    private Instant takenTimestamp;

    protected PhotoEntity() {
        // JPA constructor
    }

    public PhotoEntity(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public String getFilename() {
        return filename;
    }

    public void setFilename(String filename) {
        this.filename = filename;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getFileUrl() {
        return fileUrl;
    }

    public void setFileUrl(String fileUrl) {
        this.fileUrl = fileUrl;
    }

    public String getThumbnailUrlsJson() {
        return thumbnailUrlsJson;
    }

    public void setThumbnailUrlsJson(String thumbnailUrlsJson) {
        this.thumbnailUrlsJson = thumbnailUrlsJson;
    }

    public long getFileSize() {
        return fileSize;
    }

    public void setFileSize(long fileSize) {
        this.fileSize = fileSize;
    }

    public String getContentType() {
        return contentType;
    }

    public void setContentType(String contentType) {
        this.contentType = contentType;
    }

    public UploadStatus getUploadStatus() {
        return uploadStatus;
    }

    public void setUploadStatus(UploadStatus uploadStatus) {
        this.uploadStatus = uploadStatus;
    }

    public Double getLatitude() {
        return latitude;
    }

    public void setLatitude(Double latitude) {
        this.latitude = latitude;
    }

    public Double getLongitude() {
        return longitude;
    }

    public void setLongitude(Double longitude) {
        this.longitude = longitude;
    }

    public String getLocationJson() {
        return locationJson;
    }

    public void setLocationJson(String locationJson) {
        this.locationJson = locationJson;
    }

    public String getExifJson() {
        return exifJson;
    }

    public void setExifJson(String exifJson) {
        this.exifJson = exifJson;
    }

    public String getTagsJson() {
        return tagsJson;
    }

    public void setTagsJson(String tagsJson) {
        this.tagsJson = tagsJson;
    }

    public Instant getUploadTimestamp() {
        return uploadTimestamp;
    }

    public void setUploadTimestamp(Instant uploadTimestamp) {
        this.uploadTimestamp = uploadTimestamp;
    }

    public Instant getTakenTimestamp() {
        return takenTimestamp;
    }

    public void setTakenTimestamp(Instant takenTimestamp) {
        this.takenTimestamp = takenTimestamp;
    }
}
