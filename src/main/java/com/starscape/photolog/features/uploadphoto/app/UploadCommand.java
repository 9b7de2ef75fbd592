package com.starscape.photolog.features.uploadphoto.app;

import com.starscape.photolog.features.metadata.domain.ExifInfo;
import com.starscape.photolog.features.metadata.domain.PhotoLocation;
import com.starscape.photolog.features.thumbnail.domain.ThumbnailPolicy;
import com.starscape.photolog.features.thumbnail.domain.ThumbnailSpec;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One photo to ingest.
 *
 * @param preRenderedThumbnails JPEG thumbnails rendered by the caller, keyed by size name. When present
 *                              they are stored as-is and no thumbnails are derived.
 * @param thumbnailSpecs sizes to derive for this upload only; null means the configured defaults
 * @param thumbnailPolicy null means the configured default
 * @param exif caller-supplied EXIF; when null it is read from the image
 * @param location caller-supplied location; when null the image's GPS position is used if present
 */
public record UploadCommand(
    byte[] content,
    String filename,
    String contentType,
    String description,
    List<String> tags,
    Map<String, byte[]> preRenderedThumbnails,
    List<ThumbnailSpec> thumbnailSpecs,
    ThumbnailPolicy thumbnailPolicy,
    ExifInfo exif,
    PhotoLocation location
) {

    public UploadCommand {
        Objects.requireNonNull(content, "content");
        tags = tags == null ? List.of() : List.copyOf(tags);
        preRenderedThumbnails = preRenderedThumbnails == null
                ? Map.of()
                : new LinkedHashMap<>(preRenderedThumbnails);
        thumbnailSpecs = thumbnailSpecs == null ? null : List.copyOf(thumbnailSpecs);
    }

    public static Builder builder(byte[] content, String filename) {
        return new Builder(content, filename);
    }

    public static final class Builder {

        private final byte[] content;
        private final String filename;
        private String contentType;
        private String description;
        private List<String> tags;
        private Map<String, byte[]> preRenderedThumbnails;
        private List<ThumbnailSpec> thumbnailSpecs;
        private ThumbnailPolicy thumbnailPolicy;
        private ExifInfo exif;
        private PhotoLocation location;

        private Builder(byte[] content, String filename) {
            this.content = content;
            this.filename = filename;
        }

        public Builder contentType(String contentType) {
            this.contentType = contentType;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder preRenderedThumbnails(Map<String, byte[]> preRenderedThumbnails) {
            this.preRenderedThumbnails = preRenderedThumbnails;
            return this;
        }

        public Builder thumbnailSpecs(List<ThumbnailSpec> thumbnailSpecs) {
            this.thumbnailSpecs = thumbnailSpecs;
            return this;
        }

        public Builder thumbnailPolicy(ThumbnailPolicy thumbnailPolicy) {
            this.thumbnailPolicy = thumbnailPolicy;
            return this;
        }

        public Builder exif(ExifInfo exif) {
            this.exif = exif;
            return this;
        }

        public Builder location(PhotoLocation location) {
            this.location = location;
            return this;
        }

        public UploadCommand build() {
            return new UploadCommand(content, filename, contentType, description, tags,
                    preRenderedThumbnails, thumbnailSpecs, thumbnailPolicy, exif, location);
        }
    }
}
