package com.starscape.photolog.common.config;

import com.starscape.photolog.features.thumbnail.domain.ThumbnailPolicy;
import com.starscape.photolog.features.thumbnail.domain.ThumbnailSpec;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Configuration properties for photo processing.
 * Binds to app.processing.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.processing")
public class ProcessingProperties {

    private List<ThumbnailSize> thumbnails = new ArrayList<>(List.of(
            new ThumbnailSize("small", 150, 150),
            new ThumbnailSize("medium", 400, 400),
            new ThumbnailSize("large", 800, 600)
    ));
    private ThumbnailPolicy thumbnailPolicy = ThumbnailPolicy.LETTERBOX;
    private float jpegQuality = 0.85f;
    private List<String> allowedExtensions = new ArrayList<>(List.of(".jpg", ".jpeg", ".png", ".webp", ".heic"));
    private DataSize maxFileSize = DataSize.ofMegabytes(50);
    private int uploadParallelism = 3;

    public List<ThumbnailSize> getThumbnails() {
        return thumbnails;
    }

    public void setThumbnails(List<ThumbnailSize> thumbnails) {
        this.thumbnails = thumbnails;
    }

    /**
     * The configured thumbnail sizes as immutable specs, in configuration order.
     */
    public List<ThumbnailSpec> getThumbnailSpecs() {
        return thumbnails.stream()
                .map(size -> new ThumbnailSpec(size.getName(), size.getWidth(), size.getHeight()))
                .toList();
    }

    public ThumbnailPolicy getThumbnailPolicy() {
        return thumbnailPolicy;
    }

    public void setThumbnailPolicy(ThumbnailPolicy thumbnailPolicy) {
        this.thumbnailPolicy = thumbnailPolicy;
    }

    public float getJpegQuality() {
        return jpegQuality;
    }

    public void setJpegQuality(float jpegQuality) {
        this.jpegQuality = jpegQuality;
    }

    public List<String> getAllowedExtensions() {
        return allowedExtensions;
    }

    public void setAllowedExtensions(List<String> allowedExtensions) {
        this.allowedExtensions = allowedExtensions;
    }

    public DataSize getMaxFileSize() {
        return maxFileSize;
    }

    public void setMaxFileSize(DataSize maxFileSize) {
        this.maxFileSize = maxFileSize;
    }

    public int getUploadParallelism() {
        return uploadParallelism;
    }

    public void setUploadParallelism(int uploadParallelism) {
        this.uploadParallelism = uploadParallelism;
    }

    /**
     * Check if a file extension is allowed.
     * Performs case-insensitive comparison; the extension must include the leading dot.
     * @param extension The extension to check, e.g. ".jpg"
     * @return true if the extension is in the allowed list
     */
    public boolean isAllowedExtension(String extension) {
        if (extension == null || allowedExtensions == null || allowedExtensions.isEmpty()) {
            return false;
        }
        String normalized = extension.toLowerCase(Locale.ROOT).trim();
        return allowedExtensions.stream()
                .map(ext -> ext.toLowerCase(Locale.ROOT).trim())
                .anyMatch(ext -> ext.equals(normalized));
    }

    public static class ThumbnailSize {

        private String name;
        private int width;
        private int height;

        public ThumbnailSize() {
        }

        public ThumbnailSize(String name, int width, int height) {
            this.name = name;
            this.width = width;
            this.height = height;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public int getWidth() {
            return width;
        }

        public void setWidth(int width) {
            this.width = width;
        }

        public int getHeight() {
            return height;
        }

        public void setHeight(int height) {
            this.height = height;
        }
    }
}
