package com.starscape.photolog.features.uploadphoto.app;

import com.starscape.photolog.common.config.ProcessingProperties;
import com.starscape.photolog.common.config.StorageProperties;
import com.starscape.photolog.common.config.StorageType;
import com.starscape.photolog.common.exception.ImageValidationException;
import com.starscape.photolog.common.exception.NotFoundException;
import com.starscape.photolog.features.blobstore.domain.BlobInfo;
import com.starscape.photolog.features.blobstore.domain.BlobStore;
import com.starscape.photolog.features.blobstore.domain.StoredBlob;
import com.starscape.photolog.features.metadata.domain.ExifInfo;
import com.starscape.photolog.features.metadata.domain.GeoDistance;
import com.starscape.photolog.features.metadata.domain.PageQuery;
import com.starscape.photolog.features.metadata.domain.PhotoLocation;
import com.starscape.photolog.features.metadata.domain.PhotoMetadataStore;
import com.starscape.photolog.features.metadata.domain.PhotoPage;
import com.starscape.photolog.features.metadata.domain.PhotoRecord;
import com.starscape.photolog.features.metadata.domain.UploadStatus;
import com.starscape.photolog.features.thumbnail.app.ThumbnailDeriver;
import com.starscape.photolog.features.thumbnail.domain.DerivedThumbnail;
import com.starscape.photolog.features.thumbnail.domain.ThumbnailPolicy;
import com.starscape.photolog.features.thumbnail.domain.ThumbnailSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.support.AopUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Ingests photos across the blob store and the metadata store, which share no transaction.
 * <p>
 * Every upload runs the same sequence:
 * <ol>
 *   <li>validate the bytes; nothing is written for a rejected image</li>
 *   <li>reserve a metadata record in {@code uploading}</li>
 *   <li>store the original as {@code photos/{id}{ext}}</li>
 *   <li>store thumbnails as {@code thumbnails/{id}_{size}.jpg}; a failed size is dropped</li>
 *   <li>write the URLs and mark the record {@code completed}</li>
 * </ol>
 * A failure after step 2 marks the record {@code failed} on a best-effort basis. A record can only
 * leave {@code uploading} after the original has been written or attempted, and records stranded
 * in {@code uploading} are picked up by the stale-upload sweep.
 */
@Service
public class PhotoIngestionService {

    private static final Logger log = LoggerFactory.getLogger(PhotoIngestionService.class);

    static final String ORIGINAL_PREFIX = "photos/";
    static final String THUMBNAIL_PREFIX = "thumbnails/";
    private static final int MAX_SEARCH_RESULTS = 100;

    private final BlobStore blobStore;
    private final PhotoMetadataStore metadataStore;
    private final ThumbnailDeriver thumbnailDeriver;
    private final ImageValidator imageValidator;
    private final ExifExtractor exifExtractor;
    private final ProcessingProperties processingProperties;
    private final StorageType storageType;
    private final Executor thumbnailUploadExecutor;
    private final Clock clock;

    public PhotoIngestionService(
            BlobStore blobStore,
            PhotoMetadataStore metadataStore,
            ThumbnailDeriver thumbnailDeriver,
            ImageValidator imageValidator,
            ExifExtractor exifExtractor,
            ProcessingProperties processingProperties,
            StorageProperties storageProperties,
            @Qualifier("thumbnailUploadExecutor") Executor thumbnailUploadExecutor,
            Clock clock) {
        this.blobStore = blobStore;
        this.metadataStore = metadataStore;
        this.thumbnailDeriver = thumbnailDeriver;
        this.imageValidator = imageValidator;
        this.exifExtractor = exifExtractor;
        this.processingProperties = processingProperties;
        this.storageType = storageProperties.getType();
        this.thumbnailUploadExecutor = thumbnailUploadExecutor;
        this.clock = clock;
    }

    /**
     * Run the full ingestion sequence for one photo. Never throws for backend failures;
     * the result names the stage that failed.
     */
    public UploadResult upload(UploadCommand command) {
        long fileSize = command.content().length;

        ValidatedImage image;
        try {
            image = imageValidator.validate(command.content(), command.filename());
        } catch (ImageValidationException e) {
            log.warn("Rejected upload: filename={}, reason={}", command.filename(), e.getMessage());
            return UploadResult.failed(null, UploadStage.VALIDATION, e.getMessage(), fileSize, storageType);
        }

        String photoId = UUID.randomUUID().toString();
        UploadStage stage = UploadStage.METADATA_RESERVE;
        try {
            metadataStore.upsert(reserveRecord(photoId, command, image));
            log.info("Reserved photo record: photoId={}, filename={}", photoId, command.filename());

            stage = UploadStage.FILE_UPLOAD;
            StoredBlob original = blobStore.put(
                    command.content(),
                    originalObjectName(photoId, image.extension()),
                    image.contentType(),
                    originalTags(photoId, command, image));

            stage = UploadStage.THUMBNAIL_GENERATION;
            Map<String, DerivedThumbnail> thumbnails = thumbnailsFor(photoId, command);

            stage = UploadStage.THUMBNAIL_UPLOAD;
            Map<String, String> thumbnailUrls = uploadThumbnails(photoId, thumbnails);

            stage = UploadStage.METADATA_FINALIZE;
            return finalizeUpload(photoId, original, thumbnailUrls, fileSize);
        } catch (RuntimeException e) {
            return abort(photoId, stage, e, fileSize);
        }
    }

    public PhotoRecord getPhoto(String photoId) {
        return metadataStore.get(photoId)
                .orElseThrow(() -> new NotFoundException("Photo not found: " + photoId));
    }

    public PhotoPage listPhotos(PageQuery query) {
        return metadataStore.list(query);
    }

    public List<PhotoRecord> searchByLocation(double latitude, double longitude, double radiusKm, int limit) {
        GeoDistance.validateCoordinates(latitude, longitude);
        if (!(radiusKm > 0)) {
            throw new IllegalArgumentException("Radius must be positive: " + radiusKm);
        }
        int effectiveLimit = Math.max(1, Math.min(MAX_SEARCH_RESULTS, limit));
        return metadataStore.searchByLocation(latitude, longitude, radiusKm, effectiveLimit);
    }

    /**
     * Remove the original, every thumbnail and then the metadata record. Blob removal is
     * best-effort: a blob that cannot be removed is logged and does not stop the record delete.
     */
    public void deletePhoto(String photoId) {
        PhotoRecord record = getPhoto(photoId);

        for (String objectName : objectNamesOf(record)) {
            try {
                if (blobStore.delete(objectName)) {
                    log.debug("Deleted blob of photo {}: {}", photoId, objectName);
                }
            } catch (RuntimeException e) {
                log.warn("Failed to delete blob of photo {}: {}", photoId, objectName, e);
            }
        }

        if (!metadataStore.delete(photoId)) {
            throw new NotFoundException("Photo not found: " + photoId);
        }
        log.info("Deleted photo: photoId={}", photoId);
    }

    public List<BlobInfo> listObjects(String prefix) {
        return blobStore.list(prefix);
    }

    public StorageInfo storageInfo() {
        return new StorageInfo(
                storageType,
                AopUtils.getTargetClass(blobStore).getSimpleName(),
                AopUtils.getTargetClass(metadataStore).getSimpleName(),
                thumbnailDeriver.defaultSpecs());
    }

    static String originalObjectName(String photoId, String extension) {
        return ORIGINAL_PREFIX + photoId + extension;
    }

    static String thumbnailObjectName(String photoId, String sizeName) {
        return THUMBNAIL_PREFIX + photoId + "_" + sizeName + ".jpg";
    }

    private PhotoRecord reserveRecord(String photoId, UploadCommand command, ValidatedImage image) {
        ExifInfo exif = command.exif();
        PhotoLocation location = command.location();
        if (exif == null || location == null || !location.hasCoordinates()) {
            ExifExtractor.Extracted extracted = exifExtractor.extract(command.content());
            if (exif == null) {
                exif = extracted.exif();
            }
            location = mergeLocation(location, extracted.location());
        }

        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        return PhotoRecord.reserved(
                photoId,
                command.filename(),
                command.description(),
                command.content().length,
                image.contentType(),
                location,
                exif,
                command.tags(),
                now);
    }

    /**
     * Caller-supplied location wins; GPS coordinates from the image fill in when the caller gave none.
     */
    private static PhotoLocation mergeLocation(PhotoLocation supplied, PhotoLocation fromImage) {
        if (supplied == null) {
            return fromImage;
        }
        if (supplied.hasCoordinates() || fromImage == null) {
            return supplied;
        }
        return new PhotoLocation(fromImage.latitude(), fromImage.longitude(),
                supplied.address(), supplied.city(), supplied.country());
    }

    private Map<String, DerivedThumbnail> thumbnailsFor(String photoId, UploadCommand command) {
        if (!command.preRenderedThumbnails().isEmpty()) {
            Map<String, DerivedThumbnail> supplied = new LinkedHashMap<>();
            command.preRenderedThumbnails().forEach((name, data) -> {
                if (ThumbnailSpec.isValidName(name) && data != null && data.length > 0) {
                    supplied.put(name, new DerivedThumbnail(data, 0, 0));
                } else {
                    log.warn("Ignoring pre-rendered thumbnail {} for photo {}", name, photoId);
                }
            });
            if (!supplied.isEmpty()) {
                log.debug("Using {} pre-rendered thumbnails for photo {}", supplied.size(), photoId);
                return supplied;
            }
        }

        List<ThumbnailSpec> specs = command.thumbnailSpecs() != null
                ? command.thumbnailSpecs()
                : thumbnailDeriver.defaultSpecs();
        ThumbnailPolicy policy = command.thumbnailPolicy() != null
                ? command.thumbnailPolicy()
                : thumbnailDeriver.defaultPolicy();
        try {
            return thumbnailDeriver.derive(command.content(), specs, policy);
        } catch (RuntimeException e) {
            log.warn("Thumbnail generation failed for photo {}; continuing without thumbnails", photoId, e);
            return Map.of();
        }
    }

    /**
     * Upload every thumbnail on the bounded executor and wait for all of them. Returns the URLs of the
     * sizes that were stored, in the order they were rendered.
     */
    private Map<String, String> uploadThumbnails(String photoId, Map<String, DerivedThumbnail> thumbnails) {
        Map<String, CompletableFuture<String>> uploads = new LinkedHashMap<>();
        thumbnails.forEach((name, thumbnail) -> uploads.put(name, submitThumbnailUpload(photoId, name, thumbnail)));

        CompletableFuture.allOf(uploads.values().toArray(new CompletableFuture[0]))
                .exceptionally(ex -> null)
                .join();

        Map<String, String> urls = new LinkedHashMap<>();
        uploads.forEach((name, upload) -> {
            try {
                urls.put(name, upload.join());
            } catch (CompletionException e) {
                log.warn("Thumbnail upload failed: photoId={}, size={}", photoId, name, e.getCause());
            }
        });
        if (urls.size() < thumbnails.size()) {
            log.warn("Photo {} stored with {} of {} thumbnails", photoId, urls.size(), thumbnails.size());
        }
        return urls;
    }

    private CompletableFuture<String> submitThumbnailUpload(String photoId, String name, DerivedThumbnail thumbnail) {
        try {
            return CompletableFuture.supplyAsync(() -> blobStore.put(
                    thumbnail.data(),
                    thumbnailObjectName(photoId, name),
                    "image/jpeg",
                    thumbnailTags(photoId, name, thumbnail)).url(), thumbnailUploadExecutor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Both metadata writes are attempted even if the first one fails.
     */
    private UploadResult finalizeUpload(String photoId, StoredBlob original, Map<String, String> thumbnailUrls, long fileSize) {
        List<String> errors = new ArrayList<>();

        try {
            if (!metadataStore.updateUrls(photoId, original.url(), thumbnailUrls)) {
                errors.add("record missing while writing URLs");
            }
        } catch (RuntimeException e) {
            log.error("Failed to write URLs for photo {}", photoId, e);
            errors.add("URL update failed: " + e.getMessage());
        }

        try {
            if (!metadataStore.updateStatus(photoId, UploadStatus.COMPLETED)) {
                errors.add("record missing while marking completed");
            }
        } catch (RuntimeException e) {
            log.error("Failed to mark photo {} completed", photoId, e);
            errors.add("status update failed: " + e.getMessage());
        }

        if (!errors.isEmpty()) {
            log.error("Photo {} is inconsistent: original stored at {} but metadata not finalized ({})",
                    photoId, original.url(), String.join("; ", errors));
            return UploadResult.inconsistent(photoId, original.url(), thumbnailUrls, fileSize, storageType,
                    String.join("; ", errors));
        }

        log.info("Photo uploaded: photoId={}, thumbnails={}", photoId, thumbnailUrls.keySet());
        return UploadResult.completed(photoId, original.url(), thumbnailUrls, fileSize, storageType);
    }

    private UploadResult abort(String photoId, UploadStage stage, RuntimeException cause, long fileSize) {
        log.error("Upload failed: photoId={}, stage={}", photoId, stage.wireValue(), cause);
        if (!stage.isAfterReserve()) {
            return UploadResult.failed(null, stage, cause.getMessage(), fileSize, storageType);
        }
        markFailed(photoId);
        return UploadResult.failed(photoId, stage, cause.getMessage(), fileSize, storageType);
    }

    private void markFailed(String photoId) {
        try {
            if (metadataStore.updateStatus(photoId, UploadStatus.FAILED)) {
                log.info("Compensation: marked photo {} failed", photoId);
            } else {
                log.warn("Compensation: photo {} not found while marking failed", photoId);
            }
        } catch (RuntimeException e) {
            log.error("Compensation failed: photo {} left in uploading for the stale-upload sweep", photoId, e);
        }
    }

    private Set<String> objectNamesOf(PhotoRecord record) {
        Set<String> names = new LinkedHashSet<>();

        String urlPrefix = blobStore.url("");
        if (!record.fileUrl().isEmpty() && record.fileUrl().startsWith(urlPrefix)) {
            names.add(record.fileUrl().substring(urlPrefix.length()));
        } else {
            // URL never written; try every name the original could have been stored under
            for (String extension : processingProperties.getAllowedExtensions()) {
                names.add(originalObjectName(record.id(), extension.toLowerCase(Locale.ROOT)));
            }
        }

        Set<String> sizes = new LinkedHashSet<>(record.thumbnailUrls().keySet());
        thumbnailDeriver.defaultSpecs().forEach(spec -> sizes.add(spec.name()));
        sizes.forEach(size -> names.add(thumbnailObjectName(record.id(), size)));
        return names;
    }

    private static Map<String, String> originalTags(String photoId, UploadCommand command, ValidatedImage image) {
        Map<String, String> tags = new HashMap<>();
        tags.put("photo_id", photoId);
        if (command.filename() != null) {
            tags.put("original_filename", command.filename());
        }
        tags.put("width", String.valueOf(image.width()));
        tags.put("height", String.valueOf(image.height()));
        return tags;
    }

    private static Map<String, String> thumbnailTags(String photoId, String name, DerivedThumbnail thumbnail) {
        Map<String, String> tags = new HashMap<>();
        tags.put("photo_id", photoId);
        tags.put("thumbnail_size", name);
        if (thumbnail.width() > 0 && thumbnail.height() > 0) {
            tags.put("width", String.valueOf(thumbnail.width()));
            tags.put("height", String.valueOf(thumbnail.height()));
        }
        return tags;
    }
}
