package com.starscape.photolog.features.uploadphoto.api;

import com.starscape.photolog.features.metadata.domain.GeoDistance;
import com.starscape.photolog.features.metadata.domain.PhotoLocation;
import com.starscape.photolog.features.thumbnail.domain.ThumbnailPolicy;
import com.starscape.photolog.features.uploadphoto.app.PhotoIngestionService;
import com.starscape.photolog.features.uploadphoto.app.UploadCommand;
import com.starscape.photolog.features.uploadphoto.app.UploadResult;
import com.starscape.photolog.features.uploadphoto.app.UploadStage;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.Locale;

/**
 * Controller for photo uploads.
 * Runs the whole ingestion synchronously and reports the outcome as an {@link UploadResult}.
 */
@RestController
@RequestMapping("/api/photos")
public class UploadPhotoController {

    private final PhotoIngestionService ingestionService;

    public UploadPhotoController(PhotoIngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    /**
     * Upload one photo.
     * POST /api/photos (multipart/form-data)
     * <p>
     * 201 when stored, 400 when the image was rejected, 502 when a storage backend failed.
     */
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<UploadResult> upload(
            @RequestPart("file") MultipartFile file,
            @RequestParam(required = false) String description,
            @RequestParam(required = false) List<String> tags,
            @RequestParam(required = false) Double latitude,
            @RequestParam(required = false) Double longitude,
            @RequestParam(required = false) String address,
            @RequestParam(required = false) String city,
            @RequestParam(required = false) String country,
            @RequestParam(required = false) String policy) throws IOException {

        UploadCommand command = UploadCommand.builder(file.getBytes(), file.getOriginalFilename())
                .contentType(file.getContentType())
                .description(description)
                .tags(tags)
                .location(toLocation(latitude, longitude, address, city, country))
                .thumbnailPolicy(parsePolicy(policy))
                .build();

        UploadResult result = ingestionService.upload(command);
        return ResponseEntity.status(statusOf(result)).body(result);
    }

    private static HttpStatus statusOf(UploadResult result) {
        if (result.success()) {
            return HttpStatus.CREATED;
        }
        if (result.stage() == UploadStage.VALIDATION) {
            return HttpStatus.BAD_REQUEST;
        }
        return HttpStatus.BAD_GATEWAY;
    }

    private static PhotoLocation toLocation(Double latitude, Double longitude, String address, String city, String country) {
        if (latitude == null && longitude == null && address == null && city == null && country == null) {
            return null;
        }
        if ((latitude == null) != (longitude == null)) {
            throw new IllegalArgumentException("latitude and longitude must be given together");
        }
        if (latitude != null) {
            GeoDistance.validateCoordinates(latitude, longitude);
        }
        return new PhotoLocation(latitude, longitude, address, city, country);
    }

    private static ThumbnailPolicy parsePolicy(String policy) {
        if (policy == null || policy.isBlank()) {
            return null;
        }
        try {
            return ThumbnailPolicy.valueOf(policy.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown thumbnail policy: " + policy);
        }
    }
}
