package com.starscape.photolog.features.storageinfo.api;

import com.starscape.photolog.common.exception.NotFoundException;
import com.starscape.photolog.features.blobstore.domain.BlobInfo;
import com.starscape.photolog.features.blobstore.domain.BlobStore;
import com.starscape.photolog.features.uploadphoto.app.PhotoIngestionService;
import com.starscape.photolog.features.uploadphoto.app.StorageInfo;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Storage introspection, plus the endpoint that makes filesystem blob URLs resolvable.
 */
@RestController
public class StorageController {

    private final PhotoIngestionService ingestionService;
    private final BlobStore blobStore;

    public StorageController(PhotoIngestionService ingestionService, BlobStore blobStore) {
        this.ingestionService = ingestionService;
        this.blobStore = blobStore;
    }

    @GetMapping("/api/storage/info")
    public ResponseEntity<StorageInfo> info() {
        return ResponseEntity.ok(ingestionService.storageInfo());
    }

    /**
     * GET /api/storage/objects?prefix=thumbnails/
     * Newest first.
     */
    @GetMapping("/api/storage/objects")
    public ResponseEntity<List<BlobInfo>> listObjects(@RequestParam(defaultValue = "") String prefix) {
        return ResponseEntity.ok(ingestionService.listObjects(prefix));
    }

    /**
     * Serve a stored object by name, e.g. GET /storage/photos/{id}.jpg
     */
    @GetMapping("/storage/{*objectName}")
    public ResponseEntity<byte[]> serve(@PathVariable String objectName) {
        String name = objectName.startsWith("/") ? objectName.substring(1) : objectName;
        byte[] content = blobStore.get(name)
                .orElseThrow(() -> new NotFoundException("Object not found: " + name));
        MediaType mediaType = MediaTypeFactory.getMediaType(name).orElse(MediaType.APPLICATION_OCTET_STREAM);
        return ResponseEntity.ok().contentType(mediaType).body(content);
    }
}
