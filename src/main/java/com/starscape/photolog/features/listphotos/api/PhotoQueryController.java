package com.starscape.photolog.features.listphotos.api;

import com.starscape.photolog.features.metadata.domain.PageQuery;
import com.starscape.photolog.features.metadata.domain.PhotoPage;
import com.starscape.photolog.features.metadata.domain.PhotoRecord;
import com.starscape.photolog.features.uploadphoto.app.PhotoIngestionService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read side: paged listing, single record and radius search.
 */
@RestController
@RequestMapping("/api/photos")
public class PhotoQueryController {

    private final PhotoIngestionService ingestionService;

    public PhotoQueryController(PhotoIngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    /**
     * GET /api/photos?limit=20&page=2&orderBy=filename&direction=asc
     * Unknown orderBy values sort by upload time; unknown directions sort descending.
     */
    @GetMapping
    public ResponseEntity<PhotoPage> listPhotos(
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String page,
            @RequestParam(required = false) String orderBy,
            @RequestParam(required = false) String direction) {
        PageQuery query = PageQuery.of(limit, page, orderBy, direction);
        return ResponseEntity.ok(ingestionService.listPhotos(query));
    }

    @GetMapping("/{photoId}")
    public ResponseEntity<PhotoRecord> getPhoto(@PathVariable String photoId) {
        return ResponseEntity.ok(ingestionService.getPhoto(photoId));
    }

    @GetMapping("/search/location")
    public ResponseEntity<List<PhotoRecord>> searchByLocation(
            @RequestParam double lat,
            @RequestParam double lon,
            @RequestParam(defaultValue = "10") double radiusKm,
            @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(ingestionService.searchByLocation(lat, lon, radiusKm, limit));
    }
}
