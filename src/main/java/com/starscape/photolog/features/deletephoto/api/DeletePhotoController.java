package com.starscape.photolog.features.deletephoto.api;

import com.starscape.photolog.features.uploadphoto.app.PhotoIngestionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Controller for photo deletion.
 */
@RestController
@RequestMapping("/api/photos")
public class DeletePhotoController {

    private final PhotoIngestionService ingestionService;

    public DeletePhotoController(PhotoIngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    /**
     * Delete a photo, its original and its thumbnails.
     * DELETE /api/photos/{photoId}
     */
    @DeleteMapping("/{photoId}")
    public ResponseEntity<Void> deletePhoto(@PathVariable String photoId) {
        ingestionService.deletePhoto(photoId);
        return ResponseEntity.status(HttpStatus.NO_CONTENT).build();
    }
}
