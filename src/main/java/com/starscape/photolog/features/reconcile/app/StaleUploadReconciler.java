package com.starscape.photolog.features.reconcile.app;

import com.starscape.photolog.features.metadata.domain.PhotoMetadataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Marks records stuck in {@code uploading} as {@code failed}. An upload that crashed or lost its
 * metadata connection mid-way leaves such a record behind; once it is older than the threshold no
 * live upload can still own it.
 * <p>
 * Running a sweep twice in a row transitions nothing the second time.
 */
@Service
public class StaleUploadReconciler {

    private static final Logger log = LoggerFactory.getLogger(StaleUploadReconciler.class);

    private final PhotoMetadataStore metadataStore;

    public StaleUploadReconciler(PhotoMetadataStore metadataStore) {
        this.metadataStore = metadataStore;
    }

    public SweepResult sweep(int hoursOld) {
        if (hoursOld < 0) {
            throw new IllegalArgumentException("hoursOld must not be negative: " + hoursOld);
        }
        List<String> photoIds = metadataStore.cleanupStale(hoursOld);
        if (photoIds.isEmpty()) {
            log.debug("Stale-upload sweep found nothing older than {}h", hoursOld);
        } else {
            log.info("Stale-upload sweep marked {} records failed: {}", photoIds.size(), photoIds);
        }
        return SweepResult.of(photoIds);
    }
}
