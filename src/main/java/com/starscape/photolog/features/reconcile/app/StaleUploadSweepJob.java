package com.starscape.photolog.features.reconcile.app;

import com.starscape.photolog.common.config.ReconcilerProperties;
import com.starscape.photolog.common.exception.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic stale-upload sweep. Disabled with app.reconciler.enabled=false.
 */
@Component
@ConditionalOnProperty(prefix = "app.reconciler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class StaleUploadSweepJob {

    private static final Logger log = LoggerFactory.getLogger(StaleUploadSweepJob.class);

    private final StaleUploadReconciler reconciler;
    private final ReconcilerProperties reconcilerProperties;

    public StaleUploadSweepJob(StaleUploadReconciler reconciler, ReconcilerProperties reconcilerProperties) {
        this.reconciler = reconciler;
        this.reconcilerProperties = reconcilerProperties;
    }

    @Scheduled(
        fixedDelayString = "${app.reconciler.interval:PT1H}",
        initialDelayString = "${app.reconciler.initial-delay:PT1M}"
    )
    public void run() {
        try {
            reconciler.sweep(reconcilerProperties.getStaleThresholdHours());
        } catch (StorageUnavailableException e) {
            // Next scheduled run retries
            log.warn("Stale-upload sweep skipped, metadata store unavailable: {}", e.getMessage());
        }
    }
}
