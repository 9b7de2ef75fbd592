package com.starscape.photolog.features.reconcile.api;

import com.starscape.photolog.common.config.ReconcilerProperties;
import com.starscape.photolog.features.reconcile.app.StaleUploadReconciler;
import com.starscape.photolog.features.reconcile.app.SweepResult;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin")
public class ReconciliationController {

    private final StaleUploadReconciler reconciler;
    private final ReconcilerProperties reconcilerProperties;

    public ReconciliationController(StaleUploadReconciler reconciler, ReconcilerProperties reconcilerProperties) {
        this.reconciler = reconciler;
        this.reconcilerProperties = reconcilerProperties;
    }

    /**
     * Run a stale-upload sweep now.
     * POST /api/admin/reconcile?hoursOld=1 (defaults to the configured threshold)
     */
    @PostMapping("/reconcile")
    public ResponseEntity<SweepResult> reconcile(@RequestParam(required = false) Integer hoursOld) {
        int threshold = hoursOld != null ? hoursOld : reconcilerProperties.getStaleThresholdHours();
        return ResponseEntity.ok(reconciler.sweep(threshold));
    }
}
