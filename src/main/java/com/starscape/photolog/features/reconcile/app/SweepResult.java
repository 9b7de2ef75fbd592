package com.starscape.photolog.features.reconcile.app;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * @param photoIds records moved from {@code uploading} to {@code failed} by this sweep
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SweepResult(int count, List<String> photoIds) {

    public SweepResult {
        photoIds = List.copyOf(photoIds);
    }

    static SweepResult of(List<String> photoIds) {
        return new SweepResult(photoIds.size(), photoIds);
    }
}
