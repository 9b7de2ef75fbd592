package com.starscape.photolog.features.metadata.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * Camera data read from the image. Every field is optional.
 *
 * @param aperture f-number, e.g. 2.8
 * @param shutterSpeed exposure time as displayed by cameras, e.g. "1/125"
 * @param focalLength millimetres
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ExifInfo(
    String cameraMake,
    String cameraModel,
    Instant takenAt,
    Integer iso,
    Double aperture,
    String shutterSpeed,
    Double focalLength
) {

    @JsonIgnore
    public boolean isEmpty() {
        return cameraMake == null && cameraModel == null && takenAt == null && iso == null
                && aperture == null && shutterSpeed == null && focalLength == null;
    }
}
