package com.starscape.photolog.features.metadata.domain;

public record PhotoLocation(
    Double latitude,
    Double longitude,
    String address,
    String city,
    String country
) {

    public boolean hasCoordinates() {
        return latitude != null && longitude != null;
    }
}
