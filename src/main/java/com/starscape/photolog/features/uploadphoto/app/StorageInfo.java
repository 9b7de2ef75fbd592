package com.starscape.photolog.features.uploadphoto.app;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.starscape.photolog.common.config.StorageType;
import com.starscape.photolog.features.thumbnail.domain.ThumbnailSpec;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StorageInfo(
    StorageType storageType,
    String blobStore,
    String metadataStore,
    List<ThumbnailSpec> thumbnailSizes
) {
}
