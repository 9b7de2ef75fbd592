package com.starscape.photolog.features.blobstore.domain;

import java.time.Instant;

public record BlobInfo(String name, long size, Instant lastModified, String url) {
}
