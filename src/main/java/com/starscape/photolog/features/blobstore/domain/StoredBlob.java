package com.starscape.photolog.features.blobstore.domain;

public record StoredBlob(String name, String url, String etag, long size) {
}
