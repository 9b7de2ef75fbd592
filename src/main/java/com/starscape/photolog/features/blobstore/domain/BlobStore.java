package com.starscape.photolog.features.blobstore.domain;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Flat namespace of named binary objects.
 * <p>
 * Implementations are thread-safe and never retry. Every backend failure surfaces as
 * {@link com.starscape.photolog.common.exception.StorageUnavailableException}.
 */
public interface BlobStore {

    /**
     * Store {@code content} under {@code name}, replacing any existing object with that name.
     * Writing the same bytes twice leaves the store in the same state as writing them once.
     *
     * @param tags optional string metadata kept alongside the object, may be empty
     */
    StoredBlob put(byte[] content, String name, String contentType, Map<String, String> tags);

    Optional<byte[]> get(String name);

    /**
     * @return true if an object existed and was removed; false if there was nothing to remove
     */
    boolean delete(String name);

    /**
     * Public URL of an object. Pure function of the name and configuration; performs no I/O.
     */
    String url(String name);

    /**
     * Objects whose names start with {@code prefix}.
     * <p>
     * The order is backend-specific but stable across calls on an unchanged store: the filesystem
     * backend lists newest first with ties broken by name, object storage lists in key order.
     * Backends may cap the number of entries returned.
     */
    List<BlobInfo> list(String prefix);
}
