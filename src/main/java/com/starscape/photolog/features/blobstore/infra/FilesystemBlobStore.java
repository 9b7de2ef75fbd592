package com.starscape.photolog.features.blobstore.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.photolog.common.exception.StorageUnavailableException;
import com.starscape.photolog.features.blobstore.domain.BlobInfo;
import com.starscape.photolog.features.blobstore.domain.BlobStore;
import com.starscape.photolog.features.blobstore.domain.StoredBlob;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Blob store backed by a local directory. Each object may carry a {@code <name>.meta}
 * JSON side-car holding its content type, size, write time and tags.
 */
public class FilesystemBlobStore implements BlobStore {

    private static final Logger log = LoggerFactory.getLogger(FilesystemBlobStore.class);

    static final String META_SUFFIX = ".meta";
    private static final String TEMP_PREFIX = ".upload-";
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path baseDir;
    private final String baseUrl;
    private final ObjectMapper objectMapper;

    public FilesystemBlobStore(Path baseDir, String baseUrl, ObjectMapper objectMapper) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.objectMapper = objectMapper;
    }

    @Override
    public StoredBlob put(byte[] content, String name, String contentType, Map<String, String> tags) {
        Path target = resolve(name);
        try {
            Files.createDirectories(target.getParent());
            // Write next to the target, then rename, so readers never see a half-written object
            Path temp = Files.createTempFile(target.getParent(), TEMP_PREFIX, TEMP_SUFFIX);
            try {
                Files.write(temp, content);
                moveIntoPlace(temp, target);
            } finally {
                Files.deleteIfExists(temp);
            }
            writeSideCar(target, content.length, contentType, tags);
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to write object " + name, e);
        }

        String etag = DigestUtils.md5Hex(content);
        log.debug("Stored object: name={}, size={}, etag={}", name, content.length, etag);
        return new StoredBlob(name, url(name), etag, content.length);
    }

    @Override
    public Optional<byte[]> get(String name) {
        Path path = resolve(name);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(path));
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to read object " + name, e);
        }
    }

    @Override
    public boolean delete(String name) {
        Path path = resolve(name);
        try {
            boolean existed = Files.deleteIfExists(path);
            Files.deleteIfExists(sideCarOf(path));
            if (existed) {
                log.debug("Deleted object: {}", name);
            }
            return existed;
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to delete object " + name, e);
        }
    }

    @Override
    public String url(String name) {
        return baseUrl + "/" + name;
    }

    @Override
    public List<BlobInfo> list(String prefix) {
        if (!Files.isDirectory(baseDir)) {
            return List.of();
        }
        String effectivePrefix = prefix == null ? "" : prefix;
        List<BlobInfo> found = new ArrayList<>();
        try {
            Files.walkFileTree(baseDir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && !isInternalFile(file)) {
                        String name = objectName(file);
                        if (name.startsWith(effectivePrefix)) {
                            found.add(new BlobInfo(name, attrs.size(), attrs.lastModifiedTime().toInstant(), url(name)));
                        }
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                    // Deleted by a concurrent request between the directory read and the stat
                    if (exc instanceof NoSuchFileException) {
                        return FileVisitResult.CONTINUE;
                    }
                    throw exc;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                    if (exc != null && !(exc instanceof NoSuchFileException)) {
                        throw exc;
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to list objects under " + effectivePrefix, e);
        }
        found.sort(Comparator.comparing(BlobInfo::lastModified).reversed()
                .thenComparing(BlobInfo::name));
        return List.copyOf(found);
    }

    public Path getBaseDir() {
        return baseDir;
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void writeSideCar(Path target, long size, String contentType, Map<String, String> tags) throws IOException {
        Map<String, Object> sideCar = new LinkedHashMap<>();
        sideCar.put("content_type", contentType);
        sideCar.put("file_size", size);
        sideCar.put("upload_timestamp", Instant.now().toString());
        sideCar.put("tags", tags == null ? Map.of() : tags);
        Files.write(sideCarOf(target), objectMapper.writeValueAsBytes(sideCar));
    }

    private Path resolve(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Object name must not be blank");
        }
        if (name.endsWith(META_SUFFIX)) {
            throw new IllegalArgumentException("Object name must not end with " + META_SUFFIX + ": " + name);
        }
        Path path = baseDir.resolve(name).normalize();
        if (!path.startsWith(baseDir) || path.equals(baseDir)) {
            throw new IllegalArgumentException("Object name escapes the storage directory: " + name);
        }
        return path;
    }

    private String objectName(Path path) {
        return baseDir.relativize(path).toString().replace('\\', '/');
    }

    private static boolean isInternalFile(Path path) {
        String fileName = path.getFileName().toString();
        return fileName.endsWith(META_SUFFIX)
                || (fileName.startsWith(TEMP_PREFIX) && fileName.endsWith(TEMP_SUFFIX));
    }

    private static Path sideCarOf(Path path) {
        return path.resolveSibling(path.getFileName() + META_SUFFIX);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
