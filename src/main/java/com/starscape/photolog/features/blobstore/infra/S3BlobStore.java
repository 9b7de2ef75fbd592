package com.starscape.photolog.features.blobstore.infra;

import com.starscape.photolog.common.exception.StorageUnavailableException;
import com.starscape.photolog.features.blobstore.domain.BlobInfo;
import com.starscape.photolog.features.blobstore.domain.BlobStore;
import com.starscape.photolog.features.blobstore.domain.StoredBlob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Blob store over an S3-compatible object storage bucket.
 */
public class S3BlobStore implements BlobStore {

    private static final Logger log = LoggerFactory.getLogger(S3BlobStore.class);

    static final int MAX_LIST_RESULTS = 1000;
    private static final int LIST_PAGE_SIZE = 250;

    private final S3Client s3Client;
    private final String bucket;
    private final String publicBaseUrl;

    public S3BlobStore(S3Client s3Client, String bucket, String publicBaseUrl) {
        this.s3Client = s3Client;
        this.bucket = bucket;
        this.publicBaseUrl = publicBaseUrl.endsWith("/")
                ? publicBaseUrl.substring(0, publicBaseUrl.length() - 1)
                : publicBaseUrl;
    }

    /**
     * Object storage style public prefix: {@code https://<host>/n/<namespace>/b/<bucket>/o}.
     */
    public static String publicBaseUrl(String host, String namespace, String bucket) {
        return "https://" + host + "/n/" + namespace + "/b/" + bucket + "/o";
    }

    @Override
    public StoredBlob put(byte[] content, String name, String contentType, Map<String, String> tags) {
        try {
            PutObjectRequest putRequest = PutObjectRequest.builder()
                    .bucket(bucket)
                    .key(name)
                    .contentType(contentType)
                    .metadata(asciiSafe(tags))
                    .build();

            PutObjectResponse response = s3Client.putObject(putRequest, RequestBody.fromBytes(content));
            String etag = stripQuotes(response.eTag());
            log.debug("Uploaded object: bucket={}, key={}, size={}", bucket, name, content.length);
            return new StoredBlob(name, url(name), etag, content.length);
        } catch (SdkException e) {
            throw new StorageUnavailableException("Failed to upload object " + name, e);
        }
    }

    @Override
    public Optional<byte[]> get(String name) {
        try {
            ResponseBytes<GetObjectResponse> bytes = s3Client.getObjectAsBytes(GetObjectRequest.builder()
                    .bucket(bucket)
                    .key(name)
                    .build());
            return Optional.of(bytes.asByteArray());
        } catch (NoSuchKeyException e) {
            return Optional.empty();
        } catch (SdkException e) {
            throw new StorageUnavailableException("Failed to read object " + name, e);
        }
    }

    @Override
    public boolean delete(String name) {
        try {
            if (!exists(name)) {
                log.debug("Object does not exist (already deleted?): bucket={}, key={}", bucket, name);
                return false;
            }
            s3Client.deleteObject(DeleteObjectRequest.builder()
                    .bucket(bucket)
                    .key(name)
                    .build());
            log.info("Deleted object: bucket={}, key={}", bucket, name);
            return true;
        } catch (SdkException e) {
            throw new StorageUnavailableException("Failed to delete object " + name, e);
        }
    }

    @Override
    public String url(String name) {
        return publicBaseUrl + "/" + name;
    }

    /**
     * Objects in S3 key order, fetched page by page and capped at {@value #MAX_LIST_RESULTS} entries.
     */
    @Override
    public List<BlobInfo> list(String prefix) {
        ListObjectsV2Request request = ListObjectsV2Request.builder()
                .bucket(bucket)
                .prefix(prefix == null ? "" : prefix)
                .maxKeys(LIST_PAGE_SIZE)
                .build();
        try {
            return s3Client.listObjectsV2Paginator(request).contents().stream()
                    .limit(MAX_LIST_RESULTS)
                    .map(object -> new BlobInfo(
                            object.key(),
                            object.size() == null ? 0L : object.size(),
                            object.lastModified() == null ? Instant.EPOCH : object.lastModified(),
                            url(object.key())))
                    .toList();
        } catch (SdkException e) {
            throw new StorageUnavailableException("Failed to list objects under " + prefix, e);
        }
    }

    private boolean exists(String name) {
        try {
            s3Client.headObject(HeadObjectRequest.builder()
                    .bucket(bucket)
                    .key(name)
                    .build());
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return false;
            }
            throw e;
        }
    }

    /**
     * User metadata travels as HTTP headers, so keys and values are reduced to printable ASCII.
     * Pairs that end up empty are dropped.
     */
    static Map<String, String> asciiSafe(Map<String, String> tags) {
        Map<String, String> safe = new HashMap<>();
        if (tags != null) {
            tags.forEach((key, value) -> {
                String safeKey = printableAscii(key);
                String safeValue = printableAscii(value);
                if (!safeKey.isEmpty() && !safeValue.isEmpty()) {
                    safe.put(safeKey, safeValue);
                }
            });
        }
        safe.put("upload_timestamp", Instant.now().toString());
        return safe;
    }

    private static String printableAscii(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c >= 0x20 && c < 0x7f) {
                sb.append(c);
            }
        }
        return sb.toString().trim();
    }

    private static String stripQuotes(String etag) {
        if (etag == null) {
            return null;
        }
        return etag.replace("\"", "");
    }
}
