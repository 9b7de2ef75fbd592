package com.starscape.photolog.features.blobstore.infra;

import com.starscape.photolog.common.exception.StorageUnavailableException;
import com.starscape.photolog.features.blobstore.domain.BlobInfo;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Object;
import software.amazon.awssdk.services.s3.paginators.ListObjectsV2Iterable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class S3BlobStoreTest {

    @Mock
    private S3Client s3Client;

    @Test
    void urlsFollowThePublicObjectLayout() {
        S3BlobStore store = new S3BlobStore(s3Client, "photos-bucket",
                S3BlobStore.publicBaseUrl("objectstorage.ap-chuncheon-1.oraclecloud.com", "ns1", "photos-bucket"));

        assertEquals("https://objectstorage.ap-chuncheon-1.oraclecloud.com/n/ns1/b/photos-bucket/o/photos/abc.jpg",
                store.url("photos/abc.jpg"));
    }

    @Test
    void metadataIsReducedToPrintableAscii() {
        Map<String, String> tags = new HashMap<>();
        tags.put("original_filename", "서울 trip.jpg");
        tags.put("photo_id", "abc");
        tags.put("empty", "한글");

        Map<String, String> safe = S3BlobStore.asciiSafe(tags);

        assertEquals("trip.jpg", safe.get("original_filename"));
        assertEquals("abc", safe.get("photo_id"));
        assertFalse(safe.containsKey("empty"));
        assertTrue(safe.containsKey("upload_timestamp"));
    }

    @Test
    void deleteOfMissingObjectReturnsFalseWithoutDeleting() {
        when(s3Client.headObject(any(HeadObjectRequest.class)))
                .thenThrow(NoSuchKeyException.builder().message("missing").build());
        S3BlobStore store = new S3BlobStore(s3Client, "bucket", "https://example.test/o");

        assertFalse(store.delete("photos/missing.jpg"));
        verify(s3Client, never()).deleteObject(any(DeleteObjectRequest.class));
    }

    @Test
    void clientFailuresSurfaceAsStorageUnavailable() {
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenThrow(SdkClientException.create("connection refused"));
        S3BlobStore store = new S3BlobStore(s3Client, "bucket", "https://example.test/o");

        assertThrows(StorageUnavailableException.class,
                () -> store.put(new byte[] {1}, "photos/a.jpg", "image/jpeg", Map.of()));
    }

    @Test
    void listKeepsKeyOrderAndStopsFetchingAtTheCap() {
        when(s3Client.listObjectsV2Paginator(any(ListObjectsV2Request.class)))
                .thenAnswer(invocation -> new ListObjectsV2Iterable(s3Client, invocation.getArgument(0)));
        when(s3Client.listObjectsV2(any(ListObjectsV2Request.class))).thenAnswer(invocation -> {
            ListObjectsV2Request request = invocation.getArgument(0);
            int pageIndex = request.continuationToken() == null ? 0 : Integer.parseInt(request.continuationToken());
            return listPage(pageIndex, 600);
        });
        S3BlobStore store = new S3BlobStore(s3Client, "bucket", "https://example.test/o");

        List<BlobInfo> listed = store.list("photos/");

        assertEquals(S3BlobStore.MAX_LIST_RESULTS, listed.size());
        assertEquals("photos/0000000.jpg", listed.get(0).name());
        assertEquals("photos/0000999.jpg", listed.get(999).name());
        assertEquals("https://example.test/o/photos/0000000.jpg", listed.get(0).url());
        verify(s3Client, times(2)).listObjectsV2(any(ListObjectsV2Request.class));
    }

    private static ListObjectsV2Response listPage(int pageIndex, int pageSize) {
        List<S3Object> contents = new ArrayList<>();
        for (int i = 0; i < pageSize; i++) {
            contents.add(S3Object.builder()
                    .key(String.format("photos/%07d.jpg", pageIndex * pageSize + i))
                    .size(10L)
                    .lastModified(Instant.parse("2024-01-01T00:00:00Z").minusSeconds(i))
                    .build());
        }
        return ListObjectsV2Response.builder()
                .contents(contents)
                .isTruncated(true)
                .nextContinuationToken(String.valueOf(pageIndex + 1))
                .build();
    }
}
