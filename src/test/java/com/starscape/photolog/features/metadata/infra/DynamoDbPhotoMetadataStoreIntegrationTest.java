package com.starscape.photolog.features.metadata.infra;

import com.starscape.photolog.features.metadata.domain.PageQuery;
import com.starscape.photolog.features.metadata.domain.PhotoLocation;
import com.starscape.photolog.features.metadata.domain.PhotoPage;
import com.starscape.photolog.features.metadata.domain.PhotoRecord;
import com.starscape.photolog.features.metadata.domain.UploadStatus;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.localstack.LocalStackContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeDefinition;
import software.amazon.awssdk.services.dynamodb.model.BillingMode;
import software.amazon.awssdk.services.dynamodb.model.KeySchemaElement;
import software.amazon.awssdk.services.dynamodb.model.KeyType;
import software.amazon.awssdk.services.dynamodb.model.ScalarAttributeType;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.testcontainers.containers.localstack.LocalStackContainer.Service.DYNAMODB;

/**
 * Runs the DynamoDB metadata store against LocalStack. Skipped when Docker is not available.
 */
@Testcontainers(disabledWithoutDocker = true)
class DynamoDbPhotoMetadataStoreIntegrationTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Container
    static LocalStackContainer localstack = new LocalStackContainer(
            DockerImageName.parse("localstack/localstack:3.4.0"))
            .withServices(DYNAMODB);

    private static DynamoDbClient dynamoDbClient;

    private DynamoDbPhotoMetadataStore store;

    @BeforeAll
    static void createClient() {
        dynamoDbClient = DynamoDbClient.builder()
                .endpointOverride(localstack.getEndpointOverride(DYNAMODB))
                .credentialsProvider(StaticCredentialsProvider.create(
                        AwsBasicCredentials.create(localstack.getAccessKey(), localstack.getSecretKey())))
                .region(Region.of(localstack.getRegion()))
                .build();
    }

    @BeforeEach
    void createTable() {
        // Fresh table per test keeps scans independent
        String tableName = "photos-" + UUID.randomUUID();
        dynamoDbClient.createTable(b -> b
                .tableName(tableName)
                .keySchema(KeySchemaElement.builder().attributeName("id").keyType(KeyType.HASH).build())
                .attributeDefinitions(AttributeDefinition.builder()
                        .attributeName("id")
                        .attributeType(ScalarAttributeType.S)
                        .build())
                .billingMode(BillingMode.PAY_PER_REQUEST));
        dynamoDbClient.waiter().waitUntilTableExists(b -> b.tableName(tableName));
        store = new DynamoDbPhotoMetadataStore(dynamoDbClient, tableName, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void reserveFinalizeAndRead() {
        store.upsert(reserved("p1", NOW, null));

        assertTrue(store.updateUrls("p1", "https://host/o/photos/p1.jpg",
                Map.of("small", "https://host/o/thumbnails/p1_small.jpg")));
        assertTrue(store.updateStatus("p1", UploadStatus.COMPLETED));

        PhotoRecord stored = store.get("p1").orElseThrow();
        assertEquals(UploadStatus.COMPLETED, stored.uploadStatus());
        assertEquals("https://host/o/photos/p1.jpg", stored.fileUrl());
        assertEquals(1, stored.thumbnailUrls().size());
    }

    @Test
    void updatesOfMissingItemsReturnFalseWithoutCreatingThem() {
        assertFalse(store.updateUrls("missing", "u", Map.of()));
        assertFalse(store.updateStatus("missing", UploadStatus.FAILED));
        assertTrue(store.get("missing").isEmpty());
    }

    @Test
    void listSortsAndPagesClientSide() {
        for (int i = 0; i < 3; i++) {
            store.upsert(reserved("p" + i, NOW.minus(Duration.ofMinutes(i)), null));
        }

        PhotoPage first = store.list(PageQuery.of(2, null, null, null));
        PhotoPage second = store.list(PageQuery.of(2, first.nextPageToken(), null, null));

        assertEquals(List.of("p0", "p1"), first.records().stream().map(PhotoRecord::id).toList());
        assertEquals(List.of("p2"), second.records().stream().map(PhotoRecord::id).toList());
        assertNull(second.nextPageToken());
    }

    @Test
    void locationSearchFiltersByDistance() {
        store.upsert(reserved("seoul", NOW, new PhotoLocation(37.5665, 126.9780, null, "Seoul", "KR")));
        store.upsert(reserved("incheon", NOW, new PhotoLocation(37.4563, 126.7052, null, "Incheon", "KR")));
        store.upsert(reserved("busan", NOW, new PhotoLocation(35.1796, 129.0756, null, "Busan", "KR")));
        store.upsert(reserved("nowhere", NOW, null));

        List<PhotoRecord> near = store.searchByLocation(37.5665, 126.9780, 50, 10);

        assertEquals(List.of("seoul", "incheon"), near.stream().map(PhotoRecord::id).toList());
    }

    @Test
    void cleanupStaleIsConditionalAndIdempotent() {
        store.upsert(reserved("old", NOW.minus(Duration.ofHours(2)), null));
        store.upsert(reserved("fresh", NOW.minus(Duration.ofMinutes(10)), null));

        assertEquals(List.of("old"), store.cleanupStale(1));
        assertEquals(List.of(), store.cleanupStale(1));
        assertEquals(UploadStatus.FAILED, store.get("old").orElseThrow().uploadStatus());
        assertEquals(UploadStatus.UPLOADING, store.get("fresh").orElseThrow().uploadStatus());
    }

    @Test
    void deleteReportsWhetherTheItemExisted() {
        store.upsert(reserved("p1", NOW, null));

        assertTrue(store.delete("p1"));
        assertFalse(store.delete("p1"));
    }

    private static PhotoRecord reserved(String id, Instant uploadedAt, PhotoLocation location) {
        return PhotoRecord.reserved(id, id + ".jpg", null, 100, "image/jpeg", location, null, List.of(), uploadedAt);
    }
}
