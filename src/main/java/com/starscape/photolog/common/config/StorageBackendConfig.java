package com.starscape.photolog.common.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.photolog.features.blobstore.domain.BlobStore;
import com.starscape.photolog.features.blobstore.infra.FilesystemBlobStore;
import com.starscape.photolog.features.blobstore.infra.S3BlobStore;
import com.starscape.photolog.features.metadata.domain.PhotoMetadataStore;
import com.starscape.photolog.features.metadata.infra.DynamoDbPhotoMetadataStore;
import com.starscape.photolog.features.metadata.infra.JpaPhotoEntityRepository;
import com.starscape.photolog.features.metadata.infra.JpaPhotoMetadataStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.s3.S3Client;

import java.nio.file.Paths;
import java.time.Clock;

/**
 * Wires exactly one blob store and one metadata store, chosen by app.storage.type.
 * Both stores of a pair always come from the same backend.
 */
@Configuration
public class StorageBackendConfig {

    @Configuration
    @ConditionalOnProperty(prefix = "app.storage", name = "type", havingValue = "local", matchIfMissing = true)
    static class LocalBackend {

        @Bean
        public BlobStore blobStore(StorageProperties storageProperties, ObjectMapper objectMapper) {
            StorageProperties.Local local = storageProperties.getLocal();
            return new FilesystemBlobStore(Paths.get(local.getBasePath()), local.getBaseUrl(), objectMapper);
        }

        @Bean
        public PhotoMetadataStore photoMetadataStore(
                JpaPhotoEntityRepository repository,
                ObjectMapper objectMapper,
                Clock clock) {
            return new JpaPhotoMetadataStore(repository, objectMapper, clock);
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = "app.storage", name = "type", havingValue = "cloud")
    static class CloudBackend {

        @Bean
        public BlobStore blobStore(S3Client s3Client, StorageProperties storageProperties) {
            StorageProperties.Cloud cloud = storageProperties.getCloud();
            return new S3BlobStore(s3Client, cloud.getBucket(),
                    S3BlobStore.publicBaseUrl(cloud.getPublicHost(), cloud.getNamespace(), cloud.getBucket()));
        }

        @Bean
        public PhotoMetadataStore photoMetadataStore(
                DynamoDbClient dynamoDbClient,
                StorageProperties storageProperties,
                Clock clock) {
            return new DynamoDbPhotoMetadataStore(dynamoDbClient, storageProperties.getCloud().getTableName(), clock);
        }
    }
}
