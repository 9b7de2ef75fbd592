package com.starscape.photolog.common.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClientBuilder;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

import java.net.URI;

/**
 * SDK clients for the cloud backend pair. Only created when app.storage.type=cloud.
 */
@Configuration
@ConditionalOnProperty(prefix = "app.storage", name = "type", havingValue = "cloud")
public class AwsConfig {

    private final StorageProperties.Cloud cloud;

    public AwsConfig(StorageProperties storageProperties) {
        this.cloud = storageProperties.getCloud();
    }

    @Bean
    public AwsCredentialsProvider awsCredentialsProvider() {
        // Use profile if specified, otherwise use default credentials chain
        String profile = cloud.getProfile();
        if (profile != null && !profile.isBlank()) {
            return ProfileCredentialsProvider.create(profile);
        }
        return DefaultCredentialsProvider.create();
    }

    @Bean(destroyMethod = "close")
    public S3Client s3Client(AwsCredentialsProvider credentialsProvider) {
        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(cloud.getRegion()))
                .credentialsProvider(credentialsProvider)
                .forcePathStyle(cloud.isPathStyleAccess())
                .overrideConfiguration(c -> c.apiCallTimeout(cloud.getApiCallTimeout()));
        if (hasText(cloud.getEndpoint())) {
            builder.endpointOverride(URI.create(cloud.getEndpoint()));
        }
        return builder.build();
    }

    @Bean(destroyMethod = "close")
    public DynamoDbClient dynamoDbClient(AwsCredentialsProvider credentialsProvider) {
        DynamoDbClientBuilder builder = DynamoDbClient.builder()
                .region(Region.of(cloud.getRegion()))
                .credentialsProvider(credentialsProvider)
                .overrideConfiguration(c -> c.apiCallTimeout(cloud.getApiCallTimeout()));
        if (hasText(cloud.getDynamoEndpoint())) {
            builder.endpointOverride(URI.create(cloud.getDynamoEndpoint()));
        }
        return builder.build();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
