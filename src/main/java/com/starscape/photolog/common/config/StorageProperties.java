package com.starscape.photolog.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the storage backends.
 * Binds to app.storage.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.storage")
public class StorageProperties {

    private StorageType type = StorageType.LOCAL;
    private final Local local = new Local();
    private final Cloud cloud = new Cloud();

    public StorageType getType() {
        return type;
    }

    public void setType(StorageType type) {
        this.type = type;
    }

    public Local getLocal() {
        return local;
    }

    public Cloud getCloud() {
        return cloud;
    }

    /**
     * Filesystem blob store and embedded metadata table.
     */
    public static class Local {

        private String basePath = "./data/storage";
        private String baseUrl = "http://localhost:8080/storage";

        public String getBasePath() {
            return basePath;
        }

        public void setBasePath(String basePath) {
            this.basePath = basePath;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }

    /**
     * S3-compatible object store and DynamoDB metadata table.
     */
    public static class Cloud {

        private String region = "ap-chuncheon-1";
        private String profile;
        private String endpoint;
        private boolean pathStyleAccess = true;
        private String bucket = "photolog-storage";
        private String namespace = "photolog";
        private String publicHost;
        private String tableName = "photos";
        private String dynamoEndpoint;
        private Duration apiCallTimeout = Duration.ofSeconds(30);

        public String getRegion() {
            return region;
        }

        public void setRegion(String region) {
            this.region = region;
        }

        public String getProfile() {
            return profile;
        }

        public void setProfile(String profile) {
            this.profile = profile;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public boolean isPathStyleAccess() {
            return pathStyleAccess;
        }

        public void setPathStyleAccess(boolean pathStyleAccess) {
            this.pathStyleAccess = pathStyleAccess;
        }

        public String getBucket() {
            return bucket;
        }

        public void setBucket(String bucket) {
            this.bucket = bucket;
        }

        public String getNamespace() {
            return namespace;
        }

        public void setNamespace(String namespace) {
            this.namespace = namespace;
        }

        /**
         * Host used in public object URLs. Defaults to the regional object storage host.
         */
        public String getPublicHost() {
            if (publicHost == null || publicHost.isBlank()) {
                return "objectstorage." + region + ".oraclecloud.com";
            }
            return publicHost;
        }

        public void setPublicHost(String publicHost) {
            this.publicHost = publicHost;
        }

        public String getTableName() {
            return tableName;
        }

        public void setTableName(String tableName) {
            this.tableName = tableName;
        }

        public String getDynamoEndpoint() {
            return dynamoEndpoint;
        }

        public void setDynamoEndpoint(String dynamoEndpoint) {
            this.dynamoEndpoint = dynamoEndpoint;
        }

        public Duration getApiCallTimeout() {
            return apiCallTimeout;
        }

        public void setApiCallTimeout(Duration apiCallTimeout) {
            this.apiCallTimeout = apiCallTimeout;
        }
    }
}
