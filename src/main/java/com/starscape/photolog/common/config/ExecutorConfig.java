package com.starscape.photolog.common.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class ExecutorConfig {

    /**
     * Bounded pool for per-size thumbnail uploads.
     */
    @Bean("thumbnailUploadExecutor")
    public ThreadPoolTaskExecutor thumbnailUploadExecutor(ProcessingProperties processingProperties) {
        int parallelism = Math.max(1, processingProperties.getUploadParallelism());
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(parallelism);
        ex.setMaxPoolSize(parallelism);
        ex.setQueueCapacity(200);
        ex.setThreadNamePrefix("thumb-upload-");
        ex.setWaitForTasksToCompleteOnShutdown(true);
        ex.initialize();
        return ex;
    }
}
