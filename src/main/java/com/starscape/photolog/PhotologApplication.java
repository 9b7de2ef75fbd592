package com.starscape.photolog;

import com.starscape.photolog.common.config.ProcessingProperties;
import com.starscape.photolog.common.config.ReconcilerProperties;
import com.starscape.photolog.common.config.StorageProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        StorageProperties.class,
        ProcessingProperties.class,
        ReconcilerProperties.class
})
public class PhotologApplication {

    public static void main(String[] args) {
        SpringApplication.run(PhotologApplication.class, args);
    }
}
