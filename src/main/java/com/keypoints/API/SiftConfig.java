package com.keypoints.API;

import com.keypoints.SIFT.SiftParameters;
import com.keypoints.imageOperation.ColourImageToGray;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Slf4j
@Configuration
@EnableConfigurationProperties(SiftProperties.class)
public class SiftConfig {

    @Bean
    public SiftParameters siftParameters(SiftProperties properties) {
        SiftParameters parameters = properties.toParameters();
        log.info("Default {}", parameters);
        return parameters;
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService siftExecutor(SiftProperties properties) {
        int threads = properties.resolvedThreads();
        log.info("SIFT worker pool: {} threads", threads);
        return Executors.newFixedThreadPool(threads);
    }

    @Bean
    public ColourImageToGray colourImageToGray() {
        return new ColourImageToGray();
    }
}
