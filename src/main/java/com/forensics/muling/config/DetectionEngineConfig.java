package com.forensics.muling.config;

import com.forensics.muling.support.ParallelRunner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Worker pool and default tunables for the detection engine.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(DetectionProperties.class)
public class DetectionEngineConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService detectionExecutor(DetectionProperties properties) {
        int parallelism = properties.getExecution().getParallelism();
        log.info("Detection worker pool: parallelism={}", parallelism);
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("muling-detect-");
        threadFactory.setDaemon(true);
        return Executors.newFixedThreadPool(parallelism, threadFactory);
    }

    @Bean
    public ParallelRunner parallelRunner(ExecutorService detectionExecutor, DetectionProperties properties) {
        return new ParallelRunner(detectionExecutor, properties.getExecution().getParallelism());
    }

    @Bean
    public DetectionConfig defaultDetectionConfig(DetectionProperties properties) {
        return properties.toConfig();
    }
}
