package com.poker.tracker.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class PipelineConfig {

    @Bean(name = "importExecutor", destroyMethod = "shutdown")
    public ExecutorService importExecutor(@Value("${pipeline.import.workers:4}") int workers) {
        return Executors.newFixedThreadPool(workers,
                new ThreadFactoryBuilder().setNameFormat("hand-import-%d").setDaemon(true).build());
    }

    /**
     * Runs submitted import jobs. Jobs beyond the pool size wait in the queue.
     */
    @Bean(name = "importJobExecutor", destroyMethod = "shutdownNow")
    public ExecutorService importJobExecutor(@Value("${pipeline.import.concurrent-jobs:2}") int concurrentJobs) {
        return Executors.newFixedThreadPool(concurrentJobs,
                new ThreadFactoryBuilder().setNameFormat("import-job-%d").setDaemon(true).build());
    }

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder,
                                     @Value("${analysis.api.timeout-seconds:30}") long timeoutSeconds) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(timeoutSeconds))
                .setReadTimeout(Duration.ofSeconds(timeoutSeconds))
                .build();
    }
}
