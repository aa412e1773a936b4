package com.microsoft.workspacereport.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Worker pool and clock for the enrichment pipeline.
 */
@Configuration
public class EnrichmentConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService lookupExecutor(ReportProperties properties) {
        return Executors.newFixedThreadPool(
                properties.getLookupThreads(),
                new CustomizableThreadFactory("workspace-lookup-"));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
