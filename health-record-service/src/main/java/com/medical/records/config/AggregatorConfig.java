package com.medical.records.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "aggregator")
public class AggregatorConfig {
    /**
     * Fetch each record kind on its own worker thread; when false all fetches run on the caller.
     */
    private boolean parallelFetch = true;
    private Integer fetchThreads = 8;
}
