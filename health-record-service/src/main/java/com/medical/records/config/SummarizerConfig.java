package com.medical.records.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "summarizer")
public class SummarizerConfig {
    private String apiUrl = "https://api.mistral.ai/v1";
    private String apiKey;
    private String model = "mistral-tiny";

    /**
     * Upper bound on the length of the generated summary, in tokens.
     */
    private Integer maxTokens = 500;
    private Double temperature = 0.7;
    private Duration timeout = Duration.ofSeconds(30);

    private Prompt prompt = new Prompt();

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.trim().isEmpty();
    }

    @Data
    public static class Prompt {
        private Integer maxEntriesPerSection = 50;
        private Integer maxNoteLength = 1000;
    }
}
