package com.eainde.atlas.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties(prefix = "atlas.llm")
public class LlmProperties {

    private String apiKey;
    private String modelName = "gpt-4o-mini";
    private String baseUrl;
    private Double temperature = 0.2;
    private Duration timeout = Duration.ofSeconds(60);
    private boolean logRequests;
}
