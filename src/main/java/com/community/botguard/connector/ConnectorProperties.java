package com.community.botguard.connector;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "botguard.connector")
public class ConnectorProperties {

    // Base URL of the chat-platform connector that owns the gateway session.
    private String baseUrl = "http://localhost:8081";
    private String apiToken;
    private int connectTimeoutMs = 2000;
    private int readTimeoutMs = 5000;
}
