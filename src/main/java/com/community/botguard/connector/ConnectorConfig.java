package com.community.botguard.connector;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class ConnectorConfig {

    @Bean
    public RestClient connectorRestClient(RestClient.Builder builder, ConnectorProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.getConnectTimeoutMs());
        requestFactory.setReadTimeout(properties.getReadTimeoutMs());

        RestClient.Builder configured = builder
                .baseUrl(properties.getBaseUrl())
                .requestFactory(requestFactory);
        if (properties.getApiToken() != null && !properties.getApiToken().isBlank()) {
            configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiToken());
        }
        return configured.build();
    }
}
