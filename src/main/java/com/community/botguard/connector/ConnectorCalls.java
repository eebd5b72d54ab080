package com.community.botguard.connector;

import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.function.Supplier;

final class ConnectorCalls {

    private ConnectorCalls() {}

    static <T> T execute(String action, Supplier<T> call) {
        try {
            return call.get();
        } catch (RestClientResponseException e) {
            throw new ConnectorException(e.getStatusCode().value(),
                    action + " failed with HTTP " + e.getStatusCode().value() + ": " + e.getResponseBodyAsString(), e);
        } catch (RestClientException e) {
            throw new ConnectorException(0, action + " failed: " + e.getMessage(), e);
        }
    }

    static void run(String action, Runnable call) {
        execute(action, () -> {
            call.run();
            return null;
        });
    }
}
