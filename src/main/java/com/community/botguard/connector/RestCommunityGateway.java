package com.community.botguard.connector;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
public class RestCommunityGateway implements CommunityGateway {

    private static final Logger log = LoggerFactory.getLogger(RestCommunityGateway.class);

    private final RestClient restClient;

    public RestCommunityGateway(@Qualifier("connectorRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public void removeParticipant(String communityId, String participantId, String reason) {
        ConnectorCalls.run("remove participant " + participantId, () -> restClient.post()
                .uri("/communities/{communityId}/members/{participantId}/remove", communityId, participantId)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("reason", reason))
                .retrieve()
                .toBodilessEntity());
        log.debug("Removal accepted by connector: community={}, participant={}", communityId, participantId);
    }

    @Override
    public void sendDirectMessage(String userId, String content) {
        ConnectorCalls.run("direct message to " + userId, () -> restClient.post()
                .uri("/users/{userId}/messages", userId)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("content", content))
                .retrieve()
                .toBodilessEntity());
    }

    @Override
    public void sendChannelMessage(String channelId, String content) {
        ConnectorCalls.run("channel message to " + channelId, () -> restClient.post()
                .uri("/channels/{channelId}/messages", channelId)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("content", content))
                .retrieve()
                .toBodilessEntity());
    }

    @Override
    public Set<String> grantedCapabilities(String communityId) {
        JsonNode root = ConnectorCalls.execute("capability lookup for " + communityId, () -> restClient.get()
                .uri("/communities/{communityId}/capabilities", communityId)
                .retrieve()
                .body(JsonNode.class));
        Set<String> capabilities = new LinkedHashSet<>();
        if (root != null) {
            root.path("capabilities").forEach(node -> capabilities.add(node.asText()));
        }
        return capabilities;
    }

    @Override
    public List<String> listCommunities() {
        JsonNode root = ConnectorCalls.execute("community listing", () -> restClient.get()
                .uri("/communities")
                .retrieve()
                .body(JsonNode.class));
        List<String> communities = new ArrayList<>();
        if (root != null) {
            root.path("communities").forEach(node -> communities.add(node.asText()));
        }
        return communities;
    }
}
