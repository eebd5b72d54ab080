package com.community.botguard.connector;

import com.community.botguard.config.BotGuardConfig;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Component
public class RestReviewerDirectory implements ReviewerDirectory {

    private static final Logger log = LoggerFactory.getLogger(RestReviewerDirectory.class);

    private final RestClient restClient;
    private final BotGuardConfig config;

    public RestReviewerDirectory(@Qualifier("connectorRestClient") RestClient restClient,
                                 BotGuardConfig config) {
        this.restClient = restClient;
        this.config = config;
    }

    @Override
    public boolean isReviewer(String communityId, String actorId) {
        JsonNode member;
        try {
            member = ConnectorCalls.execute("member lookup for " + actorId, () -> restClient.get()
                    .uri("/communities/{communityId}/members/{memberId}", communityId, actorId)
                    .retrieve()
                    .body(JsonNode.class));
        } catch (ConnectorException e) {
            if (e.isNotFound()) {
                return false;
            }
            throw e;
        }
        if (member == null || member.path("automated").asBoolean(false)) {
            return false;
        }
        if (member.path("administrator").asBoolean(false)) {
            return true;
        }
        String reviewerRoleId = config.getReviewerRoleId();
        if (reviewerRoleId == null) {
            return false;
        }
        for (JsonNode role : member.path("roles")) {
            if (reviewerRoleId.equals(role.asText())) {
                return true;
            }
        }
        return false;
    }

    @Override
    public List<String> findReviewers(String communityId) {
        String reviewerRoleId = config.getReviewerRoleId();
        if (reviewerRoleId == null || reviewerRoleId.isBlank()) {
            log.warn("No reviewer role configured; community={} has no reviewers to notify", communityId);
            return Collections.emptyList();
        }

        JsonNode root;
        try {
            root = ConnectorCalls.execute("reviewer listing for " + communityId, () -> restClient.get()
                    .uri("/communities/{communityId}/roles/{roleId}/members", communityId, reviewerRoleId)
                    .retrieve()
                    .body(JsonNode.class));
        } catch (ConnectorException e) {
            if (e.isNotFound()) {
                log.warn("Reviewer role {} not found in community={}", reviewerRoleId, communityId);
                return Collections.emptyList();
            }
            throw e;
        }

        List<String> reviewers = new ArrayList<>();
        if (root != null) {
            for (JsonNode member : root.path("members")) {
                if (!member.path("automated").asBoolean(false)) {
                    reviewers.add(member.path("id").asText());
                }
            }
        }
        return reviewers;
    }
}
