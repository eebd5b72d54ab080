package com.community.botguard.contract;

import com.community.botguard.config.TestAerospikeConfig;
import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Guards the published OpenAPI document against accidental drift in paths and schemas
 * the platform connector depends on.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Import(TestAerospikeConfig.class)
@ActiveProfiles("test")
class OpenApiContractTest {

    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    void openApiSpec_isAccessible() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isNotEmpty();
    }

    @Test
    void openApiSpec_containsAllEndpointPaths() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());
        Map<String, Object> paths = json.read("$.paths");

        // Connector events
        assertThat(paths).containsKey("/api/v1/events/participant-joined");
        assertThat(paths).containsKey("/api/v1/events/reactions");
        assertThat(paths).containsKey("/api/v1/events/commands");

        // Approvals
        assertThat(paths).containsKey("/api/v1/approvals/status");
        assertThat(paths).containsKey("/api/v1/approvals/{communityId}/{participantId}");
        assertThat(paths).containsKey("/api/v1/approvals/{communityId}/{participantId}/decision");
        assertThat(paths).containsKey("/api/v1/approvals/history/{participantId}");
        assertThat(paths).containsKey("/api/v1/approvals/logs");
    }

    @Test
    void openApiSpec_containsCriticalSchemas() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());
        Map<String, Object> schemas = json.read("$.components.schemas");

        assertThat(schemas).containsKey("ParticipantJoinedEvent");
        assertThat(schemas).containsKey("ReactionAddedEvent");
        assertThat(schemas).containsKey("CommandInvokedEvent");
        assertThat(schemas).containsKey("StatusSummary");
        assertThat(schemas).containsKey("PendingApproval");
        assertThat(schemas).containsKey("AuditRecord");
    }

    @Test
    void openApiSpec_approvalSchema_hasRequiredFields() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());

        Map<String, Object> approvalProps = json.read("$.components.schemas.PendingApproval.properties");
        assertThat(approvalProps).containsKey("communityId");
        assertThat(approvalProps).containsKey("participantId");
        assertThat(approvalProps).containsKey("deadline");
        assertThat(approvalProps).containsKey("status");
        assertThat(approvalProps).doesNotContainKey("timerHandle");

        Map<String, Object> auditProps = json.read("$.components.schemas.AuditRecord.properties");
        assertThat(auditProps).containsKey("eventType");
        assertThat(auditProps).containsKey("actorId");
        assertThat(auditProps).containsKey("timestamp");
        assertThat(auditProps).containsKey("sequence");
    }

    @Test
    void openApiSpec_decisionEndpoint_documentsTrustedActor() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());

        String description = json.read(
                "$.paths['/api/v1/approvals/{communityId}/{participantId}/decision'].post.description");
        assertThat(description).contains("actorId is taken from the body as-is");
        assertThat(description).contains("platform connector");
    }
}
