package com.community.botguard.connector;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class RestCommunityGatewayTest {

    private MockRestServiceServer server;
    private RestCommunityGateway gateway;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("http://connector.test");
        server = MockRestServiceServer.bindTo(builder).build();
        gateway = new RestCommunityGateway(builder.build());
    }

    @Test
    void removeParticipant_postsReason() {
        server.expect(requestTo("http://connector.test/communities/GUILD-1/members/BOT-42/remove"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.reason").value("Security Bot: Timeout - no approval received"))
                .andRespond(withNoContent());

        gateway.removeParticipant("GUILD-1", "BOT-42", "Security Bot: Timeout - no approval received");

        server.verify();
    }

    @Test
    void removeParticipant_forbidden_mapsStatus() {
        server.expect(requestTo("http://connector.test/communities/GUILD-1/members/BOT-42/remove"))
                .andRespond(withStatus(HttpStatus.FORBIDDEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\":\"Missing Permissions\"}"));

        assertThatThrownBy(() -> gateway.removeParticipant("GUILD-1", "BOT-42", "Security Bot: Rejected"))
                .isInstanceOfSatisfying(ConnectorException.class, e -> {
                    assertThat(e.isForbidden()).isTrue();
                    assertThat(e.getMessage()).contains("Missing Permissions");
                });
    }

    @Test
    void sendDirectMessage_unreachable_mapsToStatusZero() {
        server.expect(requestTo("http://connector.test/users/REVIEWER-1/messages"))
                .andRespond(withException(new IOException("connection refused")));

        assertThatThrownBy(() -> gateway.sendDirectMessage("REVIEWER-1", "hello"))
                .isInstanceOfSatisfying(ConnectorException.class, e -> assertThat(e.getStatusCode()).isZero());
    }

    @Test
    void sendChannelMessage_postsContent() {
        server.expect(requestTo("http://connector.test/channels/CHANNEL-3/messages"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.content").value("Pending Approvals: 0"))
                .andRespond(withSuccess());

        gateway.sendChannelMessage("CHANNEL-3", "Pending Approvals: 0");

        server.verify();
    }

    @Test
    void grantedCapabilities_readsList() {
        server.expect(requestTo("http://connector.test/communities/GUILD-1/capabilities"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("{\"capabilities\":[\"send_messages\",\"kick_members\"]}",
                        MediaType.APPLICATION_JSON));

        assertThat(gateway.grantedCapabilities("GUILD-1")).containsExactly("send_messages", "kick_members");
    }

    @Test
    void listCommunities_readsIds() {
        server.expect(requestTo("http://connector.test/communities"))
                .andRespond(withSuccess("{\"communities\":[\"GUILD-1\",\"GUILD-2\"]}", MediaType.APPLICATION_JSON));

        assertThat(gateway.listCommunities()).containsExactly("GUILD-1", "GUILD-2");
    }
}
