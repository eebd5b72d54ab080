package com.community.botguard.service;

import com.community.botguard.config.BotGuardConfig;
import com.community.botguard.connector.CommunityGateway;
import com.community.botguard.connector.ConnectorException;
import com.community.botguard.model.PlatformCapability;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CapabilityCheckServiceTest {

    @Mock private CommunityGateway gateway;

    private BotGuardConfig config;
    private CapabilityCheckService service;

    @BeforeEach
    void setUp() {
        config = new BotGuardConfig();
        service = new CapabilityCheckService(gateway, config);
    }

    @Test
    void checkAll_reportsMissingPerCommunity() {
        when(gateway.listCommunities()).thenReturn(List.of("GUILD-1", "GUILD-2"));
        when(gateway.grantedCapabilities("GUILD-1")).thenReturn(Set.of(
                "send_messages", "read_messages", "view_audit_log", "add_reactions", "read_message_history"));
        when(gateway.grantedCapabilities("GUILD-2")).thenReturn(Set.of("administrator"));

        Map<String, List<String>> missing = service.checkAll();

        assertThat(missing.get("GUILD-1")).containsExactly("kick_members");
        assertThat(missing.get("GUILD-2")).isEmpty();
    }

    @Test
    void checkAll_unreachableCommunity_isSkipped() {
        when(gateway.listCommunities()).thenReturn(List.of("GUILD-1", "GUILD-2"));
        when(gateway.grantedCapabilities("GUILD-1")).thenThrow(new ConnectorException(0, "timeout"));
        when(gateway.grantedCapabilities("GUILD-2")).thenReturn(Set.of("administrator"));

        Map<String, List<String>> missing = service.checkAll();

        assertThat(missing).containsOnlyKeys("GUILD-2");
    }

    @Test
    void checkAll_connectorDown_returnsEmpty() {
        when(gateway.listCommunities()).thenThrow(new ConnectorException(0, "connection refused"));

        assertThat(service.checkAll()).isEmpty();
    }

    @Test
    void requiredCapabilities_ignoresUnknownNames() {
        config.setRequiredBotCapabilities(List.of("kick_members", "summon_dragons"));

        assertThat(service.requiredCapabilities()).containsExactly(PlatformCapability.KICK_MEMBERS);
    }

    @Test
    void onApplicationReady_disabled_skipsConnector() {
        config.getCapabilityCheck().setEnabled(false);

        service.onApplicationReady();

        verifyNoInteractions(gateway);
    }
}
