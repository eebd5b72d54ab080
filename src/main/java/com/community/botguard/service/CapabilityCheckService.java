package com.community.botguard.service;

import com.community.botguard.config.BotGuardConfig;
import com.community.botguard.connector.CommunityGateway;
import com.community.botguard.connector.ConnectorException;
import com.community.botguard.model.PlatformCapability;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reports, once the application is up, which required platform permissions the
 * service is missing in each community. A missing {@code kick_members} means
 * rejected bots will stay in that community.
 */
@Service
public class CapabilityCheckService {

    private static final Logger log = LoggerFactory.getLogger(CapabilityCheckService.class);

    private final CommunityGateway gateway;
    private final BotGuardConfig config;

    public CapabilityCheckService(CommunityGateway gateway, BotGuardConfig config) {
        this.gateway = gateway;
        this.config = config;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!config.getCapabilityCheck().isEnabled()) {
            log.info("Startup capability check is DISABLED.");
            return;
        }
        checkAll();
    }

    /**
     * @return missing capability names per community; communities that could not be
     *         queried are left out
     */
    public Map<String, List<String>> checkAll() {
        Set<PlatformCapability> required = requiredCapabilities();
        Map<String, List<String>> missingByCommunity = new LinkedHashMap<>();

        List<String> communities;
        try {
            communities = gateway.listCommunities();
        } catch (ConnectorException e) {
            log.warn("Capability check skipped: cannot list communities: {}", e.getMessage());
            return missingByCommunity;
        }

        for (String communityId : communities) {
            try {
                List<String> missing = missingIn(communityId, required);
                missingByCommunity.put(communityId, missing);
                if (missing.isEmpty()) {
                    log.info("All required permissions granted in community={}", communityId);
                } else {
                    log.warn("Missing permissions in community={}: {}", communityId, missing);
                }
            } catch (ConnectorException e) {
                log.warn("Cannot read granted permissions for community={}: {}", communityId, e.getMessage());
            }
        }
        return missingByCommunity;
    }

    Set<PlatformCapability> requiredCapabilities() {
        Set<PlatformCapability> required = EnumSet.noneOf(PlatformCapability.class);
        for (String name : config.getRequiredBotCapabilities()) {
            PlatformCapability.fromWireName(name).ifPresentOrElse(
                    required::add,
                    () -> log.warn("Unknown permission in botguard.required-bot-capabilities: {}", name));
        }
        return required;
    }

    private List<String> missingIn(String communityId, Set<PlatformCapability> required) {
        Set<String> granted = gateway.grantedCapabilities(communityId);
        boolean administrator = granted.contains(PlatformCapability.ADMINISTRATOR.getWireName());
        List<String> missing = new ArrayList<>();
        for (PlatformCapability capability : required) {
            if (!administrator && !granted.contains(capability.getWireName())) {
                missing.add(capability.getWireName());
            }
        }
        return missing;
    }
}
