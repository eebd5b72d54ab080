package com.community.botguard.connector;

import java.util.List;
import java.util.Set;

/**
 * Outbound actions against the chat platform. Implementations throw
 * {@link ConnectorException} when the platform refuses or cannot be reached.
 */
public interface CommunityGateway {

    void removeParticipant(String communityId, String participantId, String reason);

    void sendDirectMessage(String userId, String content);

    void sendChannelMessage(String channelId, String content);

    /**
     * Permissions this service's own account holds in the community.
     */
    Set<String> grantedCapabilities(String communityId);

    List<String> listCommunities();
}
