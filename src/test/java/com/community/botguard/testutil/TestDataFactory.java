package com.community.botguard.testutil;

import com.community.botguard.model.*;

import java.util.List;
import java.util.Map;

/**
 * Shared test data builders to avoid repeating construction boilerplate across test classes.
 */
public final class TestDataFactory {

    public static final String COMMUNITY = "GUILD-1";
    public static final String BOT = "BOT-42";
    public static final String REVIEWER = "REVIEWER-1";

    private TestDataFactory() {}

    public static ParticipantJoinedEvent botJoined(String communityId, String participantId) {
        return ParticipantJoinedEvent.builder()
                .communityId(communityId)
                .participantId(participantId)
                .participantName("Spam Bot " + participantId)
                .automated(true)
                .inviterId("USER-7")
                .inviterName("alice")
                .accountCreatedAt(1_700_000_000_000L)
                .build();
    }

    public static ParticipantJoinedEvent humanJoined(String communityId, String participantId) {
        return ParticipantJoinedEvent.builder()
                .communityId(communityId)
                .participantId(participantId)
                .participantName("Human " + participantId)
                .automated(false)
                .build();
    }

    public static PendingApproval pendingApproval(String communityId, String participantId, long detectedAt, long deadline) {
        return PendingApproval.builder()
                .approvalId("APPROVAL-" + participantId)
                .communityId(communityId)
                .participantId(participantId)
                .participantName("Spam Bot " + participantId)
                .inviterId("USER-7")
                .inviterName("alice")
                .detectedAt(detectedAt)
                .deadline(deadline)
                .status(ApprovalStatus.PENDING)
                .build();
    }

    public static AuditRecord auditRecord(String participantId, AuditEventType type, String actorId, long timestamp) {
        return AuditRecord.builder()
                .recordId("REC-" + participantId + "-" + type + "-" + timestamp)
                .communityId(COMMUNITY)
                .participantId(participantId)
                .eventType(type)
                .actorId(actorId)
                .timestamp(timestamp)
                .detail(Map.of("participantName", "Spam Bot " + participantId, "reason", "test"))
                .build();
    }

    public static AuditStats auditStats() {
        return AuditStats.builder()
                .totalActions(12)
                .detectedCount(5)
                .approvedCount(2)
                .rejectedCount(1)
                .timedOutCount(2)
                .removalFailedCount(0)
                .recentTotal(4)
                .recentApproved(1)
                .recentRejected(0)
                .recentTimedOut(1)
                .build();
    }

    public static CommandInvokedEvent command(String actorId, String name, String... args) {
        return CommandInvokedEvent.builder()
                .communityId(COMMUNITY)
                .actorId(actorId)
                .name(name)
                .args(List.of(args))
                .build();
    }
}
