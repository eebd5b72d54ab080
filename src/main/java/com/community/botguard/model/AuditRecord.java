package com.community.botguard.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Append-only record of one approval workflow transition")
public class AuditRecord {

    public static final String SYSTEM_ACTOR = "SYSTEM";

    @Schema(description = "Unique record ID")
    private String recordId;

    @Schema(description = "Community (guild) ID", example = "GUILD-1")
    private String communityId;

    @Schema(description = "Automated participant ID", example = "BOT-42")
    private String participantId;

    @Schema(description = "Transition that was recorded", example = "APPROVED")
    private AuditEventType eventType;

    @Schema(description = "Reviewer ID, or SYSTEM for detection and timeouts", example = "REVIEWER-1")
    private String actorId;

    @Schema(description = "Event timestamp in epoch milliseconds", example = "1739886764000")
    private long timestamp;

    @Schema(description = "Write order among records sharing a timestamp", example = "17")
    private long sequence;

    @Schema(description = "Free-form context such as inviter, decision source or removal error")
    private Map<String, String> detail;
}
