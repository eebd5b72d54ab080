package com.community.botguard.controller;

import com.community.botguard.model.CommandInvokedEvent;
import com.community.botguard.model.CommandReply;
import com.community.botguard.model.DecisionResult;
import com.community.botguard.model.DetectionResult;
import com.community.botguard.model.ParticipantJoinedEvent;
import com.community.botguard.model.ReactionAddedEvent;
import com.community.botguard.service.ApprovalWorkflowService;
import com.community.botguard.service.ReviewCommandService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.Optional;

/**
 * Inbound events pushed by the platform connector.
 */
@RestController
@RequestMapping("/api/v1/events")
@Tag(name = "Platform Events", description = "Join, reaction and command events forwarded by the platform connector")
public class EventController {

    private final ApprovalWorkflowService workflowService;
    private final ReviewCommandService commandService;

    public EventController(ApprovalWorkflowService workflowService,
                           ReviewCommandService commandService) {
        this.workflowService = workflowService;
        this.commandService = commandService;
    }

    @PostMapping("/participant-joined")
    @Operation(summary = "Participant joined a community",
               description = "Automated participants enter the approval workflow; humans are ignored")
    public ResponseEntity<?> participantJoined(@RequestBody ParticipantJoinedEvent event) {
        if (isBlank(event.getCommunityId()) || isBlank(event.getParticipantId())) {
            return ResponseEntity.badRequest().body(Map.of("error", "communityId and participantId are required"));
        }
        DetectionResult result = workflowService.onParticipantDetected(event);
        return ResponseEntity.ok(result);
    }

    @PostMapping("/reactions")
    @Operation(summary = "Reaction added to a review request",
               description = "✅ approves and ❌ rejects; other reactions and non-reviewers are ignored")
    public ResponseEntity<?> reactionAdded(@RequestBody ReactionAddedEvent event) {
        if (isBlank(event.getCommunityId()) || isBlank(event.getActorId())) {
            return ResponseEntity.badRequest().body(Map.of("error", "communityId and actorId are required"));
        }
        Optional<DecisionResult> decision = commandService.handleReaction(event);
        if (decision.isEmpty()) {
            return ResponseEntity.ok(Map.of("ignored", true));
        }
        return ResponseEntity.ok(decision.get());
    }

    @PostMapping("/commands")
    @Operation(summary = "Command issued in a community channel",
               description = "status, approve, reject, history and logs; all require the reviewer role")
    public ResponseEntity<?> commandInvoked(@RequestBody CommandInvokedEvent event) {
        if (isBlank(event.getCommunityId()) || isBlank(event.getName())) {
            return ResponseEntity.badRequest().body(Map.of("error", "communityId and name are required"));
        }
        CommandReply reply = commandService.handleCommand(event);
        return ResponseEntity.ok(reply);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
