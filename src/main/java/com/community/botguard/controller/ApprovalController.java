package com.community.botguard.controller;

import com.community.botguard.exception.ApprovalNotFoundException;
import com.community.botguard.exception.NotAuthorizedException;
import com.community.botguard.model.AuditRecord;
import com.community.botguard.model.DecisionResult;
import com.community.botguard.model.DecisionSource;
import com.community.botguard.model.PendingApproval;
import com.community.botguard.model.StatusSummary;
import com.community.botguard.registry.ApprovalRegistry;
import com.community.botguard.service.ApprovalWorkflowService;
import com.community.botguard.service.AuditLogService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/v1/approvals")
@Tag(name = "Approvals", description = "Pending bot approvals, reviewer decisions and the audit trail")
public class ApprovalController {

    private final ApprovalWorkflowService workflowService;
    private final ApprovalRegistry registry;
    private final AuditLogService auditLogService;

    public ApprovalController(ApprovalWorkflowService workflowService,
                              ApprovalRegistry registry,
                              AuditLogService auditLogService) {
        this.workflowService = workflowService;
        this.registry = registry;
        this.auditLogService = auditLogService;
    }

    @GetMapping("/status")
    @Operation(summary = "Approval status",
               description = "Pending approvals with seconds remaining, recent outcomes and audit statistics")
    public ResponseEntity<StatusSummary> getStatus(@RequestParam(required = false) String communityId) {
        return ResponseEntity.ok(workflowService.statusSummary(communityId));
    }

    @GetMapping("/{communityId}/{participantId}")
    @Operation(summary = "Get a pending approval")
    public ResponseEntity<?> getPending(@PathVariable String communityId, @PathVariable String participantId) {
        Optional<PendingApproval> pending = registry.get(communityId, participantId);
        if (pending.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(pending.get());
    }

    @PostMapping("/{communityId}/{participantId}/decision")
    @Operation(summary = "Approve or reject a pending bot",
               description = "Body: {\"approve\": true|false, \"actorId\": \"...\"}. The actor must be a reviewer. "
                       + "A decision that loses to another decision or to the timeout returns alreadyHandled=true. "
                       + "actorId is taken from the body as-is: this endpoint trusts its caller to have "
                       + "authenticated the actor and must only be reachable by the platform connector.")
    public ResponseEntity<?> decide(@PathVariable String communityId,
                                    @PathVariable String participantId,
                                    @RequestBody Map<String, Object> body) {
        Object approve = body.get("approve");
        Object actorId = body.get("actorId");

        if (!(approve instanceof Boolean)) {
            return ResponseEntity.badRequest().body(Map.of("error", "approve is required and must be a boolean"));
        }
        if (!(actorId instanceof String) || ((String) actorId).isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "actorId is required"));
        }

        try {
            DecisionResult result = workflowService.onReviewerDecision(
                    communityId, participantId, (Boolean) approve, (String) actorId, DecisionSource.API);
            return ResponseEntity.ok(result);
        } catch (NotAuthorizedException e) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body(Map.of("error", e.getMessage()));
        } catch (ApprovalNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/history/{participantId}")
    @Operation(summary = "Audit history of one participant", description = "Oldest first")
    public ResponseEntity<List<AuditRecord>> getHistory(@PathVariable String participantId,
                                                        @RequestParam(required = false) String communityId) {
        return ResponseEntity.ok(auditLogService.history(participantId, communityId));
    }

    @GetMapping("/logs")
    @Operation(summary = "Recent audit records",
               description = "Newest first. limit defaults to 20 and is clamped to 1..50; "
                       + "pass nextCursor as before to page backwards.")
    public ResponseEntity<?> getLogs(@RequestParam(required = false) String communityId,
                                     @RequestParam(required = false) Integer limit,
                                     @RequestParam(required = false) String before) {
        try {
            return ResponseEntity.ok(auditLogService.recent(communityId, limit, before));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }
}
