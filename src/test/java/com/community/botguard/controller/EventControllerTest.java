package com.community.botguard.controller;

import com.community.botguard.model.*;
import com.community.botguard.service.ApprovalWorkflowService;
import com.community.botguard.service.ReviewCommandService;
import com.community.botguard.testutil.TestDataFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(EventController.class)
class EventControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private ApprovalWorkflowService workflowService;

    @MockBean
    private ReviewCommandService commandService;

    @Test
    void participantJoined_bot_returnsPending() throws Exception {
        PendingApproval approval = TestDataFactory.pendingApproval("GUILD-1", "BOT-42", 1_000L, 11_000L);
        when(workflowService.onParticipantDetected(any())).thenReturn(DetectionResult.pending(approval));

        mockMvc.perform(post("/api/v1/events/participant-joined")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(TestDataFactory.botJoined("GUILD-1", "BOT-42"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("PENDING"))
                .andExpect(jsonPath("$.approval.participantId").value("BOT-42"))
                .andExpect(jsonPath("$.approval.status").value("PENDING"))
                .andExpect(jsonPath("$.approval.timerHandle").doesNotExist());
    }

    @Test
    void participantJoined_missingIds_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/events/participant-joined")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("automated", true))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());

        verifyNoInteractions(workflowService);
    }

    @Test
    void reaction_decided_returnsDecision() throws Exception {
        when(commandService.handleReaction(any())).thenReturn(Optional.of(DecisionResult.builder()
                .communityId("GUILD-1")
                .participantId("BOT-42")
                .status(ApprovalStatus.APPROVED)
                .resolvedBy("REVIEWER-1")
                .build()));

        ReactionAddedEvent event = ReactionAddedEvent.builder()
                .communityId("GUILD-1").participantId("BOT-42").emoji("✅").actorId("REVIEWER-1").build();

        mockMvc.perform(post("/api/v1/events/reactions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(event)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("APPROVED"))
                .andExpect(jsonPath("$.alreadyHandled").value(false));
    }

    @Test
    void reaction_ignored() throws Exception {
        when(commandService.handleReaction(any())).thenReturn(Optional.empty());

        ReactionAddedEvent event = ReactionAddedEvent.builder()
                .communityId("GUILD-1").participantId("BOT-42").emoji("👍").actorId("USER-9").build();

        mockMvc.perform(post("/api/v1/events/reactions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(event)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ignored").value(true));
    }

    @Test
    void command_returnsReply() throws Exception {
        when(commandService.handleCommand(any())).thenReturn(CommandReply.ok("Pending Approvals: 0"));

        mockMvc.perform(post("/api/v1/events/commands")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(TestDataFactory.command("REVIEWER-1", "!status"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("Pending Approvals: 0"));
    }

    @Test
    void command_missingName_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/events/commands")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("communityId", "GUILD-1"))))
                .andExpect(status().isBadRequest());
    }
}
