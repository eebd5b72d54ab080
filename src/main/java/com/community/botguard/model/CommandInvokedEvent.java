package com.community.botguard.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A text command issued in a community channel")
public class CommandInvokedEvent {

    @Schema(description = "Community the command was issued in", example = "GUILD-1")
    private String communityId;

    @Schema(description = "Channel to post the reply to; optional", example = "CHANNEL-3")
    private String channelId;

    @Schema(description = "Account that issued the command", example = "REVIEWER-1")
    private String actorId;

    @Schema(description = "Command name, with or without the configured prefix", example = "approve",
            allowableValues = {"status", "botstatus", "approve", "reject", "history", "bothistory", "logs"})
    private String name;

    @Schema(description = "Positional arguments", example = "[\"BOT-42\"]")
    private List<String> args;
}
