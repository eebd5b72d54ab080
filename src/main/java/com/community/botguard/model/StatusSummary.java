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
@Schema(description = "Pending approvals plus recent outcomes and audit statistics")
public class StatusSummary {

    @Schema(description = "Number of participants currently pending", example = "2")
    private int pendingCount;

    @Schema(description = "Pending approvals, oldest first")
    private List<PendingApproval> pending;

    @Schema(description = "Most recent outcome records")
    private List<AuditRecord> recentOutcomes;

    @Schema(description = "Overall and last-24-hours counts")
    private AuditStats stats;
}
