package com.community.botguard.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditStats {
    private int totalActions;
    private int detectedCount;
    private int approvedCount;
    private int rejectedCount;
    private int timedOutCount;
    private int removalFailedCount;

    // last 24 hours
    private int recentTotal;
    private int recentApproved;
    private int recentRejected;
    private int recentTimedOut;
}
