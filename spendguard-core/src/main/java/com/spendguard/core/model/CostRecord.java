package com.spendguard.core.model;

import java.time.Instant;
import java.util.List;

/**
 * The persisted actual cost of one completed provider call.
 */
public class CostRecord {

    private final String requestId;
    private final UsageRecord usage;
    private final CostBreakdown breakdown;
    private final List<BudgetScope> scopes;
    private final Instant recordedAt;

    public CostRecord(String requestId, UsageRecord usage, CostBreakdown breakdown,
            List<BudgetScope> scopes, Instant recordedAt) {
        this.requestId = requestId;
        this.usage = usage;
        this.breakdown = breakdown;
        this.scopes = List.copyOf(scopes);
        this.recordedAt = recordedAt;
    }

    public String getRequestId() {
        return requestId;
    }

    public UsageRecord getUsage() {
        return usage;
    }

    public CostBreakdown getBreakdown() {
        return breakdown;
    }

    public List<BudgetScope> getScopes() {
        return scopes;
    }

    public Instant getRecordedAt() {
        return recordedAt;
    }

    @Override
    public String toString() {
        return "CostRecord{" + requestId + ", " + usage + ", " + breakdown + '}';
    }
}
