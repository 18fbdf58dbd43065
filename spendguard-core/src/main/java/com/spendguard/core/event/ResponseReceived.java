package com.spendguard.core.event;

import com.spendguard.core.model.BudgetScope;
import com.spendguard.core.model.UsageRecord;

import java.time.Instant;
import java.util.List;

/**
 * A provider call completed and reported usage.
 */
public class ResponseReceived {

    private final String requestId;
    private final List<BudgetScope> scopes;
    private final UsageRecord usage;
    private final Instant receivedAt;

    public ResponseReceived(String requestId, List<BudgetScope> scopes, UsageRecord usage, Instant receivedAt) {
        this.requestId = requestId;
        this.scopes = List.copyOf(scopes);
        this.usage = usage;
        this.receivedAt = receivedAt;
    }

    public String getRequestId() {
        return requestId;
    }

    public List<BudgetScope> getScopes() {
        return scopes;
    }

    public UsageRecord getUsage() {
        return usage;
    }

    public Instant getReceivedAt() {
        return receivedAt;
    }

    @Override
    public String toString() {
        return "ResponseReceived{" + requestId + ", " + usage + '}';
    }
}
