package com.spendguard.core.model;

/**
 * What the provider-call collaborator hands back: its own result object,
 * passed through untouched, plus the usage it reported.
 */
public class ProviderResponse {

    private final Object body;
    private final UsageRecord usage;

    public ProviderResponse(Object body, UsageRecord usage) {
        this.body = body;
        this.usage = usage;
    }

    public Object getBody() {
        return body;
    }

    public <T> T getBodyAs(Class<T> type) {
        return type.cast(body);
    }

    /** Null when the provider did not report usage. */
    public UsageRecord getUsage() {
        return usage;
    }

    public boolean hasUsage() {
        return usage != null;
    }

    @Override
    public String toString() {
        return "ProviderResponse{usage=" + usage + '}';
    }
}
