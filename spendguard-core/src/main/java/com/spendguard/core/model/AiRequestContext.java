package com.spendguard.core.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Everything the pipeline knows about an LLM call before it is made.
 * The recognised per-request options are the typed fields at the bottom;
 * there is no free-form options map.
 */
public class AiRequestContext {

    private final String requestId;
    private final String provider;
    private final String model;
    private final List<BudgetScope> scopes;
    private final long estimatedPromptLength;
    private final Instant timestamp;

    // Options
    private final BigDecimal perRequestBudgetLimit; // null = use configured limits
    private final Long expectedOutputTokens; // null = derive from prompt length
    private final Set<String> disabledStages;

    private AiRequestContext(Builder builder) {
        this.requestId = builder.requestId != null ? builder.requestId : UUID.randomUUID().toString();
        this.provider = builder.provider;
        this.model = builder.model;
        this.scopes = builder.scopes != null ? List.copyOf(builder.scopes) : List.of();
        this.estimatedPromptLength = builder.estimatedPromptLength;
        this.timestamp = builder.timestamp != null ? builder.timestamp : Instant.now();
        this.perRequestBudgetLimit = builder.perRequestBudgetLimit;
        this.expectedOutputTokens = builder.expectedOutputTokens;
        this.disabledStages = builder.disabledStages != null ? Set.copyOf(builder.disabledStages) : Set.of();
    }

    public String getRequestId() {
        return requestId;
    }

    public String getProvider() {
        return provider;
    }

    public String getModel() {
        return model;
    }

    /** User first, then project, then organization, each only if known. */
    public List<BudgetScope> getScopes() {
        return scopes;
    }

    /** Prompt length in characters. */
    public long getEstimatedPromptLength() {
        return estimatedPromptLength;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public BigDecimal getPerRequestBudgetLimit() {
        return perRequestBudgetLimit;
    }

    public Long getExpectedOutputTokens() {
        return expectedOutputTokens;
    }

    public Set<String> getDisabledStages() {
        return disabledStages;
    }

    public boolean isStageDisabled(String stageId) {
        return disabledStages.contains(stageId);
    }

    /**
     * Creates a copy of this context pointing at a different model
     * (used when the caller leaves the model blank and a provider default is picked).
     */
    public AiRequestContext withModel(String model) {
        return toBuilder().model(model).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .requestId(requestId)
                .provider(provider)
                .model(model)
                .scopes(scopes)
                .estimatedPromptLength(estimatedPromptLength)
                .timestamp(timestamp)
                .perRequestBudgetLimit(perRequestBudgetLimit)
                .expectedOutputTokens(expectedOutputTokens)
                .disabledStages(disabledStages);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String requestId;
        private String provider;
        private String model;
        private List<BudgetScope> scopes;
        private long estimatedPromptLength;
        private Instant timestamp;
        private BigDecimal perRequestBudgetLimit;
        private Long expectedOutputTokens;
        private Set<String> disabledStages;

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder provider(String provider) {
            this.provider = provider;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder scopes(List<BudgetScope> scopes) {
            this.scopes = scopes;
            return this;
        }

        public Builder scopes(BudgetScope... scopes) {
            this.scopes = List.of(scopes);
            return this;
        }

        public Builder estimatedPromptLength(long estimatedPromptLength) {
            this.estimatedPromptLength = estimatedPromptLength;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder perRequestBudgetLimit(BigDecimal perRequestBudgetLimit) {
            this.perRequestBudgetLimit = perRequestBudgetLimit;
            return this;
        }

        public Builder expectedOutputTokens(Long expectedOutputTokens) {
            this.expectedOutputTokens = expectedOutputTokens;
            return this;
        }

        public Builder disabledStages(Set<String> disabledStages) {
            this.disabledStages = disabledStages;
            return this;
        }

        public AiRequestContext build() {
            return new AiRequestContext(this);
        }
    }

    @Override
    public String toString() {
        return "AiRequestContext{" +
                "requestId='" + requestId + '\'' +
                ", provider='" + provider + '\'' +
                ", model='" + model + '\'' +
                ", scopes=" + scopes +
                '}';
    }
}
