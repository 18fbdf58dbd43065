package com.spendguard.core.pipeline;

import com.spendguard.core.model.AiRequestContext;
import com.spendguard.core.model.GuardOutcome;

/**
 * A step every LLM call passes through before the provider is invoked.
 *
 * <p>
 * Stages are discovered automatically via Spring's component scanning.
 * Simply annotate your implementation with {@code @Component}.
 * </p>
 *
 * <p>
 * A stage either hands the request on with {@link StageChain#proceed} and
 * returns what comes back, or short-circuits with its own outcome, in which
 * case later stages and the provider are never called.
 * </p>
 */
public interface PipelineStage {

    /**
     * Unique identifier for this stage. Used in configuration keys:
     * {@code spendguard.stages.{id}.enabled}
     */
    String getId();

    /**
     * Human-readable name for logging.
     */
    String getName();

    /**
     * Priority order. Lower values run first, closer to the caller.
     */
    default int getOrder() {
        return 500;
    }

    /**
     * Runs on the caller's thread, before the provider call. Keep it fast.
     */
    GuardOutcome handle(AiRequestContext request, StageContext context, StageChain chain);

    /**
     * Whether this stage is enabled. Checked against configuration.
     */
    default boolean isEnabled(StageContext context) {
        return context.getProperties().isStageEnabled(getId());
    }
}
