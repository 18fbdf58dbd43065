package com.spendguard.core.pipeline;

import com.spendguard.core.model.AiRequestContext;
import com.spendguard.core.model.GuardOutcome;

/**
 * The rest of the pipeline, as seen from one stage.
 */
@FunctionalInterface
public interface StageChain {

    GuardOutcome proceed(AiRequestContext request);
}
