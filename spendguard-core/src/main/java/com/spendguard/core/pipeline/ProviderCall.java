package com.spendguard.core.pipeline;

import com.spendguard.core.model.AiRequestContext;
import com.spendguard.core.model.ProviderResponse;

/**
 * The actual call to the LLM provider. Exceptions it throws reach the caller
 * unchanged.
 */
@FunctionalInterface
public interface ProviderCall {

    ProviderResponse call(AiRequestContext request);
}
