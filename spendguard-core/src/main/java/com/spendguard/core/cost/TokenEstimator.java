package com.spendguard.core.cost;

import com.spendguard.core.config.SpendGuardProperties;
import com.spendguard.core.model.AiRequestContext;
import com.spendguard.core.model.PriceEntry;
import com.spendguard.core.model.UsageRecord;

/**
 * Guesses the usage of a call that has not been made yet, from the prompt
 * length alone. Roughly four characters per token for English text.
 */
public class TokenEstimator {

    private final SpendGuardProperties.EstimationProperties properties;

    public TokenEstimator(SpendGuardProperties.EstimationProperties properties) {
        if (properties.getCharsPerToken() <= 0)
            throw new IllegalArgumentException("charsPerToken must be positive");
        if (properties.getInputShare() < 0 || properties.getInputShare() > 1)
            throw new IllegalArgumentException("inputShare must be between 0 and 1");
        this.properties = properties;
    }

    public long estimateTokens(long promptLength) {
        if (promptLength <= 0)
            return 0;
        long perToken = properties.getCharsPerToken();
        return (promptLength + perToken - 1) / perToken;
    }

    /**
     * Estimated usage for the request, in the units the price is quoted in.
     * Non-token prices are estimated as a single quoted unit (one minute of
     * audio for a per-minute price).
     */
    public UsageRecord estimate(AiRequestContext context, PriceEntry price) {
        if (!price.getUnit().isTokenBased())
            return new UsageRecord(context.getProvider(), context.getModel(), 1, 0);

        long tokens = estimateTokens(context.getEstimatedPromptLength());
        if (context.getExpectedOutputTokens() != null)
            return new UsageRecord(context.getProvider(), context.getModel(), tokens,
                    Math.max(0, context.getExpectedOutputTokens()));

        long input = Math.round(tokens * properties.getInputShare());
        return new UsageRecord(context.getProvider(), context.getModel(), input, tokens - input);
    }
}
