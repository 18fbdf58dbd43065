package com.spendguard.core.cost;

import com.spendguard.core.config.SpendGuardProperties;
import com.spendguard.core.model.AiRequestContext;
import com.spendguard.core.model.PriceEntry;
import com.spendguard.core.model.PricingUnit;
import com.spendguard.core.model.UsageRecord;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TokenEstimatorTest {

    private final TokenEstimator estimator = new TokenEstimator(new SpendGuardProperties.EstimationProperties());
    private final PriceEntry tokenPrice = PriceEntry.tokenRate("openai", "gpt-4", PricingUnit.PER_1K_TOKENS, "0.03", "0.06");

    @Test
    void roundsPartialTokensUp() {
        assertEquals(3, estimator.estimateTokens(10));
        assertEquals(1, estimator.estimateTokens(1));
        assertEquals(0, estimator.estimateTokens(0));
    }

    @Test
    void splitsEstimateBetweenInputAndOutput() {
        UsageRecord usage = estimator.estimate(request(4000, null), tokenPrice);

        assertEquals(750, usage.getInputUnits());
        assertEquals(250, usage.getOutputUnits());
    }

    @Test
    void usesExpectedOutputTokensWhenGiven() {
        UsageRecord usage = estimator.estimate(request(4000, 500L), tokenPrice);

        assertEquals(1000, usage.getInputUnits());
        assertEquals(500, usage.getOutputUnits());
    }

    @Test
    void estimatesOneQuotedUnitForFlatPrices() {
        PriceEntry whisper = PriceEntry.flatRate("openai", "whisper-1", PricingUnit.PER_MINUTE, "0.006");

        UsageRecord usage = estimator.estimate(request(4000, null), whisper);

        assertEquals(1, usage.getTotalUnits());
    }

    @Test
    void rejectsNonPositiveCharsPerToken() {
        SpendGuardProperties.EstimationProperties props = new SpendGuardProperties.EstimationProperties();
        props.setCharsPerToken(0);

        assertThrows(IllegalArgumentException.class, () -> new TokenEstimator(props));
    }

    private static AiRequestContext request(long promptLength, Long expectedOutput) {
        return AiRequestContext.builder()
                .provider("openai")
                .model("gpt-4")
                .estimatedPromptLength(promptLength)
                .expectedOutputTokens(expectedOutput)
                .build();
    }
}
