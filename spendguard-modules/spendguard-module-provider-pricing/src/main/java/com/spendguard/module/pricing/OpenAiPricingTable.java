package com.spendguard.module.pricing;

import org.springframework.stereotype.Component;

import static com.spendguard.core.model.PricingUnit.PER_1K_CHARACTERS;
import static com.spendguard.core.model.PricingUnit.PER_1K_TOKENS;
import static com.spendguard.core.model.PricingUnit.PER_IMAGE;
import static com.spendguard.core.model.PricingUnit.PER_MINUTE;

/**
 * OpenAI list prices. Chat models per 1K tokens.
 */
@Component
public class OpenAiPricingTable extends StaticPricingTable {

    public OpenAiPricingTable() {
        super("openai", "gpt-4o-mini");

        tokens("gpt-3.5-turbo", PER_1K_TOKENS, "0.0015", "0.002");
        tokens("gpt-3.5-turbo-16k", PER_1K_TOKENS, "0.003", "0.004");
        tokens("gpt-3.5-turbo-0125", PER_1K_TOKENS, "0.0005", "0.0015");
        tokens("gpt-3.5-turbo-1106", PER_1K_TOKENS, "0.001", "0.002");

        tokens("gpt-4", PER_1K_TOKENS, "0.03", "0.06");
        tokens("gpt-4-32k", PER_1K_TOKENS, "0.06", "0.12");
        tokens("gpt-4-turbo", PER_1K_TOKENS, "0.01", "0.03");
        tokens("gpt-4-1106-preview", PER_1K_TOKENS, "0.01", "0.03");
        tokens("gpt-4-0125-preview", PER_1K_TOKENS, "0.01", "0.03");

        tokens("gpt-4o", PER_1K_TOKENS, "0.0025", "0.01");
        tokens("gpt-4o-mini", PER_1K_TOKENS, "0.00015", "0.0006");

        flat("whisper-1", PER_MINUTE, "0.006");
        flat("tts-1", PER_1K_CHARACTERS, "0.015");
        flat("tts-1-hd", PER_1K_CHARACTERS, "0.030");
        flat("dall-e-2", PER_IMAGE, "0.020");
        flat("dall-e-3", PER_IMAGE, "0.040");
    }
}
