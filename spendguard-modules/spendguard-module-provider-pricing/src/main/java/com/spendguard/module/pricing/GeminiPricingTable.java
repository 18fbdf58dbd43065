package com.spendguard.module.pricing;

import org.springframework.stereotype.Component;

import static com.spendguard.core.model.PricingUnit.PER_1K_TOKENS;
import static com.spendguard.core.model.PricingUnit.PER_1M_TOKENS;

/**
 * Google Gemini list prices, per 1M tokens except the legacy gemini-pro.
 */
@Component
public class GeminiPricingTable extends StaticPricingTable {

    public GeminiPricingTable() {
        super("gemini", "gemini-2.0-flash");

        tokens("gemini-2.5-pro", PER_1M_TOKENS, "1.25", "10.00");
        tokens("gemini-2.5-flash", PER_1M_TOKENS, "0.30", "2.50");
        tokens("gemini-2.5-flash-lite", PER_1M_TOKENS, "0.10", "0.40");
        tokens("gemini-2.0-flash", PER_1M_TOKENS, "0.075", "0.30");
        tokens("gemini-2.0-flash-lite", PER_1M_TOKENS, "0.075", "0.30");
        tokens("gemini-2.0-pro", PER_1M_TOKENS, "1.25", "10.00");
        tokens("gemini-1.5-pro", PER_1M_TOKENS, "1.25", "5.00");
        tokens("gemini-1.5-flash", PER_1M_TOKENS, "0.075", "0.30");

        tokens("gemini-pro", PER_1K_TOKENS, "0.0005", "0.0015");
    }
}
