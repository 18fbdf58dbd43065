package com.spendguard.module.pricing;

import org.springframework.stereotype.Component;

import static com.spendguard.core.model.PricingUnit.PER_1M_TOKENS;

/**
 * xAI Grok list prices, per 1M tokens.
 */
@Component
public class XaiPricingTable extends StaticPricingTable {

    public XaiPricingTable() {
        super("xai", "grok-2-1212");

        tokens("grok-beta", PER_1M_TOKENS, "5.00", "15.00");
        tokens("grok-2", PER_1M_TOKENS, "2.00", "10.00");
        tokens("grok-2-1212", PER_1M_TOKENS, "2.00", "10.00");
        tokens("grok-2-vision-1212", PER_1M_TOKENS, "2.00", "10.00");
        tokens("grok-2-mini", PER_1M_TOKENS, "1.00", "5.00");
        tokens("grok-4", PER_1M_TOKENS, "3.00", "15.00");
        tokens("grok-4-0709", PER_1M_TOKENS, "3.00", "15.00");
    }
}
