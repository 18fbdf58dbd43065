package com.spendguard.core.pricing;

import com.spendguard.core.model.BillingModel;
import com.spendguard.core.model.PriceEntry;
import com.spendguard.core.model.PricingUnit;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class PricingValidatorTest {

    @Test
    void acceptsWellFormedEntries() {
        assertTrue(PricingValidator.isValid(
                PriceEntry.tokenRate("openai", "gpt-4", PricingUnit.PER_1K_TOKENS, "0.03", "0.06")));
        assertTrue(PricingValidator.isValid(
                PriceEntry.flatRate("openai", "dall-e-3", PricingUnit.PER_IMAGE, "0.04")));
    }

    @Test
    void requiresBothRatesForTokenUnits() {
        PriceEntry entry = PriceEntry.builder().provider("openai").model("gpt-4")
                .unit(PricingUnit.PER_1K_TOKENS).inputRate(new BigDecimal("0.03")).build();

        assertFalse(PricingValidator.isValid(entry));
    }

    @Test
    void requiresFlatRateForOtherUnits() {
        PriceEntry entry = PriceEntry.builder().provider("openai").model("whisper-1")
                .unit(PricingUnit.PER_MINUTE).inputRate(new BigDecimal("0.006")).outputRate(BigDecimal.ZERO).build();

        assertFalse(PricingValidator.isValid(entry));
    }

    @Test
    void rejectsNegativeRatesAndBadCurrency() {
        assertFalse(PricingValidator.isValid(
                PriceEntry.tokenRate("openai", "gpt-4", PricingUnit.PER_1K_TOKENS, "-0.03", "0.06")));
        assertFalse(PricingValidator.isValid(
                PriceEntry.tokenRate("openai", "gpt-4", PricingUnit.PER_1K_TOKENS, "0.03", "0.06")
                        .toBuilder().currency("usd").build()));
    }

    @Test
    void rejectsMissingIdentity() {
        PriceEntry entry = PriceEntry.tokenRate("", "gpt-4", PricingUnit.PER_1K_TOKENS, "0.03", "0.06");

        assertEquals(1, PricingValidator.validate(entry).size());
        assertThrows(InconsistentPriceEntryException.class, () -> PricingValidator.requireValid(entry));
    }

    @Test
    void checksBillingModelAgainstUnit() {
        PriceEntry subscriptionTokens = PriceEntry.tokenRate("openai", "gpt-4", PricingUnit.PER_1K_TOKENS, "0.03", "0.06")
                .toBuilder().billingModel(BillingModel.SUBSCRIPTION).build();
        PriceEntry creditImages = PriceEntry.flatRate("openai", "dall-e-3", PricingUnit.PER_IMAGE, "0.04")
                .toBuilder().billingModel(BillingModel.CREDITS).build();

        assertFalse(PricingValidator.isValid(subscriptionTokens));
        assertTrue(PricingValidator.isValid(creditImages));
    }
}
