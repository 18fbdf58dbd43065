package com.spendguard.core.model;

import java.math.BigDecimal;

/**
 * The unit a provider rate is quoted in.
 * The multiplier is the size of the unit in its base unit. Only token rates
 * are normalized by it; other units are billed per quoted unit.
 */
public enum PricingUnit {

    PER_TOKEN(1),
    PER_1K_TOKENS(1_000),
    PER_1M_TOKENS(1_000_000),

    PER_CHARACTER(1),
    PER_1K_CHARACTERS(1_000),

    PER_SECOND(1),
    PER_MINUTE(60),
    PER_HOUR(3_600),

    PER_REQUEST(1),
    PER_IMAGE(1),
    PER_AUDIO_FILE(1),

    PER_MB(1),
    PER_GB(1_024);

    private final BigDecimal multiplier;

    PricingUnit(long multiplier) {
        this.multiplier = BigDecimal.valueOf(multiplier);
    }

    public BigDecimal getMultiplier() {
        return multiplier;
    }

    /** Token units are the only split units: they carry separate input and output rates. */
    public boolean isTokenBased() {
        return this == PER_TOKEN || this == PER_1K_TOKENS || this == PER_1M_TOKENS;
    }

    public boolean isCharacterBased() {
        return this == PER_CHARACTER || this == PER_1K_CHARACTERS;
    }

    public boolean isTimeBased() {
        return this == PER_SECOND || this == PER_MINUTE || this == PER_HOUR;
    }

    public boolean isRequestBased() {
        return this == PER_REQUEST || this == PER_IMAGE || this == PER_AUDIO_FILE;
    }

    public boolean isDataBased() {
        return this == PER_MB || this == PER_GB;
    }
}
