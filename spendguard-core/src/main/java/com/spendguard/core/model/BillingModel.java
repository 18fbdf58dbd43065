package com.spendguard.core.model;

/**
 * How a provider charges for a model.
 */
public enum BillingModel {

    PAY_PER_USE,
    TIERED,
    SUBSCRIPTION,
    CREDITS,
    FREE_TIER,
    ENTERPRISE;

    /**
     * Whether a rate quoted in the given unit makes sense under this billing
     * model. Price rows that fail this check are treated as misconfigured.
     */
    public boolean isCompatibleWith(PricingUnit unit) {
        return switch (this) {
            case PAY_PER_USE, TIERED, ENTERPRISE -> true;
            case CREDITS -> unit.isTokenBased() || unit.isRequestBased();
            case SUBSCRIPTION -> unit.isTimeBased() || unit.isRequestBased();
            case FREE_TIER -> unit.isRequestBased() || unit.isTokenBased();
        };
    }
}
