package com.spendguard.core.model;

/**
 * What the caller gets back from the pipeline: either the provider's response
 * or a typed budget rejection. A rejection is a normal return value, not an exception.
 */
public class GuardOutcome {

    private final ProviderResponse response;
    private final BudgetDecision decision;

    private GuardOutcome(ProviderResponse response, BudgetDecision decision) {
        this.response = response;
        this.decision = decision;
    }

    public static GuardOutcome allowed(ProviderResponse response) {
        return new GuardOutcome(response, BudgetDecision.allow());
    }

    public static GuardOutcome allowed(ProviderResponse response, BudgetDecision decision) {
        return new GuardOutcome(response, decision);
    }

    public static GuardOutcome denied(BudgetDenial denial) {
        return new GuardOutcome(null, BudgetDecision.deny(denial));
    }

    public boolean isAllowed() {
        return decision.isAllowed();
    }

    public boolean isDenied() {
        return decision.isDenied();
    }

    /** Null when denied. */
    public ProviderResponse getResponse() {
        return response;
    }

    public BudgetDecision getDecision() {
        return decision;
    }

    /** Null unless denied. */
    public BudgetDenial getDenial() {
        return decision.getDenial();
    }

    @Override
    public String toString() {
        return "GuardOutcome{" + decision + '}';
    }
}
