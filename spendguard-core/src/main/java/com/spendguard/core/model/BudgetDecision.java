package com.spendguard.core.model;

/**
 * Result of a pre-request budget check.
 */
public class BudgetDecision {

    public enum Outcome {
        /** Every applicable limit has room for the estimate. */
        ALLOW,
        /** At least one limit would be exceeded. */
        DENY,
        /** The check could not complete; the request is let through anyway. */
        ALLOW_DEGRADED
    }

    private static final BudgetDecision ALLOWED = new BudgetDecision(Outcome.ALLOW, null, null);

    private final Outcome outcome;
    private final BudgetDenial denial;
    private final String failureReason;

    private BudgetDecision(Outcome outcome, BudgetDenial denial, String failureReason) {
        this.outcome = outcome;
        this.denial = denial;
        this.failureReason = failureReason;
    }

    public static BudgetDecision allow() {
        return ALLOWED;
    }

    public static BudgetDecision deny(BudgetDenial denial) {
        return new BudgetDecision(Outcome.DENY, denial, null);
    }

    public static BudgetDecision failOpen(String failureReason) {
        return new BudgetDecision(Outcome.ALLOW_DEGRADED, null, failureReason);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isAllowed() {
        return outcome != Outcome.DENY;
    }

    public boolean isDenied() {
        return outcome == Outcome.DENY;
    }

    public boolean isDegraded() {
        return outcome == Outcome.ALLOW_DEGRADED;
    }

    /** Null unless denied. */
    public BudgetDenial getDenial() {
        return denial;
    }

    /** Null unless degraded. */
    public String getFailureReason() {
        return failureReason;
    }

    @Override
    public String toString() {
        return switch (outcome) {
            case ALLOW -> "BudgetDecision{ALLOW}";
            case DENY -> "BudgetDecision{DENY, " + denial.getReason() + "}";
            case ALLOW_DEGRADED -> "BudgetDecision{ALLOW_DEGRADED, " + failureReason + "}";
        };
    }
}
