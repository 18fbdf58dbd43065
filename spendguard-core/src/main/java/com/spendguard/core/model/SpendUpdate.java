package com.spendguard.core.model;

/**
 * The outcome of recording one request's cost against one aggregate.
 * {@code applied} is false when the request id had already been recorded.
 */
public class SpendUpdate {

    private final SpendAggregate aggregate;
    private final boolean applied;

    public SpendUpdate(SpendAggregate aggregate, boolean applied) {
        this.aggregate = aggregate;
        this.applied = applied;
    }

    public SpendAggregate getAggregate() {
        return aggregate;
    }

    public boolean isApplied() {
        return applied;
    }

    public boolean isDuplicate() {
        return !applied;
    }

    @Override
    public String toString() {
        return (applied ? "applied " : "duplicate ") + aggregate;
    }
}
