package com.spendguard.core.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Accumulated spend for one scope in one daily or monthly period.
 */
public class SpendAggregate {

    private final BudgetScope scope;
    private final BudgetPeriod period;
    private final BigDecimal accumulatedAmount;

    public SpendAggregate(BudgetScope scope, BudgetPeriod period, BigDecimal accumulatedAmount) {
        this.scope = scope;
        this.period = period;
        this.accumulatedAmount = accumulatedAmount;
    }

    public BudgetScope getScope() {
        return scope;
    }

    public BudgetPeriod getPeriod() {
        return period;
    }

    public PeriodType getPeriodType() {
        return period.getType();
    }

    public Instant getPeriodStart() {
        return period.getStart();
    }

    public Instant getPeriodEnd() {
        return period.getEnd();
    }

    public BigDecimal getAccumulatedAmount() {
        return accumulatedAmount;
    }

    @Override
    public String toString() {
        return "SpendAggregate{" + scope + " " + period + " = " + accumulatedAmount.toPlainString() + '}';
    }
}
