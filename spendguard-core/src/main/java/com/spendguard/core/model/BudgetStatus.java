package com.spendguard.core.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * A point-in-time view of one scope's budget for one period type.
 */
public class BudgetStatus {

    public enum Level {
        NORMAL,
        WARNING,
        CRITICAL,
        EXCEEDED,
        /** No active limit is configured. */
        UNLIMITED
    }

    private final BudgetScope scope;
    private final PeriodType periodType;
    private final BigDecimal limit;
    private final BigDecimal spent;

    public BudgetStatus(BudgetScope scope, PeriodType periodType, BigDecimal limit, BigDecimal spent) {
        this.scope = scope;
        this.periodType = periodType;
        this.limit = limit;
        this.spent = spent;
    }

    public BudgetScope getScope() {
        return scope;
    }

    public PeriodType getPeriodType() {
        return periodType;
    }

    /** Null when no limit is configured. */
    public BigDecimal getLimit() {
        return limit;
    }

    public BigDecimal getSpent() {
        return spent;
    }

    public BigDecimal getRemaining() {
        if (limit == null)
            return null;
        BigDecimal remaining = limit.subtract(spent);
        return remaining.signum() < 0 ? BigDecimal.ZERO : remaining;
    }

    public BigDecimal getUsagePercentage() {
        if (limit == null)
            return BigDecimal.ZERO;
        if (limit.signum() == 0)
            return spent.signum() > 0 ? BigDecimal.valueOf(100) : BigDecimal.ZERO;
        return spent.multiply(BigDecimal.valueOf(100)).divide(limit, 2, RoundingMode.HALF_UP);
    }

    public Level getLevel() {
        if (limit == null)
            return Level.UNLIMITED;
        BigDecimal pct = getUsagePercentage();
        if (pct.compareTo(BigDecimal.valueOf(100)) >= 0)
            return Level.EXCEEDED;
        if (pct.compareTo(BigDecimal.valueOf(95)) >= 0)
            return Level.CRITICAL;
        if (pct.compareTo(BigDecimal.valueOf(80)) >= 0)
            return Level.WARNING;
        return Level.NORMAL;
    }

    @Override
    public String toString() {
        return "BudgetStatus{" + scope + " " + periodType + " " + spent.toPlainString()
                + "/" + (limit != null ? limit.toPlainString() : "-") + " " + getLevel() + '}';
    }
}
