package com.spendguard.core.model;

import java.math.BigDecimal;

/**
 * Why a request was refused: the first scope/period whose limit the estimate
 * would have pushed past. Rate-limit style, so web front ends can map it to 429.
 */
public class BudgetDenial {

    public static final int HTTP_STATUS = 429;

    private final BudgetScope scope;
    private final PeriodType periodType;
    private final BigDecimal currentSpend;
    private final BigDecimal limit;
    private final BigDecimal estimatedCost;

    public BudgetDenial(BudgetScope scope, PeriodType periodType, BigDecimal currentSpend,
            BigDecimal limit, BigDecimal estimatedCost) {
        this.scope = scope;
        this.periodType = periodType;
        this.currentSpend = currentSpend;
        this.limit = limit;
        this.estimatedCost = estimatedCost;
    }

    public BudgetScope getScope() {
        return scope;
    }

    public PeriodType getPeriodType() {
        return periodType;
    }

    public BigDecimal getCurrentSpend() {
        return currentSpend;
    }

    public BigDecimal getLimit() {
        return limit;
    }

    public BigDecimal getEstimatedCost() {
        return estimatedCost;
    }

    public int getHttpStatus() {
        return HTTP_STATUS;
    }

    public String getReason() {
        if (periodType == PeriodType.PER_REQUEST) {
            return String.format("Per-request budget of %s for %s would be exceeded (estimated cost %s)",
                    limit.toPlainString(), scope, estimatedCost.toPlainString());
        }
        return String.format("%s budget of %s for %s would be exceeded (current spend %s, estimated cost %s)",
                periodType == PeriodType.DAILY ? "Daily" : "Monthly",
                limit.toPlainString(), scope, currentSpend.toPlainString(), estimatedCost.toPlainString());
    }

    @Override
    public String toString() {
        return "BudgetDenial{" + getReason() + '}';
    }
}
