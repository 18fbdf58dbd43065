package com.spendguard.core.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A configured spending cap for one (scope, period type).
 * Alert thresholds are percentages of the limit, kept ascending and unique.
 */
public class BudgetLimit {

    private final BudgetScope scope;
    private final PeriodType periodType;
    private final BigDecimal limitAmount;
    private final String currency;
    private final SortedSet<Integer> alertThresholds;
    private final boolean active;

    private BudgetLimit(Builder builder) {
        this.scope = Objects.requireNonNull(builder.scope, "scope");
        this.periodType = Objects.requireNonNull(builder.periodType, "periodType");
        this.limitAmount = Objects.requireNonNull(builder.limitAmount, "limitAmount");
        if (limitAmount.signum() < 0) {
            throw new IllegalArgumentException("Limit amount must be non-negative: " + limitAmount);
        }
        this.currency = builder.currency != null ? builder.currency : "USD";
        TreeSet<Integer> thresholds = new TreeSet<>();
        for (Integer t : builder.alertThresholds) {
            if (t == null || t <= 0) {
                throw new IllegalArgumentException("Alert thresholds must be positive percentages: " + t);
            }
            thresholds.add(t);
        }
        this.alertThresholds = Collections.unmodifiableSortedSet(thresholds);
        this.active = builder.active;
    }

    public BudgetScope getScope() {
        return scope;
    }

    public PeriodType getPeriodType() {
        return periodType;
    }

    public BigDecimal getLimitAmount() {
        return limitAmount;
    }

    public String getCurrency() {
        return currency;
    }

    public SortedSet<Integer> getAlertThresholds() {
        return alertThresholds;
    }

    public boolean isActive() {
        return active;
    }

    public Builder toBuilder() {
        return new Builder()
                .scope(scope)
                .periodType(periodType)
                .limitAmount(limitAmount)
                .currency(currency)
                .alertThresholds(List.copyOf(alertThresholds))
                .active(active);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private BudgetScope scope;
        private PeriodType periodType;
        private BigDecimal limitAmount;
        private String currency;
        private List<Integer> alertThresholds = List.of();
        private boolean active = true;

        public Builder scope(BudgetScope scope) {
            this.scope = scope;
            return this;
        }

        public Builder periodType(PeriodType periodType) {
            this.periodType = periodType;
            return this;
        }

        public Builder limitAmount(BigDecimal limitAmount) {
            this.limitAmount = limitAmount;
            return this;
        }

        public Builder limitAmount(String limitAmount) {
            return limitAmount(new BigDecimal(limitAmount));
        }

        public Builder currency(String currency) {
            this.currency = currency;
            return this;
        }

        public Builder alertThresholds(List<Integer> alertThresholds) {
            this.alertThresholds = alertThresholds != null ? alertThresholds : List.of();
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public BudgetLimit build() {
            return new BudgetLimit(this);
        }
    }

    @Override
    public String toString() {
        return "BudgetLimit{" + scope + " " + periodType + " " + limitAmount.toPlainString() + " " + currency
                + (active ? "" : " (inactive)") + ", thresholds=" + alertThresholds + '}';
    }
}
