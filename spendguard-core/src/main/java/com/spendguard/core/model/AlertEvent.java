package com.spendguard.core.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Emitted once when accumulated spend first reaches a configured percentage of
 * its limit within a period.
 */
public class AlertEvent {

    private final BudgetScope scope;
    private final BudgetPeriod period;
    private final int thresholdPercentage;
    private final BigDecimal spendAtTrigger;
    private final BigDecimal limitAtTrigger;
    private final AlertSeverity severity;
    private final Instant timestamp;

    public AlertEvent(BudgetScope scope, BudgetPeriod period, int thresholdPercentage,
            BigDecimal spendAtTrigger, BigDecimal limitAtTrigger, Instant timestamp) {
        this.scope = scope;
        this.period = period;
        this.thresholdPercentage = thresholdPercentage;
        this.spendAtTrigger = spendAtTrigger;
        this.limitAtTrigger = limitAtTrigger;
        this.severity = AlertSeverity.forThreshold(thresholdPercentage);
        this.timestamp = timestamp;
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

    public int getThresholdPercentage() {
        return thresholdPercentage;
    }

    public BigDecimal getSpendAtTrigger() {
        return spendAtTrigger;
    }

    public BigDecimal getLimitAtTrigger() {
        return limitAtTrigger;
    }

    public AlertSeverity getSeverity() {
        return severity;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "AlertEvent{" + scope + " " + period + " " + thresholdPercentage + "% (" + severity + ")"
                + ", spend=" + spendAtTrigger.toPlainString() + ", limit=" + limitAtTrigger.toPlainString() + '}';
    }
}
