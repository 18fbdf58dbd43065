package com.spendguard.core.model;

import java.math.BigDecimal;

/**
 * The result of pricing one usage record. For non-split units the input and
 * output components are zero and the whole amount sits in {@code totalCost}.
 */
public class CostBreakdown {

    private final BigDecimal inputCost;
    private final BigDecimal outputCost;
    private final BigDecimal totalCost;
    private final String currency;
    private final PricingUnit unit;
    private final PriceSource source;

    public CostBreakdown(BigDecimal inputCost, BigDecimal outputCost, BigDecimal totalCost,
            String currency, PricingUnit unit, PriceSource source) {
        this.inputCost = inputCost;
        this.outputCost = outputCost;
        this.totalCost = totalCost;
        this.currency = currency;
        this.unit = unit;
        this.source = source;
    }

    public BigDecimal getInputCost() {
        return inputCost;
    }

    public BigDecimal getOutputCost() {
        return outputCost;
    }

    public BigDecimal getTotalCost() {
        return totalCost;
    }

    public String getCurrency() {
        return currency;
    }

    public PricingUnit getUnit() {
        return unit;
    }

    public PriceSource getSource() {
        return source;
    }

    @Override
    public String toString() {
        return "CostBreakdown{total=" + totalCost.toPlainString() + " " + currency
                + ", unit=" + unit + ", source=" + source + '}';
    }
}
