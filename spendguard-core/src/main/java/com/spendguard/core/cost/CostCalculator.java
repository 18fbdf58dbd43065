package com.spendguard.core.cost;

import com.spendguard.core.model.CostBreakdown;
import com.spendguard.core.model.PriceEntry;
import com.spendguard.core.model.PricingUnit;
import com.spendguard.core.model.UsageRecord;
import com.spendguard.core.pricing.PricingValidator;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Turns usage into money. Pure and thread-safe.
 *
 * Token rates are quoted per {@link PricingUnit} and usage is a raw token
 * count, so each side is {@code rate * tokens / multiplier}. Multiplication
 * happens before division so small rates keep their precision.
 * Every other unit is billed as {@code rate * quantity}, the quantity already
 * counted in the quoted unit (minutes for a per-minute rate).
 */
public class CostCalculator {

    public static final int SCALE = 10;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_EVEN;

    /**
     * @throws com.spendguard.core.pricing.InconsistentPriceEntryException if the
     *         entry's rates do not fit its unit
     */
    public CostBreakdown calculate(PriceEntry price, UsageRecord usage) {
        PricingValidator.requireValid(price);
        PricingUnit unit = price.getUnit();

        if (unit.isTokenBased()) {
            BigDecimal inputCost = component(price.getInputRate(), usage.getInputUnits(), unit);
            BigDecimal outputCost = component(price.getOutputRate(), usage.getOutputUnits(), unit);
            return new CostBreakdown(inputCost, outputCost, inputCost.add(outputCost),
                    price.getCurrency(), unit, price.getSource());
        }

        BigDecimal total = price.getFlatRate().multiply(BigDecimal.valueOf(usage.getTotalUnits()))
                .setScale(SCALE, ROUNDING);
        BigDecimal zero = BigDecimal.ZERO.setScale(SCALE);
        return new CostBreakdown(zero, zero, total, price.getCurrency(), unit, price.getSource());
    }

    private static BigDecimal component(BigDecimal rate, long quantity, PricingUnit unit) {
        return rate.multiply(BigDecimal.valueOf(quantity))
                .divide(unit.getMultiplier(), SCALE, ROUNDING);
    }
}
