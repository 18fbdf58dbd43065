package com.spendguard.core.pricing;

import com.spendguard.core.model.PriceEntry;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Structural checks on a price row. Stateless.
 */
public final class PricingValidator {

    private static final Pattern CURRENCY = Pattern.compile("[A-Z]{3}");

    private PricingValidator() {
    }

    /**
     * @return the problems found, empty if the entry is usable
     */
    public static List<String> validate(PriceEntry entry) {
        List<String> problems = new ArrayList<>();
        if (entry == null) {
            problems.add("entry is null");
            return problems;
        }
        if (isBlank(entry.getProvider()))
            problems.add("provider is required");
        if (isBlank(entry.getModel()))
            problems.add("model is required");
        if (entry.getUnit() == null) {
            problems.add("unit is required");
            return problems;
        }

        if (entry.getUnit().isTokenBased()) {
            if (entry.getInputRate() == null || entry.getOutputRate() == null)
                problems.add(entry.getUnit() + " requires both input and output rates");
            checkNonNegative(entry.getInputRate(), "input rate", problems);
            checkNonNegative(entry.getOutputRate(), "output rate", problems);
        } else {
            if (entry.getFlatRate() == null)
                problems.add(entry.getUnit() + " requires a flat rate");
            checkNonNegative(entry.getFlatRate(), "flat rate", problems);
        }

        if (entry.getCurrency() == null || !CURRENCY.matcher(entry.getCurrency()).matches())
            problems.add("currency must be a 3-letter code: " + entry.getCurrency());
        if (!entry.getBillingModel().isCompatibleWith(entry.getUnit()))
            problems.add("billing model " + entry.getBillingModel() + " does not support " + entry.getUnit());
        return problems;
    }

    public static boolean isValid(PriceEntry entry) {
        return validate(entry).isEmpty();
    }

    /**
     * @throws InconsistentPriceEntryException if the entry has any problem
     */
    public static void requireValid(PriceEntry entry) {
        List<String> problems = validate(entry);
        if (!problems.isEmpty())
            throw new InconsistentPriceEntryException(entry, problems);
    }

    private static void checkNonNegative(BigDecimal value, String name, List<String> problems) {
        if (value != null && value.signum() < 0)
            problems.add(name + " must not be negative: " + value.toPlainString());
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
