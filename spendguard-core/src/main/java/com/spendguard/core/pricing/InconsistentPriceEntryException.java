package com.spendguard.core.pricing;

import com.spendguard.core.SpendGuardException;
import com.spendguard.core.model.PriceEntry;

import java.util.List;

/**
 * A price row whose rates do not fit its unit or billing model.
 */
public class InconsistentPriceEntryException extends SpendGuardException {

    private final transient PriceEntry entry;
    private final List<String> problems;

    public InconsistentPriceEntryException(PriceEntry entry, List<String> problems) {
        super("Inconsistent price entry " + entry + ": " + String.join("; ", problems));
        this.entry = entry;
        this.problems = List.copyOf(problems);
    }

    public PriceEntry getEntry() {
        return entry;
    }

    public List<String> getProblems() {
        return problems;
    }
}
