package com.spendguard.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One concrete daily or monthly window, e.g. DAILY 2026-10-19.
 */
public final class BudgetPeriod {

    private final PeriodType type;
    private final Instant start;
    private final Instant end;
    private final String key;

    public BudgetPeriod(PeriodType type, Instant start, Instant end, String key) {
        this.type = type;
        this.start = start;
        this.end = end;
        this.key = key;
    }

    public PeriodType getType() {
        return type;
    }

    /** Inclusive. */
    public Instant getStart() {
        return start;
    }

    /** Exclusive. */
    public Instant getEnd() {
        return end;
    }

    /** "2026-10-19" for daily periods, "2026-10" for monthly ones. */
    public String getKey() {
        return key;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BudgetPeriod))
            return false;
        BudgetPeriod that = (BudgetPeriod) o;
        return type == that.type && key.equals(that.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, key);
    }

    @Override
    public String toString() {
        return type + "[" + key + "]";
    }
}
