package com.spendguard.core.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * The window a limit resets on.
 */
public enum PeriodType {

    /** Applies to a single call; nothing accumulates. */
    PER_REQUEST,
    DAILY,
    MONTHLY;

    public boolean isAccumulating() {
        return this != PER_REQUEST;
    }

    /**
     * The period containing {@code now} in the given zone.
     *
     * @throws IllegalStateException for {@link #PER_REQUEST}, which has no calendar window
     */
    public BudgetPeriod periodAt(Instant now, ZoneId zone) {
        LocalDate today = now.atZone(zone).toLocalDate();
        switch (this) {
            case DAILY: {
                ZonedDateTime start = today.atStartOfDay(zone);
                return new BudgetPeriod(this, start.toInstant(), start.plusDays(1).toInstant(),
                        today.toString());
            }
            case MONTHLY: {
                LocalDate first = today.withDayOfMonth(1);
                ZonedDateTime start = first.atStartOfDay(zone);
                return new BudgetPeriod(this, start.toInstant(), start.plusMonths(1).toInstant(),
                        first.toString().substring(0, 7));
            }
            default:
                throw new IllegalStateException("Per-request limits have no accumulation period");
        }
    }
}
