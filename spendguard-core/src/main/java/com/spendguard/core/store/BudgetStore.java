package com.spendguard.core.store;

import com.spendguard.core.model.BudgetLimit;
import com.spendguard.core.model.BudgetPeriod;
import com.spendguard.core.model.BudgetScope;
import com.spendguard.core.model.PeriodType;
import com.spendguard.core.model.SpendUpdate;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Persistent budget state: configured limits, per-period spend aggregates, and
 * which alert thresholds have already fired.
 * Every method may throw {@link StoreException}.
 */
public interface BudgetStore {

    /**
     * The limit for (scope, period type), active or not. At most one exists.
     */
    Optional<BudgetLimit> findLimit(BudgetScope scope, PeriodType periodType);

    /**
     * Insert or replace the limit for its (scope, period type).
     */
    void upsertLimit(BudgetLimit limit);

    /**
     * Spend recorded so far in the period, zero if nothing has been recorded.
     */
    BigDecimal getAccumulated(BudgetScope scope, BudgetPeriod period);

    /**
     * Atomically add {@code amount} to the aggregate for (scope, period) unless
     * {@code requestId} has already been applied to it. The aggregate is created
     * on first use. Concurrent calls must converge on the plain sum.
     */
    SpendUpdate increment(BudgetScope scope, BudgetPeriod period, String requestId, BigDecimal amount);

    /**
     * Atomically mark a threshold as fired for (scope, period).
     *
     * @return true if this call marked it, false if it was already marked
     */
    boolean markThresholdFired(BudgetScope scope, BudgetPeriod period, int thresholdPercentage);
}
