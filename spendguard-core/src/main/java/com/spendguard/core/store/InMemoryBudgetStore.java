package com.spendguard.core.store;

import com.spendguard.core.model.BudgetLimit;
import com.spendguard.core.model.BudgetPeriod;
import com.spendguard.core.model.BudgetScope;
import com.spendguard.core.model.PeriodType;
import com.spendguard.core.model.SpendAggregate;
import com.spendguard.core.model.SpendUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory implementation of BudgetStore for development and single-instance
 * deployments. Old periods are kept, not deleted, when a new one starts.
 */
public class InMemoryBudgetStore implements BudgetStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBudgetStore.class);

    private final Map<LimitKey, BudgetLimit> limits = new ConcurrentHashMap<>();
    private final Map<AggregateKey, AggregateEntry> aggregates = new ConcurrentHashMap<>();

    @Override
    public Optional<BudgetLimit> findLimit(BudgetScope scope, PeriodType periodType) {
        return Optional.ofNullable(limits.get(new LimitKey(scope, periodType)));
    }

    @Override
    public void upsertLimit(BudgetLimit limit) {
        limits.put(new LimitKey(limit.getScope(), limit.getPeriodType()), limit);
        log.info("[SpendGuard] Budget limit set: {}", limit);
    }

    @Override
    public BigDecimal getAccumulated(BudgetScope scope, BudgetPeriod period) {
        AggregateEntry entry = aggregates.get(new AggregateKey(scope, period));
        return entry != null ? entry.total.get() : BigDecimal.ZERO;
    }

    @Override
    public SpendUpdate increment(BudgetScope scope, BudgetPeriod period, String requestId, BigDecimal amount) {
        AggregateEntry entry = aggregates.computeIfAbsent(new AggregateKey(scope, period), k -> new AggregateEntry());
        boolean applied = entry.recordedRequests.add(requestId);
        BigDecimal total = applied
                ? entry.total.accumulateAndGet(amount, BigDecimal::add)
                : entry.total.get();
        return new SpendUpdate(new SpendAggregate(scope, period, total), applied);
    }

    @Override
    public boolean markThresholdFired(BudgetScope scope, BudgetPeriod period, int thresholdPercentage) {
        AggregateEntry entry = aggregates.computeIfAbsent(new AggregateKey(scope, period), k -> new AggregateEntry());
        return entry.firedThresholds.add(thresholdPercentage);
    }

    // --- Internal classes ---

    private static final class LimitKey {
        final BudgetScope scope;
        final PeriodType periodType;

        LimitKey(BudgetScope scope, PeriodType periodType) {
            this.scope = scope;
            this.periodType = periodType;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof LimitKey))
                return false;
            LimitKey that = (LimitKey) o;
            return scope.equals(that.scope) && periodType == that.periodType;
        }

        @Override
        public int hashCode() {
            return Objects.hash(scope, periodType);
        }
    }

    private static final class AggregateKey {
        final BudgetScope scope;
        final BudgetPeriod period;

        AggregateKey(BudgetScope scope, BudgetPeriod period) {
            this.scope = scope;
            this.period = period;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof AggregateKey))
                return false;
            AggregateKey that = (AggregateKey) o;
            return scope.equals(that.scope) && period.equals(that.period);
        }

        @Override
        public int hashCode() {
            return Objects.hash(scope, period);
        }
    }

    private static final class AggregateEntry {
        final AtomicReference<BigDecimal> total = new AtomicReference<>(BigDecimal.ZERO);
        final Set<String> recordedRequests = ConcurrentHashMap.newKeySet();
        final Set<Integer> firedThresholds = ConcurrentHashMap.newKeySet();
    }
}
