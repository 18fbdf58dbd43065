package com.spendguard.core.budget;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.spendguard.core.config.SpendGuardProperties;
import com.spendguard.core.model.BudgetDecision;
import com.spendguard.core.model.BudgetDenial;
import com.spendguard.core.model.BudgetLimit;
import com.spendguard.core.model.BudgetPeriod;
import com.spendguard.core.model.BudgetScope;
import com.spendguard.core.model.BudgetStatus;
import com.spendguard.core.model.PeriodType;
import com.spendguard.core.model.ScopeType;
import com.spendguard.core.model.SpendAggregate;
import com.spendguard.core.model.SpendUpdate;
import com.spendguard.core.store.BudgetStore;
import com.spendguard.core.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Limits and accumulated spend per (scope, period).
 *
 * Reads on the enforcement path go through short-lived caches and a bounded
 * store timeout, so a slow store costs at most one timeout per cache miss.
 * Writes go straight to the store and drop only the cache keys they touched.
 */
public class BudgetLedger {

    private static final Logger log = LoggerFactory.getLogger(BudgetLedger.class);

    /** Order in which limits are evaluated for each scope. */
    static final List<PeriodType> CHECK_ORDER = List.of(PeriodType.PER_REQUEST, PeriodType.DAILY, PeriodType.MONTHLY);
    static final List<PeriodType> ACCUMULATING = List.of(PeriodType.DAILY, PeriodType.MONTHLY);

    private final BudgetStore store;
    private final SpendGuardProperties.BudgetProperties properties;
    private final Clock clock;
    private final ZoneId zone;
    private final Executor storeExecutor;
    private final Map<ScopeType, Map<PeriodType, BigDecimal>> defaultLimits;

    private final Cache<String, Optional<BudgetLimit>> limitCache;
    private final Cache<String, BigDecimal> spendCache;
    private final AtomicLong storeReads = new AtomicLong();

    public BudgetLedger(BudgetStore store, SpendGuardProperties.BudgetProperties properties,
            Clock clock, Executor storeExecutor) {
        this.store = store;
        this.properties = properties;
        this.clock = clock;
        this.zone = ZoneId.of(properties.getZone());
        this.storeExecutor = storeExecutor;
        this.defaultLimits = parseDefaultLimits(properties.getDefaultLimits());
        this.limitCache = Caffeine.newBuilder()
                .expireAfterWrite(properties.getLimitCacheTtl())
                .maximumSize(properties.getCacheMaximumSize())
                .recordStats()
                .build();
        this.spendCache = Caffeine.newBuilder()
                .expireAfterWrite(properties.getSpendCacheTtl())
                .maximumSize(properties.getCacheMaximumSize())
                .recordStats()
                .build();
    }

    /**
     * Would spending {@code estimatedCost} break any limit of any scope?
     *
     * Scopes are checked in the order given, and for each scope the per-request
     * limit first, then daily, then monthly. The first violation found is
     * reported. {@code perRequestOverride}, when set, replaces the per-request
     * limit of the first scope.
     *
     * @throws StoreException if a limit or spend figure could not be read in time
     */
    public BudgetDecision check(List<BudgetScope> scopes, BigDecimal estimatedCost, BigDecimal perRequestOverride) {
        Instant now = clock.instant();
        for (int i = 0; i < scopes.size(); i++) {
            BudgetScope scope = scopes.get(i);
            for (PeriodType periodType : CHECK_ORDER) {
                BigDecimal limit;
                if (i == 0 && periodType == PeriodType.PER_REQUEST && perRequestOverride != null) {
                    limit = perRequestOverride;
                } else {
                    Optional<BudgetLimit> configured = findLimit(scope, periodType);
                    if (configured.isEmpty() || !configured.get().isActive())
                        continue;
                    limit = configured.get().getLimitAmount();
                }

                if (periodType == PeriodType.PER_REQUEST) {
                    if (estimatedCost.compareTo(limit) > 0)
                        return BudgetDecision.deny(new BudgetDenial(scope, periodType, BigDecimal.ZERO, limit, estimatedCost));
                    continue;
                }

                BigDecimal spent = currentSpend(scope, periodType.periodAt(now, zone));
                if (spent.add(estimatedCost).compareTo(limit) > 0)
                    return BudgetDecision.deny(new BudgetDenial(scope, periodType, spent, limit, estimatedCost));
            }
        }
        return BudgetDecision.allow();
    }

    public BudgetDecision check(List<BudgetScope> scopes, BigDecimal estimatedCost) {
        return check(scopes, estimatedCost, null);
    }

    /**
     * Add an actual cost to every daily and monthly aggregate of every scope.
     * Safe to repeat: a request id is applied to an aggregate at most once.
     *
     * @param at when the call happened; picks the periods the cost lands in
     * @throws StoreException if any increment fails (callers retry the whole call)
     */
    public List<SpendUpdate> recordSpend(String requestId, List<BudgetScope> scopes, BigDecimal amount, Instant at) {
        List<SpendUpdate> updates = new ArrayList<>(scopes.size() * ACCUMULATING.size());
        for (BudgetScope scope : scopes) {
            for (PeriodType periodType : ACCUMULATING) {
                BudgetPeriod period = periodType.periodAt(at, zone);
                SpendUpdate update = store.increment(scope, period, requestId, amount);
                spendCache.invalidate(spendKey(scope, period));
                if (update.isDuplicate()) {
                    log.debug("[SpendGuard] Request {} already counted for {} {}", requestId, scope, period);
                }
                updates.add(update);
            }
        }
        return Collections.unmodifiableList(updates);
    }

    public List<SpendUpdate> recordSpend(String requestId, List<BudgetScope> scopes, BigDecimal amount) {
        return recordSpend(requestId, scopes, amount, clock.instant());
    }

    /**
     * The limit in force for (scope, period type): the stored one if any,
     * otherwise the configured default for the scope type.
     */
    public Optional<BudgetLimit> findLimit(BudgetScope scope, PeriodType periodType) {
        return limitCache.get(limitKey(scope, periodType),
                k -> readFromStore(() -> store.findLimit(scope, periodType))
                        .or(() -> defaultLimit(scope, periodType)));
    }

    public void upsertLimit(BudgetLimit limit) {
        store.upsertLimit(limit);
        limitCache.invalidate(limitKey(limit.getScope(), limit.getPeriodType()));
    }

    public BigDecimal currentSpend(BudgetScope scope, BudgetPeriod period) {
        return spendCache.get(spendKey(scope, period),
                k -> readFromStore(() -> store.getAccumulated(scope, period)));
    }

    public BigDecimal currentSpend(BudgetScope scope, PeriodType periodType) {
        if (!periodType.isAccumulating())
            return BigDecimal.ZERO;
        return currentSpend(scope, periodType.periodAt(clock.instant(), zone));
    }

    /**
     * Claim an alert threshold for the aggregate's period.
     *
     * @return true exactly once per (scope, period, threshold)
     */
    public boolean markThresholdFired(SpendAggregate aggregate, int thresholdPercentage) {
        return store.markThresholdFired(aggregate.getScope(), aggregate.getPeriod(), thresholdPercentage);
    }

    public BudgetStatus status(BudgetScope scope, PeriodType periodType) {
        Optional<BudgetLimit> limit = findLimit(scope, periodType).filter(BudgetLimit::isActive);
        return new BudgetStatus(scope, periodType,
                limit.map(BudgetLimit::getLimitAmount).orElse(null),
                currentSpend(scope, periodType));
    }

    /**
     * Load limits and current spend for each scope so its first checks are
     * cache hits. A scope whose store read fails is logged and skipped.
     *
     * @return how many scopes were fully loaded
     */
    public int warmUp(List<BudgetScope> scopes) {
        int warmed = 0;
        for (BudgetScope scope : scopes) {
            try {
                for (PeriodType periodType : CHECK_ORDER) {
                    findLimit(scope, periodType);
                    currentSpend(scope, periodType);
                }
                warmed++;
            } catch (StoreException e) {
                log.warn("[SpendGuard] Budget cache warm-up failed for {}: {}", scope, e.getMessage());
            }
        }
        log.info("[SpendGuard] Budget cache warmed for {} of {} scope(s)", warmed, scopes.size());
        return warmed;
    }

    public int warmUp() {
        List<BudgetScope> scopes = new ArrayList<>();
        for (String key : properties.getWarmUpScopes()) {
            try {
                scopes.add(BudgetScope.parse(key));
            } catch (IllegalArgumentException e) {
                log.warn("[SpendGuard] Skipping malformed warm-up scope '{}': {}", key, e.getMessage());
            }
        }
        return warmUp(scopes);
    }

    /** Combined hit/miss statistics of the limit and spend caches. */
    public CacheStats cacheStats() {
        return limitCache.stats().plus(spendCache.stats());
    }

    /** Reads that reached the store, timed-out ones included. */
    public long getStoreReads() {
        return storeReads.get();
    }

    public ZoneId getZone() {
        return zone;
    }

    private <T> T readFromStore(Supplier<T> read) {
        long timeoutMs = properties.getStoreTimeout().toMillis();
        storeReads.incrementAndGet();
        CompletableFuture<T> future = CompletableFuture.supplyAsync(read, storeExecutor);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new StoreException("Budget store did not answer within " + timeoutMs + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreException("Interrupted while reading budget store", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof StoreException)
                throw (StoreException) e.getCause();
            throw new StoreException("Budget store read failed", e.getCause());
        }
    }

    private Optional<BudgetLimit> defaultLimit(BudgetScope scope, PeriodType periodType) {
        BigDecimal amount = defaultLimits.getOrDefault(scope.getType(), Map.of()).get(periodType);
        if (amount == null)
            return Optional.empty();
        return Optional.of(BudgetLimit.builder()
                .scope(scope)
                .periodType(periodType)
                .limitAmount(amount)
                .alertThresholds(properties.getDefaultAlertThresholds())
                .build());
    }

    private static Map<ScopeType, Map<PeriodType, BigDecimal>> parseDefaultLimits(
            Map<String, Map<String, BigDecimal>> raw) {
        Map<ScopeType, Map<PeriodType, BigDecimal>> parsed = new EnumMap<>(ScopeType.class);
        raw.forEach((scopeType, periods) -> {
            Map<PeriodType, BigDecimal> byPeriod = new EnumMap<>(PeriodType.class);
            periods.forEach((periodType, amount) -> byPeriod.put(PeriodType.valueOf(enumName(periodType)), amount));
            parsed.put(ScopeType.valueOf(enumName(scopeType)), byPeriod);
        });
        return parsed;
    }

    private static String enumName(String key) {
        return key.trim().toUpperCase().replace('-', '_');
    }

    private static String limitKey(BudgetScope scope, PeriodType periodType) {
        return "limit:" + scope.key() + ":" + periodType;
    }

    private static String spendKey(BudgetScope scope, BudgetPeriod period) {
        return "spend:" + scope.key() + ":" + period.getType() + ":" + period.getKey();
    }
}
