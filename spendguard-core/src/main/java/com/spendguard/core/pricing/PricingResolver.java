package com.spendguard.core.pricing;

import com.github.benmanes.caffeine.cache.AsyncLoadingCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.spendguard.core.config.SpendGuardProperties;
import com.spendguard.core.model.PriceEntry;
import com.spendguard.core.model.PriceSource;
import com.spendguard.core.model.PricingUnit;
import com.spendguard.core.store.PriceStore;
import com.spendguard.core.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Finds the price for a (provider, model) pair. Always answers.
 *
 * Lookup order:
 * 1. the price store, through a cache that serves stale rows while refreshing
 * 2. the driver's built-in table
 * 3. the configured universal fallback rate
 *
 * A store that is down, slow, or holding a malformed row only pushes the
 * lookup down a tier. Store reads run on the store executor and the caller
 * waits at most {@code storeTimeout}; a late answer still lands in the cache.
 */
public class PricingResolver {

    private static final Logger log = LoggerFactory.getLogger(PricingResolver.class);

    private final PriceStore priceStore;
    private final SpendGuardProperties.PricingProperties properties;
    private final Clock clock;
    private final AsyncLoadingCache<PriceKey, Optional<PriceEntry>> storeCache;
    private volatile DriverPricingCatalog catalog;

    public PricingResolver(PriceStore priceStore, DriverPricingCatalog catalog,
            SpendGuardProperties.PricingProperties properties, Clock clock, Executor storeExecutor) {
        this(priceStore, catalog, properties, clock, Ticker.systemTicker(), storeExecutor);
    }

    PricingResolver(PriceStore priceStore, DriverPricingCatalog catalog,
            SpendGuardProperties.PricingProperties properties, Clock clock, Ticker ticker, Executor storeExecutor) {
        this.priceStore = priceStore;
        this.catalog = catalog;
        this.properties = properties;
        this.clock = clock;
        this.storeCache = Caffeine.newBuilder()
                .refreshAfterWrite(properties.getCacheTtl())
                .maximumSize(properties.getCacheMaximumSize())
                .ticker(ticker)
                .executor(storeExecutor)
                .recordStats()
                .buildAsync(this::loadFromStore);
    }

    /**
     * Resolve the price for a model, tagging the entry with the tier that answered.
     */
    public PriceEntry resolve(String provider, String model) {
        String normalizedProvider = provider != null ? provider.toLowerCase() : null;

        if (normalizedProvider != null && model != null) {
            Optional<PriceEntry> stored = lookupStore(new PriceKey(normalizedProvider, model));
            if (stored.isPresent())
                return stored.get().withSource(PriceSource.DATABASE);

            Optional<PriceEntry> driverDefault = catalog.findPricing(normalizedProvider, model);
            if (driverDefault.isPresent()) {
                List<String> problems = PricingValidator.validate(driverDefault.get());
                if (problems.isEmpty())
                    return driverDefault.get().withSource(PriceSource.DRIVER_DEFAULT);
                log.warn("[SpendGuard] Ignoring malformed driver price for {}/{}: {}",
                        normalizedProvider, model, problems);
            }
        }

        log.debug("[SpendGuard] No price for {}/{}, using universal fallback", normalizedProvider, model);
        return fallback(normalizedProvider, model);
    }

    /**
     * Save a new price row and drop exactly its cache key.
     *
     * @return false if the entry is malformed or the store rejected it
     */
    public boolean updatePricing(PriceEntry entry) {
        List<String> problems = PricingValidator.validate(entry);
        if (!problems.isEmpty()) {
            log.warn("[SpendGuard] Rejected price update {}: {}", entry, problems);
            return false;
        }
        PriceEntry normalized = entry.toBuilder()
                .provider(entry.getProvider().toLowerCase())
                .effectiveDate(entry.getEffectiveDate() != null ? entry.getEffectiveDate() : LocalDate.now(clock))
                .source(PriceSource.DATABASE)
                .build();
        try {
            priceStore.save(normalized);
        } catch (StoreException e) {
            log.error("[SpendGuard] Could not store price update {}: {}", normalized, e.getMessage());
            return false;
        }
        invalidate(normalized.getProvider(), normalized.getModel());
        log.info("[SpendGuard] Price updated for {}/{} effective {}",
                normalized.getProvider(), normalized.getModel(), normalized.getEffectiveDate());
        return true;
    }

    public void invalidate(String provider, String model) {
        storeCache.synchronous().invalidate(new PriceKey(provider.toLowerCase(), model));
    }

    public void invalidateAll() {
        storeCache.synchronous().invalidateAll();
    }

    /**
     * Preload "provider:model" pairs so the first real request is a cache hit.
     */
    public void warmUp(List<String> pairs) {
        int loaded = 0;
        for (String pair : pairs) {
            int sep = pair.indexOf(':');
            if (sep <= 0 || sep == pair.length() - 1) {
                log.warn("[SpendGuard] Skipping malformed warm-up entry '{}'", pair);
                continue;
            }
            resolve(pair.substring(0, sep).trim(), pair.substring(sep + 1).trim());
            loaded++;
        }
        log.info("[SpendGuard] Pricing cache warmed with {} model(s)", loaded);
    }

    public void warmUp() {
        warmUp(properties.getWarmUp());
    }

    /**
     * Swap in a new driver catalog. Store-backed cache entries are kept.
     */
    public void reload(DriverPricingCatalog newCatalog) {
        long previous = catalog.getVersion();
        this.catalog = newCatalog;
        log.info("[SpendGuard] Driver pricing catalog reloaded: v{} -> v{}", previous, newCatalog.getVersion());
    }

    public DriverPricingCatalog getCatalog() {
        return catalog;
    }

    public CacheStats cacheStats() {
        return storeCache.synchronous().stats();
    }

    private Optional<PriceEntry> lookupStore(PriceKey key) {
        long timeoutMs = properties.getStoreTimeout().toMillis();
        try {
            return storeCache.get(key).get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // The load keeps running and fills the cache for later requests.
            log.warn("[SpendGuard] Price store did not answer within {}ms for {}/{}", timeoutMs, key.provider, key.model);
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (ExecutionException | RuntimeException e) {
            // Failed loads are not cached: the next request tries the store again.
            Throwable cause = e instanceof ExecutionException ? e.getCause() : e;
            log.warn("[SpendGuard] Price store unavailable for {}/{}: {}", key.provider, key.model, cause.getMessage());
            return Optional.empty();
        }
    }

    private Optional<PriceEntry> loadFromStore(PriceKey key) {
        Optional<PriceEntry> row = priceStore.findCurrent(key.provider, key.model, LocalDate.now(clock));
        if (row.isEmpty())
            return row;
        List<String> problems = PricingValidator.validate(row.get());
        if (!problems.isEmpty()) {
            log.warn("[SpendGuard] Ignoring malformed stored price for {}/{}: {}", key.provider, key.model, problems);
            return Optional.empty();
        }
        return row;
    }

    private PriceEntry fallback(String provider, String model) {
        return PriceEntry.builder()
                .provider(provider != null ? provider : "unknown")
                .model(model != null ? model : "unknown")
                .unit(PricingUnit.valueOf(properties.getFallbackUnit()))
                .inputRate(properties.getFallbackInputRate())
                .outputRate(properties.getFallbackOutputRate())
                .currency(properties.getFallbackCurrency())
                .source(PriceSource.UNIVERSAL_FALLBACK)
                .build();
    }

    private static final class PriceKey {
        final String provider;
        final String model;

        PriceKey(String provider, String model) {
            this.provider = provider;
            this.model = model;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof PriceKey))
                return false;
            PriceKey that = (PriceKey) o;
            return provider.equals(that.provider) && model.equals(that.model);
        }

        @Override
        public int hashCode() {
            return Objects.hash(provider, model);
        }

        @Override
        public String toString() {
            return "pricing:db:" + provider + ":" + model;
        }
    }
}
