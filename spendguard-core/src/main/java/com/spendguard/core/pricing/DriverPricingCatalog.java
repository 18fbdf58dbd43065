package com.spendguard.core.pricing;

import com.spendguard.core.model.PriceEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Immutable snapshot of every driver's default prices.
 * A new snapshot is built and swapped in to reload; readers never see a
 * half-built catalog.
 */
public final class DriverPricingCatalog {

    private static final Logger log = LoggerFactory.getLogger(DriverPricingCatalog.class);
    private static final AtomicLong VERSIONS = new AtomicLong();

    private final Map<String, DriverPricingTable> tables;
    private final long version;

    private DriverPricingCatalog(Map<String, DriverPricingTable> tables) {
        this.tables = Map.copyOf(tables);
        this.version = VERSIONS.incrementAndGet();
    }

    public static DriverPricingCatalog of(Collection<? extends DriverPricingTable> tables) {
        Map<String, DriverPricingTable> byProvider = new HashMap<>();
        for (DriverPricingTable table : tables) {
            String provider = table.getProvider().toLowerCase();
            if (byProvider.putIfAbsent(provider, table) != null) {
                log.warn("[SpendGuard] Duplicate pricing table for provider '{}', keeping {}",
                        provider, byProvider.get(provider).getClass().getSimpleName());
            }
        }
        DriverPricingCatalog catalog = new DriverPricingCatalog(byProvider);
        log.info("[SpendGuard] Driver pricing catalog v{} loaded for providers {}",
                catalog.version, byProvider.keySet());
        return catalog;
    }

    public static DriverPricingCatalog empty() {
        return of(List.of());
    }

    public Optional<PriceEntry> findPricing(String provider, String model) {
        DriverPricingTable table = tables.get(provider.toLowerCase());
        if (table == null || model == null)
            return Optional.empty();
        return table.findPricing(model);
    }

    public Optional<String> getDefaultModel(String provider) {
        DriverPricingTable table = tables.get(provider.toLowerCase());
        return table != null ? Optional.ofNullable(table.getDefaultModel()) : Optional.empty();
    }

    public boolean hasProvider(String provider) {
        return tables.containsKey(provider.toLowerCase());
    }

    public long getVersion() {
        return version;
    }
}
