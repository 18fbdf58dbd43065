package com.spendguard.module.pricing;

import com.spendguard.core.model.PriceEntry;
import com.spendguard.core.model.PriceSource;
import com.spendguard.core.model.PricingUnit;
import com.spendguard.core.pricing.DriverPricingTable;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A driver price list held in memory.
 *
 * Model names are matched after dropping suffixes that do not change the
 * price (a trailing date, "-preview", "-latest"). If there is no exact match
 * the longest listed name the model starts with wins, so dated snapshots
 * inherit the base model's price.
 */
public abstract class StaticPricingTable implements DriverPricingTable {

    static final LocalDate EFFECTIVE = LocalDate.of(2025, 1, 1);
    private static final Pattern DATE_SUFFIX = Pattern.compile("-\\d{4}-\\d{2}-\\d{2}$");

    private final String provider;
    private final String defaultModel;
    private final Map<String, PriceEntry> entries = new LinkedHashMap<>();

    protected StaticPricingTable(String provider, String defaultModel) {
        this.provider = provider;
        this.defaultModel = defaultModel;
    }

    protected final void tokens(String model, PricingUnit unit, String input, String output) {
        entries.put(normalize(model), PriceEntry.builder()
                .provider(provider)
                .model(model)
                .unit(unit)
                .inputRate(new BigDecimal(input))
                .outputRate(new BigDecimal(output))
                .effectiveDate(EFFECTIVE)
                .source(PriceSource.DRIVER_DEFAULT)
                .build());
    }

    protected final void flat(String model, PricingUnit unit, String rate) {
        entries.put(normalize(model), PriceEntry.builder()
                .provider(provider)
                .model(model)
                .unit(unit)
                .flatRate(new BigDecimal(rate))
                .effectiveDate(EFFECTIVE)
                .source(PriceSource.DRIVER_DEFAULT)
                .build());
    }

    @Override
    public String getProvider() {
        return provider;
    }

    @Override
    public String getDefaultModel() {
        return defaultModel;
    }

    @Override
    public Optional<PriceEntry> findPricing(String model) {
        String normalized = normalize(model);
        PriceEntry exact = entries.get(normalized);
        if (exact != null)
            return Optional.of(exact);
        return entries.entrySet().stream()
                .filter(e -> normalized.startsWith(e.getKey()))
                .max(Comparator.comparingInt(e -> e.getKey().length()))
                .map(Map.Entry::getValue);
    }

    @Override
    public Collection<PriceEntry> getEntries() {
        return entries.values();
    }

    static String normalize(String model) {
        String stripped = DATE_SUFFIX.matcher(model.trim()).replaceFirst("");
        return stripped.replace("-preview", "").replace("-latest", "").toLowerCase();
    }
}
