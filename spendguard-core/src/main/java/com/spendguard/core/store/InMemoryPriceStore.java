package com.spendguard.core.store;

import com.spendguard.core.model.PriceEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-memory implementation of PriceStore for development and single-instance
 * deployments. Rows without an effective date are treated as effective since
 * {@link LocalDate#MIN}.
 */
public class InMemoryPriceStore implements PriceStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPriceStore.class);

    private final Map<String, NavigableMap<LocalDate, PriceEntry>> rows = new ConcurrentHashMap<>();

    @Override
    public Optional<PriceEntry> findCurrent(String provider, String model, LocalDate asOf) {
        NavigableMap<LocalDate, PriceEntry> versions = rows.get(key(provider, model));
        if (versions == null)
            return Optional.empty();
        Map.Entry<LocalDate, PriceEntry> current = versions.floorEntry(asOf);
        return current != null ? Optional.of(current.getValue()) : Optional.empty();
    }

    @Override
    public void save(PriceEntry entry) {
        LocalDate effective = entry.getEffectiveDate() != null ? entry.getEffectiveDate() : LocalDate.MIN;
        rows.computeIfAbsent(key(entry.getProvider(), entry.getModel()), k -> new ConcurrentSkipListMap<>())
                .put(effective, entry);
        log.debug("[SpendGuard] Stored price row {}/{} effective {}",
                entry.getProvider(), entry.getModel(), effective);
    }

    @Override
    public List<PriceEntry> history(String provider, String model) {
        NavigableMap<LocalDate, PriceEntry> versions = rows.get(key(provider, model));
        return versions != null ? new ArrayList<>(versions.values()) : List.of();
    }

    private static String key(String provider, String model) {
        return provider.toLowerCase() + ":" + model;
    }
}
