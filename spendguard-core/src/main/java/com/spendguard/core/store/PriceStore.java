package com.spendguard.core.store;

import com.spendguard.core.model.PriceEntry;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Persistent price table, keyed by (provider, model, effective date).
 * Implementations: a database table (production) or InMemory (dev/testing).
 */
public interface PriceStore {

    /**
     * The row in force on {@code asOf}: the one with the latest effective date
     * not after it.
     *
     * @throws StoreException if the store cannot be reached
     */
    Optional<PriceEntry> findCurrent(String provider, String model, LocalDate asOf);

    /**
     * Insert or replace the row for (provider, model, effective date).
     *
     * @throws StoreException if the store cannot be reached
     */
    void save(PriceEntry entry);

    /**
     * Every stored row for the pair, oldest first.
     */
    List<PriceEntry> history(String provider, String model);
}
