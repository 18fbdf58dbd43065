package com.spendguard.core.pricing;

import com.spendguard.core.model.PriceEntry;

import java.util.Collection;
import java.util.Optional;

/**
 * Built-in price list shipped with a provider driver. Used when the price
 * store has no row for a model.
 *
 * Implementations are discovered as Spring beans and merged into a
 * {@link DriverPricingCatalog}.
 */
public interface DriverPricingTable {

    /** Lower-case provider name, e.g. "openai". */
    String getProvider();

    Optional<PriceEntry> findPricing(String model);

    /** Model used when a request does not name one. */
    String getDefaultModel();

    Collection<PriceEntry> getEntries();
}
