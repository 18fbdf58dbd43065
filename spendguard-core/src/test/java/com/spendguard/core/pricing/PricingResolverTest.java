package com.spendguard.core.pricing;

import com.spendguard.core.config.SpendGuardProperties;
import com.spendguard.core.model.PriceEntry;
import com.spendguard.core.model.PriceSource;
import com.spendguard.core.model.PricingUnit;
import com.spendguard.core.store.InMemoryPriceStore;
import com.spendguard.core.store.PriceStore;
import com.spendguard.core.store.StoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PricingResolverTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-19T12:00:00Z"), ZoneOffset.UTC);
    private static final LocalDate TODAY = LocalDate.of(2026, 10, 19);

    @Mock
    private PriceStore mockStore;

    private final SpendGuardProperties.PricingProperties properties = new SpendGuardProperties.PricingProperties();
    private final AtomicLong nanos = new AtomicLong();
    private DriverPricingCatalog catalog;

    @BeforeEach
    void setUp() {
        catalog = DriverPricingCatalog.of(List.of(new FixedTable("openai", "gpt-4o-mini",
                PriceEntry.tokenRate("openai", "gpt-4o", PricingUnit.PER_1K_TOKENS, "0.0025", "0.01"),
                PriceEntry.tokenRate("openai", "gpt-4o-mini", PricingUnit.PER_1K_TOKENS, "0.00015", "0.0006"))));
    }

    @Test
    void storedPriceWinsOverDriverDefault() {
        InMemoryPriceStore store = new InMemoryPriceStore();
        store.save(stored("gpt-4o", "0.002", "0.008", TODAY.minusDays(30)));
        PricingResolver resolver = resolver(store);

        PriceEntry price = resolver.resolve("openai", "gpt-4o");

        assertEquals(PriceSource.DATABASE, price.getSource());
        assertEquals(0, new BigDecimal("0.002").compareTo(price.getInputRate()));
    }

    @Test
    void fallsBackToDriverThenUniversalRate() {
        PricingResolver resolver = resolver(new InMemoryPriceStore());

        PriceEntry known = resolver.resolve("openai", "gpt-4o");
        PriceEntry unknown = resolver.resolve("openai", "gpt-9-ultra");

        assertEquals(PriceSource.DRIVER_DEFAULT, known.getSource());
        assertEquals(PriceSource.UNIVERSAL_FALLBACK, unknown.getSource());
        assertEquals(PricingUnit.PER_1K_TOKENS, unknown.getUnit());
        assertEquals(0, new BigDecimal("0.03").compareTo(unknown.getInputRate()));
        assertEquals(0, new BigDecimal("0.06").compareTo(unknown.getOutputRate()));
    }

    @Test
    void ignoresRowsNotYetEffective() {
        InMemoryPriceStore store = new InMemoryPriceStore();
        store.save(stored("gpt-4o", "0.002", "0.008", TODAY.plusDays(1)));

        assertEquals(PriceSource.DRIVER_DEFAULT, resolver(store).resolve("openai", "gpt-4o").getSource());
    }

    @Test
    void picksLatestEffectiveRow() {
        InMemoryPriceStore store = new InMemoryPriceStore();
        store.save(stored("gpt-4o", "0.005", "0.015", TODAY.minusDays(90)));
        store.save(stored("gpt-4o", "0.002", "0.008", TODAY.minusDays(10)));

        PriceEntry price = resolver(store).resolve("openai", "gpt-4o");

        assertEquals(0, new BigDecimal("0.002").compareTo(price.getInputRate()));
        assertEquals(2, store.history("openai", "gpt-4o").size());
    }

    @Test
    void storeOutageCountsAsAbsentAndIsNotCached() {
        when(mockStore.findCurrent("openai", "gpt-4o", TODAY))
                .thenThrow(new StoreException("connection refused"))
                .thenReturn(Optional.of(stored("gpt-4o", "0.002", "0.008", TODAY)));
        PricingResolver resolver = resolver(mockStore);

        assertEquals(PriceSource.DRIVER_DEFAULT, resolver.resolve("openai", "gpt-4o").getSource());
        assertEquals(PriceSource.DATABASE, resolver.resolve("openai", "gpt-4o").getSource());
    }

    @Test
    void malformedStoredRowFallsThrough() {
        PriceEntry broken = PriceEntry.builder().provider("openai").model("gpt-4o")
                .unit(PricingUnit.PER_1K_TOKENS).inputRate(new BigDecimal("0.002")).effectiveDate(TODAY).build();
        when(mockStore.findCurrent("openai", "gpt-4o", TODAY)).thenReturn(Optional.of(broken));

        assertEquals(PriceSource.DRIVER_DEFAULT, resolver(mockStore).resolve("openai", "gpt-4o").getSource());
    }

    @Test
    void cachesStoreLookupsPerModel() {
        when(mockStore.findCurrent(eq("openai"), any(), eq(TODAY))).thenReturn(Optional.empty());
        PricingResolver resolver = resolver(mockStore);

        resolver.resolve("openai", "gpt-4o");
        resolver.resolve("OpenAI", "gpt-4o");
        resolver.resolve("openai", "gpt-4o-mini");

        verify(mockStore, times(1)).findCurrent("openai", "gpt-4o", TODAY);
        verify(mockStore, times(1)).findCurrent("openai", "gpt-4o-mini", TODAY);
        assertEquals(1, resolver.cacheStats().hitCount());
    }

    @Test
    void servesStalePriceWhileRefreshing() {
        when(mockStore.findCurrent("openai", "gpt-4o", TODAY))
                .thenReturn(Optional.of(stored("gpt-4o", "0.002", "0.008", TODAY)))
                .thenReturn(Optional.of(stored("gpt-4o", "0.003", "0.009", TODAY)));
        PricingResolver resolver = resolver(mockStore);

        assertEquals(0, new BigDecimal("0.002").compareTo(resolver.resolve("openai", "gpt-4o").getInputRate()));
        nanos.addAndGet(Duration.ofHours(2).toNanos());

        assertEquals(0, new BigDecimal("0.002").compareTo(resolver.resolve("openai", "gpt-4o").getInputRate()));
        assertEquals(0, new BigDecimal("0.003").compareTo(resolver.resolve("openai", "gpt-4o").getInputRate()));
    }

    @Test
    void keepsStalePriceWhenRefreshFails() {
        when(mockStore.findCurrent("openai", "gpt-4o", TODAY))
                .thenReturn(Optional.of(stored("gpt-4o", "0.002", "0.008", TODAY)))
                .thenThrow(new StoreException("timeout"));
        PricingResolver resolver = resolver(mockStore);

        resolver.resolve("openai", "gpt-4o");
        nanos.addAndGet(Duration.ofHours(2).toNanos());

        PriceEntry price = resolver.resolve("openai", "gpt-4o");
        assertEquals(PriceSource.DATABASE, price.getSource());
        assertEquals(PriceSource.DATABASE, resolver.resolve("openai", "gpt-4o").getSource());
    }

    @Test
    void updateReplacesCachedPrice() {
        PricingResolver resolver = resolver(new InMemoryPriceStore());
        assertEquals(PriceSource.DRIVER_DEFAULT, resolver.resolve("openai", "gpt-4o").getSource());

        assertTrue(resolver.updatePricing(
                PriceEntry.tokenRate("OpenAI", "gpt-4o", PricingUnit.PER_1K_TOKENS, "0.002", "0.008")));

        PriceEntry price = resolver.resolve("openai", "gpt-4o");
        assertEquals(PriceSource.DATABASE, price.getSource());
        assertEquals(TODAY, price.getEffectiveDate());
    }

    @Test
    void updateRejectsMalformedEntry() {
        PriceEntry broken = PriceEntry.flatRate("openai", "gpt-4o", PricingUnit.PER_1K_TOKENS, "0.002");

        assertFalse(resolver(mockStore).updatePricing(broken));
        verify(mockStore, never()).save(any());
    }

    @Test
    void updateReportsStoreFailure() {
        doThrow(new StoreException("read-only replica")).when(mockStore).save(any());

        assertFalse(resolver(mockStore).updatePricing(
                PriceEntry.tokenRate("openai", "gpt-4o", PricingUnit.PER_1K_TOKENS, "0.002", "0.008")));
    }

    @Test
    void warmUpPreloadsConfiguredPairs() {
        when(mockStore.findCurrent(any(), any(), eq(TODAY))).thenReturn(Optional.empty());
        PricingResolver resolver = resolver(mockStore);

        resolver.warmUp(List.of("openai:gpt-4o", "gemini:gemini-2.0-flash", "no-separator"));
        resolver.resolve("openai", "gpt-4o");

        verify(mockStore).findCurrent("openai", "gpt-4o", TODAY);
        verify(mockStore).findCurrent("gemini", "gemini-2.0-flash", TODAY);
        assertEquals(2, resolver.cacheStats().loadCount());
        assertEquals(1, resolver.cacheStats().hitCount());
    }

    @Test
    void reloadSwapsDriverTables() {
        PricingResolver resolver = resolver(new InMemoryPriceStore());
        long before = resolver.getCatalog().getVersion();

        resolver.reload(DriverPricingCatalog.of(List.of(new FixedTable("openai", "gpt-4o",
                PriceEntry.tokenRate("openai", "gpt-4o", PricingUnit.PER_1K_TOKENS, "0.001", "0.004")))));

        assertTrue(resolver.getCatalog().getVersion() > before);
        assertEquals(0, new BigDecimal("0.001").compareTo(resolver.resolve("openai", "gpt-4o").getInputRate()));
    }

    @Test
    void missingModelUsesFallback() {
        PricingResolver resolver = resolver(mockStore);

        assertEquals(PriceSource.UNIVERSAL_FALLBACK, resolver.resolve("openai", null).getSource());
        verifyNoInteractions(mockStore);
    }

    @Test
    void slowStoreIsBoundedByTimeoutAndLateAnswerIsCached() throws Exception {
        properties.setStoreTimeout(Duration.ofMillis(50));
        CountDownLatch release = new CountDownLatch(1);
        when(mockStore.findCurrent("openai", "gpt-4o", TODAY)).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return Optional.of(stored("gpt-4o", "0.002", "0.008", TODAY));
        });
        ExecutorService storeExecutor = Executors.newSingleThreadExecutor();
        try {
            PricingResolver resolver = new PricingResolver(mockStore, catalog, properties, CLOCK, nanos::get, storeExecutor);

            long started = System.nanoTime();
            PriceEntry price = resolver.resolve("openai", "gpt-4o");
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

            assertEquals(PriceSource.DRIVER_DEFAULT, price.getSource());
            assertTrue(elapsedMs < 1000, "resolve blocked for " + elapsedMs + "ms");

            release.countDown();
            PriceSource source = null;
            for (int i = 0; i < 100 && source != PriceSource.DATABASE; i++) {
                source = resolver.resolve("openai", "gpt-4o").getSource();
                if (source != PriceSource.DATABASE)
                    Thread.sleep(10);
            }
            assertEquals(PriceSource.DATABASE, source);
            verify(mockStore, times(1)).findCurrent("openai", "gpt-4o", TODAY);
        } finally {
            release.countDown();
            storeExecutor.shutdownNow();
        }
    }

    @Test
    void missingProviderUsesFallback() {
        PricingResolver resolver = resolver(mockStore);

        PriceEntry price = resolver.resolve(null, "gpt-4o");

        assertEquals(PriceSource.UNIVERSAL_FALLBACK, price.getSource());
        assertEquals("unknown", price.getProvider());
        assertTrue(PricingValidator.isValid(price));
        verifyNoInteractions(mockStore);
    }

    private PricingResolver resolver(PriceStore store) {
        return new PricingResolver(store, catalog, properties, CLOCK, nanos::get, Runnable::run);
    }

    private static PriceEntry stored(String model, String input, String output, LocalDate effective) {
        return PriceEntry.tokenRate("openai", model, PricingUnit.PER_1K_TOKENS, input, output)
                .toBuilder().effectiveDate(effective).build();
    }

    private static final class FixedTable implements DriverPricingTable {
        private final String provider;
        private final String defaultModel;
        private final Map<String, PriceEntry> entries;

        FixedTable(String provider, String defaultModel, PriceEntry... entries) {
            this.provider = provider;
            this.defaultModel = defaultModel;
            this.entries = Arrays.stream(entries)
                    .collect(Collectors.toMap(PriceEntry::getModel, e -> e));
        }

        @Override
        public String getProvider() {
            return provider;
        }

        @Override
        public Optional<PriceEntry> findPricing(String model) {
            return Optional.ofNullable(entries.get(model));
        }

        @Override
        public String getDefaultModel() {
            return defaultModel;
        }

        @Override
        public Collection<PriceEntry> getEntries() {
            return entries.values();
        }
    }
}
