package com.spendguard.core.budget;

import com.spendguard.core.config.SpendGuardProperties;
import com.spendguard.core.model.BudgetDecision;
import com.spendguard.core.model.BudgetLimit;
import com.spendguard.core.model.BudgetScope;
import com.spendguard.core.model.BudgetStatus;
import com.spendguard.core.model.PeriodType;
import com.spendguard.core.model.SpendUpdate;
import com.spendguard.core.store.BudgetStore;
import com.spendguard.core.store.InMemoryBudgetStore;
import com.spendguard.core.store.StoreException;
import com.spendguard.core.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BudgetLedgerTest {

    private static final BudgetScope USER = BudgetScope.user("42");
    private static final BudgetScope PROJECT = BudgetScope.project("apollo");

    private final MutableClock clock = MutableClock.at("2026-10-19T12:00:00Z");
    private final SpendGuardProperties.BudgetProperties properties = new SpendGuardProperties.BudgetProperties();
    private InMemoryBudgetStore store;
    private BudgetLedger ledger;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        store = new InMemoryBudgetStore();
        ledger = new BudgetLedger(store, properties, clock, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void deniesWhenEstimateWouldPushSpendPastLimit() {
        ledger.upsertLimit(limit(USER, PeriodType.DAILY, "10.00"));
        ledger.recordSpend("r1", List.of(USER), new BigDecimal("9.50"));

        BudgetDecision decision = ledger.check(List.of(USER), new BigDecimal("1.00"));

        assertTrue(decision.isDenied());
        assertEquals(PeriodType.DAILY, decision.getDenial().getPeriodType());
        assertEquals(0, new BigDecimal("9.50").compareTo(decision.getDenial().getCurrentSpend()));
        assertEquals(0, new BigDecimal("10.00").compareTo(decision.getDenial().getLimit()));
        assertEquals(429, decision.getDenial().getHttpStatus());
    }

    @Test
    void allowsSpendThatExactlyReachesLimit() {
        ledger.upsertLimit(limit(USER, PeriodType.DAILY, "10.00"));
        ledger.recordSpend("r1", List.of(USER), new BigDecimal("9.50"));

        assertEquals(BudgetDecision.Outcome.ALLOW, ledger.check(List.of(USER), new BigDecimal("0.50")).getOutcome());
    }

    @Test
    void reportsFirstViolationInScopeAndPeriodOrder() {
        ledger.upsertLimit(limit(USER, PeriodType.MONTHLY, "1.00"));
        ledger.upsertLimit(limit(PROJECT, PeriodType.DAILY, "0.50"));

        BudgetDecision decision = ledger.check(List.of(USER, PROJECT), new BigDecimal("2.00"));

        assertEquals(USER, decision.getDenial().getScope());
        assertEquals(PeriodType.MONTHLY, decision.getDenial().getPeriodType());
    }

    @Test
    void perRequestLimitComparesEstimateAlone() {
        ledger.upsertLimit(limit(USER, PeriodType.PER_REQUEST, "0.10"));
        ledger.recordSpend("r1", List.of(USER), new BigDecimal("100"));

        assertTrue(ledger.check(List.of(USER), new BigDecimal("0.05")).isAllowed());
        BudgetDecision denied = ledger.check(List.of(USER), new BigDecimal("0.20"));
        assertEquals(PeriodType.PER_REQUEST, denied.getDenial().getPeriodType());
    }

    @Test
    void perRequestOverrideAppliesToFirstScopeOnly() {
        ledger.upsertLimit(limit(USER, PeriodType.PER_REQUEST, "0.10"));
        assertTrue(ledger.check(List.of(USER), new BigDecimal("0.20"), new BigDecimal("1.00")).isAllowed());

        ledger.upsertLimit(limit(PROJECT, PeriodType.PER_REQUEST, "0.10"));
        BudgetDecision decision = ledger.check(List.of(USER, PROJECT), new BigDecimal("0.20"), new BigDecimal("1.00"));
        assertEquals(PROJECT, decision.getDenial().getScope());
    }

    @Test
    void skipsInactiveLimits() {
        ledger.upsertLimit(limit(USER, PeriodType.DAILY, "1.00").toBuilder().active(false).build());

        assertTrue(ledger.check(List.of(USER), new BigDecimal("5.00")).isAllowed());
    }

    @Test
    void appliesConfiguredDefaultsUntilAnExplicitLimitExists() {
        properties.setDefaultLimits(Map.of("user", Map.of("daily", new BigDecimal("1.00"))));
        BudgetLedger withDefaults = new BudgetLedger(store, properties, clock, executor);

        assertTrue(withDefaults.check(List.of(USER), new BigDecimal("2.00")).isDenied());
        assertTrue(withDefaults.check(List.of(PROJECT), new BigDecimal("2.00")).isAllowed());

        withDefaults.upsertLimit(limit(USER, PeriodType.DAILY, "5.00"));
        assertTrue(withDefaults.check(List.of(USER), new BigDecimal("2.00")).isAllowed());
    }

    @Test
    void recordingTheSameRequestTwiceCountsOnce() {
        List<SpendUpdate> first = ledger.recordSpend("r1", List.of(USER, PROJECT), new BigDecimal("1.25"));
        List<SpendUpdate> replay = ledger.recordSpend("r1", List.of(USER, PROJECT), new BigDecimal("1.25"));

        assertEquals(4, first.size());
        assertTrue(first.stream().allMatch(SpendUpdate::isApplied));
        assertTrue(replay.stream().allMatch(SpendUpdate::isDuplicate));
        assertEquals(0, new BigDecimal("1.25").compareTo(ledger.currentSpend(USER, PeriodType.DAILY)));
        assertEquals(0, new BigDecimal("1.25").compareTo(ledger.currentSpend(PROJECT, PeriodType.MONTHLY)));
    }

    @Test
    void recordedSpendIsVisibleToTheNextCheck() {
        ledger.upsertLimit(limit(USER, PeriodType.DAILY, "10.00"));
        assertTrue(ledger.check(List.of(USER), new BigDecimal("1.00")).isAllowed());

        ledger.recordSpend("r1", List.of(USER), new BigDecimal("9.50"));

        assertTrue(ledger.check(List.of(USER), new BigDecimal("1.00")).isDenied());
    }

    @Test
    void limitChangeIsVisibleToTheNextCheck() {
        assertTrue(ledger.check(List.of(USER), new BigDecimal("3.00")).isAllowed());

        ledger.upsertLimit(limit(USER, PeriodType.DAILY, "2.00"));

        assertTrue(ledger.check(List.of(USER), new BigDecimal("3.00")).isDenied());
    }

    @Test
    void dailySpendResetsAtMidnightButMonthlyCarriesOver() {
        ledger.upsertLimit(limit(USER, PeriodType.DAILY, "10.00"));
        ledger.upsertLimit(limit(USER, PeriodType.MONTHLY, "12.00"));
        ledger.recordSpend("r1", List.of(USER), new BigDecimal("9.50"));

        clock.set(Instant.parse("2026-10-20T00:00:01Z"));

        assertEquals(0, BigDecimal.ZERO.compareTo(ledger.currentSpend(USER, PeriodType.DAILY)));
        assertTrue(ledger.check(List.of(USER), new BigDecimal("2.00")).isAllowed());
        BudgetDecision decision = ledger.check(List.of(USER), new BigDecimal("3.00"));
        assertEquals(PeriodType.MONTHLY, decision.getDenial().getPeriodType());
    }

    @Test
    void spendLandsInThePeriodTheCallHappened() {
        ledger.recordSpend("late", List.of(USER), new BigDecimal("4.00"), Instant.parse("2026-10-18T23:59:59Z"));

        assertEquals(0, BigDecimal.ZERO.compareTo(ledger.currentSpend(USER, PeriodType.DAILY)));
        assertEquals(0, new BigDecimal("4.00").compareTo(ledger.currentSpend(USER, PeriodType.MONTHLY)));
    }

    @Test
    void slowStoreRaisesStoreException() {
        BudgetStore slow = mock(BudgetStore.class);
        when(slow.findLimit(any(), any())).thenAnswer(invocation -> {
            Thread.sleep(500);
            return Optional.empty();
        });
        properties.setStoreTimeout(Duration.ofMillis(20));
        BudgetLedger slowLedger = new BudgetLedger(slow, properties, clock, executor);

        assertThrows(StoreException.class, () -> slowLedger.check(List.of(USER), BigDecimal.ONE));
    }

    @Test
    void failingStoreRaisesStoreException() {
        BudgetStore down = mock(BudgetStore.class);
        when(down.findLimit(any(), any())).thenThrow(new IllegalStateException("pool exhausted"));
        BudgetLedger downLedger = new BudgetLedger(down, properties, clock, executor);

        StoreException e = assertThrows(StoreException.class, () -> downLedger.check(List.of(USER), BigDecimal.ONE));
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    void statusReportsUsageLevel() {
        ledger.upsertLimit(limit(USER, PeriodType.DAILY, "10.00"));
        ledger.recordSpend("r1", List.of(USER), new BigDecimal("8.50"));

        BudgetStatus status = ledger.status(USER, PeriodType.DAILY);

        assertEquals(BudgetStatus.Level.WARNING, status.getLevel());
        assertEquals(0, new BigDecimal("85").compareTo(status.getUsagePercentage()));
        assertEquals(0, new BigDecimal("1.50").compareTo(status.getRemaining()));
        assertEquals(BudgetStatus.Level.UNLIMITED, ledger.status(PROJECT, PeriodType.DAILY).getLevel());
    }

    @Test
    void thresholdCanBeClaimedOncePerPeriod() {
        SpendUpdate update = ledger.recordSpend("r1", List.of(USER), BigDecimal.ONE).get(0);

        assertTrue(ledger.markThresholdFired(update.getAggregate(), 80));
        assertFalse(ledger.markThresholdFired(update.getAggregate(), 80));
        assertTrue(ledger.markThresholdFired(update.getAggregate(), 95));
    }

    @Test
    void warmUpMakesFirstCheckServedFromCache() {
        ledger.upsertLimit(limit(USER, PeriodType.DAILY, "10.00"));

        assertEquals(1, ledger.warmUp(List.of(USER)));
        long readsAfterWarmUp = ledger.getStoreReads();
        long hitsAfterWarmUp = ledger.cacheStats().hitCount();

        assertTrue(ledger.check(List.of(USER), BigDecimal.ONE).isAllowed());

        assertEquals(5, readsAfterWarmUp);
        assertEquals(readsAfterWarmUp, ledger.getStoreReads());
        assertEquals(hitsAfterWarmUp + 4, ledger.cacheStats().hitCount());
    }

    @Test
    void warmUpSkipsScopesTheStoreCannotServe() {
        BudgetStore down = mock(BudgetStore.class);
        when(down.findLimit(any(), any())).thenThrow(new IllegalStateException("pool exhausted"));
        BudgetLedger downLedger = new BudgetLedger(down, properties, clock, executor);

        assertEquals(0, downLedger.warmUp(List.of(USER, PROJECT)));
    }

    @Test
    void warmUpReadsConfiguredScopesAndIgnoresMalformedOnes() {
        properties.setWarmUpScopes(List.of("user:42", "project:apollo", "nonsense", "galaxy:7"));

        assertEquals(2, ledger.warmUp());
        assertEquals(0, ledger.cacheStats().hitCount());
        assertEquals(10, ledger.cacheStats().missCount());
    }

    @Test
    void cacheStatsCountHitsAcrossLimitAndSpendCaches() {
        ledger.currentSpend(USER, PeriodType.DAILY);
        ledger.currentSpend(USER, PeriodType.DAILY);
        ledger.findLimit(USER, PeriodType.MONTHLY);
        ledger.findLimit(USER, PeriodType.MONTHLY);

        assertEquals(2, ledger.cacheStats().hitCount());
        assertEquals(2, ledger.cacheStats().missCount());
        assertEquals(2, ledger.getStoreReads());
    }

    private static BudgetLimit limit(BudgetScope scope, PeriodType periodType, String amount) {
        return BudgetLimit.builder()
                .scope(scope)
                .periodType(periodType)
                .limitAmount(amount)
                .alertThresholds(List.of(80, 95, 100))
                .build();
    }
}
