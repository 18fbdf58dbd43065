package com.spendguard.core.recording;

import com.spendguard.core.budget.BudgetLedger;
import com.spendguard.core.config.SpendGuardProperties;
import com.spendguard.core.cost.CostCalculator;
import com.spendguard.core.event.CostRecorded;
import com.spendguard.core.event.CostTrackingListener;
import com.spendguard.core.event.ErrorReporter;
import com.spendguard.core.event.ResponseReceived;
import com.spendguard.core.event.SpendSignalPublisher;
import com.spendguard.core.model.CostBreakdown;
import com.spendguard.core.model.CostRecord;
import com.spendguard.core.model.PriceEntry;
import com.spendguard.core.model.SpendUpdate;
import com.spendguard.core.model.UsageRecord;
import com.spendguard.core.pricing.PricingResolver;
import com.spendguard.core.store.CostRecordStore;
import com.spendguard.core.store.StoreException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.function.Supplier;

/**
 * Prices a finished call from its reported usage, persists the cost, and adds
 * it to every budget aggregate of the request's scopes.
 *
 * Store writes are retried with exponential backoff. A recording that still
 * fails goes to the {@link ErrorReporter}; it is never silently dropped.
 * Replaying the same request id is harmless.
 */
public class CostRecorder implements CostTrackingListener {

    private static final Logger log = LoggerFactory.getLogger(CostRecorder.class);

    private final PricingResolver pricingResolver;
    private final CostCalculator costCalculator;
    private final BudgetLedger ledger;
    private final CostRecordStore recordStore;
    private final SpendSignalPublisher publisher;
    private final ErrorReporter errorReporter;
    private final List<CostTrackingListener> downstream;
    private final Clock clock;
    private final Retry retry;

    public CostRecorder(PricingResolver pricingResolver, CostCalculator costCalculator, BudgetLedger ledger,
            CostRecordStore recordStore, SpendSignalPublisher publisher, ErrorReporter errorReporter,
            List<CostTrackingListener> downstream, SpendGuardProperties.RecordingProperties properties,
            Clock clock) {
        this.pricingResolver = pricingResolver;
        this.costCalculator = costCalculator;
        this.ledger = ledger;
        this.recordStore = recordStore;
        this.publisher = publisher;
        this.errorReporter = errorReporter;
        this.downstream = List.copyOf(downstream);
        this.clock = clock;
        this.retry = Retry.of("spendguard-recording",
                RetryConfig.custom()
                        .maxAttempts(properties.getMaxAttempts())
                        .intervalFunction(IntervalFunction.ofExponentialBackoff(
                                properties.getInitialBackoff(), properties.getBackoffMultiplier()))
                        .retryExceptions(StoreException.class)
                        .build());
        this.retry.getEventPublisher().onRetry(e -> log.warn("[SpendGuard] Recording attempt {} failed, retrying: {}",
                e.getNumberOfRetryAttempts(), e.getLastThrowable() != null ? e.getLastThrowable().getMessage() : ""));
    }

    @Override
    public void onResponseReceived(ResponseReceived event) {
        try {
            record(event);
        } catch (RuntimeException e) {
            errorReporter.recordingFailed(event, e);
        }
    }

    private void record(ResponseReceived event) {
        UsageRecord usage = event.getUsage();
        PriceEntry price = pricingResolver.resolve(usage.getProvider(), usage.getModel());
        CostBreakdown breakdown = costCalculator.calculate(price, usage);
        CostRecord record = new CostRecord(event.getRequestId(), usage, breakdown, event.getScopes(), clock.instant());

        boolean stored = withRetry(() -> recordStore.save(record));
        // Spend is applied even for an already-stored record: an earlier attempt
        // may have died between the two writes. Increments are idempotent.
        List<SpendUpdate> updates = withRetry(() -> ledger.recordSpend(
                event.getRequestId(), event.getScopes(), breakdown.getTotalCost(), event.getReceivedAt()));

        if (!stored && updates.stream().allMatch(SpendUpdate::isDuplicate)) {
            log.debug("[SpendGuard] Request {} already recorded, ignoring replay", event.getRequestId());
            return;
        }

        log.debug("[SpendGuard] Recorded {} {} for request {} ({} via {})",
                breakdown.getTotalCost().toPlainString(), breakdown.getCurrency(), event.getRequestId(),
                usage.getModel(), breakdown.getSource());

        CostRecorded recorded = new CostRecorded(record, updates);
        try {
            publisher.costRecorded(recorded);
        } catch (RuntimeException e) {
            log.error("[SpendGuard] Publishing cost for request {} failed: {}", event.getRequestId(), e.getMessage());
        }
        for (CostTrackingListener listener : downstream) {
            try {
                listener.onCostRecorded(recorded);
            } catch (RuntimeException e) {
                log.error("[SpendGuard] Listener {} failed for request {}: {}",
                        listener.getClass().getSimpleName(), event.getRequestId(), e.getMessage());
            }
        }
    }

    private <T> T withRetry(Supplier<T> write) {
        return Retry.decorateSupplier(retry, write).get();
    }
}
