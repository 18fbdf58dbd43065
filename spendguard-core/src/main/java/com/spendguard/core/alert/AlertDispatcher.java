package com.spendguard.core.alert;

import com.spendguard.core.budget.BudgetLedger;
import com.spendguard.core.config.SpendGuardProperties;
import com.spendguard.core.event.CostRecorded;
import com.spendguard.core.event.CostTrackingListener;
import com.spendguard.core.event.ResponseReceived;
import com.spendguard.core.event.SpendSignalPublisher;
import com.spendguard.core.model.AlertEvent;
import com.spendguard.core.model.BudgetLimit;
import com.spendguard.core.model.SpendAggregate;
import com.spendguard.core.model.SpendUpdate;
import com.spendguard.core.store.StoreException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Optional;

/**
 * Emits an alert the first time an aggregate reaches each configured
 * percentage of its limit. A jump over several thresholds fires all of them,
 * lowest first. A new period starts with no thresholds fired.
 *
 * Store failures while evaluating an update are retried with the recording
 * backoff; a re-run cannot double-fire since each threshold is claimed once.
 */
public class AlertDispatcher implements CostTrackingListener {

    private static final Logger log = LoggerFactory.getLogger(AlertDispatcher.class);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final BudgetLedger ledger;
    private final SpendSignalPublisher publisher;
    private final Clock clock;
    private final Retry retry;

    public AlertDispatcher(BudgetLedger ledger, SpendSignalPublisher publisher,
            SpendGuardProperties.RecordingProperties properties, Clock clock) {
        this.ledger = ledger;
        this.publisher = publisher;
        this.clock = clock;
        this.retry = Retry.of("spendguard-alerts",
                RetryConfig.custom()
                        .maxAttempts(properties.getMaxAttempts())
                        .intervalFunction(IntervalFunction.ofExponentialBackoff(
                                properties.getInitialBackoff(), properties.getBackoffMultiplier()))
                        .retryExceptions(StoreException.class)
                        .build());
        this.retry.getEventPublisher().onRetry(e -> log.warn("[SpendGuard] Alert evaluation attempt {} failed, retrying: {}",
                e.getNumberOfRetryAttempts(), e.getLastThrowable() != null ? e.getLastThrowable().getMessage() : ""));
    }

    @Override
    public void onResponseReceived(ResponseReceived event) {
        // Alerts only look at recorded spend.
    }

    @Override
    public void onCostRecorded(CostRecorded event) {
        for (SpendUpdate update : event.getUpdates()) {
            try {
                Retry.decorateRunnable(retry, () -> dispatch(update.getAggregate())).run();
            } catch (RuntimeException e) {
                log.error("[SpendGuard] Alert evaluation failed for {}: {}", update.getAggregate(), e.getMessage());
            }
        }
    }

    private void dispatch(SpendAggregate aggregate) {
        BigDecimal accumulated = aggregate.getAccumulatedAmount();
        if (accumulated.signum() <= 0)
            return;
        Optional<BudgetLimit> limit = ledger.findLimit(aggregate.getScope(), aggregate.getPeriodType());
        if (limit.isEmpty() || !limit.get().isActive())
            return;

        BigDecimal limitAmount = limit.get().getLimitAmount();
        BigDecimal scaledSpend = accumulated.multiply(HUNDRED);
        for (int threshold : limit.get().getAlertThresholds()) {
            // spend / limit * 100 >= threshold, without dividing by a possibly zero limit
            if (scaledSpend.compareTo(limitAmount.multiply(BigDecimal.valueOf(threshold))) < 0)
                break;
            if (ledger.markThresholdFired(aggregate, threshold)) {
                AlertEvent alert = new AlertEvent(aggregate.getScope(), aggregate.getPeriod(), threshold,
                        accumulated, limitAmount, clock.instant());
                publisher.alertThresholdCrossed(alert);
            }
        }
    }
}
