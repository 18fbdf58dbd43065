package com.spendguard.autoconfigure;

import com.spendguard.core.event.CostRecorded;
import com.spendguard.core.event.SpendSignalPublisher;
import com.spendguard.core.model.AlertEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Republishes spend signals as Spring application events, so applications can
 * react with a plain {@code @EventListener(AlertEvent.class)}.
 */
public class ApplicationEventSpendSignalPublisher implements SpendSignalPublisher {

    private static final Logger log = LoggerFactory.getLogger(ApplicationEventSpendSignalPublisher.class);

    private final ApplicationEventPublisher eventPublisher;

    public ApplicationEventSpendSignalPublisher(ApplicationEventPublisher eventPublisher) {
        this.eventPublisher = eventPublisher;
    }

    @Override
    public void costRecorded(CostRecorded event) {
        eventPublisher.publishEvent(event);
    }

    @Override
    public void alertThresholdCrossed(AlertEvent alert) {
        log.warn("[SpendGuard] BUDGET ALERT [{}]: {}", alert.getSeverity(), alert);
        eventPublisher.publishEvent(alert);
    }
}
