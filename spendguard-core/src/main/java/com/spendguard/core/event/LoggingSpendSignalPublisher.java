package com.spendguard.core.event;

import com.spendguard.core.model.AlertEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default publisher when nothing else is wired: writes signals to the log.
 */
public class LoggingSpendSignalPublisher implements SpendSignalPublisher {

    private static final Logger log = LoggerFactory.getLogger(LoggingSpendSignalPublisher.class);

    @Override
    public void costRecorded(CostRecorded event) {
        log.debug("[SpendGuard] Cost recorded: {}", event);
    }

    @Override
    public void alertThresholdCrossed(AlertEvent alert) {
        log.warn("[SpendGuard] BUDGET ALERT [{}]: {}", alert.getSeverity(), alert);
    }
}
