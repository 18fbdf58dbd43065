package com.spendguard.core.event;

import com.spendguard.core.model.AlertEvent;

/**
 * Outbound notifications for external systems (dashboards, billing, alert
 * channels).
 */
public interface SpendSignalPublisher {

    void costRecorded(CostRecorded event);

    void alertThresholdCrossed(AlertEvent alert);
}
