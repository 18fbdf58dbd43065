package com.spendguard.core.event;

/**
 * Reacts to the two steps of cost tracking: a response arriving, and its cost
 * being recorded. Implementations run on the background executor, never on the
 * request thread.
 */
public interface CostTrackingListener {

    void onResponseReceived(ResponseReceived event);

    default void onCostRecorded(CostRecorded event) {
    }
}
