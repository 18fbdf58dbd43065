package com.spendguard.core.model;

/**
 * Severity attached to a threshold crossing.
 */
public enum AlertSeverity {

    /** Below 95% of the limit. */
    WARNING,

    /** At least 95% but below 100%. */
    CRITICAL,

    /** At or above the limit. */
    EXCEEDED;

    public static AlertSeverity forThreshold(int thresholdPercentage) {
        if (thresholdPercentage >= 100)
            return EXCEEDED;
        if (thresholdPercentage >= 95)
            return CRITICAL;
        return WARNING;
    }
}
