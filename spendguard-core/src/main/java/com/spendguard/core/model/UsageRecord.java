package com.spendguard.core.model;

/**
 * Usage quantities reported for one provider call.
 * Token units are raw token counts. For non-split units the billable quantity
 * is {@code inputUnits + outputUnits}, counted in the quoted unit (minutes for
 * a per-minute price, thousands of characters for a per-1K-characters price).
 */
public class UsageRecord {

    private final String provider;
    private final String model;
    private final long inputUnits;
    private final long outputUnits;

    public UsageRecord(String provider, String model, long inputUnits, long outputUnits) {
        if (inputUnits < 0 || outputUnits < 0) {
            throw new IllegalArgumentException("Usage quantities must be non-negative");
        }
        this.provider = provider;
        this.model = model;
        this.inputUnits = inputUnits;
        this.outputUnits = outputUnits;
    }

    public String getProvider() {
        return provider;
    }

    public String getModel() {
        return model;
    }

    public long getInputUnits() {
        return inputUnits;
    }

    public long getOutputUnits() {
        return outputUnits;
    }

    public long getTotalUnits() {
        return inputUnits + outputUnits;
    }

    @Override
    public String toString() {
        return "UsageRecord{" + provider + "/" + model + ", in=" + inputUnits + ", out=" + outputUnits + '}';
    }
}
