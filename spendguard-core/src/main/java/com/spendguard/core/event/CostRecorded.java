package com.spendguard.core.event;

import com.spendguard.core.model.CostRecord;
import com.spendguard.core.model.SpendUpdate;

import java.util.List;

/**
 * The actual cost of a call was persisted and added to the budget aggregates.
 * {@code updates} holds one entry per (scope, period) touched, with the
 * aggregate as it stood right after the increment.
 */
public class CostRecorded {

    private final CostRecord record;
    private final List<SpendUpdate> updates;

    public CostRecorded(CostRecord record, List<SpendUpdate> updates) {
        this.record = record;
        this.updates = List.copyOf(updates);
    }

    public CostRecord getRecord() {
        return record;
    }

    public List<SpendUpdate> getUpdates() {
        return updates;
    }

    @Override
    public String toString() {
        return "CostRecorded{" + record.getRequestId() + ", " + record.getBreakdown() + '}';
    }
}
