package com.spendguard.core.store;

import com.spendguard.core.model.CostRecord;

import java.util.Optional;

/**
 * Where actual per-request costs are persisted for billing and analytics.
 */
public interface CostRecordStore {

    /**
     * Persist the record unless one already exists for its request id.
     *
     * @return true if stored, false if a record for the request id already existed
     * @throws StoreException on a write failure; callers retry
     */
    boolean save(CostRecord record);

    Optional<CostRecord> findByRequestId(String requestId);
}
