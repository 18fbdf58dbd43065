package com.spendguard.core.store;

import com.spendguard.core.model.CostRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of CostRecordStore for development and testing.
 */
public class InMemoryCostRecordStore implements CostRecordStore {

    private final Map<String, CostRecord> records = new ConcurrentHashMap<>();

    @Override
    public boolean save(CostRecord record) {
        return records.putIfAbsent(record.getRequestId(), record) == null;
    }

    @Override
    public Optional<CostRecord> findByRequestId(String requestId) {
        return Optional.ofNullable(records.get(requestId));
    }

    public List<CostRecord> findAll() {
        return new ArrayList<>(records.values());
    }
}
