package com.cloudalerts.engine.infrastructure.persistence;

import com.cloudalerts.engine.domain.store.AlertPersistencePort;
import com.cloudalerts.engine.domain.store.StoredAlertRecord;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;

/**
 * Default persistence adapter keeping records in memory, ordered by alert id.
 * Hosts with a real database register their own {@link AlertPersistencePort} bean.
 */
@Slf4j
public class InMemoryAlertRecordStore implements AlertPersistencePort {

    private final Map<Integer, byte[]> records = new TreeMap<>();

    @Override
    public synchronized void put(int alertId, byte[] record) {
        records.put(alertId, Arrays.copyOf(record, record.length));
    }

    @Override
    public synchronized void delete(int alertId) {
        records.remove(alertId);
    }

    @Override
    public synchronized List<StoredAlertRecord> loadAll() {
        var loaded = new ArrayList<StoredAlertRecord>(records.size());
        records.forEach((id, data) -> loaded.add(new StoredAlertRecord(id, Arrays.copyOf(data, data.length))));
        return loaded;
    }

    @Override
    public synchronized void deleteAll() {
        log.debug("Deleting {} stored alert records", records.size());
        records.clear();
    }

    public synchronized int size() {
        return records.size();
    }
}
