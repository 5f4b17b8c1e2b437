package com.cloudalerts.engine.domain.store;

import java.util.List;

/**
 * Domain port for the byte store holding one record per alert, keyed by alert id.
 * Calls are synchronous; the engine writes after every commit.
 */
public interface AlertPersistencePort {

    void put(int alertId, byte[] record);

    void delete(int alertId);

    List<StoredAlertRecord> loadAll();

    void deleteAll();
}
