package com.cloudalerts.engine.domain.store;

public record StoredAlertRecord(int alertId, byte[] data) {}
