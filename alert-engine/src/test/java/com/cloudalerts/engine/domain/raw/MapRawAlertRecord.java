package com.cloudalerts.engine.domain.raw;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Field bag backed by a map, for feeding the classifier in tests. */
final class MapRawAlertRecord implements RawAlertRecord {

    private final String type;
    private final Map<String, Object> fields = new HashMap<>();

    MapRawAlertRecord(String type) {
        this.type = type;
    }

    MapRawAlertRecord with(String field, Object value) {
        fields.put(field, value);
        return this;
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public boolean has(String field) {
        return fields.containsKey(field);
    }

    @Override
    public int getInt(String field, int defaultValue) {
        return fields.get(field) instanceof Number ? ((Number) fields.get(field)).intValue() : defaultValue;
    }

    @Override
    public long getLong(String field, long defaultValue) {
        return fields.get(field) instanceof Number ? ((Number) fields.get(field)).longValue() : defaultValue;
    }

    @Override
    public long getHandle(String field, int handleSize, long defaultValue) {
        return getLong(field, defaultValue);
    }

    @Override
    public String getString(String field, String defaultValue) {
        return fields.get(field) instanceof String ? (String) fields.get(field) : defaultValue;
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<HandleType> getHandleTypeArray(String field) {
        return fields.get(field) instanceof List ? (List<HandleType>) fields.get(field) : List.of();
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<String> getStringArray(String field) {
        return fields.get(field) instanceof List ? (List<String>) fields.get(field) : List.of();
    }

    @Override
    public Optional<RawAlertRecord> getObject(String field) {
        return fields.get(field) instanceof RawAlertRecord
                ? Optional.of((RawAlertRecord) fields.get(field))
                : Optional.empty();
    }
}
