package com.cloudalerts.engine.infrastructure.json;

import com.cloudalerts.common.handle.Handles;
import com.cloudalerts.engine.domain.raw.HandleType;
import com.cloudalerts.engine.domain.raw.RawAlertRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import tools.jackson.databind.JsonNode;

/**
 * {@link RawAlertRecord} over one JSON object of a catch-up reply. The type code sits in
 * {@code "t"}. Handles may be given as url-safe base64 strings or as plain numbers.
 */
public final class JsonRawAlertRecord implements RawAlertRecord {

    static final String TYPE = "t";
    private static final String HANDLE = "h";
    private static final String NODE_TYPE = "t";

    private final JsonNode node;

    public JsonRawAlertRecord(JsonNode node) {
        this.node = node;
    }

    @Override
    public String type() {
        var type = node.get(TYPE);
        return type != null && type.isString() ? type.asString() : null;
    }

    @Override
    public boolean has(String field) {
        return node.has(field);
    }

    @Override
    public int getInt(String field, int defaultValue) {
        var value = node.get(field);
        return value != null && value.isNumber() ? value.asInt() : defaultValue;
    }

    @Override
    public long getLong(String field, long defaultValue) {
        var value = node.get(field);
        return value != null && value.isNumber() ? value.asLong() : defaultValue;
    }

    @Override
    public long getHandle(String field, int handleSize, long defaultValue) {
        return handleOf(node.get(field), handleSize, defaultValue);
    }

    @Override
    public String getString(String field, String defaultValue) {
        var value = node.get(field);
        return value != null && value.isString() ? value.asString() : defaultValue;
    }

    @Override
    public List<HandleType> getHandleTypeArray(String field) {
        var array = node.get(field);
        if (array == null || !array.isArray()) {
            return List.of();
        }
        var result = new ArrayList<HandleType>(array.size());
        for (JsonNode element : array) {
            long handle = handleOf(element.get(HANDLE), Handles.NODE_HANDLE_SIZE, Handles.UNDEF);
            if (Handles.isUndef(handle)) {
                continue;
            }
            var type = element.get(NODE_TYPE);
            result.add(new HandleType(handle, type != null && type.isNumber() ? type.asInt() : HandleType.FILE));
        }
        return result;
    }

    @Override
    public List<String> getStringArray(String field) {
        var array = node.get(field);
        if (array == null || !array.isArray()) {
            return List.of();
        }
        var result = new ArrayList<String>(array.size());
        for (JsonNode element : array) {
            result.add(element.asString(""));
        }
        return result;
    }

    @Override
    public Optional<RawAlertRecord> getObject(String field) {
        var value = node.get(field);
        return value != null && value.isObject() ? Optional.of(new JsonRawAlertRecord(value)) : Optional.empty();
    }

    private static long handleOf(JsonNode value, int handleSize, long defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (value.isNumber()) {
            return value.asLong();
        }
        if (value.isString()) {
            long handle = Handles.fromBase64(value.asString(), handleSize);
            return Handles.isUndef(handle) ? defaultValue : handle;
        }
        return defaultValue;
    }

    @Override
    public String toString() {
        return node.toString();
    }
}
