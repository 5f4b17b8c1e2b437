package com.cloudalerts.engine.domain.raw;

import java.util.List;
import java.util.Optional;

/**
 * One catch-up record: a type code plus a bag of fields keyed by short codes.
 * Every getter falls back to the supplied default when the field is missing or of the wrong
 * shape.
 */
public interface RawAlertRecord {

    String type();

    boolean has(String field);

    int getInt(String field, int defaultValue);

    long getLong(String field, long defaultValue);

    long getHandle(String field, int handleSize, long defaultValue);

    String getString(String field, String defaultValue);

    /** Empty when the field is missing or not an array of handle/type pairs. */
    List<HandleType> getHandleTypeArray(String field);

    List<String> getStringArray(String field);

    Optional<RawAlertRecord> getObject(String field);
}
