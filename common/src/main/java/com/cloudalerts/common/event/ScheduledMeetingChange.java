package com.cloudalerts.common.event;

import java.util.Optional;

/**
 * Fields of a scheduled meeting that an update can report as changed.
 * The ordinal is the bit position used when a change set is persisted.
 */
public enum ScheduledMeetingChange {
    TITLE,
    DESCRIPTION,
    CANCELLED,
    TIMEZONE,
    START_DATE,
    END_DATE,
    RULES;

    private static final ScheduledMeetingChange[] VALUES = values();

    public static Optional<ScheduledMeetingChange> fromIndex(int index) {
        if (index < 0 || index >= VALUES.length) {
            return Optional.empty();
        }
        return Optional.of(VALUES[index]);
    }

    public static int count() {
        return VALUES.length;
    }
}
