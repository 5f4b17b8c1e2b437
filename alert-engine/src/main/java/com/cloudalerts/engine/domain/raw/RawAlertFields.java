package com.cloudalerts.engine.domain.raw;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Short field codes used by catch-up records.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class RawAlertFields {

    public static final String USER = "u";
    public static final String EMAIL = "m";
    public static final String TIME_DELTA = "td";

    public static final String REQUEST = "p";
    public static final String DELETED_AT = "dts";
    public static final String REMINDED_AT = "rts";

    public static final String CONTACT_ACTION = "c";
    public static final String PENDING_STATUS = "s";

    public static final String NODE = "n";
    public static final String OWNER = "o";
    public static final String NODES = "f";

    public static final String RESULT = "r";
    public static final String PLAN = "p";
    public static final String EXPIRY = "ts";

    public static final String TAKEDOWN_STATE = "down";
    public static final String TAKEDOWN_NODE = "h";

    public static final String MEETING = "id";
    public static final String PARENT_MEETING = "p";
    public static final String CHANGESET = "cs";

    public static final String CHANGE_TITLE = "t";
    public static final String CHANGE_DESCRIPTION = "d";
    public static final String CHANGE_CANCELLED = "c";
    public static final String CHANGE_TIMEZONE = "tz";
    public static final String CHANGE_START = "s";
    public static final String CHANGE_END = "e";
    public static final String CHANGE_RULES = "r";

    public static final String PAYMENT_SUCCEEDED = "s";
}
