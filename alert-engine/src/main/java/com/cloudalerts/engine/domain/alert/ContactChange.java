package com.cloudalerts.engine.domain.alert;

public record ContactChange(int action) implements AlertPayload {

    public static final int DELETED = 0;
    public static final int ESTABLISHED = 1;
    public static final int ACCOUNT_DELETED = 2;
    public static final int BLOCKED = 3;
}
