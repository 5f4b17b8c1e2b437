package com.cloudalerts.engine.domain.alert;

public record IncomingPendingContact(long requestHandle, boolean requestDeleted, boolean requestReminded)
        implements AlertPayload {}
