package com.cloudalerts.engine.domain.alert;

/**
 * Status change of a pending contact request, incoming or outgoing.
 */
public record UpdatedPendingContact(int action) implements AlertPayload {

    public static final int IGNORED = 1;
    public static final int ACCEPTED = 2;
    public static final int DENIED = 3;
}
