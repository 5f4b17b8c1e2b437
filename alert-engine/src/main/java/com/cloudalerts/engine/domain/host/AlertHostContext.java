package com.cloudalerts.engine.domain.host;

import java.util.Optional;

/**
 * What the engine needs to know about the client session that owns it. Passed in explicitly
 * so alerts stay plain data.
 */
public interface AlertHostContext {

    long ownUserHandle();

    /** Email of a known contact, if the session has one for this user. */
    Optional<String> emailOf(long userHandle);

    /** Whether {@code nodeHandle} is {@code ancestorHandle} or lies below it. */
    boolean isNodeUnder(long nodeHandle, long ancestorHandle);

    boolean shareExists(long folderHandle);

    boolean incomingPendingContactExists(long requestHandle);

    /** Mirrors "all alerts seen" to the backing service. */
    void acknowledgeAlerts();
}
