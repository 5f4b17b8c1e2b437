package com.cloudalerts.common.event;

import java.time.Instant;

/**
 * A typed change built by the host from a live protocol message.
 * Node additions and removals inside shares are not change events; they are noted
 * individually and converted in batches.
 */
public interface ChangeEvent {

    ChangeEventKind kind();

    long userHandle();

    Instant timestamp();
}
