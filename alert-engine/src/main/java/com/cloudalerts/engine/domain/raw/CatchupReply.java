package com.cloudalerts.engine.domain.raw;

import com.cloudalerts.engine.domain.alert.PendingContactUser;
import java.util.List;
import lombok.Builder;

/**
 * The reply to the initial alert query: recent raw records, oldest first, the users that are
 * only known through pending contact requests, and the time delta of the last alert the user
 * saw, or {@code null} when the user has seen none.
 */
@Builder(toBuilder = true)
public record CatchupReply(List<RawAlertRecord> records, List<PendingContactUser> pendingContactUsers, Long lastSeenTimeDelta) {

    public CatchupReply {
        records = records == null ? List.of() : List.copyOf(records);
        pendingContactUsers = pendingContactUsers == null ? List.of() : List.copyOf(pendingContactUsers);
    }

    /** Records at least as old as the last seen one are loaded as seen. */
    public boolean isSeen(long timeDelta) {
        return lastSeenTimeDelta != null && timeDelta >= lastSeenTimeDelta;
    }
}
