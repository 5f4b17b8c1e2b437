package com.cloudalerts.engine.domain.alert;

import java.time.Instant;
import java.util.Objects;
import lombok.Builder;
import lombok.Getter;

/**
 * One user-facing alert: common fields plus a kind-specific payload.
 *
 * <p>The kind and id never change. Ids come from the store's counter when the candidate is
 * created, so a candidate that is merged away or discarded leaves a gap.
 */
@Getter
public final class UserAlert {

    private final int id;
    private final AlertType type;
    private final long userHandle;
    private final AlertPayload payload;

    private Instant timestamp;
    private String email;
    private boolean relevant;
    private boolean seen;
    private boolean removed;
    private int tag;

    @Builder
    private UserAlert(
            int id,
            AlertType type,
            long userHandle,
            String email,
            Instant timestamp,
            Boolean relevant,
            boolean seen,
            int tag,
            AlertPayload payload) {
        this.id = id;
        this.type = Objects.requireNonNull(type, "type");
        this.payload = Objects.requireNonNull(payload, "payload");
        if (!type.getPayloadType().isInstance(payload)) {
            throw new IllegalArgumentException(
                    "alert type " + type + " cannot carry " + payload.getClass().getSimpleName());
        }
        this.userHandle = userHandle;
        this.email = email == null ? "" : email;
        this.timestamp = timestamp == null ? Instant.EPOCH : timestamp;
        this.relevant = relevant == null || relevant;
        this.seen = seen;
        this.tag = tag;
    }

    public <T extends AlertPayload> T payload(Class<T> payloadType) {
        return payloadType.cast(payload);
    }

    public void setEmail(String email) {
        this.email = email == null ? "" : email;
    }

    public void setRelevant(boolean relevant) {
        this.relevant = relevant;
    }

    public void setSeen(boolean seen) {
        this.seen = seen;
    }

    public void setTag(int tag) {
        this.tag = tag;
    }

    /** Moves the timestamp forward only. */
    public void touch(Instant later) {
        if (later != null && later.isAfter(timestamp)) {
            timestamp = later;
        }
    }

    /** Marks the alert for deletion from persistent storage. */
    public void markRemoved() {
        removed = true;
    }

    @Override
    public String toString() {
        return "UserAlert[id=" + id + ", type=" + type + ", user=" + userHandle + ", ts=" + timestamp
                + ", seen=" + seen + ", relevant=" + relevant + ", removed=" + removed + ", payload=" + payload + "]";
    }
}
