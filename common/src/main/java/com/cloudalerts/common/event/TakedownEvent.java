package com.cloudalerts.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import lombok.Builder;

@Builder(toBuilder = true)
public record TakedownEvent(
        @JsonProperty("user_handle") long userHandle,
        @JsonProperty("node_handle") long nodeHandle,
        boolean reinstated,
        Instant timestamp) implements ChangeEvent {

    @Override
    public ChangeEventKind kind() {
        return ChangeEventKind.TAKEDOWN;
    }
}
