package com.cloudalerts.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import lombok.Builder;

/**
 * Contact and contact-request changes. {@code action} carries the contact change action
 * or the pending-contact update status, depending on {@code kind}.
 */
@Builder(toBuilder = true)
public record ContactEvent(
        ChangeEventKind kind,
        @JsonProperty("user_handle") long userHandle,
        String email,
        int action,
        @JsonProperty("request_handle") long requestHandle,
        @JsonProperty("deleted_at") Instant deletedAt,
        @JsonProperty("reminded_at") Instant remindedAt,
        Instant timestamp) implements ChangeEvent {}
