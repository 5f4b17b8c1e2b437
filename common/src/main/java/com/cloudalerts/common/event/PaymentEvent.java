package com.cloudalerts.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import lombok.Builder;

/**
 * A payment outcome ({@code PAYMENT}) or a plan expiry reminder ({@code PAYMENT_REMINDER}).
 * Payments are never attributed to another user, so {@code userHandle} is normally the
 * session's own handle.
 */
@Builder(toBuilder = true)
public record PaymentEvent(
        ChangeEventKind kind,
        @JsonProperty("user_handle") long userHandle,
        boolean success,
        @JsonProperty("plan_number") int planNumber,
        Instant expiry,
        Instant timestamp) implements ChangeEvent {}
