package com.cloudalerts.engine.domain.alert;

import java.time.Instant;

public record PaymentReminder(Instant expiry) implements AlertPayload {}
