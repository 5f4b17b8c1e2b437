package com.cloudalerts.engine.domain.alert;

public record Payment(boolean success, int planNumber) implements AlertPayload {}
