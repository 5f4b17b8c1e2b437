package com.cloudalerts.engine.domain.alert;

public record Takedown(boolean takedown, boolean reinstate, long nodeHandle) implements AlertPayload {}
