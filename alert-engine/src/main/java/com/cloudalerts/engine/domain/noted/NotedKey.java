package com.cloudalerts.engine.domain.noted;

public record NotedKey(long userHandle, long parentHandle) {}
