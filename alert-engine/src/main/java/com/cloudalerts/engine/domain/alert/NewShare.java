package com.cloudalerts.engine.domain.alert;

public record NewShare(long folderHandle) implements AlertPayload {}
