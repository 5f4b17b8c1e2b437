package com.cloudalerts.engine.domain.merge;

public enum MergeOutcome {
    APPENDED,
    MERGED
}
