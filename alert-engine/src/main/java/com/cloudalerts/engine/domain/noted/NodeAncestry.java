package com.cloudalerts.engine.domain.noted;

@FunctionalInterface
public interface NodeAncestry {

    /** Whether {@code nodeHandle} is {@code ancestorHandle} or lies below it. */
    boolean isUnder(long nodeHandle, long ancestorHandle);
}
