package com.cloudalerts.engine.domain.noted;

import lombok.Builder;

/**
 * The few facts about a node inside an incoming share that alerting needs.
 */
@Builder(toBuilder = true)
public record SharedNode(long handle, long parentHandle, NodeType type) {}
