package com.cloudalerts.engine.domain.host;

import com.cloudalerts.engine.domain.alert.AlertType;

public interface AlertMetrics {

    AlertMetrics NOOP = new AlertMetrics() {};

    default void alertAdded(AlertType type) {}

    default void alertMerged(AlertType type) {}

    default void alertDiscarded(AlertType type) {}

    default void alertsTrimmed(int count) {}

    default void nodeSuppressed() {}
}
