package com.cloudalerts.engine.domain.noted;

import com.cloudalerts.engine.domain.alert.AlertType;

/**
 * What happened to a noted node, and the alert kind it turns into.
 */
public enum NotedChange {
    ADDED(AlertType.NEW_SHARED_NODES),
    UPDATED(AlertType.UPDATED_SHARED_NODES),
    REMOVED(AlertType.REMOVED_SHARED_NODES);

    private final AlertType alertType;

    NotedChange(AlertType alertType) {
        this.alertType = alertType;
    }

    public AlertType alertType() {
        return alertType;
    }
}
