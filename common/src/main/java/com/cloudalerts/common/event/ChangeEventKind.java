package com.cloudalerts.common.event;

public enum ChangeEventKind {
    CONTACT_CHANGE,
    INCOMING_PENDING_CONTACT,
    UPDATED_PENDING_CONTACT_INCOMING,
    UPDATED_PENDING_CONTACT_OUTGOING,
    NEW_SHARE,
    DELETED_SHARE,
    PAYMENT,
    PAYMENT_REMINDER,
    TAKEDOWN,
    NEW_SCHEDULED_MEETING,
    UPDATED_SCHEDULED_MEETING,
    DELETED_SCHEDULED_MEETING
}
