package com.cloudalerts.engine.domain.alert;

import com.cloudalerts.common.handle.NameIds;
import lombok.Getter;

/**
 * Closed set of alert kinds. Each kind fixes the payload class its alerts carry and the
 * wire code used both by catch-up records and as the persisted type tag.
 * New and updated scheduled meetings share one wire code; they are told apart by a subtype.
 */
@Getter
public enum AlertType {
    INCOMING_PENDING_CONTACT("ipc", IncomingPendingContact.class),
    CONTACT_CHANGE("c", ContactChange.class),
    UPDATED_PENDING_CONTACT_INCOMING("upci", UpdatedPendingContact.class),
    UPDATED_PENDING_CONTACT_OUTGOING("upco", UpdatedPendingContact.class),
    NEW_SHARE("share", NewShare.class),
    DELETED_SHARE("dshare", DeletedShare.class),
    NEW_SHARED_NODES("put", SharedNodes.class),
    REMOVED_SHARED_NODES("d", SharedNodes.class),
    UPDATED_SHARED_NODES("u", SharedNodes.class),
    PAYMENT("psts", Payment.class),
    PAYMENT_REMINDER("pses", PaymentReminder.class),
    TAKEDOWN("ph", Takedown.class),
    NEW_SCHEDULED_MEETING("mcsmp", ScheduledMeeting.class),
    UPDATED_SCHEDULED_MEETING("mcsmp", ScheduledMeeting.class),
    DELETED_SCHEDULED_MEETING("mcsmr", ScheduledMeeting.class);

    public static final String SCHEDULED_MEETING_CODE = "mcsmp";
    public static final String DELETED_SCHEDULED_MEETING_CODE = "mcsmr";

    private final String code;
    private final long nameId;
    private final Class<? extends AlertPayload> payloadType;

    AlertType(String code, Class<? extends AlertPayload> payloadType) {
        this.code = code;
        this.nameId = NameIds.of(code);
        this.payloadType = payloadType;
    }

    public boolean isSharedNodes() {
        return payloadType == SharedNodes.class;
    }

    public boolean isScheduledMeeting() {
        return payloadType == ScheduledMeeting.class;
    }
}
