package com.cloudalerts.engine.domain.alert;

import com.cloudalerts.common.handle.Handles;

/**
 * Scheduled meeting reference. The change set is empty for new and deleted meetings.
 */
public record ScheduledMeeting(long meetingHandle, long parentMeetingHandle, Changeset changeset)
        implements AlertPayload {

    public static final int SUBTYPE_NEW = 1;
    public static final int SUBTYPE_UPDATE = 2;
    public static final int SUBTYPE_DELETED = 3;

    public ScheduledMeeting {
        changeset = changeset == null ? new Changeset() : changeset;
    }

    public static ScheduledMeeting deleted(long meetingHandle) {
        return new ScheduledMeeting(meetingHandle, Handles.UNDEF, new Changeset());
    }
}
