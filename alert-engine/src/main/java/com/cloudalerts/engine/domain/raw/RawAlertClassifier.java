package com.cloudalerts.engine.domain.raw;

import static com.cloudalerts.engine.domain.raw.RawAlertFields.*;

import com.cloudalerts.common.event.ScheduledMeetingChange;
import com.cloudalerts.common.handle.Handles;
import com.cloudalerts.engine.domain.alert.AlertFlags;
import com.cloudalerts.engine.domain.alert.AlertPayload;
import com.cloudalerts.engine.domain.alert.AlertType;
import com.cloudalerts.engine.domain.alert.Changeset;
import com.cloudalerts.engine.domain.alert.ContactChange;
import com.cloudalerts.engine.domain.alert.DeletedShare;
import com.cloudalerts.engine.domain.alert.IncomingPendingContact;
import com.cloudalerts.engine.domain.alert.NewShare;
import com.cloudalerts.engine.domain.alert.Payment;
import com.cloudalerts.engine.domain.alert.PaymentReminder;
import com.cloudalerts.engine.domain.alert.ScheduledMeeting;
import com.cloudalerts.engine.domain.alert.SharedNodes;
import com.cloudalerts.engine.domain.alert.Takedown;
import com.cloudalerts.engine.domain.alert.UpdatedPendingContact;
import com.cloudalerts.engine.domain.alert.UserAlert;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;
import java.util.function.IntSupplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns catch-up records into candidate alerts. Unknown type codes and kinds switched off by
 * the flags produce nothing, and consume no id.
 */
@Slf4j
@RequiredArgsConstructor
public class RawAlertClassifier {

    private static final Map<String, ScheduledMeetingChange> CHANGE_CODES = Map.of(
            CHANGE_TITLE, ScheduledMeetingChange.TITLE,
            CHANGE_DESCRIPTION, ScheduledMeetingChange.DESCRIPTION,
            CHANGE_CANCELLED, ScheduledMeetingChange.CANCELLED,
            CHANGE_TIMEZONE, ScheduledMeetingChange.TIMEZONE,
            CHANGE_START, ScheduledMeetingChange.START_DATE,
            CHANGE_END, ScheduledMeetingChange.END_DATE,
            CHANGE_RULES, ScheduledMeetingChange.RULES);

    private final AlertFlags flags;
    private final Clock clock;

    public Optional<UserAlert> classify(RawAlertRecord raw, IntSupplier ids) {
        var type = resolveType(raw);
        if (type == null) {
            log.warn("Ignoring user alert record with unknown type '{}'", raw.type());
            return Optional.empty();
        }
        if (flags.isUnwanted(type, actionOf(type, raw))) {
            log.debug("Ignoring unwanted user alert of type {}", type);
            return Optional.empty();
        }

        var timestamp = Instant.ofEpochSecond(clock.instant().getEpochSecond() - raw.getLong(TIME_DELTA, 0));
        var payload = payloadOf(type, raw);
        if (type == AlertType.INCOMING_PENDING_CONTACT) {
            timestamp = pendingContactTimestamp(raw, timestamp);
        }

        return Optional.of(UserAlert.builder()
                .id(ids.getAsInt())
                .type(type)
                .userHandle(raw.getHandle(USER, Handles.USER_HANDLE_SIZE, Handles.UNDEF))
                .email(raw.getString(EMAIL, ""))
                .timestamp(timestamp)
                .payload(payload)
                .build());
    }

    private AlertType resolveType(RawAlertRecord raw) {
        var code = raw.type();
        if (code == null) {
            return null;
        }
        if (AlertType.SCHEDULED_MEETING_CODE.equals(code)) {
            return raw.has(CHANGESET) ? AlertType.UPDATED_SCHEDULED_MEETING : AlertType.NEW_SCHEDULED_MEETING;
        }
        for (var type : AlertType.values()) {
            if (type.getCode().equals(code)) {
                return type;
            }
        }
        return null;
    }

    private static int actionOf(AlertType type, RawAlertRecord raw) {
        return switch (type) {
            case CONTACT_CHANGE -> raw.getInt(CONTACT_ACTION, -1);
            case UPDATED_PENDING_CONTACT_INCOMING, UPDATED_PENDING_CONTACT_OUTGOING -> raw.getInt(PENDING_STATUS, -1);
            default -> -1;
        };
    }

    private AlertPayload payloadOf(AlertType type, RawAlertRecord raw) {
        return switch (type) {
            case INCOMING_PENDING_CONTACT -> new IncomingPendingContact(
                    raw.getHandle(REQUEST, Handles.USER_HANDLE_SIZE, Handles.UNDEF),
                    raw.getLong(DELETED_AT, 0) != 0,
                    raw.getLong(REMINDED_AT, 0) != 0);
            case CONTACT_CHANGE -> new ContactChange(raw.getInt(CONTACT_ACTION, -1));
            case UPDATED_PENDING_CONTACT_INCOMING, UPDATED_PENDING_CONTACT_OUTGOING ->
                    new UpdatedPendingContact(raw.getInt(PENDING_STATUS, -1));
            case NEW_SHARE -> new NewShare(raw.getHandle(NODE, Handles.NODE_HANDLE_SIZE, Handles.UNDEF));
            case DELETED_SHARE -> new DeletedShare(
                    raw.getHandle(NODE, Handles.NODE_HANDLE_SIZE, Handles.UNDEF),
                    "",
                    "",
                    raw.getHandle(OWNER, Handles.USER_HANDLE_SIZE, Handles.UNDEF));
            case NEW_SHARED_NODES -> sharedNodes(raw.getHandle(NODE, Handles.NODE_HANDLE_SIZE, Handles.UNDEF), raw, NODES);
            case REMOVED_SHARED_NODES, UPDATED_SHARED_NODES -> sharedNodes(Handles.UNDEF, raw, NODE);
            case PAYMENT -> new Payment(PAYMENT_SUCCEEDED.equals(raw.getString(RESULT, "")), raw.getInt(PLAN, 0));
            case PAYMENT_REMINDER -> new PaymentReminder(Instant.ofEpochSecond(raw.getLong(EXPIRY, 0)));
            case TAKEDOWN -> {
                int down = raw.getInt(TAKEDOWN_STATE, -1);
                yield new Takedown(down == 1, down == 0, raw.getHandle(TAKEDOWN_NODE, Handles.NODE_HANDLE_SIZE, Handles.UNDEF));
            }
            case NEW_SCHEDULED_MEETING -> new ScheduledMeeting(
                    raw.getHandle(MEETING, Handles.USER_HANDLE_SIZE, Handles.UNDEF),
                    raw.getHandle(PARENT_MEETING, Handles.USER_HANDLE_SIZE, Handles.UNDEF),
                    new Changeset());
            case UPDATED_SCHEDULED_MEETING -> new ScheduledMeeting(
                    raw.getHandle(MEETING, Handles.USER_HANDLE_SIZE, Handles.UNDEF),
                    raw.getHandle(PARENT_MEETING, Handles.USER_HANDLE_SIZE, Handles.UNDEF),
                    raw.getObject(CHANGESET).map(RawAlertClassifier::changeset).orElseGet(Changeset::new));
            case DELETED_SCHEDULED_MEETING ->
                    ScheduledMeeting.deleted(raw.getHandle(MEETING, Handles.USER_HANDLE_SIZE, Handles.UNDEF));
        };
    }

    private static SharedNodes sharedNodes(long parent, RawAlertRecord raw, String field) {
        var files = new ArrayList<Long>();
        var folders = new ArrayList<Long>();
        for (var node : raw.getHandleTypeArray(field)) {
            (node.isFolder() ? folders : files).add(node.handle());
        }
        return new SharedNodes(parent, files, folders);
    }

    /** A title change needs both values; one without them is dropped. */
    private static Changeset changeset(RawAlertRecord cs) {
        var changeset = new Changeset();
        CHANGE_CODES.forEach((code, change) -> {
            if (!cs.has(code)) {
                return;
            }
            if (change == ScheduledMeetingChange.TITLE) {
                var values = cs.getStringArray(code);
                if (values.size() == 2) {
                    changeset.addChange(change, values.get(0), values.get(1));
                }
            } else {
                changeset.addChange(change);
            }
        });
        return changeset;
    }

    private static Instant pendingContactTimestamp(RawAlertRecord raw, Instant fallback) {
        long deletedAt = raw.getLong(DELETED_AT, 0);
        if (deletedAt != 0) {
            return Instant.ofEpochSecond(deletedAt);
        }
        long remindedAt = raw.getLong(REMINDED_AT, 0);
        return remindedAt != 0 ? Instant.ofEpochSecond(remindedAt) : fallback;
    }
}
