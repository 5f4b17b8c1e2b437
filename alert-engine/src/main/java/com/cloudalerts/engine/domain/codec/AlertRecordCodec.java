package com.cloudalerts.engine.domain.codec;

import com.cloudalerts.common.event.ScheduledMeetingChange;
import com.cloudalerts.common.event.TitleChange;
import com.cloudalerts.common.handle.NameIds;
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
import java.time.Instant;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Byte form of a persisted alert:
 * {@code [type tag: 8][timestamp: 8][user handle: 8][email][relevant: 1][seen: 1][payload]}.
 * Timestamps are whole epoch seconds. The alert id is the record key. The removed marker and
 * the correlation tag belong to the running session and are never written.
 */
@Slf4j
public class AlertRecordCodec {

    public byte[] serialize(UserAlert alert) {
        var w = new RecordWriter()
                .writeLong(alert.getType().getNameId())
                .writeLong(alert.getTimestamp().getEpochSecond())
                .writeHandle(alert.getUserHandle())
                .writeString(alert.getEmail())
                .writeBool(alert.isRelevant())
                .writeBool(alert.isSeen());
        return writePayload(w, alert.getType(), alert.getPayload()).toByteArray();
    }

    /**
     * Decodes one record. Unknown tags and truncated or inconsistent payloads yield empty;
     * nothing is thrown.
     */
    public Optional<UserAlert> deserialize(int alertId, byte[] record) {
        if (record == null) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(read(alertId, new RecordReader(record)));
        } catch (MalformedAlertRecordException e) {
            log.warn("Skipping undecodable alert record {}: {}", alertId, e.getMessage());
            return Optional.empty();
        }
    }

    private UserAlert read(int alertId, RecordReader r) {
        long tag = r.readLong();
        var timestamp = Instant.ofEpochSecond(r.readLong());
        long userHandle = r.readHandle();
        String email = r.readString();
        boolean relevant = r.readBool();
        boolean seen = r.readBool();

        AlertType type;
        AlertPayload payload;
        String code = NameIds.toCode(tag);
        if (AlertType.SCHEDULED_MEETING_CODE.equals(code) || AlertType.DELETED_SCHEDULED_MEETING_CODE.equals(code)) {
            int subtype = r.readInt();
            type = meetingType(code, subtype);
            if (type == null) {
                log.warn("Skipping alert record {}: unknown scheduled meeting subtype {}", alertId, subtype);
                return null;
            }
            payload = readMeeting(r, type);
        } else {
            type = typeForCode(code);
            if (type == null) {
                log.warn("Skipping alert record {}: unknown type tag '{}'", alertId, code);
                return null;
            }
            payload = readPayload(r, type);
        }

        return UserAlert.builder()
                .id(alertId)
                .type(type)
                .userHandle(userHandle)
                .email(email)
                .timestamp(timestamp)
                .relevant(relevant)
                .seen(seen)
                .payload(payload)
                .build();
    }

    private RecordWriter writePayload(RecordWriter w, AlertType type, AlertPayload payload) {
        return switch (type) {
            case INCOMING_PENDING_CONTACT -> {
                var p = (IncomingPendingContact) payload;
                yield w.writeHandle(p.requestHandle()).writeBool(p.requestDeleted()).writeBool(p.requestReminded());
            }
            case CONTACT_CHANGE -> w.writeInt(((ContactChange) payload).action());
            case UPDATED_PENDING_CONTACT_INCOMING, UPDATED_PENDING_CONTACT_OUTGOING ->
                    w.writeInt(((UpdatedPendingContact) payload).action());
            case NEW_SHARE -> w.writeHandle(((NewShare) payload).folderHandle());
            case DELETED_SHARE -> {
                var p = (DeletedShare) payload;
                yield w.writeHandle(p.folderHandle())
                        .writeString(p.folderPath())
                        .writeString(p.folderName())
                        .writeHandle(p.ownerHandle());
            }
            case NEW_SHARED_NODES, REMOVED_SHARED_NODES, UPDATED_SHARED_NODES -> {
                var p = (SharedNodes) payload;
                yield w.writeHandle(p.getParentHandle()).writeHandles(p.fileHandles()).writeHandles(p.folderHandles());
            }
            case PAYMENT -> {
                var p = (Payment) payload;
                yield w.writeBool(p.success()).writeInt(p.planNumber());
            }
            case PAYMENT_REMINDER -> w.writeLong(((PaymentReminder) payload).expiry().getEpochSecond());
            case TAKEDOWN -> {
                var p = (Takedown) payload;
                yield w.writeBool(p.takedown()).writeBool(p.reinstate()).writeHandle(p.nodeHandle());
            }
            case NEW_SCHEDULED_MEETING -> {
                var p = (ScheduledMeeting) payload;
                yield w.writeInt(ScheduledMeeting.SUBTYPE_NEW)
                        .writeHandle(p.meetingHandle())
                        .writeHandle(p.parentMeetingHandle());
            }
            case UPDATED_SCHEDULED_MEETING -> {
                var p = (ScheduledMeeting) payload;
                w.writeInt(ScheduledMeeting.SUBTYPE_UPDATE)
                        .writeHandle(p.meetingHandle())
                        .writeHandle(p.parentMeetingHandle())
                        .writeLong(p.changeset().bits());
                p.changeset().updatedTitle().ifPresent(title ->
                        w.writeString(title.oldValue()).writeString(title.newValue()));
                yield w;
            }
            case DELETED_SCHEDULED_MEETING -> w.writeInt(ScheduledMeeting.SUBTYPE_DELETED)
                    .writeHandle(((ScheduledMeeting) payload).meetingHandle());
        };
    }

    private AlertPayload readPayload(RecordReader r, AlertType type) {
        return switch (type) {
            case INCOMING_PENDING_CONTACT -> new IncomingPendingContact(r.readHandle(), r.readBool(), r.readBool());
            case CONTACT_CHANGE -> new ContactChange(r.readInt());
            case UPDATED_PENDING_CONTACT_INCOMING, UPDATED_PENDING_CONTACT_OUTGOING ->
                    new UpdatedPendingContact(r.readInt());
            case NEW_SHARE -> new NewShare(r.readHandle());
            case DELETED_SHARE -> new DeletedShare(r.readHandle(), r.readString(), r.readString(), r.readHandle());
            case NEW_SHARED_NODES, REMOVED_SHARED_NODES, UPDATED_SHARED_NODES ->
                    new SharedNodes(r.readHandle(), r.readHandles(), r.readHandles());
            case PAYMENT -> new Payment(r.readBool(), r.readInt());
            case PAYMENT_REMINDER -> new PaymentReminder(Instant.ofEpochSecond(r.readLong()));
            case TAKEDOWN -> new Takedown(r.readBool(), r.readBool(), r.readHandle());
            case NEW_SCHEDULED_MEETING, UPDATED_SCHEDULED_MEETING, DELETED_SCHEDULED_MEETING ->
                    throw new IllegalStateException("scheduled meetings are read by readMeeting");
        };
    }

    private AlertPayload readMeeting(RecordReader r, AlertType type) {
        long meetingHandle = r.readHandle();
        if (type == AlertType.DELETED_SCHEDULED_MEETING) {
            return ScheduledMeeting.deleted(meetingHandle);
        }
        long parentHandle = r.readHandle();
        if (type == AlertType.NEW_SCHEDULED_MEETING) {
            return new ScheduledMeeting(meetingHandle, parentHandle, new Changeset());
        }
        long bits = r.readLong();
        TitleChange title = null;
        if ((bits & (1L << ScheduledMeetingChange.TITLE.ordinal())) != 0) {
            title = new TitleChange(r.readString(), r.readString());
        }
        var changeset = Changeset.fromBits(bits, title)
                .orElseThrow(() -> new MalformedAlertRecordException("invalid change set bits " + Long.toBinaryString(bits)));
        return new ScheduledMeeting(meetingHandle, parentHandle, changeset);
    }

    private static AlertType meetingType(String code, int subtype) {
        if (AlertType.DELETED_SCHEDULED_MEETING_CODE.equals(code)) {
            return subtype == ScheduledMeeting.SUBTYPE_DELETED ? AlertType.DELETED_SCHEDULED_MEETING : null;
        }
        return switch (subtype) {
            case ScheduledMeeting.SUBTYPE_NEW -> AlertType.NEW_SCHEDULED_MEETING;
            case ScheduledMeeting.SUBTYPE_UPDATE -> AlertType.UPDATED_SCHEDULED_MEETING;
            default -> null;
        };
    }

    private static AlertType typeForCode(String code) {
        for (var type : AlertType.values()) {
            if (!type.isScheduledMeeting() && type.getCode().equals(code)) {
                return type;
            }
        }
        return null;
    }
}
