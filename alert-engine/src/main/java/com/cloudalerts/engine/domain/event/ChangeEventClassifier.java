package com.cloudalerts.engine.domain.event;

import com.cloudalerts.common.event.ChangeEvent;
import com.cloudalerts.common.event.ContactEvent;
import com.cloudalerts.common.event.PaymentEvent;
import com.cloudalerts.common.event.ScheduledMeetingEvent;
import com.cloudalerts.common.event.ShareEvent;
import com.cloudalerts.common.event.TakedownEvent;
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
import com.cloudalerts.engine.domain.alert.Takedown;
import com.cloudalerts.engine.domain.alert.UpdatedPendingContact;
import com.cloudalerts.engine.domain.alert.UserAlert;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.function.IntSupplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps live change events onto candidate alerts, honouring the alert flags.
 * Timestamps are cut to whole seconds, the precision alerts are persisted with.
 */
@Slf4j
@RequiredArgsConstructor
public class ChangeEventClassifier {

    private final AlertFlags flags;
    private final Clock clock;

    public Optional<UserAlert> classify(ChangeEvent event, IntSupplier ids) {
        var type = typeOf(event);
        int action = event instanceof ContactEvent ? ((ContactEvent) event).action() : -1;
        if (flags.isUnwanted(type, action)) {
            log.debug("Ignoring unwanted {} change for user {}", type, event.userHandle());
            return Optional.empty();
        }

        var timestamp = seconds(event.timestamp());
        String email = "";
        AlertPayload payload;
        switch (type) {
            case CONTACT_CHANGE -> {
                var contact = (ContactEvent) event;
                email = contact.email();
                payload = new ContactChange(contact.action());
            }
            case INCOMING_PENDING_CONTACT -> {
                var contact = (ContactEvent) event;
                email = contact.email();
                payload = new IncomingPendingContact(
                        contact.requestHandle(), contact.deletedAt() != null, contact.remindedAt() != null);
                if (contact.deletedAt() != null) {
                    timestamp = seconds(contact.deletedAt());
                } else if (contact.remindedAt() != null) {
                    timestamp = seconds(contact.remindedAt());
                }
            }
            case UPDATED_PENDING_CONTACT_INCOMING, UPDATED_PENDING_CONTACT_OUTGOING -> {
                var contact = (ContactEvent) event;
                email = contact.email();
                payload = new UpdatedPendingContact(contact.action());
            }
            case NEW_SHARE -> {
                var share = (ShareEvent) event;
                email = share.email();
                payload = new NewShare(share.folderHandle());
            }
            case DELETED_SHARE -> {
                var share = (ShareEvent) event;
                email = share.email();
                payload = new DeletedShare(share.folderHandle(), share.folderPath(), share.folderName(), share.ownerHandle());
            }
            case PAYMENT -> {
                var payment = (PaymentEvent) event;
                payload = new Payment(payment.success(), payment.planNumber());
            }
            case PAYMENT_REMINDER -> payload = new PaymentReminder(seconds(((PaymentEvent) event).expiry()));
            case TAKEDOWN -> {
                var takedown = (TakedownEvent) event;
                payload = new Takedown(!takedown.reinstated(), takedown.reinstated(), takedown.nodeHandle());
            }
            case NEW_SCHEDULED_MEETING -> {
                var meeting = (ScheduledMeetingEvent) event;
                payload = new ScheduledMeeting(meeting.meetingHandle(), meeting.parentMeetingHandle(), new Changeset());
            }
            case UPDATED_SCHEDULED_MEETING -> {
                var meeting = (ScheduledMeetingEvent) event;
                payload = new ScheduledMeeting(meeting.meetingHandle(), meeting.parentMeetingHandle(),
                        Changeset.of(meeting.changes(), meeting.titleChange()));
            }
            case DELETED_SCHEDULED_MEETING -> payload = ScheduledMeeting.deleted(((ScheduledMeetingEvent) event).meetingHandle());
            default -> throw new IllegalStateException("no change event maps to " + type);
        }

        return Optional.of(UserAlert.builder()
                .id(ids.getAsInt())
                .type(type)
                .userHandle(event.userHandle())
                .email(email)
                .timestamp(timestamp)
                .payload(payload)
                .build());
    }

    private static AlertType typeOf(ChangeEvent event) {
        return switch (event.kind()) {
            case CONTACT_CHANGE -> AlertType.CONTACT_CHANGE;
            case INCOMING_PENDING_CONTACT -> AlertType.INCOMING_PENDING_CONTACT;
            case UPDATED_PENDING_CONTACT_INCOMING -> AlertType.UPDATED_PENDING_CONTACT_INCOMING;
            case UPDATED_PENDING_CONTACT_OUTGOING -> AlertType.UPDATED_PENDING_CONTACT_OUTGOING;
            case NEW_SHARE -> AlertType.NEW_SHARE;
            case DELETED_SHARE -> AlertType.DELETED_SHARE;
            case PAYMENT -> AlertType.PAYMENT;
            case PAYMENT_REMINDER -> AlertType.PAYMENT_REMINDER;
            case TAKEDOWN -> AlertType.TAKEDOWN;
            case NEW_SCHEDULED_MEETING -> AlertType.NEW_SCHEDULED_MEETING;
            case UPDATED_SCHEDULED_MEETING -> AlertType.UPDATED_SCHEDULED_MEETING;
            case DELETED_SCHEDULED_MEETING -> AlertType.DELETED_SCHEDULED_MEETING;
        };
    }

    private Instant seconds(Instant at) {
        return Instant.ofEpochSecond((at == null ? clock.instant() : at).getEpochSecond());
    }
}
