package com.cloudalerts.engine.domain.event;

import static com.cloudalerts.engine.domain.TestAlerts.OWN_USER;
import static com.cloudalerts.engine.domain.TestAlerts.T0;
import static com.cloudalerts.engine.domain.TestAlerts.USER_A;
import static org.assertj.core.api.Assertions.assertThat;

import com.cloudalerts.common.event.ChangeEventKind;
import com.cloudalerts.common.event.ContactEvent;
import com.cloudalerts.common.event.PaymentEvent;
import com.cloudalerts.common.event.ScheduledMeetingChange;
import com.cloudalerts.common.event.ScheduledMeetingEvent;
import com.cloudalerts.common.event.ShareEvent;
import com.cloudalerts.common.event.TakedownEvent;
import com.cloudalerts.engine.domain.alert.AlertFlags;
import com.cloudalerts.engine.domain.alert.AlertType;
import com.cloudalerts.engine.domain.alert.ContactChange;
import com.cloudalerts.engine.domain.alert.DeletedShare;
import com.cloudalerts.engine.domain.alert.PaymentReminder;
import com.cloudalerts.engine.domain.alert.ScheduledMeeting;
import com.cloudalerts.engine.domain.alert.Takedown;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ChangeEventClassifierTest {

    private static final Clock CLOCK = Clock.fixed(T0.plusSeconds(100), ZoneOffset.UTC);

    private AtomicInteger ids;
    private ChangeEventClassifier classifier;

    @BeforeEach
    void setUp() {
        ids = new AtomicInteger(10);
        classifier = new ChangeEventClassifier(AlertFlags.allEnabled(), CLOCK);
    }

    @Test
    void shouldMapContactChangeAndTruncateToSeconds() {
        // given
        var event = ContactEvent.builder()
                .kind(ChangeEventKind.CONTACT_CHANGE)
                .userHandle(USER_A)
                .email("ann@example.com")
                .action(ContactChange.BLOCKED)
                .timestamp(T0.plusMillis(900))
                .build();

        // when
        var alert = classifier.classify(event, ids::incrementAndGet).orElseThrow();

        // then
        assertThat(alert.getId()).isEqualTo(11);
        assertThat(alert.getType()).isEqualTo(AlertType.CONTACT_CHANGE);
        assertThat(alert.getEmail()).isEqualTo("ann@example.com");
        assertThat(alert.getTimestamp()).isEqualTo(T0);
        assertThat(alert.payload(ContactChange.class).action()).isEqualTo(ContactChange.BLOCKED);
    }

    @Test
    void shouldUseClockWhenEventHasNoTimestamp() {
        // given
        var event = TakedownEvent.builder().userHandle(OWN_USER).nodeHandle(0x5000L).reinstated(true).build();

        // when
        var alert = classifier.classify(event, ids::incrementAndGet).orElseThrow();

        // then
        assertThat(alert.getTimestamp()).isEqualTo(T0.plusSeconds(100));
        assertThat(alert.payload(Takedown.class)).isEqualTo(new Takedown(false, true, 0x5000L));
    }

    @Test
    void shouldSnapshotFolderOfDeletedShare() {
        // given
        var event = ShareEvent.builder()
                .kind(ChangeEventKind.DELETED_SHARE)
                .userHandle(USER_A)
                .folderHandle(0x3000L)
                .ownerHandle(USER_A)
                .folderPath("/Shared/Docs")
                .folderName("Docs")
                .timestamp(T0)
                .build();

        // when
        var alert = classifier.classify(event, ids::incrementAndGet).orElseThrow();

        // then
        assertThat(alert.payload(DeletedShare.class))
                .isEqualTo(new DeletedShare(0x3000L, "/Shared/Docs", "Docs", USER_A));
    }

    @Test
    void shouldCarryPlanExpiryOfReminder() {
        // given
        var event = PaymentEvent.builder()
                .kind(ChangeEventKind.PAYMENT_REMINDER)
                .userHandle(OWN_USER)
                .expiry(T0.plusSeconds(3_600).plusMillis(10))
                .timestamp(T0)
                .build();

        // when
        var alert = classifier.classify(event, ids::incrementAndGet).orElseThrow();

        // then
        assertThat(alert.payload(PaymentReminder.class).expiry()).isEqualTo(T0.plusSeconds(3_600));
    }

    @Test
    void shouldBuildChangesetForMeetingUpdate() {
        // given
        var event = ScheduledMeetingEvent.builder()
                .kind(ChangeEventKind.UPDATED_SCHEDULED_MEETING)
                .userHandle(USER_A)
                .meetingHandle(0x99L)
                .changes(EnumSet.of(ScheduledMeetingChange.CANCELLED))
                .timestamp(T0)
                .build();

        // when
        var alert = classifier.classify(event, ids::incrementAndGet).orElseThrow();

        // then
        assertThat(alert.payload(ScheduledMeeting.class).changeset().changes())
                .containsExactly(ScheduledMeetingChange.CANCELLED);
    }

    @Test
    void shouldSkipUnwantedEventWithoutConsumingId() {
        // given
        classifier = new ChangeEventClassifier(AlertFlags.allEnabled().toBuilder().cloudNewShare(false).build(), CLOCK);
        var event = ShareEvent.builder()
                .kind(ChangeEventKind.NEW_SHARE)
                .userHandle(USER_A)
                .folderHandle(0x3000L)
                .timestamp(T0)
                .build();

        // when
        var alert = classifier.classify(event, ids::incrementAndGet);

        // then
        assertThat(alert).isEmpty();
        assertThat(ids.get()).isEqualTo(10);
    }
}
