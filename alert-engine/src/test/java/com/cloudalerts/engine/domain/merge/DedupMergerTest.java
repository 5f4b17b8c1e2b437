package com.cloudalerts.engine.domain.merge;

import static com.cloudalerts.engine.domain.TestAlerts.PARENT_P;
import static com.cloudalerts.engine.domain.TestAlerts.PARENT_Q;
import static com.cloudalerts.engine.domain.TestAlerts.T0;
import static com.cloudalerts.engine.domain.TestAlerts.USER_A;
import static com.cloudalerts.engine.domain.TestAlerts.USER_B;
import static com.cloudalerts.engine.domain.TestAlerts.contactChange;
import static com.cloudalerts.engine.domain.TestAlerts.meetingUpdate;
import static com.cloudalerts.engine.domain.TestAlerts.nodes;
import static com.cloudalerts.engine.domain.TestAlerts.payment;
import static org.assertj.core.api.Assertions.assertThat;

import com.cloudalerts.common.event.ScheduledMeetingChange;
import com.cloudalerts.common.event.TitleChange;
import com.cloudalerts.common.handle.Handles;
import com.cloudalerts.engine.domain.alert.AlertType;
import com.cloudalerts.engine.domain.alert.Changeset;
import com.cloudalerts.engine.domain.alert.ScheduledMeeting;
import com.cloudalerts.engine.domain.alert.SharedNodes;
import com.cloudalerts.engine.domain.codec.AlertRecordCodec;
import com.cloudalerts.engine.domain.host.AlertMetrics;
import com.cloudalerts.engine.domain.store.AlertStore;
import com.cloudalerts.engine.infrastructure.persistence.InMemoryAlertRecordStore;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DedupMergerTest {

    private AlertStore store;
    private DedupMerger merger;

    @BeforeEach
    void setUp() {
        store = new AlertStore(new InMemoryAlertRecordStore(), new AlertRecordCodec(), AlertMetrics.NOOP);
        merger = new DedupMerger(store, AlertMetrics.NOOP);
    }

    @Test
    void shouldMergeNodeAlertsForSameUserAndParent() {
        // given
        var first = nodes(store.nextId(), AlertType.NEW_SHARED_NODES, USER_A, PARENT_P, List.of(1L, 2L), T0);
        merger.offer(first);

        // when
        var outcome = merger.offer(
                nodes(store.nextId(), AlertType.NEW_SHARED_NODES, USER_A, PARENT_P, List.of(2L, 3L), T0.plusSeconds(5)));

        // then
        assertThat(outcome).isEqualTo(MergeOutcome.MERGED);
        assertThat(store.alerts()).containsExactly(first);
        assertThat(first.payload(SharedNodes.class).fileHandles()).containsExactly(1L, 2L, 3L);
        assertThat(first.getTimestamp()).isEqualTo(T0.plusSeconds(5));
    }

    @Test
    void shouldNotMergeAcrossUsersParentsOrKinds() {
        // given
        merger.offer(nodes(store.nextId(), AlertType.NEW_SHARED_NODES, USER_A, PARENT_P, List.of(1L), T0));

        // when
        merger.offer(nodes(store.nextId(), AlertType.NEW_SHARED_NODES, USER_B, PARENT_P, List.of(2L), T0));
        merger.offer(nodes(store.nextId(), AlertType.NEW_SHARED_NODES, USER_A, PARENT_Q, List.of(3L), T0));
        merger.offer(nodes(store.nextId(), AlertType.UPDATED_SHARED_NODES, USER_A, PARENT_P, List.of(4L), T0));

        // then
        assertThat(store.size()).isEqualTo(4);
    }

    @Test
    void shouldNeverMergeNodeAlertsWithUndefinedParent() {
        // given
        merger.offer(nodes(store.nextId(), AlertType.REMOVED_SHARED_NODES, USER_A, Handles.UNDEF, List.of(1L), T0));

        // when
        var outcome = merger.offer(
                nodes(store.nextId(), AlertType.REMOVED_SHARED_NODES, USER_A, Handles.UNDEF, List.of(2L), T0));

        // then
        assertThat(outcome).isEqualTo(MergeOutcome.APPENDED);
        assertThat(store.size()).isEqualTo(2);
    }

    @Test
    void shouldNotMergeIntoDeliveredAlert() {
        // given
        merger.offer(nodes(store.nextId(), AlertType.NEW_SHARED_NODES, USER_A, PARENT_P, List.of(1L), T0));
        store.drainNotifications();

        // when
        var outcome = merger.offer(nodes(store.nextId(), AlertType.NEW_SHARED_NODES, USER_A, PARENT_P, List.of(2L), T0));

        // then
        assertThat(outcome).isEqualTo(MergeOutcome.APPENDED);
        assertThat(store.size()).isEqualTo(2);
    }

    @Test
    void shouldMergeIdenticalPaymentsOnly() {
        // given
        merger.offer(payment(store.nextId(), true, 4, T0));

        // when
        var same = merger.offer(payment(store.nextId(), true, 4, T0.plusSeconds(1)));
        var otherPlan = merger.offer(payment(store.nextId(), true, 5, T0.plusSeconds(2)));

        // then
        assertThat(same).isEqualTo(MergeOutcome.MERGED);
        assertThat(otherPlan).isEqualTo(MergeOutcome.APPENDED);
        assertThat(store.size()).isEqualTo(2);
    }

    @Test
    void shouldCombineChangesetsOfSameMeeting() {
        // given
        var first = Changeset.of(Set.of(ScheduledMeetingChange.TITLE), new TitleChange("Weekly", "Sync"));
        var later = Changeset.of(
                Set.of(ScheduledMeetingChange.TITLE, ScheduledMeetingChange.START_DATE), new TitleChange("Sync", "Standup"));
        var existing = meetingUpdate(store.nextId(), USER_A, 0x99L, first, T0);
        merger.offer(existing);

        // when
        var outcome = merger.offer(meetingUpdate(store.nextId(), USER_A, 0x99L, later, T0.plusSeconds(60)));

        // then
        assertThat(outcome).isEqualTo(MergeOutcome.MERGED);
        var changeset = existing.payload(ScheduledMeeting.class).changeset();
        assertThat(changeset.changes())
                .containsExactlyInAnyOrder(ScheduledMeetingChange.TITLE, ScheduledMeetingChange.START_DATE);
        assertThat(changeset.updatedTitle()).contains(new TitleChange("Weekly", "Standup"));
    }

    @Test
    void shouldAlwaysAppendContactChanges() {
        // given
        merger.offer(contactChange(store.nextId(), USER_A, T0));

        // when
        var outcome = merger.offer(contactChange(store.nextId(), USER_A, T0));

        // then
        assertThat(outcome).isEqualTo(MergeOutcome.APPENDED);
        assertThat(store.size()).isEqualTo(2);
    }
}
