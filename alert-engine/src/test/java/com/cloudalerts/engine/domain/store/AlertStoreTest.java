package com.cloudalerts.engine.domain.store;

import static com.cloudalerts.engine.domain.TestAlerts.T0;
import static com.cloudalerts.engine.domain.TestAlerts.USER_A;
import static com.cloudalerts.engine.domain.TestAlerts.USER_B;
import static com.cloudalerts.engine.domain.TestAlerts.contactChange;
import static org.assertj.core.api.Assertions.assertThat;

import com.cloudalerts.engine.domain.alert.AlertType;
import com.cloudalerts.engine.domain.alert.UserAlert;
import com.cloudalerts.engine.domain.codec.AlertRecordCodec;
import com.cloudalerts.engine.domain.host.AlertMetrics;
import com.cloudalerts.engine.infrastructure.persistence.InMemoryAlertRecordStore;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AlertStoreTest {

    private InMemoryAlertRecordStore persistence;
    private AlertStore store;

    @BeforeEach
    void setUp() {
        persistence = new InMemoryAlertRecordStore();
        store = new AlertStore(persistence, new AlertRecordCodec(), AlertMetrics.NOOP);
    }

    private UserAlert appendContactChange() {
        var alert = contactChange(store.nextId(), USER_A, T0);
        store.append(alert);
        return alert;
    }

    @Test
    void shouldQueueAndPersistAppendedAlert() {
        // when
        var alert = appendContactChange();

        // then
        assertThat(store.alerts()).containsExactly(alert);
        assertThat(store.pendingNotifications()).containsExactly(alert);
        assertThat(persistence.loadAll()).extracting(StoredAlertRecord::alertId).containsExactly(alert.getId());
    }

    @Test
    void shouldDropOldestAlertWhenLogIsFull() {
        // given
        var first = appendContactChange();
        for (int i = 1; i < AlertStore.MAX_ALERTS; i++) {
            appendContactChange();
        }
        assertThat(store.size()).isEqualTo(AlertStore.MAX_ALERTS);

        // when
        var newest = appendContactChange();

        // then
        assertThat(store.size()).isEqualTo(AlertStore.MAX_ALERTS);
        assertThat(store.alerts()).doesNotContain(first).endsWith(newest);
        assertThat(first.isRemoved()).isTrue();
        assertThat(persistence.loadAll()).extracting(StoredAlertRecord::alertId).doesNotContain(first.getId());
    }

    @Test
    void shouldQueueUpdatedAlertOnlyOnce() {
        // given
        var alert = appendContactChange();

        // when
        store.notifyUpdated(alert);
        store.notifyUpdated(alert);

        // then
        assertThat(store.pendingNotifications()).containsExactly(alert);
    }

    @Test
    void shouldForgetQueueOnDrain() {
        // given
        var alert = appendContactChange();

        // when
        var drained = store.drainNotifications();

        // then
        assertThat(drained).containsExactly(alert);
        assertThat(store.pendingNotifications()).isEmpty();
        assertThat(store.isPending(alert)).isFalse();
        assertThat(store.alerts()).containsExactly(alert);
    }

    @Test
    void shouldOnlyOfferUndeliveredUnseenAlertsForMerging() {
        // given
        var delivered = appendContactChange();
        store.drainNotifications();
        var seen = appendContactChange();
        seen.setSeen(true);
        var candidate = appendContactChange();

        // when
        var found = store.findMergeable(AlertType.CONTACT_CHANGE, USER_A, a -> true);

        // then
        assertThat(found).containsSame(candidate);
        assertThat(store.findMergeable(AlertType.CONTACT_CHANGE, USER_A, a -> a == delivered)).isEmpty();
        assertThat(store.findMergeable(AlertType.CONTACT_CHANGE, USER_A, a -> a == seen)).isEmpty();
    }

    @Test
    void shouldMarkEveryUnseenAlertSeen() {
        // given
        appendContactChange();
        appendContactChange();
        store.drainNotifications();

        // when
        int changed = store.markSeenAll();

        // then
        assertThat(changed).isEqualTo(2);
        assertThat(store.alerts()).allMatch(UserAlert::isSeen);
        assertThat(store.pendingNotifications()).hasSize(2);
        assertThat(store.markSeenAll()).isZero();
    }

    @Test
    void shouldRemoveMatchingAlertsAndQueueThem() {
        // given
        var kept = appendContactChange();
        var removed = appendContactChange();
        store.drainNotifications();

        // when
        var result = store.removeMatching(a -> a == removed);

        // then
        assertThat(result).containsExactly(removed);
        assertThat(store.alerts()).containsExactly(kept);
        assertThat(store.pendingNotifications()).containsExactly(removed);
        assertThat(persistence.loadAll()).extracting(StoredAlertRecord::alertId).containsExactly(kept.getId());
    }

    @Test
    void shouldRestoreNewestAlertsAndAdvanceIdCounter() {
        // given
        var loaded = new ArrayList<UserAlert>();
        for (int id = AlertStore.MAX_ALERTS + 5; id >= 1; id--) {
            loaded.add(contactChange(id, USER_A, T0));
            persistence.put(id, new byte[] {1});
        }

        // when
        store.restore(loaded);

        // then
        assertThat(store.size()).isEqualTo(AlertStore.MAX_ALERTS);
        assertThat(store.alerts().get(0).getId()).isEqualTo(6);
        assertThat(store.pendingNotifications()).isEmpty();
        assertThat(store.nextId()).isEqualTo(AlertStore.MAX_ALERTS + 6);
        assertThat(persistence.loadAll()).extracting(StoredAlertRecord::alertId).doesNotContain(1, 2, 3, 4, 5);
    }

    @Test
    void shouldMergeRestoredAlertsBeforeNewerLiveOnes() {
        // given
        var live = contactChange(AlertStore.MAX_ALERTS + 100, USER_B, T0);
        store.append(live);
        store.drainNotifications();
        var loaded = new ArrayList<UserAlert>();
        for (int id = 1; id <= AlertStore.MAX_ALERTS; id++) {
            loaded.add(contactChange(id, USER_A, T0));
            persistence.put(id, new byte[] {1});
        }

        // when
        store.restore(loaded);

        // then
        assertThat(store.size()).isEqualTo(AlertStore.MAX_ALERTS);
        assertThat(store.alerts()).extracting(UserAlert::getId).isSorted();
        assertThat(store.alerts().get(0).getId()).isEqualTo(2);
        assertThat(store.alerts().get(AlertStore.MAX_ALERTS - 1)).isSameAs(live);
        assertThat(store.pendingNotifications()).isEmpty();
        assertThat(persistence.loadAll()).extracting(StoredAlertRecord::alertId).doesNotContain(1);
    }

    @Test
    void shouldResetEverythingOnClear() {
        // given
        appendContactChange();

        // when
        store.clear();

        // then
        assertThat(store.isEmpty()).isTrue();
        assertThat(store.pendingNotifications()).isEmpty();
        assertThat(store.lastId()).isZero();
        assertThat(store.alerts()).isEqualTo(List.of());
    }
}
