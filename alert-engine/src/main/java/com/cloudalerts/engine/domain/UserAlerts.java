package com.cloudalerts.engine.domain;

import com.cloudalerts.common.event.ChangeEvent;
import com.cloudalerts.common.handle.Handles;
import com.cloudalerts.engine.domain.alert.AlertFlags;
import com.cloudalerts.engine.domain.alert.AlertType;
import com.cloudalerts.engine.domain.alert.Payment;
import com.cloudalerts.engine.domain.alert.PendingContactUser;
import com.cloudalerts.engine.domain.alert.SharedNodes;
import com.cloudalerts.engine.domain.alert.UserAlert;
import com.cloudalerts.engine.domain.codec.AlertRecordCodec;
import com.cloudalerts.engine.domain.event.ChangeEventClassifier;
import com.cloudalerts.engine.domain.host.AlertHostContext;
import com.cloudalerts.engine.domain.host.AlertMetrics;
import com.cloudalerts.engine.domain.merge.DedupMerger;
import com.cloudalerts.engine.domain.noted.NotedChange;
import com.cloudalerts.engine.domain.noted.NotedSharedNodeTracker;
import com.cloudalerts.engine.domain.noted.SharedNode;
import com.cloudalerts.engine.domain.provisional.CatchupState;
import com.cloudalerts.engine.domain.provisional.ProvisionalGate;
import com.cloudalerts.engine.domain.provisional.ProvisionalValidator;
import com.cloudalerts.engine.domain.raw.CatchupReply;
import com.cloudalerts.engine.domain.raw.RawAlertClassifier;
import com.cloudalerts.engine.domain.raw.RawAlertFields;
import com.cloudalerts.engine.domain.raw.RawAlertRecord;
import com.cloudalerts.engine.domain.store.AlertPersistencePort;
import com.cloudalerts.engine.domain.store.AlertStore;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * The alert engine of one client session.
 *
 * <p>Candidates from catch-up records, live change events and converted node notes all take
 * the same path: email backfill, the provisional buffer when it is on, then merge-or-append.
 * The host drains {@link #drainNotifications()} after each batch it processes.
 *
 * <p>Not thread-safe: all calls must come from the thread that owns the session.
 */
@Slf4j
public class UserAlerts {

    private final AlertHostContext host;
    private final AlertFlags flags;
    private final AlertPersistencePort persistence;
    private final AlertRecordCodec codec;
    private final AlertMetrics metrics;

    private final AlertStore store;
    private final DedupMerger merger;
    private final NotedSharedNodeTracker tracker;
    private final ProvisionalGate gate;
    private final RawAlertClassifier rawClassifier;
    private final ChangeEventClassifier eventClassifier;

    private final Map<Long, PendingContactUser> pendingContactUsers = new HashMap<>();

    public UserAlerts(
            AlertHostContext host,
            AlertFlags flags,
            AlertPersistencePort persistence,
            AlertMetrics metrics,
            Clock clock) {
        this.host = host;
        this.flags = flags;
        this.persistence = persistence;
        this.metrics = metrics;
        this.codec = new AlertRecordCodec();
        this.store = new AlertStore(persistence, codec, metrics);
        this.merger = new DedupMerger(store, metrics);
        this.tracker = new NotedSharedNodeTracker(store, metrics);
        this.gate = new ProvisionalGate(new ProvisionalValidator(), metrics);
        this.rawClassifier = new RawAlertClassifier(flags, clock);
        this.eventClassifier = new ChangeEventClassifier(flags, clock);
    }

    // catch-up

    public void beginCatchup() {
        gate.beginCatchup();
        log.info("useralerts.catchup.begin: alerts={}", store.size());
    }

    /**
     * Loads the reply to the initial alert query and finishes the catch-up. Records are
     * committed directly; they never go through the provisional buffer. Live alerts still
     * buffered are then validated against the host, as if caused by someone else, and
     * provisional mode ends.
     */
    public int processCatchupReply(CatchupReply reply) {
        if (!gate.isCatchingUp()) {
            gate.beginCatchup();
        }
        reply.pendingContactUsers().forEach(this::addPendingContactUser);

        int created = 0;
        for (var raw : reply.records()) {
            var alert = rawClassifier.classify(raw, store::nextId);
            if (alert.isEmpty()) {
                continue;
            }
            alert.get().setSeen(reply.isSeen(raw.getLong(RawAlertFields.TIME_DELTA, 0)));
            updateEmail(alert.get());
            commit(alert.get());
            created++;
        }
        if (gate.isBuffering()) {
            int released = evalProvisional(Handles.UNDEF);
            log.debug("Released {} provisional user alerts at end of catch-up", released);
        }
        gate.finishCatchup();
        log.info("useralerts.catchup.done: records={}, created={}, alerts={}",
                reply.records().size(), created, store.size());
        return created;
    }

    public boolean isCatchupBegun() {
        return gate.isCatchupBegun();
    }

    public boolean isCatchupDone() {
        return gate.isCatchupDone();
    }

    public CatchupState catchupState() {
        return gate.getState();
    }

    // ingestion

    /** @return whether the record produced a candidate */
    public boolean add(RawAlertRecord raw) {
        var alert = rawClassifier.classify(raw, store::nextId);
        alert.ifPresent(this::add);
        return alert.isPresent();
    }

    /** @return whether the event produced a candidate */
    public boolean onChangeEvent(ChangeEvent event) {
        var alert = eventClassifier.classify(event, store::nextId);
        alert.ifPresent(this::add);
        return alert.isPresent();
    }

    /** Offers a candidate built elsewhere; its id must come from {@link #nextId()}. */
    public void add(UserAlert candidate) {
        updateEmail(candidate);
        if (gate.offer(candidate)) {
            log.debug("Buffered provisional user alert {} type {}", candidate.getId(), candidate.getType());
            return;
        }
        commit(candidate);
    }

    public int nextId() {
        return store.nextId();
    }

    public void addPendingContactUser(PendingContactUser user) {
        pendingContactUsers.put(user.userHandle(), user);
    }

    // shared node notes

    public void beginNotingSharedNodes() {
        tracker.beginNoting();
    }

    public void ignoreNextSharedNodesUnder(long handle) {
        tracker.ignoreNextUnder(handle);
    }

    /** Ignored while a catch-up is in progress or when no window is open. */
    public boolean noteSharedNode(long userHandle, SharedNode node, NotedChange change, Instant at) {
        if (gate.isCatchingUp()) {
            return false;
        }
        return tracker.note(userHandle, node, change, at, host::isNodeUnder);
    }

    public void convertNotedSharedNodes(boolean added, long originatingUser) {
        if (isConvertReady(originatingUser)) {
            tracker.convert(added, originatingUser, this::addConverted);
        } else {
            tracker.discardNoted();
        }
    }

    public void stashDeletedNotedSharedNodes(long originatingUser) {
        if (isConvertReady(originatingUser)) {
            tracker.stashNoted();
        } else {
            tracker.discardNoted();
        }
    }

    public void convertStashedDeletedSharedNodes() {
        tracker.convertStashed(this::addConverted);
    }

    public boolean isDeletedSharedNodesStashEmpty() {
        return tracker.isStashEmpty();
    }

    public void removeNodeAlerts(long nodeHandle) {
        tracker.forgetNode(nodeHandle);
    }

    public boolean setNewNodeAlertToUpdateNodeAlert(SharedNode node) {
        return tracker.convertNewToUpdated(node, this::addConverted);
    }

    public boolean isHandleInAlertsAsRemoved(long nodeHandle) {
        return store.stream().anyMatch(a -> a.getType() == AlertType.REMOVED_SHARED_NODES
                        && a.payload(SharedNodes.class).contains(nodeHandle))
                || tracker.isNotedAsRemoved(nodeHandle);
    }

    // provisional mode

    public boolean startProvisional() {
        return gate.startProvisional();
    }

    public int evalProvisional(long originatingUser) {
        return gate.evalProvisional(originatingUser, host, this::commit);
    }

    // acknowledgement

    public void acknowledgeAll() {
        int changed = store.markSeenAll();
        host.acknowledgeAlerts();
        log.info("useralerts.acknowledged: changed={}", changed);
    }

    public void onAcknowledgeReceived() {
        int changed = store.markSeenAll();
        log.debug("Alerts acknowledged elsewhere, {} marked seen", changed);
    }

    /** Looks up emails again for alerts that still have none, re-notifying the ones found. */
    public int updateEmails() {
        int updated = 0;
        for (var alert : store.alerts()) {
            if (alert.getEmail().isEmpty() && updateEmail(alert)) {
                store.notifyUpdated(alert);
                updated++;
            }
        }
        return updated;
    }

    // notification and state

    public List<UserAlert> drainNotifications() {
        return store.drainNotifications();
    }

    public List<UserAlert> pendingNotifications() {
        return store.pendingNotifications();
    }

    public List<UserAlert> alerts() {
        return store.alerts();
    }

    public int size() {
        return store.size();
    }

    /**
     * Rebuilds the in-memory log from persisted records. Records that cannot be decoded are
     * deleted from storage and skipped. A non-empty restore counts as a finished catch-up.
     */
    public int restore() {
        var records = persistence.loadAll();
        var loaded = new ArrayList<UserAlert>(records.size());
        for (var record : records) {
            var alert = codec.deserialize(record.alertId(), record.data());
            if (alert.isPresent()) {
                loaded.add(alert.get());
            } else {
                persistence.delete(record.alertId());
            }
        }
        store.restore(loaded);
        if (!loaded.isEmpty()) {
            gate.beginCatchup();
            gate.finishCatchup();
        }
        log.info("useralerts.restored: records={}, loaded={}, alerts={}, next_id={}",
                records.size(), loaded.size(), store.size(), store.lastId() + 1);
        return loaded.size();
    }

    /** Forgets everything, in memory and in storage; used on sign-out. */
    public void clear() {
        store.clear();
        tracker.clear();
        gate.clear();
        pendingContactUsers.clear();
        persistence.deleteAll();
        log.info("useralerts.cleared");
    }

    /** Node alerts built from notes are filtered here; classified records already were. */
    private void addConverted(UserAlert candidate) {
        if (flags.isUnwanted(candidate.getType(), -1)) {
            log.debug("Dropping unwanted user alert {} type {}", candidate.getId(), candidate.getType());
            metrics.alertDiscarded(candidate.getType());
            return;
        }
        add(candidate);
    }

    private boolean isConvertReady(long originatingUser) {
        return !gate.isCatchingUp() && originatingUser != host.ownUserHandle();
    }

    private void commit(UserAlert alert) {
        retirePaymentReminders(alert);
        merger.offer(alert);
    }

    /** A successful payment or a newer reminder makes earlier reminders stale. */
    private void retirePaymentReminders(UserAlert alert) {
        boolean successfulPayment = alert.getType() == AlertType.PAYMENT && alert.payload(Payment.class).success();
        if (!successfulPayment && alert.getType() != AlertType.PAYMENT_REMINDER) {
            return;
        }
        var stale = store.stream()
                .filter(a -> a.getType() == AlertType.PAYMENT_REMINDER
                        && a.isRelevant()
                        && !a.getTimestamp().isAfter(alert.getTimestamp()))
                .toList();
        for (var reminder : stale) {
            reminder.setRelevant(false);
            store.notifyUpdated(reminder);
        }
    }

    private boolean updateEmail(UserAlert alert) {
        if (!alert.getEmail().isEmpty()) {
            return false;
        }
        long user = alert.getUserHandle();
        var email = host.emailOf(user)
                .or(() -> Optional.ofNullable(pendingContactUsers.get(user)).flatMap(PendingContactUser::preferredEmail));
        email.ifPresent(alert::setEmail);
        return email.isPresent();
    }
}
