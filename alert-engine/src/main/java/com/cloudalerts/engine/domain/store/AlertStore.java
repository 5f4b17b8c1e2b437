package com.cloudalerts.engine.domain.store;

import com.cloudalerts.engine.domain.alert.AlertType;
import com.cloudalerts.engine.domain.alert.UserAlert;
import com.cloudalerts.engine.domain.codec.AlertRecordCodec;
import com.cloudalerts.engine.domain.host.AlertMetrics;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;

/**
 * Ordered, bounded alert log (oldest first) plus the queue of alerts the host has not been
 * told about yet.
 *
 * <p>Every commit (new, updated or removed alert) is queued once and written through the
 * persistence port straight away. Removed alerts leave the log immediately but stay queued
 * until the host drains the queue; after that nothing references them.
 */
@Slf4j
public class AlertStore {

    public static final int MAX_ALERTS = 200;

    private final ArrayDeque<UserAlert> alerts = new ArrayDeque<>();
    private final List<UserAlert> notifyQueue = new ArrayList<>();
    private final Set<UserAlert> pending = Collections.newSetFromMap(new IdentityHashMap<>());

    private final AlertPersistencePort persistence;
    private final AlertRecordCodec codec;
    private final AlertMetrics metrics;

    private int lastId;

    public AlertStore(AlertPersistencePort persistence, AlertRecordCodec codec, AlertMetrics metrics) {
        this.persistence = persistence;
        this.codec = codec;
        this.metrics = metrics;
    }

    public int nextId() {
        return ++lastId;
    }

    public int lastId() {
        return lastId;
    }

    /**
     * Adds a committed alert at the tail, queues it, persists it and trims the log.
     *
     * @return the alert's id
     */
    public int append(UserAlert alert) {
        if (alert.getId() > lastId) {
            lastId = alert.getId();
        }
        alerts.addLast(alert);
        log.debug("Added user alert {} type {} ts {}", alert.getId(), alert.getType(), alert.getTimestamp());
        enqueue(alert);
        trim();
        return alert.getId();
    }

    /**
     * Newest alert still waiting in the notify queue with the given kind and user that the
     * predicate accepts. Alerts the host has already been given, seen ones and removed ones
     * are never returned.
     */
    public Optional<UserAlert> findMergeable(AlertType type, long userHandle, Predicate<UserAlert> sameTarget) {
        var it = alerts.descendingIterator();
        while (it.hasNext()) {
            var alert = it.next();
            if (alert.getType() == type
                    && alert.getUserHandle() == userHandle
                    && !alert.isSeen()
                    && !alert.isRemoved()
                    && pending.contains(alert)
                    && sameTarget.test(alert)) {
                return Optional.of(alert);
            }
        }
        return Optional.empty();
    }

    /** Re-queues an alert whose content changed; an alert is never queued twice. */
    public void notifyUpdated(UserAlert alert) {
        enqueue(alert);
    }

    /** @return how many alerts changed from unseen to seen */
    public int markSeenAll() {
        int changed = 0;
        for (var alert : alerts) {
            if (!alert.isSeen()) {
                alert.setSeen(true);
                enqueue(alert);
                changed++;
            }
        }
        return changed;
    }

    /** Drops alerts from the head until the log fits {@link #MAX_ALERTS}. */
    public int trim() {
        int trimmed = 0;
        while (alerts.size() > MAX_ALERTS) {
            var oldest = alerts.pollFirst();
            oldest.markRemoved();
            enqueue(oldest);
            trimmed++;
        }
        if (trimmed > 0) {
            log.debug("Trimmed {} oldest user alerts, {} remain", trimmed, alerts.size());
            metrics.alertsTrimmed(trimmed);
        }
        return trimmed;
    }

    public List<UserAlert> removeMatching(Predicate<UserAlert> predicate) {
        var removed = new ArrayList<UserAlert>();
        var it = alerts.iterator();
        while (it.hasNext()) {
            var alert = it.next();
            if (predicate.test(alert)) {
                it.remove();
                alert.markRemoved();
                removed.add(alert);
            }
        }
        removed.forEach(this::enqueue);
        return removed;
    }

    public boolean isPending(UserAlert alert) {
        return pending.contains(alert);
    }

    public List<UserAlert> pendingNotifications() {
        return List.copyOf(notifyQueue);
    }

    /** Hands the queued alerts to the host and forgets them. */
    public List<UserAlert> drainNotifications() {
        var drained = List.copyOf(notifyQueue);
        notifyQueue.clear();
        pending.clear();
        return drained;
    }

    public List<UserAlert> alerts() {
        return List.copyOf(alerts);
    }

    public Stream<UserAlert> stream() {
        return alerts.stream();
    }

    public int size() {
        return alerts.size();
    }

    public boolean isEmpty() {
        return alerts.isEmpty();
    }

    /**
     * Loads previously persisted alerts without queueing them, merged with the log by id so
     * the head stays the oldest. Loaded records beyond the bound are deleted from storage;
     * live alerts pushed out are trimmed as usual. Ids already in the log are skipped. The id
     * counter moves past the largest id.
     */
    public void restore(List<UserAlert> loaded) {
        var known = alerts.stream().map(UserAlert::getId).collect(Collectors.toCollection(HashSet::new));
        var restored = Collections.newSetFromMap(new IdentityHashMap<UserAlert, Boolean>());
        var merged = new ArrayList<>(alerts);
        for (var alert : loaded) {
            if (known.add(alert.getId())) {
                merged.add(alert);
                restored.add(alert);
            }
            if (alert.getId() > lastId) {
                lastId = alert.getId();
            }
        }
        merged.sort(Comparator.comparingInt(UserAlert::getId));
        alerts.clear();
        alerts.addAll(merged);

        int trimmed = 0;
        while (alerts.size() > MAX_ALERTS) {
            var oldest = alerts.pollFirst();
            if (restored.contains(oldest)) {
                persistence.delete(oldest.getId());
            } else {
                oldest.markRemoved();
                enqueue(oldest);
                trimmed++;
            }
        }
        if (trimmed > 0) {
            metrics.alertsTrimmed(trimmed);
        }
    }

    public void clear() {
        alerts.clear();
        notifyQueue.clear();
        pending.clear();
        lastId = 0;
    }

    private void enqueue(UserAlert alert) {
        if (pending.add(alert)) {
            notifyQueue.add(alert);
        }
        if (alert.isRemoved()) {
            persistence.delete(alert.getId());
        } else {
            persistence.put(alert.getId(), codec.serialize(alert));
        }
    }
}
