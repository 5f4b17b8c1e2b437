package com.cloudalerts.engine.domain.noted;

import com.cloudalerts.common.handle.Handles;
import com.cloudalerts.engine.domain.alert.AlertType;
import com.cloudalerts.engine.domain.alert.SharedNodes;
import com.cloudalerts.engine.domain.alert.UserAlert;
import com.cloudalerts.engine.domain.host.AlertMetrics;
import com.cloudalerts.engine.domain.store.AlertStore;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * Aggregates node changes inside incoming shares per (originating user, parent folder) and
 * turns them into node alerts when a batch is converted.
 *
 * <p>Two maps are kept: the live notes of the current window, and a stash of removals whose
 * originating user did not match the conversion that met them. A key is never present in
 * both maps once an operation returns.
 *
 * <p>A handle lives in at most one of the two maps. An addition and a later removal of the
 * same node cancel out wherever the addition is held.
 *
 * <p>Removals are checked against unflushed alerts first. A node that is still listed in an
 * unflushed new-nodes alert is erased there and produces no removal at all.
 */
@Slf4j
public class NotedSharedNodeTracker {

    private final AlertStore store;
    private final AlertMetrics metrics;

    private final Map<NotedKey, NotedEntry> noted = new LinkedHashMap<>();
    private final Map<NotedKey, NotedEntry> stash = new LinkedHashMap<>();
    private boolean noting;
    private long ignoreUnder = Handles.UNDEF;

    public NotedSharedNodeTracker(AlertStore store, AlertMetrics metrics) {
        this.store = store;
        this.metrics = metrics;
    }

    public void beginNoting() {
        noting = true;
        noted.clear();
    }

    public boolean isNoting() {
        return noting;
    }

    /** Suppresses noting of additions and updates below {@code handle} until the window closes. */
    public void ignoreNextUnder(long handle) {
        ignoreUnder = handle;
    }

    /**
     * Records one node change in the open window.
     *
     * @return whether the change is still waiting for conversion
     */
    public boolean note(long userHandle, SharedNode node, NotedChange change, Instant at, NodeAncestry ancestry) {
        if (!noting) {
            return false;
        }
        long handle = node.handle();
        if (change != NotedChange.REMOVED
                && !Handles.isUndef(ignoreUnder)
                && ancestry.isUnder(handle, ignoreUnder)) {
            log.debug("Not noting node {} under ignored share {}", handle, ignoreUnder);
            return false;
        }

        var key = new NotedKey(userHandle, node.parentHandle());
        unstash(key);
        for (var map : List.of(noted, stash)) {
            var existing = findIn(map, handle);
            if (existing == null) {
                continue;
            }
            var previous = existing.getValue().changeOf(handle);
            if (previous == NotedChange.ADDED && change != NotedChange.REMOVED) {
                return true;
            }
            existing.getValue().remove(handle);
            dropIfEmpty(map, existing.getKey());
            if (previous == NotedChange.ADDED) {
                log.debug("Node {} added and removed before conversion, dropping it", handle);
                metrics.nodeSuppressed();
                return false;
            }
            break;
        }

        noted.computeIfAbsent(key, k -> new NotedEntry()).note(handle, node.type(), change, at);
        return true;
    }

    /**
     * Closes the window and emits alerts for the live notes.
     *
     * <p>With {@code added} set, additions and updates are emitted and removals move to the
     * stash. Otherwise everything noted under {@code originatingUser} is emitted, while removals
     * noted under any other user move to the stash and the rest is emitted.
     */
    public void convert(boolean added, long originatingUser, Consumer<UserAlert> sink) {
        try {
            for (var e : noted.entrySet()) {
                var key = e.getKey();
                var entry = e.getValue();
                if (added || key.userHandle() != originatingUser) {
                    var removals = entry.extract(NotedChange.REMOVED);
                    if (!removals.isEmpty()) {
                        stashEntry(key, removals);
                    }
                }
                emit(key, entry, sink);
            }
        } finally {
            closeWindow();
        }
    }

    /** Moves every live note into the stash and closes the window. */
    public void stashNoted() {
        for (var e : noted.entrySet()) {
            stashEntry(e.getKey(), e.getValue());
        }
        closeWindow();
    }

    public void convertStashed(Consumer<UserAlert> sink) {
        if (stash.isEmpty()) {
            return;
        }
        var pendingStash = new LinkedHashMap<>(stash);
        stash.clear();
        log.debug("Converting {} stashed shared node entries", pendingStash.size());
        pendingStash.forEach((key, entry) -> emit(key, entry, sink));
    }

    public boolean isStashEmpty() {
        return stash.isEmpty();
    }

    /** Closes the window, dropping the live notes. The stash is kept. */
    public void discardNoted() {
        closeWindow();
    }

    /**
     * Forgets a deleted node: dropped from the live notes if it is there, otherwise erased
     * from unflushed new and removed node alerts.
     */
    public void forgetNode(long handle) {
        for (var map : List.of(noted, stash)) {
            var existing = findIn(map, handle);
            if (existing != null) {
                existing.getValue().remove(handle);
                dropIfEmpty(map, existing.getKey());
                return;
            }
        }
        eraseFromUnflushedAlerts(handle);
    }

    /**
     * Reclassifies a node reported as new as an updated one: in the live notes, or by moving
     * it out of an unflushed new-nodes alert into an updated-nodes alert.
     *
     * @return whether the node was found as new anywhere
     */
    public boolean convertNewToUpdated(SharedNode node, Consumer<UserAlert> sink) {
        var existing = findIn(noted, node.handle());
        if (existing != null) {
            if (existing.getValue().changeOf(node.handle()) != NotedChange.ADDED) {
                return false;
            }
            existing.getValue().setChange(node.handle(), NotedChange.UPDATED);
            return true;
        }

        var holder = store.stream()
                .filter(a -> a.getType() == AlertType.NEW_SHARED_NODES && store.isPending(a))
                .filter(a -> a.payload(SharedNodes.class).contains(node.handle()))
                .reduce((first, second) -> second);
        if (holder.isEmpty()) {
            return false;
        }
        var alert = holder.get();
        var nodes = alert.payload(SharedNodes.class);
        nodes.remove(node.handle());
        commitChange(alert, nodes);

        var files = node.type() == NodeType.FILE ? List.of(node.handle()) : List.<Long>of();
        var folders = node.type() == NodeType.FOLDER ? List.of(node.handle()) : List.<Long>of();
        sink.accept(nodeAlert(AlertType.UPDATED_SHARED_NODES, alert.getUserHandle(), node.parentHandle(),
                alert.getTimestamp(), files, folders));
        return true;
    }

    public boolean isNotedAsRemoved(long handle) {
        return isNotedAs(noted, handle, NotedChange.REMOVED) || isNotedAs(stash, handle, NotedChange.REMOVED);
    }

    public void clear() {
        closeWindow();
        stash.clear();
    }

    int notedCount() {
        return noted.size();
    }

    private void emit(NotedKey key, NotedEntry entry, Consumer<UserAlert> sink) {
        emitKind(key, entry, NotedChange.ADDED, sink);
        emitKind(key, entry, NotedChange.UPDATED, sink);

        var files = suppressGhosts(entry.fileHandles(NotedChange.REMOVED));
        var folders = suppressGhosts(entry.folderHandles(NotedChange.REMOVED));
        if (!files.isEmpty() || !folders.isEmpty()) {
            sink.accept(nodeAlert(AlertType.REMOVED_SHARED_NODES, key.userHandle(), key.parentHandle(),
                    entry.timestamp(), files, folders));
        }
    }

    private void emitKind(NotedKey key, NotedEntry entry, NotedChange change, Consumer<UserAlert> sink) {
        var files = entry.fileHandles(change);
        var folders = entry.folderHandles(change);
        if (files.isEmpty() && folders.isEmpty()) {
            return;
        }
        sink.accept(nodeAlert(change.alertType(), key.userHandle(), key.parentHandle(),
                entry.timestamp(), files, folders));
    }

    private List<Long> suppressGhosts(List<Long> removedHandles) {
        var kept = new ArrayList<Long>(removedHandles.size());
        for (long handle : removedHandles) {
            if (eraseFromUnflushedAlerts(handle)) {
                log.debug("Node {} removed before its addition was delivered, no removal alert", handle);
                metrics.nodeSuppressed();
            } else {
                kept.add(handle);
            }
        }
        return kept;
    }

    /** @return whether the handle was erased from a new-nodes alert */
    private boolean eraseFromUnflushedAlerts(long handle) {
        boolean erasedFromNew = false;
        var touched = new ArrayList<UserAlert>();
        for (var alert : store.alerts()) {
            if (alert.isRemoved() || !store.isPending(alert)) {
                continue;
            }
            boolean newNodes = alert.getType() == AlertType.NEW_SHARED_NODES;
            if (!newNodes && alert.getType() != AlertType.REMOVED_SHARED_NODES) {
                continue;
            }
            if (alert.payload(SharedNodes.class).remove(handle)) {
                touched.add(alert);
                erasedFromNew |= newNodes;
            }
        }
        touched.forEach(alert -> commitChange(alert, alert.payload(SharedNodes.class)));
        return erasedFromNew;
    }

    private void commitChange(UserAlert alert, SharedNodes nodes) {
        if (nodes.isEmpty()) {
            store.removeMatching(a -> a == alert);
        } else {
            store.notifyUpdated(alert);
        }
    }

    private UserAlert nodeAlert(AlertType type, long user, long parent, Instant at, List<Long> files, List<Long> folders) {
        return UserAlert.builder()
                .id(store.nextId())
                .type(type)
                .userHandle(user)
                .timestamp(at)
                .payload(new SharedNodes(parent, files, folders))
                .build();
    }

    private void stashEntry(NotedKey key, NotedEntry entry) {
        stash.computeIfAbsent(key, k -> new NotedEntry()).absorb(entry);
    }

    /** Moves a stashed entry back into the live notes. */
    private void unstash(NotedKey key) {
        var stashed = stash.remove(key);
        if (stashed != null) {
            noted.computeIfAbsent(key, k -> new NotedEntry()).absorb(stashed);
        }
    }

    private static Map.Entry<NotedKey, NotedEntry> findIn(Map<NotedKey, NotedEntry> map, long handle) {
        for (var e : map.entrySet()) {
            if (e.getValue().changeOf(handle) != null) {
                return e;
            }
        }
        return null;
    }

    private static boolean isNotedAs(Map<NotedKey, NotedEntry> map, long handle, NotedChange change) {
        return map.values().stream().anyMatch(entry -> entry.changeOf(handle) == change);
    }

    private static void dropIfEmpty(Map<NotedKey, NotedEntry> map, NotedKey key) {
        var entry = map.get(key);
        if (entry != null && entry.isEmpty()) {
            map.remove(key);
        }
    }

    private void closeWindow() {
        noted.clear();
        noting = false;
        ignoreUnder = Handles.UNDEF;
    }
}
