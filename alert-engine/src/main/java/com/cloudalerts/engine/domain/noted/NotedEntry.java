package com.cloudalerts.engine.domain.noted;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Node changes accumulated for one (originating user, parent folder) pair since the last
 * conversion, split into files and folders.
 */
final class NotedEntry {

    private Instant timestamp = Instant.EPOCH;
    private final Map<Long, NotedChange> files = new LinkedHashMap<>();
    private final Map<Long, NotedChange> folders = new LinkedHashMap<>();

    Instant timestamp() {
        return timestamp;
    }

    void note(long handle, NodeType type, NotedChange change, Instant at) {
        mapFor(type).put(handle, change);
        if (at != null && at.isAfter(timestamp)) {
            timestamp = at;
        }
    }

    NotedChange changeOf(long handle) {
        var change = files.get(handle);
        return change != null ? change : folders.get(handle);
    }

    boolean remove(long handle) {
        boolean file = files.remove(handle) != null;
        boolean folder = folders.remove(handle) != null;
        return file || folder;
    }

    boolean setChange(long handle, NotedChange change) {
        if (files.containsKey(handle)) {
            files.put(handle, change);
            return true;
        }
        if (folders.containsKey(handle)) {
            folders.put(handle, change);
            return true;
        }
        return false;
    }

    List<Long> fileHandles(NotedChange change) {
        return handlesWith(files, change);
    }

    List<Long> folderHandles(NotedChange change) {
        return handlesWith(folders, change);
    }

    void absorb(NotedEntry other) {
        files.putAll(other.files);
        folders.putAll(other.folders);
        if (other.timestamp.isAfter(timestamp)) {
            timestamp = other.timestamp;
        }
    }

    /** Moves the notes of the given kind into a new entry with the same timestamp. */
    NotedEntry extract(NotedChange change) {
        var extracted = new NotedEntry();
        extracted.timestamp = timestamp;
        moveMatching(files, extracted.files, change);
        moveMatching(folders, extracted.folders, change);
        return extracted;
    }

    boolean isEmpty() {
        return files.isEmpty() && folders.isEmpty();
    }

    private Map<Long, NotedChange> mapFor(NodeType type) {
        return type == NodeType.FOLDER ? folders : files;
    }

    private static void moveMatching(Map<Long, NotedChange> from, Map<Long, NotedChange> to, NotedChange change) {
        var it = from.entrySet().iterator();
        while (it.hasNext()) {
            var e = it.next();
            if (e.getValue() == change) {
                to.put(e.getKey(), e.getValue());
                it.remove();
            }
        }
    }

    private static List<Long> handlesWith(Map<Long, NotedChange> map, NotedChange change) {
        return map.entrySet().stream()
                .filter(e -> e.getValue() == change)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }
}
