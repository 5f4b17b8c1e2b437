package com.cloudalerts.engine.domain.alert;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import lombok.Getter;

/**
 * Node handles added to, removed from or updated inside a shared folder.
 * Handle collections keep insertion order and never hold duplicates.
 */
public final class SharedNodes implements AlertPayload {

    @Getter
    private final long parentHandle;

    private final Set<Long> fileHandles;
    private final Set<Long> folderHandles;

    public SharedNodes(long parentHandle, Collection<Long> fileHandles, Collection<Long> folderHandles) {
        this.parentHandle = parentHandle;
        this.fileHandles = new LinkedHashSet<>(fileHandles);
        this.folderHandles = new LinkedHashSet<>(folderHandles);
    }

    public Set<Long> fileHandles() {
        return Collections.unmodifiableSet(fileHandles);
    }

    public Set<Long> folderHandles() {
        return Collections.unmodifiableSet(folderHandles);
    }

    public Set<Long> allHandles() {
        var all = new LinkedHashSet<Long>(fileHandles);
        all.addAll(folderHandles);
        return all;
    }

    public boolean contains(long handle) {
        return fileHandles.contains(handle) || folderHandles.contains(handle);
    }

    public boolean remove(long handle) {
        boolean removedFile = fileHandles.remove(handle);
        boolean removedFolder = folderHandles.remove(handle);
        return removedFile || removedFolder;
    }

    public void addAll(SharedNodes other) {
        fileHandles.addAll(other.fileHandles);
        folderHandles.addAll(other.folderHandles);
    }

    public boolean isEmpty() {
        return fileHandles.isEmpty() && folderHandles.isEmpty();
    }

    public int size() {
        return fileHandles.size() + folderHandles.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SharedNodes)) {
            return false;
        }
        var that = (SharedNodes) o;
        return parentHandle == that.parentHandle
                && fileHandles.equals(that.fileHandles)
                && folderHandles.equals(that.folderHandles);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parentHandle, fileHandles, folderHandles);
    }

    @Override
    public String toString() {
        return "SharedNodes[parent=" + parentHandle + ", files=" + fileHandles + ", folders=" + folderHandles + "]";
    }
}
