package com.cloudalerts.engine.domain.alert;

import com.cloudalerts.common.event.ScheduledMeetingChange;
import com.cloudalerts.common.event.TitleChange;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Fields changed by a scheduled meeting update.
 *
 * <p>Invariant: when {@link ScheduledMeetingChange#TITLE} is flagged, the previous and new
 * title are both present. Index based accessors refuse indices outside the declared change
 * types instead of failing.
 */
public final class Changeset {

    private final EnumSet<ScheduledMeetingChange> changedFields;
    private TitleChange titleChange;

    public Changeset() {
        this.changedFields = EnumSet.noneOf(ScheduledMeetingChange.class);
    }

    private Changeset(EnumSet<ScheduledMeetingChange> changedFields, TitleChange titleChange) {
        this.changedFields = changedFields;
        this.titleChange = titleChange;
    }

    /**
     * Rebuilds a change set from its persisted form.
     *
     * @return empty when the bits name unknown change types or the title flag lacks its values
     */
    public static Optional<Changeset> fromBits(long bits, TitleChange titleChange) {
        var fields = EnumSet.noneOf(ScheduledMeetingChange.class);
        for (int i = 0; i < Long.SIZE; i++) {
            if ((bits & (1L << i)) == 0) {
                continue;
            }
            var change = ScheduledMeetingChange.fromIndex(i);
            if (change.isEmpty()) {
                return Optional.empty();
            }
            fields.add(change.get());
        }
        if (fields.contains(ScheduledMeetingChange.TITLE) != (titleChange != null)) {
            return Optional.empty();
        }
        return Optional.of(new Changeset(fields, titleChange));
    }

    public static Changeset of(Set<ScheduledMeetingChange> changes, TitleChange titleChange) {
        var changeset = new Changeset();
        if (changes != null) {
            for (var change : changes) {
                if (change == ScheduledMeetingChange.TITLE) {
                    if (titleChange != null) {
                        changeset.addChange(change, titleChange.oldValue(), titleChange.newValue());
                    }
                } else {
                    changeset.addChange(change);
                }
            }
        }
        return changeset;
    }

    public boolean addChange(int changeType, String oldValue, String newValue) {
        return ScheduledMeetingChange.fromIndex(changeType)
                .map(change -> addChange(change, oldValue, newValue))
                .orElse(false);
    }

    public boolean addChange(ScheduledMeetingChange change) {
        return addChange(change, "", "");
    }

    public boolean addChange(ScheduledMeetingChange change, String oldValue, String newValue) {
        Objects.requireNonNull(change, "change");
        changedFields.add(change);
        if (change == ScheduledMeetingChange.TITLE) {
            titleChange = new TitleChange(nullToEmpty(oldValue), nullToEmpty(newValue));
        }
        return true;
    }

    public boolean hasChanged(int changeType) {
        return ScheduledMeetingChange.fromIndex(changeType).map(this::hasChanged).orElse(false);
    }

    public boolean hasChanged(ScheduledMeetingChange change) {
        return changedFields.contains(change);
    }

    public Optional<TitleChange> updatedTitle() {
        return Optional.ofNullable(titleChange);
    }

    public Set<ScheduledMeetingChange> changes() {
        return EnumSet.copyOf(changedFields);
    }

    public long bits() {
        long bits = 0;
        for (var change : changedFields) {
            bits |= 1L << change.ordinal();
        }
        return bits;
    }

    public boolean isEmpty() {
        return changedFields.isEmpty();
    }

    /**
     * Folds a later update of the same meeting into this one: the union of changed fields, the
     * title going from this set's previous value to the later set's new value.
     */
    public void mergeLater(Changeset later) {
        changedFields.addAll(later.changedFields);
        if (later.titleChange != null) {
            titleChange = titleChange == null
                    ? later.titleChange
                    : new TitleChange(titleChange.oldValue(), later.titleChange.newValue());
        }
    }

    public Changeset copy() {
        return new Changeset(EnumSet.copyOf(changedFields), titleChange);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Changeset)) {
            return false;
        }
        var that = (Changeset) o;
        return changedFields.equals(that.changedFields) && Objects.equals(titleChange, that.titleChange);
    }

    @Override
    public int hashCode() {
        return Objects.hash(changedFields, titleChange);
    }

    @Override
    public String toString() {
        return "Changeset[" + changedFields + (titleChange == null ? "" : ", title=" + titleChange) + "]";
    }
}
