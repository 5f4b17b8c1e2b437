package com.cloudalerts.engine.domain.merge;

import com.cloudalerts.common.handle.Handles;
import com.cloudalerts.engine.domain.alert.Payment;
import com.cloudalerts.engine.domain.alert.ScheduledMeeting;
import com.cloudalerts.engine.domain.alert.SharedNodes;
import com.cloudalerts.engine.domain.alert.UserAlert;
import com.cloudalerts.engine.domain.host.AlertMetrics;
import com.cloudalerts.engine.domain.store.AlertStore;
import java.util.Optional;
import java.util.function.Predicate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Folds a committed candidate into a matching alert the host has not been given yet, or
 * appends it. Matching means same kind, same originating user and same merge key:
 * <ul>
 *   <li>node alerts: same parent folder (never an undefined one)</li>
 *   <li>payments: same outcome and plan</li>
 *   <li>scheduled meeting updates: same meeting</li>
 * </ul>
 * Every other kind is always appended.
 */
@Slf4j
@RequiredArgsConstructor
public class DedupMerger {

    private final AlertStore store;
    private final AlertMetrics metrics;

    public MergeOutcome offer(UserAlert candidate) {
        var target = findTarget(candidate);
        if (target.isEmpty()) {
            store.append(candidate);
            metrics.alertAdded(candidate.getType());
            return MergeOutcome.APPENDED;
        }

        var existing = target.get();
        mergeInto(existing, candidate);
        existing.touch(candidate.getTimestamp());
        store.notifyUpdated(existing);
        metrics.alertMerged(candidate.getType());
        log.debug("Merged user alert {} into {} type {} ts {}",
                candidate.getId(), existing.getId(), candidate.getType(), existing.getTimestamp());
        return MergeOutcome.MERGED;
    }

    private Optional<UserAlert> findTarget(UserAlert candidate) {
        Predicate<UserAlert> sameTarget;
        switch (candidate.getType()) {
            case NEW_SHARED_NODES, REMOVED_SHARED_NODES, UPDATED_SHARED_NODES -> {
                long parent = candidate.payload(SharedNodes.class).getParentHandle();
                if (Handles.isUndef(parent)) {
                    return Optional.empty();
                }
                sameTarget = a -> a.payload(SharedNodes.class).getParentHandle() == parent;
            }
            case PAYMENT -> {
                var payment = candidate.payload(Payment.class);
                sameTarget = a -> a.payload(Payment.class).equals(payment);
            }
            case UPDATED_SCHEDULED_MEETING -> {
                long meeting = candidate.payload(ScheduledMeeting.class).meetingHandle();
                sameTarget = a -> a.payload(ScheduledMeeting.class).meetingHandle() == meeting;
            }
            default -> {
                return Optional.empty();
            }
        }
        return store.findMergeable(candidate.getType(), candidate.getUserHandle(), sameTarget);
    }

    private void mergeInto(UserAlert existing, UserAlert candidate) {
        switch (existing.getType()) {
            case NEW_SHARED_NODES, REMOVED_SHARED_NODES, UPDATED_SHARED_NODES ->
                    existing.payload(SharedNodes.class).addAll(candidate.payload(SharedNodes.class));
            case UPDATED_SCHEDULED_MEETING -> existing.payload(ScheduledMeeting.class)
                    .changeset()
                    .mergeLater(candidate.payload(ScheduledMeeting.class).changeset());
            default -> {
                // payments only move the timestamp
            }
        }
    }
}
