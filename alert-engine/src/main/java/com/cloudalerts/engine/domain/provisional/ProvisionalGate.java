package com.cloudalerts.engine.domain.provisional;

import com.cloudalerts.engine.domain.alert.UserAlert;
import com.cloudalerts.engine.domain.host.AlertHostContext;
import com.cloudalerts.engine.domain.host.AlertMetrics;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Catch-up state machine with its provisional buffer.
 *
 * <p>{@code IDLE -> CATCHING_UP -> IDLE}. Provisional buffering can only be switched on while
 * catching up and never outlives it; buffered alerts are committed by {@link #evalProvisional}
 * once validated and otherwise vanish without trace.
 */
@Slf4j
public class ProvisionalGate {

    private final ProvisionalValidator validator;
    private final AlertMetrics metrics;
    private final List<UserAlert> buffered = new ArrayList<>();

    @Getter
    private CatchupState state = CatchupState.IDLE;

    private boolean provisional;

    @Getter
    private boolean catchupBegun;

    @Getter
    private boolean catchupDone;

    public ProvisionalGate(ProvisionalValidator validator, AlertMetrics metrics) {
        this.validator = validator;
        this.metrics = metrics;
    }

    public void beginCatchup() {
        state = CatchupState.CATCHING_UP;
        catchupBegun = true;
        catchupDone = false;
    }

    /**
     * Back to {@code IDLE}. Provisional mode ends with the catch-up; alerts still buffered at
     * this point are dropped, so callers evaluate the buffer first.
     */
    public void finishCatchup() {
        if (!buffered.isEmpty()) {
            log.debug("Dropping {} provisional user alerts left at end of catch-up", buffered.size());
            buffered.forEach(alert -> metrics.alertDiscarded(alert.getType()));
            buffered.clear();
        }
        provisional = false;
        state = CatchupState.IDLE;
        catchupDone = true;
    }

    public boolean isCatchingUp() {
        return state == CatchupState.CATCHING_UP;
    }

    /** @return false, with no state change, when no catch-up is in progress */
    public boolean startProvisional() {
        if (!isCatchingUp()) {
            log.debug("Ignoring provisional mode request outside catch-up");
            return false;
        }
        provisional = true;
        return true;
    }

    public boolean isBuffering() {
        return provisional;
    }

    /** @return whether the alert was taken into the buffer */
    public boolean offer(UserAlert alert) {
        if (!provisional) {
            return false;
        }
        buffered.add(alert);
        return true;
    }

    public List<UserAlert> buffered() {
        return List.copyOf(buffered);
    }

    /**
     * Leaves provisional mode, committing the buffered alerts that are still valid, in arrival
     * order, and dropping the others.
     */
    public int evalProvisional(long originatingUser, AlertHostContext host, Consumer<UserAlert> commit) {
        provisional = false;
        var pending = List.copyOf(buffered);
        buffered.clear();
        int committed = 0;
        for (var alert : pending) {
            if (validator.isValid(alert, originatingUser, host)) {
                commit.accept(alert);
                committed++;
            } else {
                log.debug("Dropping provisional user alert {} type {}", alert.getId(), alert.getType());
                metrics.alertDiscarded(alert.getType());
            }
        }
        return committed;
    }

    /** Back to {@code IDLE}, forgetting catch-up progress and any buffered alerts. */
    public void clear() {
        buffered.forEach(alert -> metrics.alertDiscarded(alert.getType()));
        buffered.clear();
        provisional = false;
        state = CatchupState.IDLE;
        catchupBegun = false;
        catchupDone = false;
    }
}
