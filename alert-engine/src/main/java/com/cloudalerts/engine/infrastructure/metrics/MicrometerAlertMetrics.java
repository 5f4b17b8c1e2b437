package com.cloudalerts.engine.infrastructure.metrics;

import com.cloudalerts.engine.domain.alert.AlertType;
import com.cloudalerts.engine.domain.host.AlertMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;

/**
 * Counts engine events in a Micrometer registry. Per-kind counters carry a {@code type} tag
 * holding the alert's wire code.
 */
@RequiredArgsConstructor
public class MicrometerAlertMetrics implements AlertMetrics {

    static final String ADDED = "useralerts.alerts.added";
    static final String MERGED = "useralerts.alerts.merged";
    static final String DISCARDED = "useralerts.alerts.discarded";
    static final String TRIMMED = "useralerts.alerts.trimmed";
    static final String SUPPRESSED = "useralerts.nodes.suppressed";

    private final MeterRegistry registry;

    @Override
    public void alertAdded(AlertType type) {
        counter(ADDED, "Alerts appended to the log", type).increment();
    }

    @Override
    public void alertMerged(AlertType type) {
        counter(MERGED, "Candidates folded into an undelivered alert", type).increment();
    }

    @Override
    public void alertDiscarded(AlertType type) {
        counter(DISCARDED, "Provisional alerts dropped as invalid", type).increment();
    }

    @Override
    public void alertsTrimmed(int count) {
        Counter.builder(TRIMMED)
                .description("Oldest alerts dropped to respect the log bound")
                .register(registry)
                .increment(count);
    }

    @Override
    public void nodeSuppressed() {
        Counter.builder(SUPPRESSED)
                .description("Node removals cancelled against an undelivered addition")
                .register(registry)
                .increment();
    }

    private Counter counter(String name, String description, AlertType type) {
        return Counter.builder(name)
                .description(description)
                .tag("type", type.getCode())
                .register(registry);
    }
}
