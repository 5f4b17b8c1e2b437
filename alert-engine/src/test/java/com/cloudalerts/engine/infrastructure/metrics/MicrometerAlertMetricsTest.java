package com.cloudalerts.engine.infrastructure.metrics;

import static org.assertj.core.api.Assertions.assertThat;

import com.cloudalerts.engine.domain.alert.AlertType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MicrometerAlertMetricsTest {

    private SimpleMeterRegistry registry;
    private MicrometerAlertMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MicrometerAlertMetrics(registry);
    }

    @Test
    void shouldCountAddedAlertsPerKind() {
        // when
        metrics.alertAdded(AlertType.NEW_SHARED_NODES);
        metrics.alertAdded(AlertType.NEW_SHARED_NODES);
        metrics.alertAdded(AlertType.PAYMENT);

        // then
        assertThat(registry.get(MicrometerAlertMetrics.ADDED).tag("type", "put").counter().count()).isEqualTo(2.0);
        assertThat(registry.get(MicrometerAlertMetrics.ADDED).tag("type", "psts").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldCountTrimmedAlertsByAmount() {
        // when
        metrics.alertsTrimmed(3);

        // then
        assertThat(registry.get(MicrometerAlertMetrics.TRIMMED).counter().count()).isEqualTo(3.0);
    }

    @Test
    void shouldCountMergesDiscardsAndSuppressions() {
        // when
        metrics.alertMerged(AlertType.UPDATED_SCHEDULED_MEETING);
        metrics.alertDiscarded(AlertType.NEW_SHARE);
        metrics.nodeSuppressed();

        // then
        assertThat(registry.get(MicrometerAlertMetrics.MERGED).tag("type", "mcsmp").counter().count()).isEqualTo(1.0);
        assertThat(registry.get(MicrometerAlertMetrics.DISCARDED).tag("type", "share").counter().count()).isEqualTo(1.0);
        assertThat(registry.get(MicrometerAlertMetrics.SUPPRESSED).counter().count()).isEqualTo(1.0);
    }
}
