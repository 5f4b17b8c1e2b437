package com.cloudalerts.engine.application.config;

import com.cloudalerts.engine.domain.UserAlerts;
import com.cloudalerts.engine.domain.host.AlertMetrics;
import com.cloudalerts.engine.infrastructure.metrics.MicrometerAlertMetrics;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfig {

    @Bean
    public AlertMetrics alertMetrics(MeterRegistry registry) {
        return new MicrometerAlertMetrics(registry);
    }

    @Bean
    public Gauge alertLogSizeGauge(MeterRegistry registry, UserAlerts userAlerts) {
        return Gauge.builder("useralerts.log.size", userAlerts::size)
                .description("Alerts currently held in the log")
                .register(registry);
    }

    @Bean
    public Gauge notifyQueueGauge(MeterRegistry registry, UserAlerts userAlerts) {
        return Gauge.builder("useralerts.notify.queue", () -> userAlerts.pendingNotifications().size())
                .description("Alerts waiting to be handed to the host")
                .register(registry);
    }
}
