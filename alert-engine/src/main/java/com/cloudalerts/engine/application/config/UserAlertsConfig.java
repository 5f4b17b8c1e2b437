package com.cloudalerts.engine.application.config;

import com.cloudalerts.engine.domain.UserAlerts;
import com.cloudalerts.engine.domain.host.AlertHostContext;
import com.cloudalerts.engine.domain.host.AlertMetrics;
import com.cloudalerts.engine.domain.store.AlertPersistencePort;
import com.cloudalerts.engine.infrastructure.json.JsonCatchupReplyParser;
import com.cloudalerts.engine.infrastructure.persistence.InMemoryAlertRecordStore;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires one {@link UserAlerts} engine for the host's session. The host supplies the
 * {@link AlertHostContext}; persistence falls back to memory when none is registered.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(UserAlertsProperties.class)
public class UserAlertsConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock userAlertsClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public AlertPersistencePort alertPersistencePort() {
        log.info("No alert persistence configured, keeping alert records in memory");
        return new InMemoryAlertRecordStore();
    }

    @Bean
    public JsonCatchupReplyParser catchupReplyParser() {
        return new JsonCatchupReplyParser();
    }

    @Bean
    public UserAlerts userAlerts(
            UserAlertsProperties properties,
            AlertHostContext host,
            AlertPersistencePort persistence,
            AlertMetrics alertMetrics,
            Clock clock) {
        var userAlerts = new UserAlerts(host, properties.alertFlags(), persistence, alertMetrics, clock);
        if (properties.restoreOnStartup()) {
            userAlerts.restore();
        }
        return userAlerts;
    }
}
