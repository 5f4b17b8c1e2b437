package com.cloudalerts.engine.application.config;

import com.cloudalerts.engine.domain.alert.AlertFlags;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "user-alerts")
public record UserAlertsProperties(boolean restoreOnStartup, Flags flags) {

    /** Each switch left unset stays on. */
    public record Flags(
            @DefaultValue("true") boolean cloudEnabled,
            @DefaultValue("true") boolean contactsEnabled,
            @DefaultValue("true") boolean cloudNewFiles,
            @DefaultValue("true") boolean cloudNewShare,
            @DefaultValue("true") boolean cloudDeletedShare,
            @DefaultValue("true") boolean contactsIncomingRequest,
            @DefaultValue("true") boolean contactsDeleted,
            @DefaultValue("true") boolean contactsAccepted) {

        public AlertFlags toAlertFlags() {
            return AlertFlags.builder()
                    .cloudEnabled(cloudEnabled)
                    .contactsEnabled(contactsEnabled)
                    .cloudNewFiles(cloudNewFiles)
                    .cloudNewShare(cloudNewShare)
                    .cloudDeletedShare(cloudDeletedShare)
                    .contactsIncomingRequest(contactsIncomingRequest)
                    .contactsDeleted(contactsDeleted)
                    .contactsAccepted(contactsAccepted)
                    .build();
        }
    }

    /** Every category is on unless configured otherwise. */
    public AlertFlags alertFlags() {
        return flags == null ? AlertFlags.allEnabled() : flags.toAlertFlags();
    }
}
