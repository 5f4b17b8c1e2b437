package com.cloudalerts.engine.domain.alert;

/**
 * Kind-specific part of a {@link UserAlert}. Which implementation an alert carries is fixed
 * by its {@link AlertType}.
 */
public sealed interface AlertPayload
        permits IncomingPendingContact,
                ContactChange,
                UpdatedPendingContact,
                NewShare,
                DeletedShare,
                SharedNodes,
                Payment,
                PaymentReminder,
                Takedown,
                ScheduledMeeting {}
