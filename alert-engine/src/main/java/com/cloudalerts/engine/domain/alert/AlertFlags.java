package com.cloudalerts.engine.domain.alert;

import lombok.Builder;

/**
 * Per-category switches deciding which alert kinds are worth creating at all.
 */
@Builder(toBuilder = true)
public record AlertFlags(
        boolean cloudEnabled,
        boolean contactsEnabled,
        boolean cloudNewFiles,
        boolean cloudNewShare,
        boolean cloudDeletedShare,
        boolean contactsIncomingRequest,
        boolean contactsDeleted,
        boolean contactsAccepted) {

    public static AlertFlags allEnabled() {
        return new AlertFlags(true, true, true, true, true, true, true, true);
    }

    /**
     * @param action contact change action or pending contact update status; -1 when unknown
     */
    public boolean isUnwanted(AlertType type, int action) {
        switch (type) {
            case NEW_SHARED_NODES:
            case NEW_SHARE:
            case DELETED_SHARE:
                if (!cloudEnabled) {
                    return true;
                }
                break;
            case CONTACT_CHANGE:
            case INCOMING_PENDING_CONTACT:
            case UPDATED_PENDING_CONTACT_INCOMING:
            case UPDATED_PENDING_CONTACT_OUTGOING:
                if (!contactsEnabled) {
                    return true;
                }
                break;
            default:
                break;
        }
        return switch (type) {
            case NEW_SHARED_NODES -> !cloudNewFiles;
            case NEW_SHARE -> !cloudNewShare;
            case DELETED_SHARE -> !cloudDeletedShare;
            case INCOMING_PENDING_CONTACT -> !contactsIncomingRequest;
            case CONTACT_CHANGE -> (action == -1 || action == ContactChange.DELETED) && !contactsDeleted;
            case UPDATED_PENDING_CONTACT_OUTGOING ->
                    (action == -1 || action == UpdatedPendingContact.ACCEPTED) && !contactsAccepted;
            default -> false;
        };
    }
}
