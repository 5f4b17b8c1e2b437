package com.cloudalerts.engine.domain.provisional;

import com.cloudalerts.engine.domain.alert.ContactChange;
import com.cloudalerts.engine.domain.alert.IncomingPendingContact;
import com.cloudalerts.engine.domain.alert.NewShare;
import com.cloudalerts.engine.domain.alert.UserAlert;
import com.cloudalerts.engine.domain.host.AlertHostContext;

/**
 * Decides whether a buffered alert still describes the session's current state.
 */
public class ProvisionalValidator {

    public boolean isValid(UserAlert alert, long originatingUser, AlertHostContext host) {
        return switch (alert.getType()) {
            case CONTACT_CHANGE -> alert.payload(ContactChange.class).action() != ContactChange.ESTABLISHED
                    || originatingUser != host.ownUserHandle();
            case INCOMING_PENDING_CONTACT -> {
                var request = alert.payload(IncomingPendingContact.class);
                yield request.requestDeleted() || host.incomingPendingContactExists(request.requestHandle());
            }
            case NEW_SHARE -> host.shareExists(alert.payload(NewShare.class).folderHandle());
            default -> true;
        };
    }
}
