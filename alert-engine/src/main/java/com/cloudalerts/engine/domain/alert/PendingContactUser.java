package com.cloudalerts.engine.domain.alert;

import java.util.List;
import java.util.Optional;
import lombok.Builder;

/**
 * A user known only through a pending contact request, as listed in a catch-up reply.
 */
@Builder(toBuilder = true)
public record PendingContactUser(long userHandle, String email, List<String> alternateEmails, String name) {

    public PendingContactUser {
        alternateEmails = alternateEmails == null ? List.of() : List.copyOf(alternateEmails);
    }

    public Optional<String> preferredEmail() {
        if (email != null && !email.isEmpty()) {
            return Optional.of(email);
        }
        return alternateEmails.stream().filter(e -> !e.isEmpty()).findFirst();
    }
}
