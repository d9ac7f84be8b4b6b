package com.shlokmestry.gatekeeper.access;

import java.util.Optional;

public record AuthorizationDecision(
        boolean authenticated,
        Long keyId,             // null unless authenticated
        boolean banned
) {

    public static AuthorizationDecision anonymous(boolean banned) {
        return new AuthorizationDecision(false, null, banned);
    }

    public Optional<Long> key() {
        return Optional.ofNullable(keyId);
    }
}
