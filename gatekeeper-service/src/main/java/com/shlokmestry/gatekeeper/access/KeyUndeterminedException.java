package com.shlokmestry.gatekeeper.access;

import com.shlokmestry.gatekeeper.store.StoreUnavailableException;

// the key half of a decision is unknown; the ban half was answered from the index and rides along
public class KeyUndeterminedException extends StoreUnavailableException {

    private final boolean banned;

    public KeyUndeterminedException(boolean banned, StoreUnavailableException cause) {
        super("key.validate", cause);
        this.banned = banned;
    }

    public boolean banned() {
        return banned;
    }
}
