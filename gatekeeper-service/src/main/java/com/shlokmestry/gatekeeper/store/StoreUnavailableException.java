package com.shlokmestry.gatekeeper.store;

// the store could not answer; never to be read as "not found" or "not banned"
public class StoreUnavailableException extends RuntimeException {
    public StoreUnavailableException(String operation, Throwable cause) {
        super("Store unavailable during " + operation, cause);
    }
}
