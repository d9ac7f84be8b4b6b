package com.shlokmestry.gatekeeper.keys;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class KeyNotFoundException extends RuntimeException {
    public KeyNotFoundException(long keyId) {
        super("Key not found: " + keyId);
    }
}
