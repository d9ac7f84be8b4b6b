package com.shlokmestry.gatekeeper.keys;

public class TokenCollisionException extends RuntimeException {
    public TokenCollisionException() {
        super("Generated key token already exists");
    }
}
