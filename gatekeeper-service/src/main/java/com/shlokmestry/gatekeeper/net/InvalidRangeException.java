package com.shlokmestry.gatekeeper.net;

public class InvalidRangeException extends RuntimeException {
    public InvalidRangeException(String value, String reason) {
        super("Invalid network range '" + value + "': " + reason);
    }
}
