package com.shlokmestry.gatekeeper.bans;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class RangeNotFoundException extends RuntimeException {
    public RangeNotFoundException(long rangeId) {
        super("Network range not found: " + rangeId);
    }
}
