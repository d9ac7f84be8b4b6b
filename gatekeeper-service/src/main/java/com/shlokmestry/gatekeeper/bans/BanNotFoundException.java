package com.shlokmestry.gatekeeper.bans;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class BanNotFoundException extends RuntimeException {
    public BanNotFoundException(long banId) {
        super("Ban not found: " + banId);
    }
}
