package com.shlokmestry.gatekeeper.api;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.shlokmestry.gatekeeper.keys.KeyService;
import com.shlokmestry.gatekeeper.keys.KeyUpdate;
import com.shlokmestry.gatekeeper.keys.NewKey;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/v1/keys")
public class KeyController {

    private final KeyService keys;

    public KeyController(KeyService keys) {
        this.keys = keys;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public KeyResponse create(@Valid @RequestBody CreateKeyRequest req) {
        NewKey key = new NewKey(
                req.active() == null || req.active(),
                req.ownerName(),
                req.contactName(),
                req.contactEmail(),
                req.expiresAt()
        );
        return KeyResponse.from(keys.createKey(key));
    }

    @GetMapping("/{keyId}")
    public KeyResponse get(@PathVariable long keyId) {
        return KeyResponse.from(keys.getKey(keyId));
    }

    @PatchMapping("/{keyId}")
    public KeyResponse update(@PathVariable long keyId, @Valid @RequestBody UpdateKeyRequest req) {
        KeyUpdate update = new KeyUpdate(req.active(), req.ownerName(), req.contactName(), req.contactEmail(),
                req.expiresAt(), Boolean.TRUE.equals(req.clearExpiry()));
        return KeyResponse.from(keys.updateKey(keyId, update));
    }

    @PostMapping("/{keyId}/deactivate")
    public KeyResponse deactivate(@PathVariable long keyId) {
        return KeyResponse.from(keys.deactivateKey(keyId));
    }
}
