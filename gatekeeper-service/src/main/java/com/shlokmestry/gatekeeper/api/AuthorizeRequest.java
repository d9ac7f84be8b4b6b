package com.shlokmestry.gatekeeper.api;

import jakarta.validation.constraints.NotBlank;

public record AuthorizeRequest(
        String token,               // API key as presented, may be absent
        @NotBlank String address    // client IP literal, v4 or v6
) {}
