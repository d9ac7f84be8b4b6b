package com.shlokmestry.gatekeeper.api;

import jakarta.validation.constraints.NotBlank;

public record AddRangeRequest(@NotBlank String cidr) {}
