package com.shlokmestry.gatekeeper.api;

public record ErrorBody(String code, String message) {}
