package io.formrelay.backend.integration.email;

/** Outcome of a single send attempt. {@code errorMessage} is set iff {@code success} is false. */
public record SendResult(boolean success, String providerMessageId, String errorMessage) {}
