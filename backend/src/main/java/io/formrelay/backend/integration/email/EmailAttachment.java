package io.formrelay.backend.integration.email;

/** File attached to an outgoing email; content is sent unmodified. */
public record EmailAttachment(String filename, String contentType, byte[] content) {}
