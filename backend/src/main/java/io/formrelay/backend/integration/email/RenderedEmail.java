package io.formrelay.backend.integration.email;

/** Output of rendering, ready to be wrapped in an {@link EmailMessage}. */
public record RenderedEmail(String subject, String htmlBody, String plainTextBody) {}
