package io.formrelay.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/** Sender identity and links used in submission notifications. */
@ConfigurationProperties("formrelay.email")
public record EmailProperties(
    @DefaultValue("smtp") String provider,
    @DefaultValue("noreply@formrelay.local") String senderAddress,
    @DefaultValue("Form Relay") String senderName,
    @DefaultValue("http://localhost:8080") String dashboardUrl) {}
