package io.formrelay.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/** Credentials for the admin account created on first start when none exists. */
@ConfigurationProperties("formrelay.admin")
public record AdminProperties(
    @DefaultValue("admin@example.com") String email,
    @DefaultValue("changeme123") String password) {}
