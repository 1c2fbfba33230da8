package io.formrelay.backend.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/** Dashboard session token settings. The secret must be at least 32 bytes for HS256. */
@ConfigurationProperties("formrelay.security")
public record SecurityProperties(String jwtSecret, @DefaultValue("24h") Duration tokenTtl) {}
