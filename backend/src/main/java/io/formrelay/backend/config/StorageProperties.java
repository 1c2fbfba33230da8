package io.formrelay.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties("storage")
public record StorageProperties(
    @DefaultValue("local") String provider, @DefaultValue Local local) {

  public record Local(@DefaultValue("./data/uploads") String root) {}
}
