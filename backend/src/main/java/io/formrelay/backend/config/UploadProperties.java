package io.formrelay.backend.config;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.unit.DataSize;

/** Per-file upload policy applied to every ingestion request. */
@ConfigurationProperties("formrelay.uploads")
public record UploadProperties(
    @DefaultValue("10MB") DataSize maxFileSize,
    @DefaultValue({"pdf", "doc", "docx", "txt", "png", "jpg", "jpeg", "gif", "zip"})
        Set<String> allowedExtensions) {

  public UploadProperties {
    allowedExtensions =
        allowedExtensions.stream()
            .map(ext -> ext.trim().toLowerCase(Locale.ROOT))
            .filter(ext -> !ext.isEmpty())
            .collect(Collectors.toUnmodifiableSet());
  }
}
