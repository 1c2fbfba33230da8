package io.formrelay.backend.testutil;

import io.formrelay.backend.apikey.ApiKey;
import io.formrelay.backend.apikey.ApiKeyService;
import io.formrelay.backend.security.AdminJwtService;
import java.util.UUID;

/** Shared fixtures for integration tests that hit the database. */
public final class TestApiKeys {

  private TestApiKeys() {}

  public static ApiKey createKey(ApiKeyService apiKeyService, String name, String recipient) {
    return apiKeyService.createKey(name, "created by " + name, recipient);
  }

  /** Bearer header value for a dashboard request. */
  public static String adminBearer(AdminJwtService adminJwtService) {
    return "Bearer "
        + adminJwtService.issueToken(UUID.randomUUID(), "admin@formrelay.test").token();
  }
}
