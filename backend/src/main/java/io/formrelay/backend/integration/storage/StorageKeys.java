package io.formrelay.backend.integration.storage;

import java.util.UUID;
import java.util.regex.Pattern;

/** Builds and validates attachment storage keys. */
public final class StorageKeys {

  private static final String UUID_REGEX =
      "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}";

  private static final Pattern KEY_PATTERN =
      Pattern.compile("^" + UUID_REGEX + "/" + UUID_REGEX + "$");

  private StorageKeys() {}

  /** A fresh key under the given API key's prefix. The client's filename never appears in it. */
  public static String newKey(UUID apiKeyId) {
    return apiKeyId + "/" + UUID.randomUUID();
  }

  public static void validate(String key) {
    if (key == null || !KEY_PATTERN.matcher(key).matches()) {
      throw new IllegalArgumentException("Invalid storage key format");
    }
  }
}
