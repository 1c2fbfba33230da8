package io.formrelay.backend.apikey;

import java.security.SecureRandom;

/**
 * Generates public endpoint secrets: 48 characters drawn uniformly from a 62-symbol alphabet,
 * roughly 285 bits of entropy.
 */
public final class ApiKeySecretGenerator {

  static final int SECRET_LENGTH = 48;

  private static final String ALPHABET =
      "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";
  private static final SecureRandom RANDOM = new SecureRandom();

  private ApiKeySecretGenerator() {}

  public static String generate() {
    var sb = new StringBuilder(SECRET_LENGTH);
    for (int i = 0; i < SECRET_LENGTH; i++) {
      sb.append(ALPHABET.charAt(RANDOM.nextInt(ALPHABET.length())));
    }
    return sb.toString();
  }
}
