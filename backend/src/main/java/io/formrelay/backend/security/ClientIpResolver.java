package io.formrelay.backend.security;

import jakarta.servlet.http.HttpServletRequest;

/** Resolves the submitting client's address, honouring reverse-proxy headers. */
public final class ClientIpResolver {

  /** Longest textual IPv6 address; matches the {@code submissions.source_ip} column. */
  static final int MAX_LENGTH = 45;

  private ClientIpResolver() {}

  /**
   * First entry of {@code X-Forwarded-For}, else {@code X-Real-IP}, else the socket's remote
   * address. Header values are client-controlled and recorded for display only.
   */
  public static String resolve(HttpServletRequest request) {
    String forwardedFor = request.getHeader("X-Forwarded-For");
    if (forwardedFor != null && !forwardedFor.isBlank()) {
      String first = forwardedFor.split(",")[0].trim();
      if (!first.isEmpty()) {
        return truncate(first);
      }
    }
    String realIp = request.getHeader("X-Real-IP");
    if (realIp != null && !realIp.isBlank()) {
      return truncate(realIp.trim());
    }
    return truncate(request.getRemoteAddr());
  }

  private static String truncate(String address) {
    if (address == null || address.length() <= MAX_LENGTH) {
      return address;
    }
    return address.substring(0, MAX_LENGTH);
  }
}
