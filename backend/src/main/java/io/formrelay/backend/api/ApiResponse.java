package io.formrelay.backend.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Response envelope shared by every endpoint. Third-party form integrations rely on {@code success}
 * as the outcome signal, so it is always present regardless of HTTP status.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(boolean success, String message, T data, List<String> errors) {

  public static <T> ApiResponse<T> ok(T data) {
    return new ApiResponse<>(true, null, data, null);
  }

  public static <T> ApiResponse<T> ok(String message, T data) {
    return new ApiResponse<>(true, message, data, null);
  }

  public static ApiResponse<Void> error(String message) {
    return new ApiResponse<>(false, message, null, null);
  }

  public static ApiResponse<Void> error(String message, List<String> errors) {
    return new ApiResponse<>(false, message, null, errors);
  }
}
