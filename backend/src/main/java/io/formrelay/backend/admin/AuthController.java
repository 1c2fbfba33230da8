package io.formrelay.backend.admin;

import io.formrelay.backend.api.ApiResponse;
import io.formrelay.backend.security.AdminPrincipal;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.time.Instant;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuthController {

  private final AdminAuthService adminAuthService;

  public AuthController(AdminAuthService adminAuthService) {
    this.adminAuthService = adminAuthService;
  }

  @PostMapping("/api/auth/login")
  public ResponseEntity<ApiResponse<LoginResponse>> login(
      @Valid @RequestBody LoginRequest request) {
    var result = adminAuthService.login(request.email(), request.password());
    return ResponseEntity.ok(
        ApiResponse.ok(
            "Login successful",
            new LoginResponse(
                result.token().token(),
                result.token().expiresAt(),
                AdminUserResponse.from(result.user()))));
  }

  @GetMapping("/api/auth/me")
  public ResponseEntity<ApiResponse<AdminUserResponse>> me(
      @AuthenticationPrincipal AdminPrincipal principal) {
    return ResponseEntity.ok(
        ApiResponse.ok(AdminUserResponse.from(adminAuthService.getUser(principal.adminId()))));
  }

  public record LoginRequest(
      @NotBlank(message = "email is required") String email,
      @NotBlank(message = "password is required") String password) {}

  public record LoginResponse(String accessToken, Instant expiresAt, AdminUserResponse user) {}

  public record AdminUserResponse(UUID id, String email, Instant createdAt, Instant lastLoginAt) {

    public static AdminUserResponse from(AdminUser user) {
      return new AdminUserResponse(
          user.getId(), user.getEmail(), user.getCreatedAt(), user.getLastLoginAt());
    }
  }
}
