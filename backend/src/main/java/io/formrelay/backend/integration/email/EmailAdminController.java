package io.formrelay.backend.integration.email;

import io.formrelay.backend.api.ApiResponse;
import io.formrelay.backend.integration.ConnectionTestResult;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Dashboard endpoint for checking the configured email provider. */
@RestController
@RequestMapping("/api/email")
public class EmailAdminController {

  private final EmailProvider emailProvider;

  public EmailAdminController(EmailProvider emailProvider) {
    this.emailProvider = emailProvider;
  }

  @PostMapping("/test-connection")
  public ResponseEntity<ApiResponse<ConnectionTestResult>> testConnection() {
    return ResponseEntity.ok(ApiResponse.ok(emailProvider.testConnection()));
  }
}
