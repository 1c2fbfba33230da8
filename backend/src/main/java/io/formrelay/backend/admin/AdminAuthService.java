package io.formrelay.backend.admin;

import io.formrelay.backend.config.AdminProperties;
import io.formrelay.backend.exception.ResourceNotFoundException;
import io.formrelay.backend.security.AdminAuthException;
import io.formrelay.backend.security.AdminJwtService;
import io.formrelay.backend.security.AdminJwtService.IssuedToken;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AdminAuthService {

  private static final Logger log = LoggerFactory.getLogger(AdminAuthService.class);

  static final String INVALID_CREDENTIALS = "Invalid email or password";

  private final AdminUserRepository adminUserRepository;
  private final PasswordEncoder passwordEncoder;
  private final AdminJwtService adminJwtService;

  public AdminAuthService(
      AdminUserRepository adminUserRepository,
      PasswordEncoder passwordEncoder,
      AdminJwtService adminJwtService) {
    this.adminUserRepository = adminUserRepository;
    this.passwordEncoder = passwordEncoder;
    this.adminJwtService = adminJwtService;
  }

  public record LoginResult(IssuedToken token, AdminUser user) {}

  /** Same failure for unknown email and wrong password. */
  @Transactional
  public LoginResult login(String email, String password) {
    var user =
        adminUserRepository
            .findByEmailIgnoreCase(email.trim())
            .filter(candidate -> passwordEncoder.matches(password, candidate.getPasswordHash()))
            .orElseThrow(
                () -> {
                  log.warn("Failed admin login for {}", email);
                  return new AdminAuthException(INVALID_CREDENTIALS);
                });
    user.recordLogin(Instant.now());
    log.info("Admin {} logged in", user.getId());
    return new LoginResult(adminJwtService.issueToken(user.getId(), user.getEmail()), user);
  }

  @Transactional(readOnly = true)
  public AdminUser getUser(UUID adminId) {
    return adminUserRepository
        .findById(adminId)
        .orElseThrow(() -> new ResourceNotFoundException("Admin user", adminId));
  }

  /** Creates the configured admin when the table is empty. */
  @Transactional
  public void ensureDefaultAdmin(AdminProperties adminProperties) {
    if (adminUserRepository.count() > 0) {
      return;
    }
    adminUserRepository.save(
        new AdminUser(
            adminProperties.email().trim().toLowerCase(Locale.ROOT),
            passwordEncoder.encode(adminProperties.password())));
    log.warn(
        "Created default admin {}; change its password before exposing the dashboard",
        adminProperties.email());
  }
}
