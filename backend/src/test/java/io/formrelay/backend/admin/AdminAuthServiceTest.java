package io.formrelay.backend.admin;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.formrelay.backend.config.AdminProperties;
import io.formrelay.backend.config.SecurityProperties;
import io.formrelay.backend.security.AdminAuthException;
import io.formrelay.backend.security.AdminJwtService;
import io.formrelay.backend.testutil.TestEntities;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

@ExtendWith(MockitoExtension.class)
class AdminAuthServiceTest {

  @Mock private AdminUserRepository adminUserRepository;

  private final BCryptPasswordEncoder passwordEncoder = new BCryptPasswordEncoder(4);
  private final AdminJwtService jwtService =
      new AdminJwtService(
          new SecurityProperties(
              "test-jwt-secret-that-is-at-least-32-bytes-long", Duration.ofHours(1)));
  private AdminAuthService service;

  @BeforeEach
  void setUp() {
    service = new AdminAuthService(adminUserRepository, passwordEncoder, jwtService);
  }

  @Test
  void login_issues_token_and_records_login_time() {
    var user =
        TestEntities.withId(
            new AdminUser("admin@formrelay.test", passwordEncoder.encode("s3cret-pass")),
            UUID.randomUUID());
    when(adminUserRepository.findByEmailIgnoreCase("admin@formrelay.test"))
        .thenReturn(Optional.of(user));

    var result = service.login(" admin@formrelay.test ", "s3cret-pass");

    assertThat(result.user()).isSameAs(user);
    assertThat(user.getLastLoginAt()).isNotNull();
    assertThat(jwtService.verifyToken(result.token().token()).adminId()).isEqualTo(user.getId());
  }

  @Test
  void login_rejects_wrong_password() {
    var user = new AdminUser("admin@formrelay.test", passwordEncoder.encode("s3cret-pass"));
    when(adminUserRepository.findByEmailIgnoreCase("admin@formrelay.test"))
        .thenReturn(Optional.of(user));

    assertThatThrownBy(() -> service.login("admin@formrelay.test", "nope"))
        .isInstanceOfSatisfying(
            AdminAuthException.class,
            e ->
                assertThat(e.getBody().getDetail())
                    .isEqualTo(AdminAuthService.INVALID_CREDENTIALS));
    assertThat(user.getLastLoginAt()).isNull();
  }

  @Test
  void ensureDefaultAdmin_creates_hashed_admin_when_none_exist() {
    when(adminUserRepository.count()).thenReturn(0L);

    service.ensureDefaultAdmin(new AdminProperties(" Admin@Example.com ", "changeme123"));

    var captor = ArgumentCaptor.forClass(AdminUser.class);
    verify(adminUserRepository).save(captor.capture());
    assertThat(captor.getValue().getEmail()).isEqualTo("admin@example.com");
    assertThat(captor.getValue().getPasswordHash()).isNotEqualTo("changeme123");
    assertThat(passwordEncoder.matches("changeme123", captor.getValue().getPasswordHash()))
        .isTrue();
  }

  @Test
  void ensureDefaultAdmin_leaves_existing_admins_alone() {
    when(adminUserRepository.count()).thenReturn(1L);

    service.ensureDefaultAdmin(new AdminProperties("admin@example.com", "changeme123"));

    verify(adminUserRepository, never()).save(any());
  }
}
