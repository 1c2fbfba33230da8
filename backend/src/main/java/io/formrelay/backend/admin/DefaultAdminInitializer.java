package io.formrelay.backend.admin;

import io.formrelay.backend.config.AdminProperties;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Component
public class DefaultAdminInitializer implements ApplicationRunner {

  private final AdminAuthService adminAuthService;
  private final AdminProperties adminProperties;

  public DefaultAdminInitializer(
      AdminAuthService adminAuthService, AdminProperties adminProperties) {
    this.adminAuthService = adminAuthService;
    this.adminProperties = adminProperties;
  }

  @Override
  public void run(ApplicationArguments args) {
    adminAuthService.ensureDefaultAdmin(adminProperties);
  }
}
