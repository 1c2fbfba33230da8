package io.formrelay.backend.apikey;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashSet;
import org.junit.jupiter.api.Test;

class ApiKeySecretGeneratorTest {

  @Test
  void generates_48_alphanumeric_characters() {
    String secret = ApiKeySecretGenerator.generate();

    assertThat(secret).hasSize(48).matches("[A-Za-z0-9]+");
  }

  @Test
  void secrets_do_not_repeat() {
    var secrets = new HashSet<String>();
    for (int i = 0; i < 1000; i++) {
      secrets.add(ApiKeySecretGenerator.generate());
    }

    assertThat(secrets).hasSize(1000);
  }
}
