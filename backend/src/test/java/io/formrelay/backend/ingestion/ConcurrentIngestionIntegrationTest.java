package io.formrelay.backend.ingestion;

import static org.assertj.core.api.Assertions.assertThat;

import io.formrelay.backend.TestcontainersConfiguration;
import io.formrelay.backend.apikey.ApiKeyService;
import io.formrelay.backend.submission.SubmissionField;
import io.formrelay.backend.submission.SubmissionRepository;
import io.formrelay.backend.testutil.TestApiKeys;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
class ConcurrentIngestionIntegrationTest {

  private static final int SUBMISSIONS = 50;

  @Autowired private IngestionService ingestionService;
  @Autowired private ApiKeyService apiKeyService;
  @Autowired private SubmissionRepository submissionRepository;

  @Test
  void concurrent_submissions_to_one_key_never_lose_a_usage_increment() throws Exception {
    var key = TestApiKeys.createKey(apiKeyService, "Busy Form", "busy@example.com");
    long before = apiKeyService.getKey(key.getId()).getUsageCount();

    var executor = Executors.newFixedThreadPool(8);
    var start = new CountDownLatch(1);
    try {
      List<Future<IngestionResult>> futures = new ArrayList<>();
      for (int i = 0; i < SUBMISSIONS; i++) {
        int n = i;
        futures.add(
            executor.submit(
                () -> {
                  start.await();
                  return ingestionService.ingest(
                      new InboundSubmission(
                          key.getSecret(),
                          List.of(new SubmissionField("n", Integer.toString(n))),
                          List.of(),
                          "198.51.100.1",
                          "load-test"));
                }));
      }
      start.countDown();

      var submissionIds = new HashSet<UUID>();
      for (Future<IngestionResult> future : futures) {
        submissionIds.add(future.get(60, TimeUnit.SECONDS).submissionId());
      }
      assertThat(submissionIds).hasSize(SUBMISSIONS);
    } finally {
      executor.shutdownNow();
    }

    assertThat(apiKeyService.getKey(key.getId()).getUsageCount()).isEqualTo(before + SUBMISSIONS);
    assertThat(submissionRepository.countByApiKeyId(key.getId())).isEqualTo(SUBMISSIONS);
  }
}
