package io.formrelay.backend.stats;

import io.formrelay.backend.apikey.ApiKeyRepository;
import io.formrelay.backend.submission.FileAttachmentRepository;
import io.formrelay.backend.submission.SubmissionRepository;
import java.time.Clock;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class StatsService {

  static final Duration RECENT_WINDOW = Duration.ofDays(7);

  private final ApiKeyRepository apiKeyRepository;
  private final SubmissionRepository submissionRepository;
  private final FileAttachmentRepository fileAttachmentRepository;
  private final Clock clock;

  @Autowired
  public StatsService(
      ApiKeyRepository apiKeyRepository,
      SubmissionRepository submissionRepository,
      FileAttachmentRepository fileAttachmentRepository) {
    this(apiKeyRepository, submissionRepository, fileAttachmentRepository, Clock.systemUTC());
  }

  StatsService(
      ApiKeyRepository apiKeyRepository,
      SubmissionRepository submissionRepository,
      FileAttachmentRepository fileAttachmentRepository,
      Clock clock) {
    this.apiKeyRepository = apiKeyRepository;
    this.submissionRepository = submissionRepository;
    this.fileAttachmentRepository = fileAttachmentRepository;
    this.clock = clock;
  }

  public record DashboardStats(
      long totalApiKeys,
      long activeApiKeys,
      long totalSubmissions,
      long recentSubmissions,
      long totalFiles) {}

  /** Recent means created within the last seven days. */
  @Transactional(readOnly = true)
  public DashboardStats getStats() {
    return new DashboardStats(
        apiKeyRepository.count(),
        apiKeyRepository.countByActiveTrue(),
        submissionRepository.count(),
        submissionRepository.countByCreatedAtAfter(clock.instant().minus(RECENT_WINDOW)),
        fileAttachmentRepository.count());
  }
}
