package io.formrelay.backend.submission;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SubmissionRepository extends JpaRepository<Submission, UUID> {

  Page<Submission> findByApiKeyId(UUID apiKeyId, Pageable pageable);

  long countByApiKeyId(UUID apiKeyId);

  long countByCreatedAtAfter(Instant since);

  @Query(
      """
      SELECT new io.formrelay.backend.submission.SubmissionCount(s.apiKeyId, COUNT(s))
      FROM Submission s
      GROUP BY s.apiKeyId
      """)
  List<SubmissionCount> countGroupedByApiKey();

  /** Records the outcome of the single delivery attempt for a submission. */
  @Modifying(clearAutomatically = true)
  @Query(
      """
      UPDATE Submission s SET s.emailSent = :sent, s.emailError = :error
      WHERE s.id = :id
      """)
  int markDelivery(
      @Param("id") UUID id, @Param("sent") boolean sent, @Param("error") String error);

  /** Field rows and attachment rows go with it through ON DELETE CASCADE. */
  @Modifying(clearAutomatically = true)
  @Query("DELETE FROM Submission s WHERE s.apiKeyId = :apiKeyId")
  int deleteByApiKeyId(@Param("apiKeyId") UUID apiKeyId);
}
