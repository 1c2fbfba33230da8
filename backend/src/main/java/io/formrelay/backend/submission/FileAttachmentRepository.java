package io.formrelay.backend.submission;

import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface FileAttachmentRepository extends JpaRepository<FileAttachment, UUID> {

  List<FileAttachment> findBySubmissionIdOrderByCreatedAtAsc(UUID submissionId);

  List<FileAttachment> findBySubmissionIdIn(Collection<UUID> submissionIds);

  @Query(
      """
      SELECT f.storedPath FROM FileAttachment f
      WHERE f.submissionId IN (SELECT s.id FROM Submission s WHERE s.apiKeyId = :apiKeyId)
      """)
  List<String> findStoredPathsByApiKeyId(@Param("apiKeyId") UUID apiKeyId);

  @Modifying(clearAutomatically = true)
  @Query("DELETE FROM FileAttachment f WHERE f.submissionId = :submissionId")
  int deleteBySubmissionId(@Param("submissionId") UUID submissionId);
}
