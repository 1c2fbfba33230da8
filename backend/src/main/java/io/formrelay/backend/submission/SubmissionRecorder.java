package io.formrelay.backend.submission;

import io.formrelay.backend.attachment.StagedFile;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persists a submission together with its attachment rows. The submission row, its field rows and
 * every attachment row commit in one transaction; readers never see a partially linked submission.
 */
@Service
public class SubmissionRecorder {

  private static final Logger log = LoggerFactory.getLogger(SubmissionRecorder.class);

  private final SubmissionRepository submissionRepository;
  private final FileAttachmentRepository fileAttachmentRepository;

  public SubmissionRecorder(
      SubmissionRepository submissionRepository,
      FileAttachmentRepository fileAttachmentRepository) {
    this.submissionRepository = submissionRepository;
    this.fileAttachmentRepository = fileAttachmentRepository;
  }

  @Transactional
  public RecordedSubmission record(
      UUID apiKeyId,
      List<SubmissionField> fields,
      String sourceIp,
      String userAgent,
      List<StagedFile> stagedFiles) {
    var submission =
        submissionRepository.saveAndFlush(new Submission(apiKeyId, fields, sourceIp, userAgent));

    var attachments =
        stagedFiles.stream()
            .map(
                file ->
                    new FileAttachment(
                        submission.getId(),
                        file.originalFilename(),
                        file.storedPath(),
                        file.fileSize(),
                        file.contentType()))
            .toList();
    var saved = fileAttachmentRepository.saveAllAndFlush(attachments);

    log.debug(
        "Recorded submission {} for api key {} with {} field(s) and {} attachment(s)",
        submission.getId(),
        apiKeyId,
        fields.size(),
        saved.size());
    return new RecordedSubmission(submission, saved);
  }

  /** Writes the delivery outcome. Called once per submission, after the delivery attempt. */
  @Transactional
  public void markDelivery(UUID submissionId, boolean delivered, String error) {
    int updated = submissionRepository.markDelivery(submissionId, delivered, error);
    if (updated == 0) {
      log.warn("Submission {} vanished before its delivery status was recorded", submissionId);
    }
  }
}
