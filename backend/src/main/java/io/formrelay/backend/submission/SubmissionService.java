package io.formrelay.backend.submission;

import io.formrelay.backend.apikey.ApiKey;
import io.formrelay.backend.apikey.ApiKeyRepository;
import io.formrelay.backend.exception.InvalidStateException;
import io.formrelay.backend.exception.ResourceNotFoundException;
import io.formrelay.backend.integration.storage.StorageException;
import io.formrelay.backend.integration.storage.StorageService;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Dashboard reads and deletes over recorded submissions and their stored files. */
@Service
public class SubmissionService {

  private static final Logger log = LoggerFactory.getLogger(SubmissionService.class);

  static final int MAX_PER_PAGE = 100;

  private final SubmissionRepository submissionRepository;
  private final FileAttachmentRepository fileAttachmentRepository;
  private final ApiKeyRepository apiKeyRepository;
  private final StorageService storageService;

  public SubmissionService(
      SubmissionRepository submissionRepository,
      FileAttachmentRepository fileAttachmentRepository,
      ApiKeyRepository apiKeyRepository,
      StorageService storageService) {
    this.submissionRepository = submissionRepository;
    this.fileAttachmentRepository = fileAttachmentRepository;
    this.apiKeyRepository = apiKeyRepository;
    this.storageService = storageService;
  }

  /**
   * Newest-first page of submissions, optionally restricted to one API key.
   *
   * @param page 1-based page number
   */
  @Transactional(readOnly = true)
  public Page<SubmissionDetail> list(int page, int perPage, UUID apiKeyId) {
    if (page < 1) {
      throw new InvalidStateException("Invalid page", "page must be 1 or greater");
    }
    if (perPage < 1 || perPage > MAX_PER_PAGE) {
      throw new InvalidStateException(
          "Invalid page size", "perPage must be between 1 and " + MAX_PER_PAGE);
    }
    var pageable =
        PageRequest.of(
            page - 1,
            perPage,
            Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id")));
    Page<Submission> submissions =
        apiKeyId != null
            ? submissionRepository.findByApiKeyId(apiKeyId, pageable)
            : submissionRepository.findAll(pageable);

    List<UUID> submissionIds = submissions.map(Submission::getId).getContent();
    Map<UUID, List<FileAttachment>> attachmentsBySubmission =
        fileAttachmentRepository.findBySubmissionIdIn(submissionIds).stream()
            .collect(Collectors.groupingBy(FileAttachment::getSubmissionId));
    Map<UUID, String> keyNames =
        apiKeyRepository
            .findAllById(submissions.map(Submission::getApiKeyId).toSet())
            .stream()
            .collect(Collectors.toMap(ApiKey::getId, ApiKey::getName));

    return submissions.map(
        submission ->
            new SubmissionDetail(
                submission,
                submission.getFields(),
                keyNames.get(submission.getApiKeyId()),
                attachmentsBySubmission.getOrDefault(submission.getId(), List.of())));
  }

  @Transactional(readOnly = true)
  public SubmissionDetail get(UUID submissionId) {
    var submission =
        submissionRepository
            .findById(submissionId)
            .orElseThrow(() -> new ResourceNotFoundException("Submission", submissionId));
    String keyName =
        apiKeyRepository.findById(submission.getApiKeyId()).map(ApiKey::getName).orElse(null);
    return new SubmissionDetail(
        submission,
        submission.getFields(),
        keyName,
        fileAttachmentRepository.findBySubmissionIdOrderByCreatedAtAsc(submissionId));
  }

  /** Deletes a submission's stored files, then its attachment rows and the submission itself. */
  @Transactional
  public void delete(UUID submissionId) {
    if (!submissionRepository.existsById(submissionId)) {
      throw new ResourceNotFoundException("Submission", submissionId);
    }
    var attachments = fileAttachmentRepository.findBySubmissionIdOrderByCreatedAtAsc(submissionId);
    attachments.forEach(attachment -> storageService.delete(attachment.getStoredPath()));
    fileAttachmentRepository.deleteBySubmissionId(submissionId);
    submissionRepository.deleteById(submissionId);
    log.info("Deleted submission {} with {} file(s)", submissionId, attachments.size());
  }

  /**
   * Removes every submission owned by an API key together with its stored files. Used when the key
   * itself is deleted.
   *
   * @return number of submissions removed
   */
  @Transactional
  public int purgeForApiKey(UUID apiKeyId) {
    var storedPaths = fileAttachmentRepository.findStoredPathsByApiKeyId(apiKeyId);
    storedPaths.forEach(storageService::delete);
    int removed = submissionRepository.deleteByApiKeyId(apiKeyId);
    log.info(
        "Purged {} submission(s) and {} file(s) for api key {}",
        removed,
        storedPaths.size(),
        apiKeyId);
    return removed;
  }

  @Transactional(readOnly = true)
  public DownloadedFile download(UUID fileId) {
    var attachment =
        fileAttachmentRepository
            .findById(fileId)
            .orElseThrow(() -> new ResourceNotFoundException("File", fileId));
    try {
      byte[] content = storageService.download(attachment.getStoredPath());
      return new DownloadedFile(
          attachment.getOriginalFilename(), attachment.getContentType(), content);
    } catch (StorageException e) {
      log.error("Stored bytes missing for file {} at {}", fileId, attachment.getStoredPath(), e);
      throw new ResourceNotFoundException("File", fileId);
    }
  }

  /** Submission totals per API key, for keys that have at least one submission. */
  @Transactional(readOnly = true)
  public Map<UUID, Long> countByApiKey() {
    return submissionRepository.countGroupedByApiKey().stream()
        .collect(Collectors.toMap(SubmissionCount::apiKeyId, SubmissionCount::count));
  }

  @Transactional(readOnly = true)
  public long countForApiKey(UUID apiKeyId) {
    return submissionRepository.countByApiKeyId(apiKeyId);
  }
}
