package io.formrelay.backend.submission;

import java.util.List;

/**
 * A submission with everything the dashboard shows for it. Fields are copied out while the
 * persistence context is open.
 */
public record SubmissionDetail(
    Submission submission,
    List<SubmissionField> fields,
    String apiKeyName,
    List<FileAttachment> attachments) {}
