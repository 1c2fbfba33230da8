package io.formrelay.backend.ingestion;

import io.formrelay.backend.attachment.IncomingFile;
import io.formrelay.backend.submission.SubmissionField;
import java.util.List;

/** Everything the ingestion pipeline needs from one HTTP request, already sanitized. */
public record InboundSubmission(
    String secret,
    List<SubmissionField> fields,
    List<IncomingFile> files,
    String sourceIp,
    String userAgent) {}
