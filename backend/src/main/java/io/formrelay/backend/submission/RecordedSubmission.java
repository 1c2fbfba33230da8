package io.formrelay.backend.submission;

import java.util.List;

/** A submission and its attachments as committed by {@link SubmissionRecorder}. */
public record RecordedSubmission(Submission submission, List<FileAttachment> attachments) {}
