package io.formrelay.backend.submission;

import java.util.UUID;

/** Projection row for per-key submission totals. */
public record SubmissionCount(UUID apiKeyId, long count) {}
