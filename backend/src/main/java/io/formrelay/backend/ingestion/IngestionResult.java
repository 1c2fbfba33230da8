package io.formrelay.backend.ingestion;

import java.util.UUID;

public record IngestionResult(UUID submissionId, boolean emailSent) {}
