package io.formrelay.backend.submission;

public record DownloadedFile(String filename, String contentType, byte[] content) {}
