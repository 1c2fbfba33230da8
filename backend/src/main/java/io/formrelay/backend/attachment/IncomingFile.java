package io.formrelay.backend.attachment;

import org.springframework.core.io.InputStreamSource;
import org.springframework.web.multipart.MultipartFile;

/**
 * A file part as declared by the client. Filename and content type are untrusted and used for
 * display and policy checks only.
 */
public record IncomingFile(
    String filename, String contentType, long size, InputStreamSource content) {

  public static IncomingFile from(MultipartFile file) {
    return new IncomingFile(
        file.getOriginalFilename(), file.getContentType(), file.getSize(), file);
  }
}
