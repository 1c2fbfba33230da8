package io.formrelay.backend.integration.storage.s3;

import io.formrelay.backend.config.S3Config.S3Properties;
import io.formrelay.backend.integration.storage.StorageException;
import io.formrelay.backend.integration.storage.StorageKeys;
import io.formrelay.backend.integration.storage.StorageService;
import java.io.IOException;
import java.io.InputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

/** S3 implementation of {@link StorageService}. All AWS SDK types are confined to this class. */
@Component
@ConditionalOnProperty(name = "storage.provider", havingValue = "s3")
public class S3StorageAdapter implements StorageService {

  private static final Logger log = LoggerFactory.getLogger(S3StorageAdapter.class);

  private final S3Client s3Client;
  private final String bucketName;

  public S3StorageAdapter(S3Client s3Client, S3Properties s3Properties) {
    this.s3Client = s3Client;
    this.bucketName = s3Properties.bucketName();
  }

  @Override
  public String upload(String key, byte[] content, String contentType) {
    StorageKeys.validate(key);
    try {
      s3Client.putObject(putRequest(key, contentType), RequestBody.fromBytes(content));
    } catch (SdkException e) {
      throw new StorageException("Failed to upload object to storage", e);
    }
    return key;
  }

  @Override
  public String upload(String key, InputStream content, long contentLength, String contentType) {
    StorageKeys.validate(key);
    try {
      s3Client.putObject(
          putRequest(key, contentType), RequestBody.fromInputStream(content, contentLength));
    } catch (SdkException e) {
      throw new StorageException("Failed to upload object to storage", e);
    }
    return key;
  }

  @Override
  public byte[] download(String key) {
    StorageKeys.validate(key);
    var getRequest = GetObjectRequest.builder().bucket(bucketName).key(key).build();
    try (var response = s3Client.getObject(getRequest)) {
      return response.readAllBytes();
    } catch (SdkException | IOException e) {
      log.warn("Download failed for key: {}", key, e);
      throw new StorageException("Failed to download object from storage", e);
    }
  }

  @Override
  public void delete(String key) {
    try {
      var deleteRequest = DeleteObjectRequest.builder().bucket(bucketName).key(key).build();
      s3Client.deleteObject(deleteRequest);
    } catch (SdkException e) {
      log.warn("Best-effort S3 deletion failed for key={}: {}", key, e.getMessage());
    }
  }

  private PutObjectRequest putRequest(String key, String contentType) {
    var builder = PutObjectRequest.builder().bucket(bucketName).key(key);
    if (contentType != null) {
      builder.contentType(contentType);
    }
    return builder.build();
  }
}
