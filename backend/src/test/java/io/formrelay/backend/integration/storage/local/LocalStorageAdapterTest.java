package io.formrelay.backend.integration.storage.local;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.formrelay.backend.integration.storage.StorageException;
import io.formrelay.backend.integration.storage.StorageKeys;
import java.io.ByteArrayInputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LocalStorageAdapterTest {

  @TempDir Path root;

  private LocalStorageAdapter adapter;
  private UUID apiKeyId;

  @BeforeEach
  void setUp() {
    adapter = new LocalStorageAdapter(root);
    apiKeyId = UUID.randomUUID();
  }

  @Test
  void upload_writes_under_the_key_and_download_reads_it_back() throws Exception {
    String key = StorageKeys.newKey(apiKeyId);
    byte[] content = "hello attachment".getBytes();

    adapter.upload(key, new ByteArrayInputStream(content), content.length, "text/plain");

    assertThat(root.resolve(key)).exists().hasBinaryContent(content);
    assertThat(adapter.download(key)).isEqualTo(content);
  }

  @Test
  void upload_leaves_no_temporary_files_behind() throws Exception {
    String key = StorageKeys.newKey(apiKeyId);

    adapter.upload(key, "abc".getBytes(), "text/plain");

    try (Stream<Path> files = Files.list(root.resolve(apiKeyId.toString()))) {
      assertThat(files).containsExactly(root.resolve(key));
    }
  }

  @Test
  void delete_removes_the_file_and_tolerates_missing_ones() {
    String key = StorageKeys.newKey(apiKeyId);
    adapter.upload(key, "abc".getBytes(), "text/plain");

    adapter.delete(key);

    assertThat(root.resolve(key)).doesNotExist();
    assertThatCode(() -> adapter.delete(key)).doesNotThrowAnyException();
    assertThatCode(() -> adapter.delete("../../etc/passwd")).doesNotThrowAnyException();
  }

  @Test
  void download_of_missing_file_raises_storage_exception() {
    assertThatThrownBy(() -> adapter.download(StorageKeys.newKey(apiKeyId)))
        .isInstanceOf(StorageException.class);
  }

  @Test
  void keys_outside_the_generated_format_are_refused() {
    assertThatThrownBy(() -> adapter.upload("../escape/" + UUID.randomUUID(), new byte[1], null))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> adapter.upload(apiKeyId + "/report.pdf", new byte[1], null))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> adapter.download("/etc/passwd"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
