package io.formrelay.backend.apikey;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ApiKeyRepository extends JpaRepository<ApiKey, UUID> {

  /** Exact, case-sensitive match on the public secret. */
  Optional<ApiKey> findBySecret(String secret);

  List<ApiKey> findAllByOrderByCreatedAtDesc();

  long countByActiveTrue();

  /**
   * Increments the usage counter inside a single UPDATE so concurrent submissions to the same key
   * never lose an increment. Returns the number of rows touched (0 if the key was deleted).
   */
  @Modifying(clearAutomatically = true)
  @Query(
      """
      UPDATE ApiKey k SET k.usageCount = k.usageCount + 1, k.lastUsedAt = :usedAt
      WHERE k.id = :id
      """)
  int incrementUsage(@Param("id") UUID id, @Param("usedAt") Instant usedAt);
}
