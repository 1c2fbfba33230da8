package io.formrelay.backend.stats;

import io.formrelay.backend.api.ApiResponse;
import io.formrelay.backend.stats.StatsService.DashboardStats;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatsController {

  private final StatsService statsService;

  public StatsController(StatsService statsService) {
    this.statsService = statsService;
  }

  @GetMapping("/api/stats")
  public ResponseEntity<ApiResponse<DashboardStats>> getStats() {
    return ResponseEntity.ok(ApiResponse.ok(statsService.getStats()));
  }
}
