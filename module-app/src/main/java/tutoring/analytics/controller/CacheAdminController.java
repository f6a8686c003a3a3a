package tutoring.analytics.controller;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import tutoring.analytics.controller.dto.DomainEventRequest;
import tutoring.analytics.controller.dto.WarmRequest;
import tutoring.analytics.controller.dto.WarmResult;
import tutoring.analytics.core.domain.model.CacheStats;
import tutoring.analytics.infrastructure.cache.TieredAnalyticsCache;
import tutoring.analytics.response.ApiResponse;
import tutoring.analytics.service.invalidation.CacheInvalidationTrigger;
import tutoring.analytics.service.warmup.CacheWarmer;

/**
 * 캐시 관리 API
 *
 * <p>엔드포인트:
 *
 * <ul>
 *   <li>GET /api/admin/cache/stats - 적중률 통계
 *   <li>POST /api/admin/cache/stats/reset - 통계 초기화 (캐시 데이터 유지)
 *   <li>POST /api/admin/cache/warm - 쿼리 목록 워밍
 *   <li>POST /api/admin/cache/warm/users/{userId} - 사용자 대시보드 워밍
 *   <li>DELETE /api/admin/cache/keys/{key} - 단일 키 무효화
 *   <li>DELETE /api/admin/cache/keys?pattern= - 패턴 무효화
 *   <li>DELETE /api/admin/cache/keys/all - 전체 삭제
 *   <li>POST /api/admin/cache/events - 도메인 이벤트 수동 발행
 * </ul>
 */
@Validated
@RestController
@RequestMapping("/api/admin/cache")
@RequiredArgsConstructor
public class CacheAdminController {

  private final TieredAnalyticsCache cache;
  private final CacheWarmer warmer;
  private final CacheInvalidationTrigger trigger;

  @GetMapping("/stats")
  public ResponseEntity<ApiResponse<CacheStats>> stats() {
    return ResponseEntity.ok(ApiResponse.success(cache.getStats()));
  }

  @PostMapping("/stats/reset")
  public ResponseEntity<ApiResponse<CacheStats>> resetStats() {
    cache.resetStats();
    return ResponseEntity.ok(ApiResponse.success(cache.getStats()));
  }

  @PostMapping("/warm")
  public ResponseEntity<ApiResponse<List<WarmResult>>> warm(
      @Valid @RequestBody WarmRequest request) {
    return ResponseEntity.ok(
        ApiResponse.success(WarmResult.from(warmer.warm(request.toQueries()))));
  }

  @PostMapping("/warm/users/{userId}")
  public ResponseEntity<ApiResponse<List<WarmResult>>> warmUser(
      @PathVariable @NotBlank String userId) {
    return ResponseEntity.ok(
        ApiResponse.success(WarmResult.from(warmer.warmUserDashboard(userId))));
  }

  @DeleteMapping("/keys/all")
  public ResponseEntity<ApiResponse<Map<String, Long>>> clearAll() {
    return ResponseEntity.ok(ApiResponse.success(Map.of("removed", cache.clearAll())));
  }

  @DeleteMapping("/keys/{key}")
  public ResponseEntity<ApiResponse<String>> invalidate(@PathVariable String key) {
    cache.invalidate(key);
    return ResponseEntity.ok(ApiResponse.success(key));
  }

  @DeleteMapping("/keys")
  public ResponseEntity<ApiResponse<Map<String, Long>>> invalidatePattern(
      @RequestParam @NotBlank String pattern) {
    return ResponseEntity.ok(
        ApiResponse.success(Map.of("removed", cache.invalidatePattern(pattern))));
  }

  @PostMapping("/events")
  public ResponseEntity<ApiResponse<Map<String, Long>>> fireEvent(
      @Valid @RequestBody DomainEventRequest request) {
    long removed = trigger.onEvent(request.eventType(), request.params());
    return ResponseEntity.ok(ApiResponse.success(Map.of("removed", removed)));
  }
}
