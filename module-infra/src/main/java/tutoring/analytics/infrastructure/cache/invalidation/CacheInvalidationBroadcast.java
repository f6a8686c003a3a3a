package tutoring.analytics.infrastructure.cache.invalidation;

import java.util.Objects;

/**
 * 인스턴스 간 L1 무효화 메시지
 *
 * <p>L2는 공유 저장소이므로 발행 인스턴스가 이미 지웠습니다. 수신 인스턴스는 자신의 L1만 정리합니다.
 *
 * @param scope 무효화 범위
 * @param target 키 또는 패턴 (CLEAR_ALL이면 빈 문자열)
 * @param sourceInstanceId 발행 인스턴스 ID (Self-skip 용)
 * @param timestamp 발행 시각 (epoch millis)
 */
public record CacheInvalidationBroadcast(
    InvalidationScope scope, String target, String sourceInstanceId, long timestamp) {

  public CacheInvalidationBroadcast {
    Objects.requireNonNull(scope, "scope");
    Objects.requireNonNull(sourceInstanceId, "sourceInstanceId");
    target = target == null ? "" : target;
  }

  public static CacheInvalidationBroadcast evict(String key, String instanceId, long now) {
    return new CacheInvalidationBroadcast(InvalidationScope.EVICT, key, instanceId, now);
  }

  public static CacheInvalidationBroadcast evictPattern(
      String pattern, String instanceId, long now) {
    return new CacheInvalidationBroadcast(InvalidationScope.EVICT_PATTERN, pattern, instanceId, now);
  }

  public static CacheInvalidationBroadcast clearAll(String instanceId, long now) {
    return new CacheInvalidationBroadcast(InvalidationScope.CLEAR_ALL, "", instanceId, now);
  }
}
