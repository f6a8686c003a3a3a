package tutoring.analytics.core.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * 캐시 엔트리
 *
 * <p>값은 통째로 덮어쓰기만 가능하며(부분 갱신 없음), {@code now > expiresAt} 이후에는 어떤 계층도 반환하지 않습니다.
 */
public record CacheEntry(String key, Object value, Instant storedAt, Instant expiresAt) {

  public CacheEntry {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(storedAt, "storedAt");
    Objects.requireNonNull(expiresAt, "expiresAt");
  }

  public static CacheEntry create(String key, Object value, Instant now, Duration ttl) {
    return new CacheEntry(key, value, now, now.plus(ttl));
  }

  public boolean isExpired(Instant now) {
    return now.isAfter(expiresAt);
  }

  /** 남은 수명. 만료된 경우 {@link Duration#ZERO} */
  public Duration remaining(Instant now) {
    Duration left = Duration.between(now, expiresAt);
    return left.isNegative() ? Duration.ZERO : left;
  }

  /** 같은 값을 다른 계층 TTL로 다시 싣는다 */
  public CacheEntry restamp(Instant now, Duration ttl) {
    return create(key, value, now, ttl);
  }
}
