package tutoring.analytics.core.domain.model;

/**
 * 조회 결과
 *
 * @param value 값
 * @param tier 값을 제공한 계층
 */
public record CacheResult<T>(T value, CacheTier tier) {

  public static <T> CacheResult<T> of(T value, CacheTier tier) {
    return new CacheResult<>(value, tier);
  }
}
