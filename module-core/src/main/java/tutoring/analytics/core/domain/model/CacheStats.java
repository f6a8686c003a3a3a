package tutoring.analytics.core.domain.model;

/**
 * 캐시 통계 스냅샷
 *
 * <p>{@code hitRate = hits / (hits + misses)}, 요청이 없으면 0
 */
public record CacheStats(
    long hitsL1, long hitsL2, long hitsL3, long misses, long computed, double hitRate) {

  public static CacheStats of(long hitsL1, long hitsL2, long hitsL3, long misses, long computed) {
    long hits = hitsL1 + hitsL2 + hitsL3;
    long total = hits + misses;
    double rate = total == 0 ? 0.0 : (double) hits / total;
    return new CacheStats(hitsL1, hitsL2, hitsL3, misses, computed, rate);
  }

  public static CacheStats empty() {
    return of(0, 0, 0, 0, 0);
  }

  public long hits() {
    return hitsL1 + hitsL2 + hitsL3;
  }

  public long requests() {
    return hits() + misses;
  }
}
