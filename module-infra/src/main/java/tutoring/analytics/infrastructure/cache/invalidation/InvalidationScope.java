package tutoring.analytics.infrastructure.cache.invalidation;

/** 인스턴스 간 L1 무효화 범위 */
public enum InvalidationScope {
  /** 단일 키 */
  EVICT,
  /** 키 패턴 */
  EVICT_PATTERN,
  /** L1 전체 */
  CLEAR_ALL
}
