package tutoring.analytics.infrastructure.cache.invalidation;

/**
 * L1 무효화 브로드캐스트 발행자
 *
 * <p>발행 실패는 예외로 전파하지 않습니다. 수신 측 L1은 짧은 TTL로 결국 정리됩니다.
 */
public interface CacheInvalidationPublisher {

  void publish(CacheInvalidationBroadcast broadcast);

  /** 단일 인스턴스 배포용 */
  static CacheInvalidationPublisher noop() {
    return broadcast -> {};
  }
}
