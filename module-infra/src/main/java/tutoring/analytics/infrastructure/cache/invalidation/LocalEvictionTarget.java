package tutoring.analytics.infrastructure.cache.invalidation;

/** 다른 인스턴스의 브로드캐스트를 자신의 L1에 적용하는 대상 */
public interface LocalEvictionTarget {

  void evictLocal(CacheInvalidationBroadcast broadcast);
}
