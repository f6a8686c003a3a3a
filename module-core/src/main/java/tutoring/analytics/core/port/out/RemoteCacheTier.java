package tutoring.analytics.core.port.out;

import java.time.Duration;
import java.util.Optional;
import tutoring.analytics.core.domain.model.CacheEntry;
import tutoring.analytics.core.domain.model.KeyPattern;

/**
 * 공유 원격 캐시 계층(L2) 포트
 *
 * <p>구현체는 저장소 장애를 {@code CacheTierUnavailableException}으로 변환해 던집니다. 오케스트레이터가 이를 miss로 취급합니다.
 */
public interface RemoteCacheTier {

  /** 만료되지 않은 엔트리 조회 */
  Optional<CacheEntry> get(String key);

  void put(CacheEntry entry, Duration ttl);

  boolean delete(String key);

  /**
   * 패턴에 매칭되는 키 삭제
   *
   * <p>전체 키 공간 조회(KEYS) 대신 커서 기반 SCAN을 사용해야 합니다.
   *
   * @return 삭제된 키 개수
   */
  long deleteByPattern(KeyPattern pattern);

  /** 이 계층이 소유한 모든 키 삭제 */
  long clear();
}
