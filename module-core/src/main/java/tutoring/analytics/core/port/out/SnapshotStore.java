package tutoring.analytics.core.port.out;

import java.time.Duration;
import java.util.Optional;
import tutoring.analytics.core.domain.model.CacheEntry;

/**
 * 사전 집계 스냅샷 저장소(L3) 포트
 *
 * <p>읽기 경로에서는 조회만 하고, 쓰기는 백그라운드 갱신 또는 명시적 set에서만 일어납니다. 동기 무효화 대상이 아니며 TTL로 신선도를 보장합니다.
 */
public interface SnapshotStore {

  Optional<CacheEntry> find(String key);

  void save(CacheEntry entry, Duration ttl);

  int size();
}
