package tutoring.analytics.infrastructure.cache.local;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import tutoring.analytics.core.domain.model.CacheEntry;
import tutoring.analytics.core.domain.model.KeyPattern;

/**
 * L1 in-process 캐시 (Caffeine)
 *
 * <h3>동시성</h3>
 *
 * <p>Caffeine 내부의 striped lock이 맵 읽기/쓰기만 보호합니다. compute() 호출은 이 계층 밖에서 일어나므로 느린 집계가 다른 키의
 * 요청을 막지 않습니다.
 *
 * <h3>만료</h3>
 *
 * <ul>
 *   <li>엔트리별 가변 만료: {@link CacheEntry#expiresAt()} 기준
 *   <li>읽기 시점에 한 번 더 만료를 확인해 만료된 엔트리는 절대 반환하지 않음
 *   <li>용량 초과 시 W-TinyLFU 정책으로 축출 (best-effort)
 * </ul>
 */
@Slf4j
public class CaffeineLocalTier {

  private final Cache<String, CacheEntry> cache;
  private final Clock clock;

  public CaffeineLocalTier(long maximumSize, Clock clock) {
    this.clock = clock;
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
            .expireAfter(new EntryExpiry(clock))
            .executor(Runnable::run)
            .build();
  }

  public Optional<CacheEntry> get(String key) {
    CacheEntry entry = cache.getIfPresent(key);
    if (entry == null) {
      return Optional.empty();
    }
    if (entry.isExpired(clock.instant())) {
      cache.asMap().remove(key, entry);
      return Optional.empty();
    }
    return Optional.of(entry);
  }

  public void put(CacheEntry entry) {
    cache.put(entry.key(), entry);
  }

  public boolean remove(String key) {
    return cache.asMap().remove(key) != null;
  }

  /**
   * 패턴에 매칭되는 키 제거
   *
   * <p>매칭 키를 먼저 스냅샷한 뒤 하나씩 제거합니다. 전체 스캔 동안 락을 잡지 않습니다.
   */
  public int removeMatching(KeyPattern pattern) {
    if (!pattern.isWildcard()) {
      return remove(pattern.base()) ? 1 : 0;
    }
    List<String> matched = cache.asMap().keySet().stream().filter(pattern::matches).toList();
    int removed = 0;
    for (String key : matched) {
      if (cache.asMap().remove(key) != null) {
        removed++;
      }
    }
    return removed;
  }

  public long clear() {
    long size = cache.estimatedSize();
    cache.invalidateAll();
    return size;
  }

  /** 만료된 엔트리 정리 (백그라운드 sweep 전용) */
  public void cleanUp() {
    cache.cleanUp();
  }

  public long size() {
    return cache.estimatedSize();
  }

  private record EntryExpiry(Clock clock) implements Expiry<String, CacheEntry> {

    @Override
    public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
      return entry.remaining(clock.instant()).toNanos();
    }

    @Override
    public long expireAfterUpdate(
        String key, CacheEntry entry, long currentTime, long currentDuration) {
      return entry.remaining(clock.instant()).toNanos();
    }

    @Override
    public long expireAfterRead(
        String key, CacheEntry entry, long currentTime, long currentDuration) {
      return currentDuration;
    }
  }
}
