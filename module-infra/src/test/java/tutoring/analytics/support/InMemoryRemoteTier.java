package tutoring.analytics.support;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import tutoring.analytics.core.domain.model.CacheEntry;
import tutoring.analytics.core.domain.model.KeyPattern;
import tutoring.analytics.core.port.out.RemoteCacheTier;
import tutoring.analytics.error.exception.CacheTierUnavailableException;

/** Redis 없이 L2 의미만 재현하는 fake. {@link #failWith}로 장애를 흉내낸다. */
public class InMemoryRemoteTier implements RemoteCacheTier {

  private final Map<String, CacheEntry> store = new ConcurrentHashMap<>();
  private final Clock clock;
  private final AtomicInteger reads = new AtomicInteger();
  private volatile boolean down;

  public InMemoryRemoteTier(Clock clock) {
    this.clock = clock;
  }

  public void failWith(boolean down) {
    this.down = down;
  }

  public int reads() {
    return reads.get();
  }

  public boolean contains(String key) {
    return get(key).isPresent();
  }

  @Override
  public Optional<CacheEntry> get(String key) {
    checkUp("get");
    reads.incrementAndGet();
    CacheEntry entry = store.get(key);
    if (entry == null || entry.isExpired(clock.instant())) {
      return Optional.empty();
    }
    return Optional.of(entry);
  }

  @Override
  public void put(CacheEntry entry, Duration ttl) {
    checkUp("put");
    store.put(entry.key(), entry);
  }

  @Override
  public boolean delete(String key) {
    checkUp("delete");
    return store.remove(key) != null;
  }

  @Override
  public long deleteByPattern(KeyPattern pattern) {
    checkUp("deleteByPattern");
    List<String> matched = store.keySet().stream().filter(pattern::matches).toList();
    matched.forEach(store::remove);
    return matched.size();
  }

  @Override
  public long clear() {
    checkUp("clear");
    long size = store.size();
    store.clear();
    return size;
  }

  private void checkUp(String operation) {
    if (down) {
      throw new CacheTierUnavailableException(
          "L2", operation, new IllegalStateException("connection refused"));
    }
  }
}
