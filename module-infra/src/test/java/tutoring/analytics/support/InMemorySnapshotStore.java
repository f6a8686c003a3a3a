package tutoring.analytics.support;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import tutoring.analytics.core.domain.model.CacheEntry;
import tutoring.analytics.core.port.out.SnapshotStore;
import tutoring.analytics.error.exception.CacheTierUnavailableException;

public class InMemorySnapshotStore implements SnapshotStore {

  private final Map<String, CacheEntry> store = new ConcurrentHashMap<>();
  private final Clock clock;
  private volatile boolean down;

  public InMemorySnapshotStore(Clock clock) {
    this.clock = clock;
  }

  public void failWith(boolean down) {
    this.down = down;
  }

  public boolean contains(String key) {
    return store.containsKey(key);
  }

  @Override
  public Optional<CacheEntry> find(String key) {
    if (down) {
      throw new CacheTierUnavailableException("L3", "find", new IllegalStateException("down"));
    }
    CacheEntry entry = store.get(key);
    if (entry == null || entry.isExpired(clock.instant())) {
      return Optional.empty();
    }
    return Optional.of(entry);
  }

  @Override
  public void save(CacheEntry entry, Duration ttl) {
    if (down) {
      throw new CacheTierUnavailableException("L3", "save", new IllegalStateException("down"));
    }
    store.put(entry.key(), entry);
  }

  @Override
  public int size() {
    return store.size();
  }
}
