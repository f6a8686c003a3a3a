package tutoring.analytics.infrastructure.cache.snapshot;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import tutoring.analytics.core.domain.model.CacheEntry;
import tutoring.analytics.core.port.out.SnapshotStore;
import tutoring.analytics.error.exception.CacheSerializationException;
import tutoring.analytics.error.exception.CacheTierUnavailableException;

/**
 * L3 쓰기 대기열
 *
 * <p>읽기 경로는 L3에 직접 쓰지 않고 이 대기열에 기록만 합니다. 같은 키는 마지막 값만 남습니다. 용량을 넘는 신규 키는 버려지며, 다음 계산
 * 때 다시 기록됩니다. 신규 키는 {@code reserved} 카운터로 자리를 먼저 확보하므로 동시 기록에서도 용량을 넘지 않습니다.
 */
@Slf4j
public class SnapshotWriteQueue {

  private final Map<String, Pending> pending = new ConcurrentHashMap<>();
  private final int capacity;
  private final Clock clock;
  private final AtomicLong dropped = new AtomicLong();
  private final AtomicInteger reserved = new AtomicInteger();

  public SnapshotWriteQueue(int capacity, Clock clock) {
    this.capacity = capacity;
    this.clock = clock;
  }

  public boolean offer(CacheEntry entry, Duration ttl) {
    AtomicBoolean accepted = new AtomicBoolean(true);
    pending.compute(
        entry.key(),
        (key, previous) -> {
          if (previous == null && !reserveSlot()) {
            accepted.set(false);
            return null;
          }
          return new Pending(entry, ttl);
        });
    if (!accepted.get()) {
      dropped.incrementAndGet();
      log.debug("[SnapshotQueue] Capacity reached, dropping: key={}", entry.key());
    }
    return accepted.get();
  }

  private boolean reserveSlot() {
    if (reserved.incrementAndGet() > capacity) {
      reserved.decrementAndGet();
      return false;
    }
    return true;
  }

  private void release(String key, Pending item) {
    if (pending.remove(key, item)) {
      reserved.decrementAndGet();
    }
  }

  /**
   * 대기 중인 스냅샷을 저장소로 옮긴다.
   *
   * <p>저장소 장애 시 남은 항목은 다음 주기에 다시 시도하도록 대기열에 남긴다.
   *
   * @return 저장된 개수
   */
  public int drainTo(SnapshotStore store) {
    int written = 0;
    Iterator<Map.Entry<String, Pending>> it = pending.entrySet().iterator();
    while (it.hasNext()) {
      Map.Entry<String, Pending> next = it.next();
      Pending item = next.getValue();
      try {
        store.save(item.entry().restamp(clock.instant(), item.ttl()), item.ttl());
      } catch (CacheTierUnavailableException e) {
        log.warn("[SnapshotQueue] Drain interrupted, {} pending: {}", pending.size(), e.getMessage());
        return written;
      } catch (CacheSerializationException e) {
        log.warn("[SnapshotQueue] Unserializable snapshot discarded: key={}", next.getKey(), e);
        release(next.getKey(), item);
        continue;
      }
      release(next.getKey(), item);
      written++;
    }
    return written;
  }

  public int size() {
    return pending.size();
  }

  public long droppedCount() {
    return dropped.get();
  }

  private record Pending(CacheEntry entry, Duration ttl) {}
}
