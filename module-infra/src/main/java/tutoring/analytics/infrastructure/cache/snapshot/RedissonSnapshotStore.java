package tutoring.analytics.infrastructure.cache.snapshot;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.redisson.api.RMapCache;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import tutoring.analytics.core.domain.model.CacheEntry;
import tutoring.analytics.core.port.out.SnapshotStore;
import tutoring.analytics.infrastructure.cache.codec.CacheEntryJsonCodec;
import tutoring.analytics.infrastructure.executor.LogicExecutor;
import tutoring.analytics.infrastructure.executor.TaskContext;
import tutoring.analytics.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * L3 사전 집계 스냅샷 저장소
 *
 * <p>Redisson {@link RMapCache} 하나에 엔트리별 TTL로 저장합니다. 패턴 무효화 대상이 아니므로 키 공간을 L2와 분리해 두었습니다.
 */
public class RedissonSnapshotStore implements SnapshotStore {

  private static final String COMPONENT = "SnapshotStore";

  private final RMapCache<String, String> snapshots;
  private final CacheEntryJsonCodec codec;
  private final LogicExecutor executor;
  private final Clock clock;
  private final ExceptionTranslator translator = ExceptionTranslator.forRemoteTier("L3");

  public RedissonSnapshotStore(
      RedissonClient redissonClient,
      String mapName,
      CacheEntryJsonCodec codec,
      LogicExecutor executor,
      Clock clock) {
    this.snapshots = redissonClient.getMapCache(mapName, StringCodec.INSTANCE);
    this.codec = codec;
    this.executor = executor;
    this.clock = clock;
  }

  @Override
  public Optional<CacheEntry> find(String key) {
    return executor.executeWithTranslation(
        () -> {
          String json = snapshots.get(key);
          if (json == null) {
            return Optional.<CacheEntry>empty();
          }
          CacheEntry entry = codec.decode(key, json);
          return entry.isExpired(clock.instant()) ? Optional.<CacheEntry>empty() : Optional.of(entry);
        },
        translator,
        TaskContext.of(COMPONENT, "find", key));
  }

  @Override
  public void save(CacheEntry entry, Duration ttl) {
    executor.executeWithTranslation(
        () -> snapshots.fastPut(entry.key(), codec.encode(entry), ttl.toMillis(), TimeUnit.MILLISECONDS),
        translator,
        TaskContext.of(COMPONENT, "save", entry.key()));
  }

  @Override
  public int size() {
    return executor.executeWithTranslation(
        snapshots::size, translator, TaskContext.of(COMPONENT, "size"));
  }
}
