package tutoring.analytics.infrastructure.cache.remote;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RBucket;
import org.redisson.api.RKeys;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import tutoring.analytics.common.function.ThrowingSupplier;
import tutoring.analytics.core.domain.model.CacheEntry;
import tutoring.analytics.core.domain.model.KeyPattern;
import tutoring.analytics.core.port.out.RemoteCacheTier;
import tutoring.analytics.infrastructure.cache.codec.CacheEntryJsonCodec;
import tutoring.analytics.infrastructure.executor.LogicExecutor;
import tutoring.analytics.infrastructure.executor.TaskContext;
import tutoring.analytics.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * L2 공유 캐시 (Redis, Redisson)
 *
 * <h3>저장 방식</h3>
 *
 * <ul>
 *   <li>키: {@code <keyPrefix><cacheKey>} 문자열 버킷 (StringCodec)
 *   <li>값: {@link CacheEntryJsonCodec} JSON 봉투, Redis TTL = 엔트리 TTL
 * </ul>
 *
 * <h3>패턴 삭제</h3>
 *
 * <p>KEYS 대신 커서 기반 SCAN({@code getKeysByPattern(glob, count)})으로 매칭 키를 모은 뒤 배치 단위로 DEL 합니다.
 *
 * <h3>장애 처리</h3>
 *
 * <p>모든 호출은 {@code remoteTier} 서킷 브레이커를 거칩니다. 실패는 {@code CacheTierUnavailableException}으로 변환되며,
 * OPEN 상태에서는 Redis에 접근하지 않고 즉시 실패합니다.
 */
@Slf4j
public class RedissonRemoteTier implements RemoteCacheTier {

  private static final String TIER = "L2";
  private static final String COMPONENT = "RemoteTier";
  private static final int SCAN_COUNT = 100;

  private final RedissonClient redissonClient;
  private final CacheEntryJsonCodec codec;
  private final CircuitBreaker circuitBreaker;
  private final LogicExecutor executor;
  private final Clock clock;
  private final String keyPrefix;
  private final ExceptionTranslator translator = ExceptionTranslator.forRemoteTier(TIER);

  public RedissonRemoteTier(
      RedissonClient redissonClient,
      CacheEntryJsonCodec codec,
      CircuitBreaker circuitBreaker,
      LogicExecutor executor,
      Clock clock,
      String keyPrefix) {
    this.redissonClient = redissonClient;
    this.codec = codec;
    this.circuitBreaker = circuitBreaker;
    this.executor = executor;
    this.clock = clock;
    this.keyPrefix = Objects.requireNonNull(keyPrefix, "keyPrefix");
  }

  @Override
  public Optional<CacheEntry> get(String key) {
    return call("get", key, () -> read(key));
  }

  @Override
  public void put(CacheEntry entry, Duration ttl) {
    call(
        "put",
        entry.key(),
        () -> {
          bucket(entry.key()).set(codec.encode(entry), ttl);
          return null;
        });
  }

  @Override
  public boolean delete(String key) {
    return call("delete", key, () -> bucket(key).delete());
  }

  @Override
  public long deleteByPattern(KeyPattern pattern) {
    return call("deleteByPattern", pattern.value(), () -> scanAndDelete(pattern));
  }

  @Override
  public long clear() {
    return call("clear", keyPrefix, () -> deleteScanned(keyPrefix + KeyPattern.WILDCARD, null));
  }

  private Optional<CacheEntry> read(String key) throws Exception {
    String json = bucket(key).get();
    if (json == null) {
      return Optional.empty();
    }
    CacheEntry entry = codec.decode(key, json);
    if (entry.isExpired(clock.instant())) {
      return Optional.empty();
    }
    return Optional.of(entry);
  }

  private long scanAndDelete(KeyPattern pattern) {
    RKeys keys = redissonClient.getKeys();
    if (!pattern.isWildcard()) {
      return keys.delete(keyPrefix + pattern.base());
    }
    long removed = deleteScanned(keyPrefix + pattern.toRedisGlob(), pattern);
    if (pattern.kind() == KeyPattern.Kind.SEGMENT_SCOPE) {
      removed += keys.delete(keyPrefix + pattern.base());
    }
    return removed;
  }

  /** SCAN 결과를 SCAN_COUNT 단위로 나누어 삭제. matcher가 있으면 glob 결과를 한 번 더 거른다. */
  private long deleteScanned(String glob, KeyPattern matcher) {
    RKeys keys = redissonClient.getKeys();
    List<String> batch = new ArrayList<>(SCAN_COUNT);
    long removed = 0;
    for (String name : keys.getKeysByPattern(glob, SCAN_COUNT)) {
      if (matcher != null && !matcher.matches(name.substring(keyPrefix.length()))) {
        continue;
      }
      batch.add(name);
      if (batch.size() >= SCAN_COUNT) {
        removed += keys.delete(batch.toArray(new String[0]));
        batch.clear();
      }
    }
    if (!batch.isEmpty()) {
      removed += keys.delete(batch.toArray(new String[0]));
    }
    return removed;
  }

  private RBucket<String> bucket(String key) {
    return redissonClient.getBucket(keyPrefix + key, StringCodec.INSTANCE);
  }

  private <T> T call(String operation, String target, ThrowingSupplier<T> task) {
    return executor.executeWithTranslation(
        () -> circuitBreaker.executeCheckedSupplier(task::get),
        translator,
        TaskContext.of(COMPONENT, operation, target));
  }
}
