package tutoring.analytics.infrastructure.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import tutoring.analytics.core.domain.model.CacheEntry;
import tutoring.analytics.core.domain.model.CacheKey;
import tutoring.analytics.core.domain.model.CacheResult;
import tutoring.analytics.core.domain.model.CacheStats;
import tutoring.analytics.core.domain.model.CacheTier;
import tutoring.analytics.core.domain.model.KeyPattern;
import tutoring.analytics.core.domain.model.TtlConfig;
import tutoring.analytics.core.port.out.RemoteCacheTier;
import tutoring.analytics.core.port.out.SnapshotStore;
import tutoring.analytics.error.exception.CacheSerializationException;
import tutoring.analytics.infrastructure.cache.codec.CacheEntryJsonCodec;
import tutoring.analytics.infrastructure.cache.flight.ComputeCoordinator;
import tutoring.analytics.infrastructure.cache.flight.ComputeCoordinator.FlightResult;
import tutoring.analytics.infrastructure.cache.invalidation.CacheInvalidationBroadcast;
import tutoring.analytics.infrastructure.cache.invalidation.CacheInvalidationPublisher;
import tutoring.analytics.infrastructure.cache.invalidation.LocalEvictionTarget;
import tutoring.analytics.infrastructure.cache.local.CaffeineLocalTier;
import tutoring.analytics.infrastructure.cache.monitor.CacheMonitor;
import tutoring.analytics.infrastructure.cache.snapshot.SnapshotWriteQueue;
import tutoring.analytics.infrastructure.executor.LogicExecutor;
import tutoring.analytics.infrastructure.executor.TaskContext;

/**
 * 3계층 분석 캐시 오케스트레이터 (L1 Caffeine → L2 Redis → L3 스냅샷 → compute)
 *
 * <h3>조회 (get)</h3>
 *
 * <ol>
 *   <li>L1 hit → 반환
 *   <li>L2 hit → L1 backfill 후 반환
 *   <li>L3에 만료되지 않은 스냅샷 → L1/L2 backfill 후 반환
 *   <li>모두 miss → 키 단위 single-flight 안에서 L1/L2 재확인 후 compute, L2 → L1 저장, L3 대기열 기록
 * </ol>
 *
 * <h3>장애 처리</h3>
 *
 * <ul>
 *   <li>L2/L3 장애는 로그 + {@code analytics.cache.tier.failure} 기록 후 해당 계층 miss로 처리 (호출자에게 전파하지 않음)
 *   <li>compute() 예외는 감싸지 않고 그대로 전파하며 재시도하지 않음
 *   <li>잘못된 키/패턴은 어떤 계층 I/O보다 먼저 거부
 * </ul>
 *
 * <h3>무효화</h3>
 *
 * <p>L1/L2만 동기적으로 제거합니다. L3는 TTL로만 갱신됩니다. 제거 후 다른 인스턴스의 L1을 위해 브로드캐스트를 발행합니다.
 *
 * <h3>통계</h3>
 *
 * <p>single-flight follower(다른 호출자의 계산을 기다린 경우)는 miss로만 기록하고 computed에는 포함하지 않습니다.
 */
@Slf4j
public class TieredAnalyticsCache implements LocalEvictionTarget, AutoCloseable {

  private static final String COMPONENT = "TieredAnalyticsCache";

  private final CaffeineLocalTier l1;
  private final RemoteCacheTier l2;
  private final SnapshotStore l3;
  private final SnapshotWriteQueue snapshotQueue;
  private final ComputeCoordinator coordinator;
  private final CacheMonitor monitor;
  private final CacheInvalidationPublisher publisher;
  private final CacheEntryJsonCodec codec;
  private final LogicExecutor executor;
  private final Clock clock;
  private final String instanceId;

  /**
   * @param snapshotStore L3 저장소. null이면 L3 계층을 사용하지 않는다
   * @param publisher 무효화 브로드캐스트 발행자. null이면 발행하지 않는다
   */
  @Builder
  public TieredAnalyticsCache(
      CaffeineLocalTier localTier,
      RemoteCacheTier remoteTier,
      SnapshotStore snapshotStore,
      SnapshotWriteQueue snapshotQueue,
      ComputeCoordinator coordinator,
      CacheMonitor monitor,
      CacheInvalidationPublisher publisher,
      CacheEntryJsonCodec codec,
      LogicExecutor executor,
      Clock clock,
      String instanceId) {
    this.l1 = Objects.requireNonNull(localTier, "localTier");
    this.l2 = Objects.requireNonNull(remoteTier, "remoteTier");
    this.l3 = snapshotStore;
    this.snapshotQueue = snapshotStore == null ? null : Objects.requireNonNull(snapshotQueue);
    this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
    this.monitor = Objects.requireNonNull(monitor, "monitor");
    this.publisher = publisher == null ? CacheInvalidationPublisher.noop() : publisher;
    this.codec = Objects.requireNonNull(codec, "codec");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.clock = clock == null ? Clock.systemUTC() : clock;
    this.instanceId = instanceId == null ? "local" : instanceId;
  }

  // ==================== get ====================

  public <T> CacheResult<T> get(String key, Class<T> type, Supplier<T> compute, TtlConfig ttl) {
    return get(CacheKey.parse(key), type, compute, ttl);
  }

  public <T> CacheResult<T> get(CacheKey cacheKey, Class<T> type, Supplier<T> compute, TtlConfig ttl) {
    Objects.requireNonNull(compute, "compute");
    Objects.requireNonNull(ttl, "ttl");
    String key = cacheKey.value();

    Optional<T> fromL1 = readL1(key, type);
    if (fromL1.isPresent()) {
      monitor.recordHit(CacheTier.L1);
      log.debug("[TieredAnalyticsCache] L1 hit: key={}", key);
      return CacheResult.of(fromL1.get(), CacheTier.L1);
    }

    Optional<T> fromL2 = readL2(key, type, ttl);
    if (fromL2.isPresent()) {
      monitor.recordHit(CacheTier.L2);
      log.debug("[TieredAnalyticsCache] L2 hit: key={}", key);
      return CacheResult.of(fromL2.get(), CacheTier.L2);
    }

    Optional<T> fromL3 = readL3(key, type, ttl);
    if (fromL3.isPresent()) {
      monitor.recordHit(CacheTier.L3);
      log.debug("[TieredAnalyticsCache] L3 hit: key={}", key);
      return CacheResult.of(fromL3.get(), CacheTier.L3);
    }

    FlightResult<CacheResult<T>> flight =
        coordinator.execute(key, () -> loadOrCompute(key, type, compute, ttl));
    CacheResult<T> result = flight.value();
    recordFlight(flight.leader(), result.tier());
    return result;
  }

  /** single-flight 리더 전용: 대기 중 다른 호출자가 채웠을 수 있으므로 L1/L2를 다시 확인한 뒤 계산 */
  private <T> CacheResult<T> loadOrCompute(
      String key, Class<T> type, Supplier<T> compute, TtlConfig ttl) {
    Optional<T> fromL1 = readL1(key, type);
    if (fromL1.isPresent()) {
      return CacheResult.of(fromL1.get(), CacheTier.L1);
    }
    Optional<T> fromL2 = readL2(key, type, ttl);
    if (fromL2.isPresent()) {
      return CacheResult.of(fromL2.get(), CacheTier.L2);
    }

    log.debug("[TieredAnalyticsCache] Miss, computing: key={}", key);
    T value = compute.get();
    writeComputed(key, value, ttl);
    return CacheResult.of(value, CacheTier.COMPUTE);
  }

  /** follower는 리더가 실제로 계산한 경우에만 miss, 재확인에서 찾은 경우에는 해당 계층 hit로 기록 */
  private void recordFlight(boolean leader, CacheTier tier) {
    if (tier.isHit()) {
      monitor.recordHit(tier);
      return;
    }
    monitor.recordMiss();
    if (leader) {
      monitor.recordComputed();
    }
  }

  // ==================== set / invalidate ====================

  /** 설정된 모든 계층에 무조건 덮어쓴다. L3는 이 명시적 경로에서만 직접 쓴다. */
  public boolean set(String key, Object value, TtlConfig ttl) {
    return set(CacheKey.parse(key), value, ttl);
  }

  /**
   * TTL이 있는 모든 계층을 덮어쓴다.
   *
   * @return 공유 계층(L2, 활성화된 L3) 쓰기가 모두 성공했는지. false여도 L1에는 기록되어 있다.
   */
  public boolean set(CacheKey cacheKey, Object value, TtlConfig ttl) {
    Objects.requireNonNull(value, "value");
    Objects.requireNonNull(ttl, "ttl");
    String key = cacheKey.value();
    Instant now = clock.instant();
    boolean shared = true;

    if (ttl.hasL2()) {
      shared = writeL2(CacheEntry.create(key, value, now, ttl.l2()), ttl.l2());
    }
    if (ttl.hasL1()) {
      l1.put(CacheEntry.create(key, value, now, ttl.l1()));
    }
    if (ttl.hasL3() && l3 != null) {
      CacheEntry snapshot = CacheEntry.create(key, value, now, ttl.l3());
      boolean saved =
          executor.executeOrCatch(
              () -> {
                l3.save(snapshot, ttl.l3());
                return true;
              },
              degrade(CacheTier.L3, false),
              TaskContext.of(COMPONENT, "setL3", key));
      shared = shared && saved;
    }
    return shared;
  }

  /** L1/L2에서 동기 제거. L3는 건드리지 않는다. */
  public void invalidate(String key) {
    invalidate(CacheKey.parse(key));
  }

  public void invalidate(CacheKey cacheKey) {
    String key = cacheKey.value();
    l1.remove(key);
    executor.executeOrCatch(
        () -> l2.delete(key),
        degrade(CacheTier.L2, false),
        TaskContext.of(COMPONENT, "invalidate", key));
    publisher.publish(CacheInvalidationBroadcast.evict(key, instanceId, clock.millis()));
    log.debug("[TieredAnalyticsCache] Invalidated: key={}", key);
  }

  /**
   * 패턴 무효화
   *
   * @return L1과 L2에서 제거된 엔트리 수의 합
   */
  public long invalidatePattern(String pattern) {
    KeyPattern keyPattern = KeyPattern.parse(pattern);

    long removedL1 = l1.removeMatching(keyPattern);
    long removedL2 =
        executor.executeOrCatch(
            () -> l2.deleteByPattern(keyPattern),
            degrade(CacheTier.L2, 0L),
            TaskContext.of(COMPONENT, "invalidatePattern", pattern));
    publisher.publish(
        CacheInvalidationBroadcast.evictPattern(keyPattern.value(), instanceId, clock.millis()));

    long removed = removedL1 + removedL2;
    if (removed > 0) {
      log.info(
          "[TieredAnalyticsCache] Invalidated pattern: {} (L1={}, L2={})",
          pattern,
          removedL1,
          removedL2);
    }
    return removed;
  }

  /** L1 전체와 접두사 아래의 L2 키 전체를 제거 */
  public long clearAll() {
    long removedL1 = l1.clear();
    long removedL2 =
        executor.executeOrCatch(
            l2::clear,
            degrade(CacheTier.L2, 0L),
            TaskContext.of(COMPONENT, "clearAll"));
    publisher.publish(CacheInvalidationBroadcast.clearAll(instanceId, clock.millis()));
    log.info("[TieredAnalyticsCache] Cleared all: L1={}, L2={}", removedL1, removedL2);
    return removedL1 + removedL2;
  }

  /** 다른 인스턴스의 브로드캐스트를 L1에만 적용 */
  @Override
  public void evictLocal(CacheInvalidationBroadcast broadcast) {
    switch (broadcast.scope()) {
      case EVICT -> l1.remove(broadcast.target());
      case EVICT_PATTERN -> l1.removeMatching(KeyPattern.parse(broadcast.target()));
      case CLEAR_ALL -> l1.clear();
    }
    log.debug(
        "[TieredAnalyticsCache] L1 evicted by peer: scope={}, target={}, source={}",
        broadcast.scope(),
        broadcast.target(),
        broadcast.sourceInstanceId());
  }

  // ==================== background ====================

  /** L1 만료 엔트리 정리 */
  public void sweepExpired() {
    l1.cleanUp();
  }

  /** L3 대기열을 스냅샷 저장소로 반영 */
  public int refreshSnapshots() {
    if (l3 == null) {
      return 0;
    }
    return snapshotQueue.drainTo(l3);
  }

  public CacheStats getStats() {
    return monitor.getStats();
  }

  public void resetStats() {
    monitor.reset();
  }

  /** 종료 시 대기 중인 L3 스냅샷을 반영하고 L1을 비운다 */
  @Override
  public void close() {
    int flushed =
        executor.executeOrCatch(
            this::refreshSnapshots, degrade(CacheTier.L3, 0), TaskContext.of(COMPONENT, "close"));
    long released = l1.clear();
    log.info("[TieredAnalyticsCache] Closed: snapshotsFlushed={}, l1Released={}", flushed, released);
  }

  // ==================== tiers ====================

  private <T> Optional<T> readL1(String key, Class<T> type) {
    return l1.get(key).flatMap(entry -> convert(entry, type, CacheTier.L1));
  }

  private <T> Optional<T> readL2(String key, Class<T> type, TtlConfig ttl) {
    Optional<CacheEntry> entry =
        executor.executeOrCatch(
            () -> l2.get(key),
            degrade(CacheTier.L2, Optional.<CacheEntry>empty()),
            TaskContext.of(COMPONENT, "readL2", key));
    Optional<T> value = entry.flatMap(e -> convert(e, type, CacheTier.L2));
    value.ifPresent(v -> backfillL1(entry.get(), v, ttl));
    return value;
  }

  private <T> Optional<T> readL3(String key, Class<T> type, TtlConfig ttl) {
    if (l3 == null) {
      return Optional.empty();
    }
    Optional<CacheEntry> entry =
        executor.executeOrCatch(
            () -> l3.find(key),
            degrade(CacheTier.L3, Optional.<CacheEntry>empty()),
            TaskContext.of(COMPONENT, "readL3", key));
    Optional<T> value = entry.flatMap(e -> convert(e, type, CacheTier.L3));
    value.ifPresent(
        v -> {
          backfillL2(entry.get(), ttl);
          backfillL1(entry.get(), v, ttl);
        });
    return value;
  }

  private void writeComputed(String key, Object value, TtlConfig ttl) {
    if (value == null) {
      return;
    }
    Instant now = clock.instant();
    if (ttl.hasL2()) {
      writeL2(CacheEntry.create(key, value, now, ttl.l2()), ttl.l2());
    }
    if (ttl.hasL1()) {
      l1.put(CacheEntry.create(key, value, now, ttl.l1()));
    }
    if (ttl.hasL3() && l3 != null) {
      snapshotQueue.offer(CacheEntry.create(key, value, now, ttl.l3()), ttl.l3());
    }
  }

  /** 하위 계층 값의 남은 수명을 넘지 않도록 L1 TTL을 자른다 */
  private void backfillL1(CacheEntry source, Object typedValue, TtlConfig ttl) {
    if (!ttl.hasL1()) {
      return;
    }
    Instant now = clock.instant();
    Duration lifetime = min(ttl.l1(), source.remaining(now));
    if (!lifetime.isZero()) {
      l1.put(CacheEntry.create(source.key(), typedValue, now, lifetime));
    }
  }

  private void backfillL2(CacheEntry source, TtlConfig ttl) {
    if (!ttl.hasL2()) {
      return;
    }
    Instant now = clock.instant();
    Duration lifetime = min(ttl.l2(), source.remaining(now));
    if (!lifetime.isZero()) {
      writeL2(source.restamp(now, lifetime), lifetime);
    }
  }

  private boolean writeL2(CacheEntry entry, Duration ttl) {
    return executor.executeOrCatch(
        () -> {
          l2.put(entry, ttl);
          return true;
        },
        degrade(CacheTier.L2, false),
        TaskContext.of(COMPONENT, "writeL2", entry.key()));
  }

  /** 저장된 값이 요청 타입으로 변환되지 않으면 해당 계층 miss로 취급 */
  private <T> Optional<T> convert(CacheEntry entry, Class<T> type, CacheTier tier) {
    try {
      return Optional.ofNullable(codec.convert(entry.key(), entry.value(), type));
    } catch (CacheSerializationException e) {
      log.warn(
          "[TieredAnalyticsCache] {} value not convertible to {}: key={}",
          tier,
          type.getSimpleName(),
          entry.key());
      monitor.recordTierFailure(tier);
      return Optional.empty();
    }
  }

  /** 계층 장애를 기록하고 miss에 해당하는 기본값을 돌려주는 복구 함수 */
  private <T> Function<Throwable, T> degrade(CacheTier tier, T fallback) {
    return e -> {
      monitor.recordTierFailure(tier);
      return fallback;
    };
  }

  private static Duration min(Duration a, Duration b) {
    return a.compareTo(b) <= 0 ? a : b;
  }
}
