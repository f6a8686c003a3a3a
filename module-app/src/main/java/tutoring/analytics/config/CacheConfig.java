package tutoring.analytics.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.Nullable;
import tutoring.analytics.core.domain.invalidation.InvalidationRuleRegistry;
import tutoring.analytics.core.domain.model.TtlConfig;
import tutoring.analytics.core.domain.ttl.TtlPolicy;
import tutoring.analytics.core.port.out.RemoteCacheTier;
import tutoring.analytics.core.port.out.SnapshotStore;
import tutoring.analytics.infrastructure.cache.TieredAnalyticsCache;
import tutoring.analytics.infrastructure.cache.codec.CacheEntryJsonCodec;
import tutoring.analytics.infrastructure.cache.flight.ComputeCoordinator;
import tutoring.analytics.infrastructure.cache.flight.LocalSingleFlight;
import tutoring.analytics.infrastructure.cache.flight.RedissonSingleFlight;
import tutoring.analytics.infrastructure.cache.invalidation.CacheInvalidationPublisher;
import tutoring.analytics.infrastructure.cache.local.CaffeineLocalTier;
import tutoring.analytics.infrastructure.cache.monitor.CacheMonitor;
import tutoring.analytics.infrastructure.cache.remote.RedissonRemoteTier;
import tutoring.analytics.infrastructure.cache.snapshot.RedissonSnapshotStore;
import tutoring.analytics.infrastructure.cache.snapshot.SnapshotWriteQueue;
import tutoring.analytics.infrastructure.executor.LogicExecutor;

/**
 * 3계층 캐시 조립
 *
 * <p>오케스트레이터는 전역 싱글턴이 아닌 일반 Bean입니다. 종료 시 Spring이 {@code close()}를 호출해 대기 중인 L3 스냅샷을 반영합니다.
 */
@Slf4j
@Configuration
public class CacheConfig {

  private static final String REMOTE_TIER_BREAKER = "remoteTier";

  @Bean
  public TtlPolicy ttlPolicy(CacheProperties properties) {
    CacheProperties.Ttl ttl = properties.ttl();
    Map<String, TtlConfig> byType = new LinkedHashMap<>();
    ttl.types().forEach((type, tiers) -> byType.put(type, tiers.toTtlConfig()));

    TtlPolicy policy = new TtlPolicy(ttl.defaults().toTtlConfig(), byType);
    policy
        .nonMonotonicConfigs()
        .forEach(
            (type, config) ->
                log.warn(
                    "[CacheConfig] TTL is not monotonic (l1 <= l2 <= l3 recommended): type={}, ttl={}",
                    type,
                    config));
    return policy;
  }

  @Bean
  public InvalidationRuleRegistry invalidationRuleRegistry() {
    return InvalidationRuleRegistry.withDefaults();
  }

  @Bean
  public CacheEntryJsonCodec cacheEntryJsonCodec(ObjectMapper objectMapper) {
    return new CacheEntryJsonCodec(objectMapper);
  }

  @Bean
  public CaffeineLocalTier caffeineLocalTier(CacheProperties properties, Clock clock) {
    return new CaffeineLocalTier(properties.l1().maxSize(), clock);
  }

  @Bean
  public RemoteCacheTier remoteCacheTier(
      RedissonClient redissonClient,
      CacheEntryJsonCodec codec,
      CircuitBreakerRegistry circuitBreakerRegistry,
      LogicExecutor executor,
      Clock clock,
      CacheProperties properties) {
    return new RedissonRemoteTier(
        redissonClient,
        codec,
        circuitBreakerRegistry.circuitBreaker(REMOTE_TIER_BREAKER),
        executor,
        clock,
        properties.l2().keyPrefix());
  }

  @Bean
  public SnapshotWriteQueue snapshotWriteQueue(CacheProperties properties, Clock clock) {
    return new SnapshotWriteQueue(properties.l3().queueCapacity(), clock);
  }

  @Bean
  @Nullable
  public SnapshotStore snapshotStore(
      RedissonClient redissonClient,
      CacheEntryJsonCodec codec,
      LogicExecutor executor,
      Clock clock,
      CacheProperties properties) {
    if (!properties.l3().enabled()) {
      log.info("[CacheConfig] L3 snapshot tier disabled");
      return null;
    }
    return new RedissonSnapshotStore(
        redissonClient, properties.l3().mapName(), codec, executor, clock);
  }

  @Bean
  public ComputeCoordinator computeCoordinator(
      CacheProperties properties, RedissonClient redissonClient, LogicExecutor executor) {
    CacheProperties.SingleFlight singleFlight = properties.singleflight();
    if (singleFlight.mode() == CacheProperties.SingleFlight.Mode.DISTRIBUTED) {
      log.info(
          "[CacheConfig] Distributed single-flight enabled: lockWait={}s",
          singleFlight.lockWaitSeconds());
      return new RedissonSingleFlight(
          redissonClient,
          executor,
          new LocalSingleFlight(),
          singleFlight.lockWaitSeconds(),
          singleFlight.leaseSeconds());
    }
    return new LocalSingleFlight();
  }

  @Bean
  public CacheMonitor cacheMonitor(MeterRegistry meterRegistry) {
    return new CacheMonitor(meterRegistry);
  }

  @Bean
  public TieredAnalyticsCache tieredAnalyticsCache(
      CaffeineLocalTier localTier,
      RemoteCacheTier remoteTier,
      @Nullable SnapshotStore snapshotStore,
      SnapshotWriteQueue snapshotQueue,
      ComputeCoordinator coordinator,
      CacheMonitor monitor,
      @Nullable CacheInvalidationPublisher publisher,
      CacheEntryJsonCodec codec,
      LogicExecutor executor,
      Clock clock,
      @Value("${app.instance-id:${HOSTNAME:local}}") String instanceId) {
    return TieredAnalyticsCache.builder()
        .localTier(localTier)
        .remoteTier(remoteTier)
        .snapshotStore(snapshotStore)
        .snapshotQueue(snapshotQueue)
        .coordinator(coordinator)
        .monitor(monitor)
        .publisher(publisher)
        .codec(codec)
        .executor(executor)
        .clock(clock)
        .instanceId(instanceId)
        .build();
  }
}
