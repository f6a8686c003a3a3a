package tutoring.analytics.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tutoring.analytics.infrastructure.cache.TieredAnalyticsCache;
import tutoring.analytics.infrastructure.cache.invalidation.CacheInvalidationPublisher;
import tutoring.analytics.infrastructure.cache.invalidation.RedisCacheInvalidationPublisher;
import tutoring.analytics.infrastructure.cache.invalidation.RedisCacheInvalidationSubscriber;
import tutoring.analytics.infrastructure.executor.LogicExecutor;

/**
 * 인스턴스 간 L1 무효화 Pub/Sub 설정
 *
 * <p>{@code analytics.cache.invalidation.broadcast-enabled=false}이면 발행자가 없으므로 오케스트레이터는 no-op 발행자를
 * 사용하고, 다른 인스턴스의 L1은 짧은 TTL로만 정리됩니다.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(
    name = "analytics.cache.invalidation.broadcast-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class CacheInvalidationConfig {

  @Bean
  public CacheInvalidationPublisher cacheInvalidationPublisher(
      RedissonClient redissonClient,
      CacheProperties properties,
      ObjectMapper objectMapper,
      LogicExecutor executor,
      MeterRegistry meterRegistry) {
    log.info(
        "[CacheInvalidationConfig] Creating publisher: topic={}",
        properties.invalidation().topic());
    return new RedisCacheInvalidationPublisher(
        redissonClient, properties.invalidation().topic(), objectMapper, executor, meterRegistry);
  }

  /** 구독은 Bean 초기화 시 시작하고 종료 시 해제한다 */
  @Bean(initMethod = "subscribe", destroyMethod = "unsubscribe")
  public RedisCacheInvalidationSubscriber cacheInvalidationSubscriber(
      RedissonClient redissonClient,
      CacheProperties properties,
      TieredAnalyticsCache cache,
      ObjectMapper objectMapper,
      LogicExecutor executor,
      MeterRegistry meterRegistry,
      @Value("${app.instance-id:${HOSTNAME:local}}") String instanceId) {
    return new RedisCacheInvalidationSubscriber(
        redissonClient,
        properties.invalidation().topic(),
        instanceId,
        cache,
        objectMapper,
        executor,
        meterRegistry);
  }
}
