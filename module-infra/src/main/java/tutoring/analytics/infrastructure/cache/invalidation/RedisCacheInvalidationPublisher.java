package tutoring.analytics.infrastructure.cache.invalidation;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RTopic;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import tutoring.analytics.infrastructure.executor.LogicExecutor;
import tutoring.analytics.infrastructure.executor.TaskContext;

/**
 * Redis Pub/Sub 기반 L1 무효화 발행자
 *
 * <p>메시지는 JSON 문자열(StringCodec)로 발행합니다. 발행 실패 또는 구독자 0명은 메트릭과 로그로만 남깁니다.
 */
@Slf4j
public class RedisCacheInvalidationPublisher implements CacheInvalidationPublisher {

  private final LogicExecutor executor;
  private final MeterRegistry meterRegistry;
  private final ObjectMapper objectMapper;
  private final RTopic topic;

  public RedisCacheInvalidationPublisher(
      RedissonClient redissonClient,
      String topicName,
      ObjectMapper objectMapper,
      LogicExecutor executor,
      MeterRegistry meterRegistry) {
    this.executor = executor;
    this.meterRegistry = meterRegistry;
    this.objectMapper = objectMapper;
    this.topic = redissonClient.getTopic(topicName, StringCodec.INSTANCE);
  }

  @Override
  public void publish(CacheInvalidationBroadcast broadcast) {
    TaskContext context =
        TaskContext.of("CacheInvalidation", "publish", broadcast.scope().name());

    long clientsReceived =
        executor.executeOrDefault(
            () -> topic.publish(objectMapper.writeValueAsString(broadcast)), 0L, context);

    recordPublishResult(clientsReceived, broadcast);
  }

  private void recordPublishResult(long clientsReceived, CacheInvalidationBroadcast broadcast) {
    if (clientsReceived > 0) {
      meterRegistry.counter("analytics.cache.invalidation.publish", "status", "success").increment();
      log.debug(
          "[CacheInvalidation] Published: scope={}, target={}, clients={}",
          broadcast.scope(),
          broadcast.target(),
          clientsReceived);
    } else {
      meterRegistry.counter("analytics.cache.invalidation.publish", "status", "failure").increment();
      log.warn(
          "[CacheInvalidation] Publish failed or no subscribers: scope={}, target={}",
          broadcast.scope(),
          broadcast.target());
    }
  }
}
