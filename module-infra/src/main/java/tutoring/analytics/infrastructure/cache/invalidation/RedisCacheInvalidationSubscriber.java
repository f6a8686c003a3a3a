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
 * Redis Pub/Sub 기반 L1 무효화 구독자
 *
 * <ul>
 *   <li>Self-skip: 자기가 발행한 메시지는 무시 (이미 로컬에서 처리됨)
 *   <li>수신 처리 실패는 로그만 남기고 리스너 스레드를 죽이지 않음
 * </ul>
 */
@Slf4j
public class RedisCacheInvalidationSubscriber {

  private final RedissonClient redissonClient;
  private final String topicName;
  private final String instanceId;
  private final LocalEvictionTarget target;
  private final ObjectMapper objectMapper;
  private final LogicExecutor executor;
  private final MeterRegistry meterRegistry;

  private volatile RTopic topic;
  private volatile Integer listenerId;

  public RedisCacheInvalidationSubscriber(
      RedissonClient redissonClient,
      String topicName,
      String instanceId,
      LocalEvictionTarget target,
      ObjectMapper objectMapper,
      LogicExecutor executor,
      MeterRegistry meterRegistry) {
    this.redissonClient = redissonClient;
    this.topicName = topicName;
    this.instanceId = instanceId;
    this.target = target;
    this.objectMapper = objectMapper;
    this.executor = executor;
    this.meterRegistry = meterRegistry;
  }

  /** 구독 시작 (애플리케이션 시작 시) */
  public void subscribe() {
    executor.executeVoid(
        () -> {
          topic = redissonClient.getTopic(topicName, StringCodec.INSTANCE);
          listenerId = topic.addListener(String.class, (channel, message) -> onMessage(message));
          log.info(
              "[CacheInvalidation] Subscribed to topic: {}, instanceId={}", topicName, instanceId);
        },
        TaskContext.of("CacheInvalidation", "subscribe", instanceId));
  }

  public void onMessage(String message) {
    executor.executeOrDefault(
        () -> {
          onBroadcast(objectMapper.readValue(message, CacheInvalidationBroadcast.class));
          return null;
        },
        null,
        TaskContext.of("CacheInvalidation", "onMessage"));
  }

  public void onBroadcast(CacheInvalidationBroadcast broadcast) {
    if (instanceId.equals(broadcast.sourceInstanceId())) {
      log.trace("[CacheInvalidation] Self-skip: scope={}", broadcast.scope());
      return;
    }
    target.evictLocal(broadcast);
    meterRegistry
        .counter("analytics.cache.invalidation.received", "scope", broadcast.scope().name())
        .increment();
  }

  /** 구독 해제 (애플리케이션 종료 시) */
  public void unsubscribe() {
    executor.executeVoid(
        () -> {
          if (topic != null && listenerId != null) {
            topic.removeListener(listenerId);
            log.info("[CacheInvalidation] Unsubscribed from topic: instanceId={}", instanceId);
          }
        },
        TaskContext.of("CacheInvalidation", "unsubscribe", instanceId));
  }
}
