package tutoring.analytics.service.invalidation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import tutoring.analytics.infrastructure.executor.LogicExecutor;
import tutoring.analytics.infrastructure.executor.TaskContext;

/**
 * 도메인 이벤트 리스너
 *
 * <p>무효화 실패가 이벤트를 발행한 비즈니스 트랜잭션을 깨뜨리지 않도록 로그만 남깁니다. 남은 항목은 TTL로 정리됩니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnalyticsDomainEventListener {

  private final CacheInvalidationTrigger trigger;
  private final LogicExecutor executor;

  @EventListener
  public void onDomainEvent(AnalyticsDomainEvent event) {
    executor.executeOrCatch(
        () -> trigger.onEvent(event.eventType(), event.params()),
        e -> {
          log.warn(
              "[AnalyticsDomainEventListener] Invalidation skipped: event={}, reason={}",
              event.eventType(),
              e.getMessage());
          return 0L;
        },
        TaskContext.of("DomainEvent", "invalidate", event.eventType()));
  }
}
