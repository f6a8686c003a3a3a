package tutoring.analytics.service.invalidation;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tutoring.analytics.core.domain.invalidation.InvalidationEvent;
import tutoring.analytics.core.domain.invalidation.InvalidationEventType;
import tutoring.analytics.core.domain.invalidation.InvalidationRuleRegistry;
import tutoring.analytics.core.domain.model.KeyPattern;
import tutoring.analytics.infrastructure.cache.TieredAnalyticsCache;

/**
 * 도메인 이벤트 → 캐시 무효화
 *
 * <p>이벤트마다 규칙이 정한 패턴을 모두 계산한 뒤(검증 실패 시 I/O 없이 거부) 순서대로 {@code invalidatePattern}을 호출합니다. 같은
 * 이벤트를 다시 처리해도 결과 상태는 같습니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CacheInvalidationTrigger {

  private final InvalidationRuleRegistry ruleRegistry;
  private final TieredAnalyticsCache cache;

  /**
   * @param eventType 이벤트 유형 (grade_updated 등)
   * @param params 이벤트 파라미터. 값이 null인 항목은 없는 것으로 본다
   * @return 제거된 키 수 (L1 + L2)
   */
  public long onEvent(String eventType, Map<String, String> params) {
    InvalidationEventType type = InvalidationEventType.from(eventType);
    return onEvent(InvalidationEvent.of(type, withoutNullValues(params)));
  }

  public long onEvent(InvalidationEvent event) {
    List<KeyPattern> patterns = ruleRegistry.patternsFor(event);

    long removed = 0;
    for (KeyPattern pattern : patterns) {
      removed += cache.invalidatePattern(pattern.value());
    }
    log.info(
        "[CacheInvalidationTrigger] {} handled: patterns={}, removed={}",
        event.type().wireName(),
        patterns.size(),
        removed);
    return removed;
  }

  private static Map<String, String> withoutNullValues(Map<String, String> params) {
    Map<String, String> copy = new HashMap<>();
    if (params != null) {
      params.forEach(
          (name, value) -> {
            if (name != null && value != null) {
              copy.put(name, value);
            }
          });
    }
    return copy;
  }
}
