package tutoring.analytics.service.invalidation;

import java.util.Map;

/**
 * 캐시 무효화 대상 도메인 이벤트 (Spring Application Event)
 *
 * <p>채점/진도/콘텐츠 등 비즈니스 코드가 {@code ApplicationEventPublisher}로 발행합니다.
 *
 * @param eventType 이벤트 유형 와이어 이름 (예: grade_updated)
 * @param params 이벤트 파라미터
 */
public record AnalyticsDomainEvent(String eventType, Map<String, String> params) {

  public static AnalyticsDomainEvent of(String eventType, Map<String, String> params) {
    return new AnalyticsDomainEvent(eventType, params);
  }
}
