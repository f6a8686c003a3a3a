package tutoring.analytics.infrastructure.executor;

import java.util.Objects;

/**
 * LogicExecutor 작업 식별 정보
 *
 * <p>component/operation은 메트릭 태그로, dynamicValue(키, 패턴 등)는 로그에만 사용해 카디널리티를 통제합니다.
 *
 * @param component 컴포넌트 이름 (예: RemoteTier, TieredAnalyticsCache)
 * @param operation 작업 유형 (예: get, put, scan)
 * @param dynamicValue 동적 값 (예: 캐시 키)
 */
public record TaskContext(String component, String operation, String dynamicValue) {

  public TaskContext {
    Objects.requireNonNull(component, "component");
    Objects.requireNonNull(operation, "operation");
    if (dynamicValue == null) {
      dynamicValue = "";
    }
  }

  public static TaskContext of(String component, String operation, String dynamicValue) {
    return new TaskContext(component, operation, dynamicValue);
  }

  public static TaskContext of(String component, String operation) {
    return new TaskContext(component, operation, "");
  }

  /** "component:operation:dynamicValue" 형식 */
  public String toTaskName() {
    if (dynamicValue.isEmpty()) {
      return component + ":" + operation;
    }
    return component + ":" + operation + ":" + dynamicValue;
  }
}
