package tutoring.analytics.core.domain.invalidation;

import java.util.Arrays;
import java.util.Locale;
import tutoring.analytics.error.exception.InvalidInvalidationEventException;

/** 캐시 무효화를 유발하는 도메인 이벤트 유형 */
public enum InvalidationEventType {
  /** 과제 채점 (assignment_id, student_id?) */
  GRADE_UPDATED("grade_updated"),
  /** 학습 자료 열람 (material_id, student_id?) */
  MATERIAL_VIEWED("material_viewed"),
  /** 사용자 진도 변경 (user_id, module?) */
  USER_PROGRESS_CHANGED("user_progress_changed"),
  /** 리포트 생성 (report_type) */
  REPORT_GENERATED("report_generated"),
  /** 과목 단위 콘텐츠 공개 (subject_id) */
  CONTENT_PUBLISHED("content_published");

  private final String wireName;

  InvalidationEventType(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  /** 와이어 이름(grade_updated) 또는 상수명(GRADE_UPDATED)으로 조회 */
  public static InvalidationEventType from(String name) {
    if (name == null || name.isBlank()) {
      throw new InvalidInvalidationEventException(String.valueOf(name), "event type is blank");
    }
    String normalized = name.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(type -> type.wireName.equals(normalized))
        .findFirst()
        .orElseThrow(() -> new InvalidInvalidationEventException(name, "unknown event type"));
  }
}
