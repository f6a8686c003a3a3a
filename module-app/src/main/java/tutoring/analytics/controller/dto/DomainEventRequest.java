package tutoring.analytics.controller.dto;

import jakarta.validation.constraints.NotBlank;
import java.util.Map;

/**
 * 수동 도메인 이벤트
 *
 * @param eventType 이벤트 유형 (grade_updated, material_viewed, user_progress_changed,
 *     report_generated, content_published)
 * @param params 이벤트 파라미터 (예: {"assignment_id": "a1", "student_id": "42"})
 */
public record DomainEventRequest(@NotBlank String eventType, Map<String, String> params) {}
