package tutoring.analytics.error;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor
public enum CommonErrorCode implements ErrorCode {
  // === Client Errors (4xx) ===
  INVALID_INPUT_VALUE("C001", "잘못된 입력값입니다: %s", HttpStatus.BAD_REQUEST),
  INVALID_CACHE_KEY("C002", "잘못된 캐시 키입니다 (key: %s, 사유: %s)", HttpStatus.BAD_REQUEST),
  INVALID_KEY_PATTERN("C003", "잘못된 키 패턴입니다 (pattern: %s, 사유: %s)", HttpStatus.BAD_REQUEST),
  INVALID_TTL_CONFIG("C004", "잘못된 TTL 설정입니다: %s", HttpStatus.BAD_REQUEST),
  INVALID_INVALIDATION_EVENT("C005", "처리할 수 없는 무효화 이벤트입니다 (event: %s, 사유: %s)", HttpStatus.BAD_REQUEST),
  COMPUTATION_NOT_REGISTERED("C006", "등록되지 않은 집계 유형입니다 (queryType: %s)", HttpStatus.NOT_FOUND),

  // === Server Errors (5xx) ===
  INTERNAL_SERVER_ERROR("S001", "서버 내부 오류가 발생했습니다: %s", HttpStatus.INTERNAL_SERVER_ERROR),
  CACHE_TIER_UNAVAILABLE("S002", "캐시 계층 접근 실패 (tier: %s, 작업: %s)", HttpStatus.SERVICE_UNAVAILABLE),
  CACHE_SERIALIZATION_ERROR("S003", "캐시 직렬화 처리 실패 (key: %s)", HttpStatus.INTERNAL_SERVER_ERROR);

  private final String code;
  private final String message;
  private final HttpStatus status;
}
