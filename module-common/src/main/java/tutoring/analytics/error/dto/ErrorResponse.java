package tutoring.analytics.error.dto;

import java.time.LocalDateTime;
import tutoring.analytics.error.ErrorCode;
import tutoring.analytics.error.exception.base.BaseException;

public record ErrorResponse(int status, String code, String message, LocalDateTime timestamp) {

  /**
   * BaseException으로부터 생성
   *
   * <p>e.getMessage()를 통해 동적으로 가공된 메시지(예: 어떤 키가 잘못되었는지)를 전달합니다.
   */
  public static ErrorResponse from(BaseException e) {
    return new ErrorResponse(
        e.getErrorCode().getStatusCode(),
        e.getErrorCode().getCode(),
        e.getMessage(),
        LocalDateTime.now());
  }

  /**
   * ErrorCode로부터 생성
   *
   * <p>Enum에 정의된 기본 메시지를 사용하며, 상세한 에러 내용은 보안을 위해 숨깁니다.
   */
  public static ErrorResponse from(ErrorCode errorCode, Object... args) {
    return new ErrorResponse(
        errorCode.getStatusCode(),
        errorCode.getCode(),
        String.format(errorCode.getMessage(), args),
        LocalDateTime.now());
  }
}
