package tutoring.analytics.error.exception.base;

import tutoring.analytics.error.ErrorCode;

/**
 * ServerBaseException: 캐시 계층 장애나 시스템 내부 오류로 발생하는 5xx 계열 예외입니다.
 *
 * <p>장애 회고를 위해 원인 예외(cause)를 함께 보존합니다.
 */
public abstract class ServerBaseException extends BaseException {

  protected ServerBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  // 상세 메시지(args)와 실제 에러(cause)를 동시에 기록
  protected ServerBaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(errorCode, cause, args);
  }
}
