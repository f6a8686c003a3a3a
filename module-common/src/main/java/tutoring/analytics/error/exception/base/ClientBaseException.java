package tutoring.analytics.error.exception.base;

import tutoring.analytics.error.ErrorCode;

/**
 * ClientBaseException: 호출자의 잘못된 사용(잘못된 키, 패턴, 이벤트)으로 발생하는 4xx 계열 예외입니다.
 *
 * <p>캐시 I/O가 일어나기 전에 던져지며, 호출자에게 구체적인 실패 원인을 전달하는 것이 목적입니다.
 */
public abstract class ClientBaseException extends BaseException {

  protected ClientBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  // "잘못된 캐시 키입니다 (key: %s, 사유: %s)" 와 같은 메시지 완성
  protected ClientBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }
}
