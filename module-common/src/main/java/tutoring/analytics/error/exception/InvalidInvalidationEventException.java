package tutoring.analytics.error.exception;

import tutoring.analytics.error.CommonErrorCode;
import tutoring.analytics.error.exception.base.ClientBaseException;

/** 알 수 없는 이벤트 유형이거나 필수 파라미터가 누락/오염된 무효화 이벤트 */
public class InvalidInvalidationEventException extends ClientBaseException {

  public InvalidInvalidationEventException(String eventType, String reason) {
    super(CommonErrorCode.INVALID_INVALIDATION_EVENT, eventType, reason);
  }
}
