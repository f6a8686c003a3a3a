package tutoring.analytics.error.exception;

import tutoring.analytics.error.CommonErrorCode;
import tutoring.analytics.error.exception.base.ClientBaseException;

public class InvalidKeyPatternException extends ClientBaseException {

  public InvalidKeyPatternException(String pattern, String reason) {
    super(CommonErrorCode.INVALID_KEY_PATTERN, pattern, reason);
  }
}
