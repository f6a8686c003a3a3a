package tutoring.analytics.error.exception;

import tutoring.analytics.error.CommonErrorCode;
import tutoring.analytics.error.exception.base.ClientBaseException;

public class InvalidTtlConfigException extends ClientBaseException {

  public InvalidTtlConfigException(String detail) {
    super(CommonErrorCode.INVALID_TTL_CONFIG, detail);
  }
}
