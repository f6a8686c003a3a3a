package tutoring.analytics.error.exception;

import tutoring.analytics.error.CommonErrorCode;
import tutoring.analytics.error.exception.base.ClientBaseException;

public class ComputationNotRegisteredException extends ClientBaseException {

  public ComputationNotRegisteredException(String queryType) {
    super(CommonErrorCode.COMPUTATION_NOT_REGISTERED, queryType);
  }
}
