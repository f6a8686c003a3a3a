package tutoring.analytics.error.exception;

import tutoring.analytics.error.CommonErrorCode;
import tutoring.analytics.error.exception.base.ClientBaseException;

/** 키 문법(namespace:type:param...)을 위반한 캐시 키 */
public class InvalidCacheKeyException extends ClientBaseException {

  public InvalidCacheKeyException(String key, String reason) {
    super(CommonErrorCode.INVALID_CACHE_KEY, key, reason);
  }
}
