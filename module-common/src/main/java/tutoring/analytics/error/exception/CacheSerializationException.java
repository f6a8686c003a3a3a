package tutoring.analytics.error.exception;

import tutoring.analytics.error.CommonErrorCode;
import tutoring.analytics.error.exception.base.ServerBaseException;

public class CacheSerializationException extends ServerBaseException {

  public CacheSerializationException(String key, Throwable cause) {
    super(CommonErrorCode.CACHE_SERIALIZATION_ERROR, cause, key);
  }
}
