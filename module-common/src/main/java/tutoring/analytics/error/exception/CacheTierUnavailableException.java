package tutoring.analytics.error.exception;

import tutoring.analytics.error.CommonErrorCode;
import tutoring.analytics.error.exception.base.ServerBaseException;

/**
 * 원격 계층(L2/L3) 접근 실패
 *
 * <p>오케스트레이터는 이 예외를 해당 계층의 miss로 취급하며 호출자에게 전파하지 않습니다.
 */
public class CacheTierUnavailableException extends ServerBaseException {

  public CacheTierUnavailableException(String tier, String operation, Throwable cause) {
    super(CommonErrorCode.CACHE_TIER_UNAVAILABLE, cause, tier, operation);
  }
}
