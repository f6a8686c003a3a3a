package tutoring.analytics.error.exception;

import tutoring.analytics.error.CommonErrorCode;
import tutoring.analytics.error.exception.base.ServerBaseException;

/**
 * LogicExecutor 전용 시스템 예외
 *
 * <p>LogicExecutor에서 처리하지 못한 관리되지 않은 예외(checked 포함)를 프로젝트 규격에 맞게 래핑합니다.
 *
 * <ul>
 *   <li>전역 핸들러에서 "어디서 터진 에러인지" 명확히 구분 가능
 *   <li>taskName으로 에러 발생 지점 추적 용이
 * </ul>
 */
public class InternalSystemException extends ServerBaseException {

  /**
   * @param taskName 작업 이름 (예: "RemoteTier:get:analytics:student:42")
   * @param cause 원본 예외
   */
  public InternalSystemException(String taskName, Throwable cause) {
    super(CommonErrorCode.INTERNAL_SERVER_ERROR, cause, taskName);
  }
}
