package tutoring.analytics.core.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 쿼리 하나의 워밍 결과
 *
 * @param state 결과 상태
 * @param reason 실패 사유, 또는 로컬에만 워밍된 경우 그 사유 (정상 워밍 시 null)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WarmStatus(State state, String reason) {

  public enum State {
    WARMED,
    FAILED
  }

  private static final WarmStatus WARMED = new WarmStatus(State.WARMED, null);

  public static WarmStatus warmed() {
    return WARMED;
  }

  /** 값은 계산되어 L1에 있지만 공유 계층 기록에 실패한 경우 */
  public static WarmStatus warmedLocally(String reason) {
    return new WarmStatus(State.WARMED, reason);
  }

  public static WarmStatus failed(String reason) {
    return new WarmStatus(State.FAILED, reason);
  }

  public boolean isWarmed() {
    return state == State.WARMED;
  }
}
