package tutoring.analytics.infrastructure.cache.flight;

import java.util.function.Supplier;

/**
 * 키 단위 계산 조정기 (Thundering Herd 방지)
 *
 * <p>같은 키의 동시 miss가 몰려도 loader는 한 번만 실행되어야 합니다. 리더가 아닌 호출자(follower)는 리더의 결과 또는 예외를 그대로
 * 받습니다.
 */
public interface ComputeCoordinator {

  <T> FlightResult<T> execute(String key, Supplier<T> loader);

  /** 진행 중인 계산 수 (모니터링용) */
  int inFlightCount();

  /**
   * @param value loader 결과
   * @param leader 이 호출자가 loader를 직접 실행했는지
   */
  record FlightResult<T>(T value, boolean leader) {}
}
