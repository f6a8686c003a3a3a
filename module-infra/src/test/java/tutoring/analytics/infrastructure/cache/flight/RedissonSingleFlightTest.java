package tutoring.analytics.infrastructure.cache.flight;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import tutoring.analytics.error.exception.InternalSystemException;
import tutoring.analytics.infrastructure.cache.flight.ComputeCoordinator.FlightResult;
import tutoring.analytics.support.TestLogicExecutors;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
@DisplayName("RedissonSingleFlight 테스트")
class RedissonSingleFlightTest {

  @Mock private RedissonClient redissonClient;
  @Mock private RLock lock;

  private RedissonSingleFlight singleFlight;

  @BeforeEach
  void setUp() {
    singleFlight =
        new RedissonSingleFlight(
            redissonClient, TestLogicExecutors.passThrough(), new LocalSingleFlight(), 2, 30);
    given(redissonClient.getLock("cache:sf:analytics:student:1")).willReturn(lock);
  }

  @Test
  @DisplayName("락을 얻으면 계산 후 해제한다")
  void computesUnderLock() throws Exception {
    given(lock.tryLock(2, 30, TimeUnit.SECONDS)).willReturn(true);
    given(lock.isHeldByCurrentThread()).willReturn(true);

    FlightResult<Integer> result = singleFlight.execute("analytics:student:1", () -> 80);

    assertThat(result.value()).isEqualTo(80);
    assertThat(result.leader()).isTrue();
    verify(lock).unlock();
  }

  @Test
  @DisplayName("락 대기 시간이 지나면 직접 계산하고 해제하지 않는다")
  void computesDirectlyWhenLockBusy() throws Exception {
    given(lock.tryLock(2, 30, TimeUnit.SECONDS)).willReturn(false);

    FlightResult<Integer> result = singleFlight.execute("analytics:student:1", () -> 81);

    assertThat(result.value()).isEqualTo(81);
    verify(lock, never()).unlock();
  }

  @Test
  @DisplayName("Redis 장애로 락 시도가 실패해도 계산은 진행된다")
  void computesWhenRedisDown() throws Exception {
    given(lock.tryLock(2, 30, TimeUnit.SECONDS))
        .willThrow(new IllegalStateException("connection refused"));

    FlightResult<Integer> result = singleFlight.execute("analytics:student:1", () -> 82);

    assertThat(result.value()).isEqualTo(82);
    assertThat(singleFlight.inFlightCount()).isZero();
  }

  @Test
  @DisplayName("락 대기 중 인터럽트되면 플래그를 복원하고 계산하지 않는다")
  void restoresInterruptWithoutComputing() throws Exception {
    given(lock.tryLock(2, 30, TimeUnit.SECONDS)).willThrow(new InterruptedException());
    AtomicBoolean computed = new AtomicBoolean();

    assertThatThrownBy(
            () ->
                singleFlight.execute(
                    "analytics:student:1",
                    () -> {
                      computed.set(true);
                      return 83;
                    }))
        .isInstanceOf(InternalSystemException.class);

    assertThat(Thread.interrupted()).isTrue();
    assertThat(computed).isFalse();
    assertThat(singleFlight.inFlightCount()).isZero();
    verify(lock, never()).unlock();
  }
}
