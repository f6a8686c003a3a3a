package tutoring.analytics.infrastructure.cache.flight;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import tutoring.analytics.infrastructure.executor.LogicExecutor;
import tutoring.analytics.infrastructure.executor.TaskContext;
import tutoring.analytics.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * 인스턴스 간 Single-flight (Redisson 분산 락)
 *
 * <h3>동작</h3>
 *
 * <ol>
 *   <li>프로세스 내부 중복은 {@link LocalSingleFlight}로 먼저 합친다
 *   <li>리더만 {@code cache:sf:<key>} 락을 {@code lockWaitSeconds} 동안 시도한다
 *   <li>락 획득 성공: loader 실행 (loader가 L2를 다시 확인하므로 대기했던 인스턴스는 계산 없이 값을 얻는다)
 *   <li>락 획득 실패 또는 Redis 장애: 가용성 우선으로 loader 직접 실행
 *   <li>락 대기 중 인터럽트: 플래그를 복원하고 계산 없이 예외 전파
 * </ol>
 */
@Slf4j
public class RedissonSingleFlight implements ComputeCoordinator {

  private static final String LOCK_PREFIX = "cache:sf:";

  private final RedissonClient redissonClient;
  private final LogicExecutor executor;
  private final LocalSingleFlight local;
  private final long lockWaitSeconds;
  private final long leaseSeconds;

  public RedissonSingleFlight(
      RedissonClient redissonClient,
      LogicExecutor executor,
      LocalSingleFlight local,
      long lockWaitSeconds,
      long leaseSeconds) {
    this.redissonClient = redissonClient;
    this.executor = executor;
    this.local = local;
    this.lockWaitSeconds = lockWaitSeconds;
    this.leaseSeconds = leaseSeconds;
  }

  @Override
  public <T> FlightResult<T> execute(String key, Supplier<T> loader) {
    return local.execute(key, () -> loadUnderLock(key, loader));
  }

  @Override
  public int inFlightCount() {
    return local.inFlightCount();
  }

  private <T> T loadUnderLock(String key, Supplier<T> loader) {
    RLock lock = redissonClient.getLock(LOCK_PREFIX + key);
    TaskContext context = TaskContext.of("SingleFlight", "lock", key);
    boolean acquired =
        executor.executeOrCatch(
            () ->
                executor.executeWithTranslation(
                    () -> lock.tryLock(lockWaitSeconds, leaseSeconds, TimeUnit.SECONDS),
                    ExceptionTranslator.forLock(),
                    context),
            e -> lockUnavailable(key, e),
            context);

    if (!acquired) {
      log.debug("[SingleFlight] Lock not acquired, computing directly: key={}", key);
      return loader.get();
    }
    try {
      return loader.get();
    } finally {
      executor.executeOrDefault(() -> unlock(lock), false, TaskContext.of("SingleFlight", "unlock", key));
    }
  }

  private static boolean lockUnavailable(String key, Throwable e) {
    if (Thread.currentThread().isInterrupted()) {
      log.debug("[SingleFlight] Interrupted while waiting for lock: key={}", key);
      throw (RuntimeException) e;
    }
    return false;
  }

  private static boolean unlock(RLock lock) {
    if (lock.isHeldByCurrentThread()) {
      lock.unlock();
      return true;
    }
    return false;
  }
}
