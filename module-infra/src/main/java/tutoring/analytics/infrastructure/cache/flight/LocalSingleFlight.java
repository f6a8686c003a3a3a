package tutoring.analytics.infrastructure.cache.flight;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import tutoring.analytics.error.exception.InternalSystemException;

/**
 * 프로세스 내 Single-flight
 *
 * <p>키별로 진행 중인 {@link CompletableFuture}를 공유합니다. 맵 삽입만 원자적으로 처리하고 loader 실행 동안에는 어떤 락도 잡지
 * 않습니다. 리더의 예외는 follower에게 감싸지 않은 원래 예외로 전달됩니다.
 */
@Slf4j
public class LocalSingleFlight implements ComputeCoordinator {

  private final ConcurrentHashMap<String, CompletableFuture<Object>> inFlight =
      new ConcurrentHashMap<>();

  @Override
  @SuppressWarnings("unchecked")
  public <T> FlightResult<T> execute(String key, Supplier<T> loader) {
    CompletableFuture<Object> mine = new CompletableFuture<>();
    CompletableFuture<Object> existing = inFlight.putIfAbsent(key, mine);
    if (existing != null) {
      log.debug("[SingleFlight] Joined in-flight computation: key={}", key);
      return new FlightResult<>((T) await(key, existing), false);
    }

    try {
      T value = loader.get();
      mine.complete(value);
      return new FlightResult<>(value, true);
    } catch (RuntimeException | Error e) {
      mine.completeExceptionally(e);
      throw e;
    } finally {
      inFlight.remove(key, mine);
    }
  }

  @Override
  public int inFlightCount() {
    return inFlight.size();
  }

  private static Object await(String key, CompletableFuture<Object> leader) {
    try {
      return leader.join();
    } catch (CompletionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException re) {
        throw re;
      }
      if (cause instanceof Error err) {
        throw err;
      }
      throw new InternalSystemException("SingleFlight:await:" + key, cause);
    } catch (CancellationException e) {
      throw new InternalSystemException("SingleFlight:await:" + key, e);
    }
  }
}
