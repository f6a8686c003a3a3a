package tutoring.analytics.infrastructure.executor.strategy;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import tutoring.analytics.error.exception.CacheSerializationException;
import tutoring.analytics.error.exception.CacheTierUnavailableException;
import tutoring.analytics.error.exception.InternalSystemException;
import tutoring.analytics.error.exception.base.BaseException;
import tutoring.analytics.infrastructure.executor.TaskContext;

/**
 * 예외 변환 전략
 *
 * <p>모든 변환기는 {@link Error}를 그대로 던지고, 비동기 래퍼(CompletionException 등)를 벗긴 뒤, 이미 도메인 예외인 경우 그대로
 * 반환합니다.
 */
@FunctionalInterface
public interface ExceptionTranslator {

  RuntimeException translate(Throwable e, TaskContext context);

  static ExceptionTranslator withErrorGuardAndUnwrap(ExceptionTranslator inner) {
    return (e, context) -> {
      if (e instanceof Error err) {
        throw err;
      }
      Throwable unwrapped = unwrapAsync(e);
      if (unwrapped instanceof BaseException be) {
        return be;
      }
      return inner.translate(unwrapped, context);
    };
  }

  static ExceptionTranslator defaultTranslator() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> new InternalSystemException(context.toTaskName(), unwrapped));
  }

  /** 원격 계층(Redis) 접근 실패 → CacheTierUnavailableException */
  static ExceptionTranslator forRemoteTier(String tier) {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> {
          if (unwrapped instanceof JsonProcessingException) {
            return new CacheSerializationException(context.dynamicValue(), unwrapped);
          }
          if (unwrapped instanceof InterruptedException) {
            Thread.currentThread().interrupt();
          }
          return new CacheTierUnavailableException(tier, context.operation(), unwrapped);
        });
  }

  /** 락 획득 중 인터럽트는 플래그를 복원한 뒤 시스템 예외로 변환 */
  static ExceptionTranslator forLock() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> {
          if (unwrapped instanceof InterruptedException) {
            Thread.currentThread().interrupt();
          }
          return new InternalSystemException("lock-operation:" + context.toTaskName(), unwrapped);
        });
  }

  private static Throwable unwrapAsync(Throwable e) {
    Throwable current = e;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
