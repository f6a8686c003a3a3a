package tutoring.analytics.infrastructure.executor;

import java.util.function.Function;
import tutoring.analytics.common.function.ThrowingSupplier;
import tutoring.analytics.infrastructure.executor.function.ThrowingRunnable;
import tutoring.analytics.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * 예외 처리 템플릿
 *
 * <p>비즈니스 코드에서 try-catch를 제거하고, 실행 시간 메트릭과 예외 변환을 한 곳에서 처리합니다. {@link Error}는 절대 잡지 않습니다.
 *
 * <h3>사용 패턴</h3>
 *
 * <ul>
 *   <li>{@link #execute} - 실패 시 기본 변환기로 변환해 전파
 *   <li>{@link #executeOrDefault} - 실패 시 기본값 반환 (조회 실패를 miss로 취급할 때)
 *   <li>{@link #executeOrCatch} - 실패 시 복구 함수 실행
 *   <li>{@link #executeWithTranslation} - 도메인 전용 변환기 사용
 *   <li>{@link #executeWithFinally} - 성공/실패와 무관하게 정리 작업 실행 (락 해제 등)
 * </ul>
 */
public interface LogicExecutor {

  <T> T execute(ThrowingSupplier<T> task, TaskContext context);

  <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context);

  <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context);

  void executeVoid(ThrowingRunnable task, TaskContext context);

  <T> T executeWithFinally(ThrowingSupplier<T> task, Runnable finallyBlock, TaskContext context);

  <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator translator, TaskContext context);
}
