package tutoring.analytics.infrastructure.executor;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.Objects;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tutoring.analytics.common.function.ThrowingSupplier;
import tutoring.analytics.infrastructure.executor.function.ThrowingRunnable;
import tutoring.analytics.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * LogicExecutor 기본 구현
 *
 * <h3>책임</h3>
 *
 * <ul>
 *   <li>{@code logic.executor} 타이머 기록 (component/operation/result 태그, 동적 값은 제외)
 *   <li>실패 시 로그 + 예외 변환
 *   <li>{@link Error}(OOM 등)는 잡지 않고 즉시 전파
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class DefaultLogicExecutor implements LogicExecutor {

  private static final String METRIC_NAME = "logic.executor";

  private final MeterRegistry meterRegistry;
  private final ExceptionTranslator translator;

  public DefaultLogicExecutor(MeterRegistry meterRegistry) {
    this(meterRegistry, ExceptionTranslator.defaultTranslator());
  }

  @Override
  public <T> T execute(ThrowingSupplier<T> task, TaskContext context) {
    return executeWithMetrics(task, context, translator);
  }

  @Override
  public <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context) {
    return executeOrCatch(task, e -> defaultValue, context);
  }

  @Override
  public <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context) {
    Objects.requireNonNull(recovery, "recovery");
    try {
      return executeWithMetrics(task, context, translator);
    } catch (RuntimeException e) {
      log.warn("[{}] 예외 발생, 복구 로직 실행: {}", context.toTaskName(), e.getMessage());
      return recovery.apply(e);
    }
  }

  @Override
  public void executeVoid(ThrowingRunnable task, TaskContext context) {
    Objects.requireNonNull(task, "task");
    execute(
        () -> {
          task.run();
          return null;
        },
        context);
  }

  @Override
  public <T> T executeWithFinally(
      ThrowingSupplier<T> task, Runnable finallyBlock, TaskContext context) {
    Objects.requireNonNull(finallyBlock, "finallyBlock");
    try {
      return executeWithMetrics(task, context, translator);
    } finally {
      finallyBlock.run();
    }
  }

  @Override
  public <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator customTranslator, TaskContext context) {
    return executeWithMetrics(task, context, Objects.requireNonNull(customTranslator));
  }

  private <T> T executeWithMetrics(
      ThrowingSupplier<T> task, TaskContext context, ExceptionTranslator activeTranslator) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(context, "context");
    Timer.Sample sample = Timer.start(meterRegistry);

    try {
      T result = task.get();
      record(sample, context, "success");
      return result;
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      record(sample, context, "failure");
      log.debug("[{}] 실행 중 예외 발생: {}", context.toTaskName(), t.toString());
      throw activeTranslator.translate(t, context);
    }
  }

  private void record(Timer.Sample sample, TaskContext context, String result) {
    sample.stop(
        Timer.builder(METRIC_NAME)
            .tag("component", context.component())
            .tag("operation", context.operation())
            .tag("result", result)
            .register(meterRegistry));
  }
}
