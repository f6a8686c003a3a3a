package tutoring.analytics.common.function;

/**
 * 체크 예외를 던질 수 있는 Supplier
 *
 * <p>LogicExecutor에 작업을 전달할 때 사용합니다. 호출부에서 try-catch 없이 람다를 그대로 넘길 수 있습니다.
 */
@FunctionalInterface
public interface ThrowingSupplier<T> {
  T get() throws Throwable;
}
