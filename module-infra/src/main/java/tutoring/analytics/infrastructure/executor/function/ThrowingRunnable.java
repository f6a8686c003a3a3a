package tutoring.analytics.infrastructure.executor.function;

@FunctionalInterface
public interface ThrowingRunnable {
  void run() throws Throwable;
}
