package tutoring.analytics.config;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tutoring.analytics.infrastructure.executor.DefaultLogicExecutor;
import tutoring.analytics.infrastructure.executor.LogicExecutor;
import tutoring.analytics.infrastructure.executor.strategy.ExceptionTranslator;

/** LogicExecutor 및 공용 Clock Bean */
@Configuration
public class ExecutorConfig {

  @Bean
  @ConditionalOnMissingBean
  public ExceptionTranslator exceptionTranslator() {
    return ExceptionTranslator.defaultTranslator();
  }

  @Bean
  public LogicExecutor logicExecutor(MeterRegistry meterRegistry, ExceptionTranslator translator) {
    return new DefaultLogicExecutor(meterRegistry, translator);
  }

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
