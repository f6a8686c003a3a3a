package tutoring.analytics.service.warmup;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import tutoring.analytics.config.CacheProperties;
import tutoring.analytics.core.domain.model.AnalyticsQuery;
import tutoring.analytics.core.domain.model.WarmStatus;
import tutoring.analytics.infrastructure.executor.LogicExecutor;
import tutoring.analytics.infrastructure.executor.TaskContext;
import tutoring.analytics.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * 정기 캐시 워밍
 *
 * <ul>
 *   <li>기동 후 {@code initial-delay-ms} 뒤 1회, 이후 {@code cron}마다 설정된 대상 워밍
 *   <li>{@code analytics-warmup-lock} 분산 락으로 한 인스턴스만 실행 (대기 없이 시도)
 *   <li>결과는 {@code analytics.cache.warmup{status}} 카운터로 기록
 * </ul>
 */
@Slf4j
@Component
@ConditionalOnProperty(
    name = "analytics.cache.warmup.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class AnalyticsWarmupScheduler {

  static final String LOCK_NAME = "analytics-warmup-lock";
  private static final long LOCK_LEASE_SECONDS = 600;

  private final CacheWarmer warmer;
  private final RedissonClient redissonClient;
  private final LogicExecutor executor;
  private final MeterRegistry meterRegistry;
  private final TaskScheduler taskScheduler;
  private final Clock clock;
  private final CacheProperties.Warmup warmup;

  public AnalyticsWarmupScheduler(
      CacheWarmer warmer,
      RedissonClient redissonClient,
      LogicExecutor executor,
      MeterRegistry meterRegistry,
      TaskScheduler taskScheduler,
      Clock clock,
      CacheProperties properties) {
    this.warmer = warmer;
    this.redissonClient = redissonClient;
    this.executor = executor;
    this.meterRegistry = meterRegistry;
    this.taskScheduler = taskScheduler;
    this.clock = clock;
    this.warmup = properties.warmup();
  }

  @EventListener(ApplicationReadyEvent.class)
  public void scheduleInitialWarmup() {
    taskScheduler.schedule(
        this::warmConfiguredTargets, clock.instant().plusMillis(warmup.initialDelayMs()));
    log.info(
        "[WarmupScheduler] Initial warmup scheduled: delayMs={}, targets={}",
        warmup.initialDelayMs(),
        warmup.targets().size());
  }

  @Scheduled(cron = "${analytics.cache.warmup.cron:0 0 3 * * *}")
  public void warmConfiguredTargets() {
    List<AnalyticsQuery> queries = warmup.queries();
    if (queries.isEmpty()) {
      log.debug("[WarmupScheduler] No warmup targets configured");
      return;
    }
    executor.executeOrCatch(
        () -> warmUnderLock(queries),
        e -> {
          log.warn("[WarmupScheduler] Warmup aborted: {}", e.getMessage());
          return Map.<AnalyticsQuery, WarmStatus>of();
        },
        TaskContext.of("WarmupScheduler", "warm", String.valueOf(queries.size())));
  }

  private Map<AnalyticsQuery, WarmStatus> warmUnderLock(List<AnalyticsQuery> queries) {
    RLock lock = redissonClient.getLock(LOCK_NAME);
    boolean acquired =
        executor.executeWithTranslation(
            () -> lock.tryLock(0, LOCK_LEASE_SECONDS, TimeUnit.SECONDS),
            ExceptionTranslator.forLock(),
            TaskContext.of("WarmupScheduler", "lock", LOCK_NAME));
    if (!acquired) {
      log.info("[WarmupScheduler] Skipped: another instance is warming");
      return Map.of();
    }
    try {
      Map<AnalyticsQuery, WarmStatus> results = warmer.warm(queries);
      record(results);
      return results;
    } finally {
      if (lock.isHeldByCurrentThread()) {
        lock.unlock();
      }
    }
  }

  private void record(Map<AnalyticsQuery, WarmStatus> results) {
    results
        .values()
        .forEach(
            status ->
                meterRegistry
                    .counter("analytics.cache.warmup", "status", status.state().name().toLowerCase(Locale.ROOT))
                    .increment());
  }
}
