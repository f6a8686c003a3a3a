package tutoring.analytics.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import tutoring.analytics.infrastructure.cache.TieredAnalyticsCache;
import tutoring.analytics.infrastructure.executor.LogicExecutor;
import tutoring.analytics.infrastructure.executor.TaskContext;

/**
 * 캐시 유지보수 스케줄러
 *
 * <ul>
 *   <li>L1 만료 엔트리 정리
 *   <li>L3 스냅샷 대기열 반영
 * </ul>
 *
 * <p>두 작업은 서로 독립적인 fixedDelay 작업이며 오케스트레이터의 공개 API만 사용합니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CacheMaintenanceScheduler {

  private final TieredAnalyticsCache cache;
  private final LogicExecutor executor;

  @Scheduled(fixedDelayString = "${analytics.cache.sweep-interval-ms:30000}")
  public void sweepExpired() {
    executor.executeVoid(cache::sweepExpired, TaskContext.of("Scheduler", "SweepL1"));
  }

  @Scheduled(fixedDelayString = "${analytics.cache.l3.drain-interval-ms:5000}")
  public void drainSnapshots() {
    int written =
        executor.executeOrCatch(
            cache::refreshSnapshots,
            e -> {
              log.warn("[CacheMaintenance] Snapshot drain failed: {}", e.getMessage());
              return 0;
            },
            TaskContext.of("Scheduler", "DrainL3"));
    if (written > 0) {
      log.debug("[CacheMaintenance] Snapshots written: {}", written);
    }
  }
}
