package tutoring.analytics.service.warmup;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tutoring.analytics.core.domain.model.AnalyticsQuery;
import tutoring.analytics.core.domain.model.CacheKey;
import tutoring.analytics.core.domain.model.WarmStatus;
import tutoring.analytics.core.domain.ttl.TtlPolicy;
import tutoring.analytics.core.port.out.AnalyticsComputation;
import tutoring.analytics.error.exception.InternalSystemException;
import tutoring.analytics.infrastructure.cache.TieredAnalyticsCache;
import tutoring.analytics.infrastructure.executor.LogicExecutor;
import tutoring.analytics.infrastructure.executor.TaskContext;

/**
 * 캐시 워머
 *
 * <p>쿼리마다 독립적으로 집계 → {@code set}을 수행합니다. 한 쿼리의 실패는 결과에 FAILED로 기록될 뿐 나머지 처리를 막지 않습니다.
 * 같은 목록을 다시 실행해도 결과 상태는 같습니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CacheWarmer {

  static final String STUDENT_QUERY = "student";
  static final String DASHBOARD_QUERY = "dashboard";

  private final TieredAnalyticsCache cache;
  private final AnalyticsComputationRegistry computations;
  private final TtlPolicy ttlPolicy;
  private final LogicExecutor executor;

  /** @return 입력 순서를 유지한 쿼리별 결과 */
  public Map<AnalyticsQuery, WarmStatus> warm(List<AnalyticsQuery> queries) {
    Map<AnalyticsQuery, WarmStatus> results = new LinkedHashMap<>();
    for (AnalyticsQuery query : queries) {
      results.put(query, warmOne(query));
    }
    long warmed = results.values().stream().filter(WarmStatus::isWarmed).count();
    log.info(
        "[CacheWarmer] Warmup finished: requested={}, warmed={}, failed={}",
        results.size(),
        warmed,
        results.size() - warmed);
    return results;
  }

  /** 한 사용자의 대시보드 진입에 필요한 쿼리 워밍 */
  public Map<AnalyticsQuery, WarmStatus> warmUserDashboard(String userId) {
    return warm(
        List.of(
            AnalyticsQuery.of(STUDENT_QUERY, userId), AnalyticsQuery.of(DASHBOARD_QUERY, userId)));
  }

  private WarmStatus warmOne(AnalyticsQuery query) {
    Optional<AnalyticsComputation> computation = computations.find(query.queryType());
    if (computation.isEmpty()) {
      return WarmStatus.failed(
          "no computation registered for query type '" + query.queryType() + "'");
    }
    return executor.executeOrCatch(
        () -> {
          CacheKey key = query.toCacheKey();
          Object value = computation.get().compute(query.params());
          if (value == null) {
            return WarmStatus.failed("computation returned no value");
          }
          if (!cache.set(key, value, ttlPolicy.forQueryType(query.queryType()))) {
            log.warn("[CacheWarmer] Shared tier write failed, warmed locally only: query={}", query);
            return WarmStatus.warmedLocally("shared tier unavailable, warmed on this instance only");
          }
          return WarmStatus.warmed();
        },
        e -> {
          log.warn("[CacheWarmer] Warmup failed: query={}, reason={}", query, e.getMessage());
          return WarmStatus.failed(describe(e));
        },
        TaskContext.of("CacheWarmer", "warm", query.toString()));
  }

  private static String describe(Throwable e) {
    Throwable cause =
        e instanceof InternalSystemException && e.getCause() != null ? e.getCause() : e;
    return cause.getClass().getSimpleName() + ": " + cause.getMessage();
  }
}
