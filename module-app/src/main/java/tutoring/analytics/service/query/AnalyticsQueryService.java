package tutoring.analytics.service.query;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import tutoring.analytics.core.domain.model.AnalyticsQuery;
import tutoring.analytics.core.domain.model.CacheKey;
import tutoring.analytics.core.domain.model.CacheResult;
import tutoring.analytics.core.domain.ttl.TtlPolicy;
import tutoring.analytics.core.port.out.AnalyticsComputation;
import tutoring.analytics.infrastructure.cache.TieredAnalyticsCache;
import tutoring.analytics.infrastructure.executor.LogicExecutor;
import tutoring.analytics.infrastructure.executor.TaskContext;
import tutoring.analytics.service.warmup.AnalyticsComputationRegistry;

/** 등록된 집계를 캐시를 거쳐 조회 (read-through) */
@Service
@RequiredArgsConstructor
public class AnalyticsQueryService {

  private final TieredAnalyticsCache cache;
  private final AnalyticsComputationRegistry computations;
  private final TtlPolicy ttlPolicy;
  private final LogicExecutor executor;

  public CacheResult<Object> query(AnalyticsQuery query) {
    AnalyticsComputation computation = computations.require(query.queryType());
    CacheKey key = query.toCacheKey();
    return cache.get(
        key,
        Object.class,
        () ->
            executor.execute(
                () -> computation.compute(query.params()),
                TaskContext.of("AnalyticsQuery", "compute", key.value())),
        ttlPolicy.forQueryType(query.queryType()));
  }
}
