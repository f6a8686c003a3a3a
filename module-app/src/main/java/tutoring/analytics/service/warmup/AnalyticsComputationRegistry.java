package tutoring.analytics.service.warmup;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tutoring.analytics.core.port.out.AnalyticsComputation;
import tutoring.analytics.error.exception.ComputationNotRegisteredException;

/** 쿼리 유형별 집계 함수 조회. 같은 유형이 두 번 등록되면 기동을 실패시킨다. */
@Slf4j
@Component
public class AnalyticsComputationRegistry {

  private final Map<String, AnalyticsComputation> byQueryType = new LinkedHashMap<>();

  public AnalyticsComputationRegistry(List<AnalyticsComputation> computations) {
    for (AnalyticsComputation computation : computations) {
      AnalyticsComputation previous = byQueryType.putIfAbsent(computation.queryType(), computation);
      if (previous != null) {
        throw new IllegalStateException(
            "Duplicate analytics computation for query type: " + computation.queryType());
      }
    }
    log.info("[AnalyticsComputationRegistry] Registered query types: {}", byQueryType.keySet());
  }

  public Optional<AnalyticsComputation> find(String queryType) {
    return Optional.ofNullable(byQueryType.get(queryType));
  }

  public AnalyticsComputation require(String queryType) {
    return find(queryType).orElseThrow(() -> new ComputationNotRegisteredException(queryType));
  }

  public Set<String> queryTypes() {
    return byQueryType.keySet();
  }
}
