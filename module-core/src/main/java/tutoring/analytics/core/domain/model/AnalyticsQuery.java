package tutoring.analytics.core.domain.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 분석 쿼리 식별자
 *
 * <p>워머가 키 생성, TTL 조회, 집계 함수 선택에 사용합니다. 키는 {@code analytics:<queryType>:<params...>} 입니다.
 */
public record AnalyticsQuery(String queryType, List<String> params) {

  public static final String NAMESPACE = "analytics";

  public AnalyticsQuery {
    Objects.requireNonNull(queryType, "queryType");
    // null 파라미터는 키 생성 시점에 거부된다
    params = params == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
  }

  public static AnalyticsQuery of(String queryType, Object... params) {
    return new AnalyticsQuery(
        queryType, Arrays.stream(params).map(p -> Objects.toString(p, null)).toList());
  }

  public CacheKey toCacheKey() {
    return CacheKey.of(NAMESPACE, queryType, params.toArray());
  }

  @Override
  public String toString() {
    return params.isEmpty() ? queryType : queryType + params;
  }
}
