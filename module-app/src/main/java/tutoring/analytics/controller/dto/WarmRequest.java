package tutoring.analytics.controller.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import tutoring.analytics.core.domain.model.AnalyticsQuery;

/**
 * 워밍 요청
 *
 * @param queries 워밍할 쿼리 목록 (1개 이상)
 */
public record WarmRequest(@NotEmpty List<@Valid QueryRequest> queries) {

  public List<AnalyticsQuery> toQueries() {
    return queries.stream().map(QueryRequest::toQuery).toList();
  }
}
