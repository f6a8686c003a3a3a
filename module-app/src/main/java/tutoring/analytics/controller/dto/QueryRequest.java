package tutoring.analytics.controller.dto;

import jakarta.validation.constraints.NotBlank;
import java.util.List;
import tutoring.analytics.core.domain.model.AnalyticsQuery;

public record QueryRequest(@NotBlank String queryType, List<String> params) {

  public AnalyticsQuery toQuery() {
    return new AnalyticsQuery(queryType, params);
  }
}
