package tutoring.analytics.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Map;
import tutoring.analytics.core.domain.model.AnalyticsQuery;
import tutoring.analytics.core.domain.model.WarmStatus;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record WarmResult(String queryType, List<String> params, WarmStatus.State state, String reason) {

  public static List<WarmResult> from(Map<AnalyticsQuery, WarmStatus> results) {
    return results.entrySet().stream()
        .map(
            e ->
                new WarmResult(
                    e.getKey().queryType(),
                    e.getKey().params(),
                    e.getValue().state(),
                    e.getValue().reason()))
        .toList();
  }
}
