package tutoring.analytics.controller;

import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import tutoring.analytics.core.domain.model.AnalyticsQuery;
import tutoring.analytics.core.domain.model.CacheResult;
import tutoring.analytics.response.ApiResponse;
import tutoring.analytics.service.query.AnalyticsQueryService;

/** 집계 조회 API. 응답의 tier로 어느 계층에서 응답했는지 확인할 수 있다. */
@RestController
@RequestMapping("/api/analytics")
@RequiredArgsConstructor
public class AnalyticsQueryController {

  private final AnalyticsQueryService queryService;

  @GetMapping("/{queryType}")
  public ResponseEntity<ApiResponse<CacheResult<Object>>> query(
      @PathVariable String queryType,
      @RequestParam(name = "params", required = false) List<String> params) {
    return ResponseEntity.ok(
        ApiResponse.success(queryService.query(new AnalyticsQuery(queryType, params))));
  }
}
