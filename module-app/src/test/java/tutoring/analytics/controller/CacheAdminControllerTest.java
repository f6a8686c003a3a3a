package tutoring.analytics.controller;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import tutoring.analytics.core.domain.model.AnalyticsQuery;
import tutoring.analytics.core.domain.model.CacheStats;
import tutoring.analytics.core.domain.model.WarmStatus;
import tutoring.analytics.error.exception.InvalidInvalidationEventException;
import tutoring.analytics.error.exception.InvalidKeyPatternException;
import tutoring.analytics.global.error.GlobalExceptionHandler;
import tutoring.analytics.infrastructure.cache.TieredAnalyticsCache;
import tutoring.analytics.service.invalidation.CacheInvalidationTrigger;
import tutoring.analytics.service.warmup.CacheWarmer;

/** Spring Context 없이 standalone MockMvc로 검증 */
@Tag("unit")
@ExtendWith(MockitoExtension.class)
@DisplayName("CacheAdminController 단위 테스트")
class CacheAdminControllerTest {

  @Mock private TieredAnalyticsCache cache;
  @Mock private CacheWarmer warmer;
  @Mock private CacheInvalidationTrigger trigger;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new CacheAdminController(cache, warmer, trigger))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
  }

  @Nested
  @DisplayName("통계")
  class Stats {

    @Test
    @DisplayName("GET /stats는 계층별 적중 수와 hit rate를 반환한다")
    void returnsStats() throws Exception {
      given(cache.getStats()).willReturn(CacheStats.of(3, 1, 0, 1, 1));

      mockMvc
          .perform(get("/api/admin/cache/stats"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.success").value(true))
          .andExpect(jsonPath("$.data.hitsL1").value(3))
          .andExpect(jsonPath("$.data.hitRate").value(0.8));
    }

    @Test
    @DisplayName("POST /stats/reset은 통계만 초기화한다")
    void resetsStats() throws Exception {
      given(cache.getStats()).willReturn(CacheStats.empty());

      mockMvc.perform(post("/api/admin/cache/stats/reset")).andExpect(status().isOk());

      verify(cache).resetStats();
    }
  }

  @Nested
  @DisplayName("무효화")
  class Invalidation {

    @Test
    @DisplayName("DELETE /keys?pattern=은 제거 수를 반환한다")
    void invalidatePattern() throws Exception {
      given(cache.invalidatePattern("analytics:student:42:*")).willReturn(4L);

      mockMvc
          .perform(delete("/api/admin/cache/keys").param("pattern", "analytics:student:42:*"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.data.removed").value(4));
    }

    @Test
    @DisplayName("잘못된 패턴은 400 + C003")
    void invalidPattern() throws Exception {
      given(cache.invalidatePattern("analytics:*:x"))
          .willThrow(new InvalidKeyPatternException("analytics:*:x", "wildcard is only allowed at the end"));

      mockMvc
          .perform(delete("/api/admin/cache/keys").param("pattern", "analytics:*:x"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value("C003"));
    }

    @Test
    @DisplayName("DELETE /keys/{key}는 단일 키를 무효화한다")
    void invalidateKey() throws Exception {
      mockMvc
          .perform(delete("/api/admin/cache/keys/analytics:student:42"))
          .andExpect(status().isOk());

      verify(cache).invalidate("analytics:student:42");
    }

    @Test
    @DisplayName("DELETE /keys/all은 전체 삭제로 라우팅된다")
    void clearAll() throws Exception {
      given(cache.clearAll()).willReturn(12L);

      mockMvc
          .perform(delete("/api/admin/cache/keys/all"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.data.removed").value(12));
    }
  }

  @Nested
  @DisplayName("이벤트")
  class Events {

    @Test
    @DisplayName("POST /events는 트리거로 전달한다")
    void firesEvent() throws Exception {
      given(trigger.onEvent("grade_updated", Map.of("assignment_id", "a1"))).willReturn(2L);

      mockMvc
          .perform(
              post("/api/admin/cache/events")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"eventType\":\"grade_updated\",\"params\":{\"assignment_id\":\"a1\"}}"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.data.removed").value(2));
    }

    @Test
    @DisplayName("처리할 수 없는 이벤트는 400 + C005")
    void rejectsUnknownEvent() throws Exception {
      given(trigger.onEvent("lesson_booked", Map.of()))
          .willThrow(new InvalidInvalidationEventException("lesson_booked", "unknown event type"));

      mockMvc
          .perform(
              post("/api/admin/cache/events")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"eventType\":\"lesson_booked\",\"params\":{}}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value("C005"));
    }

    @Test
    @DisplayName("eventType이 비어 있으면 400 + C001")
    void blankEventType() throws Exception {
      mockMvc
          .perform(
              post("/api/admin/cache/events")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"eventType\":\"\"}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value("C001"));

      verifyNoInteractions(trigger);
    }
  }

  @Nested
  @DisplayName("워밍")
  class Warm {

    @Test
    @DisplayName("POST /warm은 쿼리별 결과를 입력 순서대로 반환한다")
    void warmsQueries() throws Exception {
      Map<AnalyticsQuery, WarmStatus> results = new LinkedHashMap<>();
      results.put(AnalyticsQuery.of("student", "42"), WarmStatus.warmed());
      results.put(AnalyticsQuery.of("report", "weekly"), WarmStatus.failed("no computation"));
      given(warmer.warm(anyList())).willReturn(results);

      mockMvc
          .perform(
              post("/api/admin/cache/warm")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(
                      "{\"queries\":[{\"queryType\":\"student\",\"params\":[\"42\"]},"
                          + "{\"queryType\":\"report\",\"params\":[\"weekly\"]}]}"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.data[0].state").value("WARMED"))
          .andExpect(jsonPath("$.data[1].state").value("FAILED"))
          .andExpect(jsonPath("$.data[1].reason").value("no computation"));
    }

    @Test
    @DisplayName("빈 쿼리 목록은 400")
    void emptyQueries() throws Exception {
      mockMvc
          .perform(
              post("/api/admin/cache/warm")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"queries\":[]}"))
          .andExpect(status().isBadRequest());

      verifyNoInteractions(warmer);
    }

    @Test
    @DisplayName("POST /warm/users/{userId}는 대시보드 워밍을 호출한다")
    void warmsUserDashboard() throws Exception {
      given(warmer.warmUserDashboard("42"))
          .willReturn(Map.of(AnalyticsQuery.of("student", "42"), WarmStatus.warmed()));

      mockMvc
          .perform(post("/api/admin/cache/warm/users/42"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.data[0].queryType").value("student"));
    }
  }
}
