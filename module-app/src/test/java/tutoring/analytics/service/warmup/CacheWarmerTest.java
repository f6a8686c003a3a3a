package tutoring.analytics.service.warmup;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static tutoring.analytics.support.TestComputations.computation;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tutoring.analytics.core.domain.model.AnalyticsQuery;
import tutoring.analytics.core.domain.model.CacheKey;
import tutoring.analytics.core.domain.model.WarmStatus;
import tutoring.analytics.core.domain.ttl.TtlPolicy;
import tutoring.analytics.infrastructure.cache.TieredAnalyticsCache;
import tutoring.analytics.infrastructure.executor.DefaultLogicExecutor;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
@DisplayName("CacheWarmer 테스트")
class CacheWarmerTest {

  @Mock private TieredAnalyticsCache cache;

  private CacheWarmer warmer;

  @BeforeEach
  void setUp() {
    lenient().when(cache.set(any(CacheKey.class), any(), any())).thenReturn(true);
    AnalyticsComputationRegistry registry =
        new AnalyticsComputationRegistry(
            List.of(
                computation("student", params -> Map.of("avg", 80, "id", params.get(0))),
                computation(
                    "assignment",
                    params -> {
                      throw new IOException("db timeout");
                    }),
                computation("engagement", params -> null)));
    warmer =
        new CacheWarmer(
            cache,
            registry,
            TtlPolicy.defaults(),
            new DefaultLogicExecutor(new SimpleMeterRegistry()));
  }

  @Test
  @DisplayName("계산 결과를 쿼리 유형의 TTL로 저장한다")
  void warmsWithPolicyTtl() {
    AnalyticsQuery query = AnalyticsQuery.of("student", 42);

    Map<AnalyticsQuery, WarmStatus> results = warmer.warm(List.of(query));

    assertThat(results.get(query).isWarmed()).isTrue();
    verify(cache)
        .set(
            eq(CacheKey.of("analytics", "student", 42)),
            eq(Map.of("avg", 80, "id", "42")),
            eq(TtlPolicy.DEFAULT_CONFIG));
  }

  @Test
  @DisplayName("공유 계층 기록에 실패하면 로컬 워밍임을 사유로 남긴다")
  void reportsLocalOnlyWarmup() {
    AnalyticsQuery query = AnalyticsQuery.of("student", 9);
    given(cache.set(eq(query.toCacheKey()), any(), any())).willReturn(false);

    WarmStatus status = warmer.warm(List.of(query)).get(query);

    assertThat(status.isWarmed()).isTrue();
    assertThat(status.reason()).contains("warmed on this instance only");
  }

  @Test
  @DisplayName("정상 워밍은 사유가 없다")
  void fullWarmupHasNoReason() {
    AnalyticsQuery query = AnalyticsQuery.of("student", 10);

    assertThat(warmer.warm(List.of(query)).get(query)).isEqualTo(WarmStatus.warmed());
  }

  @Test
  @DisplayName("한 쿼리가 실패해도 나머지는 계속 처리하고 입력 순서를 유지한다")
  void isolatesFailuresPerQuery() {
    AnalyticsQuery failing = AnalyticsQuery.of("assignment", "a1");
    AnalyticsQuery unknown = AnalyticsQuery.of("leaderboard", "w1");
    AnalyticsQuery ok = AnalyticsQuery.of("student", 7);

    Map<AnalyticsQuery, WarmStatus> results = warmer.warm(List.of(failing, unknown, ok));

    assertThat(results.keySet()).containsExactly(failing, unknown, ok);
    assertThat(results.get(failing).state()).isEqualTo(WarmStatus.State.FAILED);
    assertThat(results.get(failing).reason()).contains("db timeout");
    assertThat(results.get(unknown).reason()).contains("no computation registered");
    assertThat(results.get(ok).isWarmed()).isTrue();
  }

  @Test
  @DisplayName("키 문법에 맞지 않는 파라미터는 FAILED로 기록한다")
  void invalidKeyIsFailure() {
    AnalyticsQuery query = AnalyticsQuery.of("student", "a:b");

    WarmStatus status = warmer.warm(List.of(query)).get(query);

    assertThat(status.isWarmed()).isFalse();
    verify(cache, never()).set(any(CacheKey.class), any(), any());
  }

  @Test
  @DisplayName("값이 없는 계산 결과는 저장하지 않는다")
  void nullResultIsNotCached() {
    AnalyticsQuery query = AnalyticsQuery.of("engagement", "s1");

    assertThat(warmer.warm(List.of(query)).get(query).reason())
        .isEqualTo("computation returned no value");
    verify(cache, never()).set(any(CacheKey.class), any(), any());
  }

  @Test
  @DisplayName("사용자 대시보드 워밍은 student와 dashboard 쿼리를 처리한다")
  void warmUserDashboard() {
    Map<AnalyticsQuery, WarmStatus> results = warmer.warmUserDashboard("42");

    assertThat(results.keySet())
        .containsExactly(AnalyticsQuery.of("student", "42"), AnalyticsQuery.of("dashboard", "42"));
    assertThat(results.get(AnalyticsQuery.of("student", "42")).isWarmed()).isTrue();
    assertThat(results.get(AnalyticsQuery.of("dashboard", "42")).isWarmed()).isFalse();
  }
}
