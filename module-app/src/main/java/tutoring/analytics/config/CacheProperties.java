package tutoring.analytics.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.boot.context.properties.bind.Name;
import org.springframework.validation.annotation.Validated;
import tutoring.analytics.core.domain.model.AnalyticsQuery;
import tutoring.analytics.core.domain.model.TtlConfig;

/**
 * 분석 캐시 설정 프로퍼티
 *
 * <h3>application.yml 설정 예시</h3>
 *
 * <pre>
 * analytics:
 *   cache:
 *     l1:
 *       max-size: 10000
 *     l2:
 *       key-prefix: "tac:"
 *     ttl:
 *       default: { l1: 60s, l2: 1h, l3: 7d }
 *       types:
 *         engagement: { l1: 30s, l2: 10m, l3: 1d }
 *     singleflight:
 *       mode: local
 * </pre>
 *
 * @param l1 L1 (Caffeine) 설정
 * @param l2 L2 (Redis) 설정
 * @param l3 L3 (스냅샷) 설정
 * @param ttl 기본/쿼리 유형별 TTL
 * @param singleflight 중복 계산 방지 방식
 * @param invalidation 인스턴스 간 L1 무효화 브로드캐스트
 * @param warmup 워밍 스케줄
 * @param sweepIntervalMs L1 만료 정리 주기 (ms)
 */
@Validated
@ConfigurationProperties(prefix = "analytics.cache")
public record CacheProperties(
    @Valid @DefaultValue L1 l1,
    @Valid @DefaultValue L2 l2,
    @Valid @DefaultValue L3 l3,
    @Valid @DefaultValue Ttl ttl,
    @Valid @DefaultValue SingleFlight singleflight,
    @Valid @DefaultValue Invalidation invalidation,
    @Valid @DefaultValue Warmup warmup,
    @DefaultValue("30000") @Min(1000) long sweepIntervalMs) {

  public record L1(@DefaultValue("10000") @Min(1) long maxSize) {}

  public record L2(@DefaultValue("tac:") @NotBlank String keyPrefix) {}

  public record L3(
      @DefaultValue("true") boolean enabled,
      @DefaultValue("analytics:snapshots") @NotBlank String mapName,
      @DefaultValue("10000") @Min(1) int queueCapacity,
      @DefaultValue("5000") @Min(100) long drainIntervalMs) {}

  /** TTL. {@code default}는 예약어라 {@link Name}으로 바인딩한다 */
  public record Ttl(@Name("default") @DefaultValue TierTtl defaults, Map<String, TierTtl> types) {

    public Ttl {
      types = types == null ? Map.of() : Map.copyOf(types);
    }
  }

  /** 계층별 TTL. 0이면 해당 계층에 저장하지 않는다 */
  public record TierTtl(
      @DefaultValue("60s") @NotNull Duration l1,
      @DefaultValue("1h") @NotNull Duration l2,
      @DefaultValue("7d") @NotNull Duration l3) {

    public TtlConfig toTtlConfig() {
      return TtlConfig.of(l1, l2, l3);
    }
  }

  public record SingleFlight(
      @DefaultValue("local") @NotNull Mode mode,
      @DefaultValue("3") @Min(0) long lockWaitSeconds,
      @DefaultValue("30") @Min(1) long leaseSeconds) {

    public enum Mode {
      LOCAL,
      DISTRIBUTED
    }
  }

  public record Invalidation(
      @DefaultValue("true") boolean broadcastEnabled,
      @DefaultValue("analytics:cache:invalidation") @NotBlank String topic) {}

  /**
   * @param enabled 워밍 스케줄 활성화
   * @param cron 정기 워밍 cron (기본: 매일 03:00)
   * @param initialDelayMs 기동 후 첫 워밍까지 대기 시간
   * @param targets 워밍 대상 쿼리
   */
  public record Warmup(
      @DefaultValue("true") boolean enabled,
      @DefaultValue("0 0 3 * * *") @NotBlank String cron,
      @DefaultValue("30000") @Min(0) long initialDelayMs,
      List<@Valid Target> targets) {

    public Warmup {
      targets = targets == null ? List.of() : List.copyOf(targets);
    }

    public List<AnalyticsQuery> queries() {
      return targets.stream().map(Target::toQuery).toList();
    }
  }

  public record Target(@NotBlank String queryType, List<String> params) {

    public AnalyticsQuery toQuery() {
      return new AnalyticsQuery(queryType, params);
    }
  }
}
