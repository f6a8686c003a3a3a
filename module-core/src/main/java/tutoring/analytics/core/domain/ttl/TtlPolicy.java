package tutoring.analytics.core.domain.ttl;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import tutoring.analytics.core.domain.model.TtlConfig;

/**
 * 쿼리 유형별 TTL 정책 (순수 함수)
 *
 * <p>유형별 설정이 없으면 기본값을 사용합니다. 기본값은 L1 60초, L2 1시간, L3 7일입니다.
 */
public final class TtlPolicy {

  public static final Duration DEFAULT_L1_TTL = Duration.ofSeconds(60);
  public static final Duration DEFAULT_L2_TTL = Duration.ofHours(1);
  public static final Duration DEFAULT_L3_TTL = Duration.ofDays(7);

  public static final TtlConfig DEFAULT_CONFIG =
      TtlConfig.of(DEFAULT_L1_TTL, DEFAULT_L2_TTL, DEFAULT_L3_TTL);

  private final TtlConfig defaultConfig;
  private final Map<String, TtlConfig> byQueryType;

  public TtlPolicy(TtlConfig defaultConfig, Map<String, TtlConfig> byQueryType) {
    this.defaultConfig = Objects.requireNonNull(defaultConfig, "defaultConfig");
    this.byQueryType = Map.copyOf(byQueryType);
  }

  public static TtlPolicy defaults() {
    return new TtlPolicy(DEFAULT_CONFIG, Map.of());
  }

  public TtlConfig forQueryType(String queryType) {
    return byQueryType.getOrDefault(queryType, defaultConfig);
  }

  public TtlConfig defaultConfig() {
    return defaultConfig;
  }

  /** 권장 순서(l1 <= l2 <= l3)를 어기는 유형. 기본 설정은 {@code "*"}로 표시 */
  public Map<String, TtlConfig> nonMonotonicConfigs() {
    Map<String, TtlConfig> violations = new TreeMap<>();
    if (!defaultConfig.isMonotonic()) {
      violations.put("*", defaultConfig);
    }
    byQueryType.forEach(
        (type, config) -> {
          if (!config.isMonotonic()) {
            violations.put(type, config);
          }
        });
    return violations;
  }
}
