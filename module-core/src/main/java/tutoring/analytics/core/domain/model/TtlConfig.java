package tutoring.analytics.core.domain.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import tutoring.analytics.error.exception.InvalidTtlConfigException;

/**
 * 계층별 TTL 설정
 *
 * <p>0 또는 미지정(null) TTL은 해당 계층에 쓰지 않음을 뜻합니다. 음수는 거부됩니다. {@code l1 <= l2 <= l3}는 권장 순서일 뿐
 * 강제하지 않습니다({@link #isMonotonic()}).
 *
 * @param l1 in-process 계층 TTL
 * @param l2 공유 원격 계층 TTL
 * @param l3 사전 집계 스냅샷 TTL
 */
public record TtlConfig(Duration l1, Duration l2, Duration l3) {

  public TtlConfig {
    l1 = normalize("l1", l1);
    l2 = normalize("l2", l2);
    l3 = normalize("l3", l3);
  }

  public static TtlConfig of(Duration l1, Duration l2) {
    return new TtlConfig(l1, l2, Duration.ZERO);
  }

  public static TtlConfig of(Duration l1, Duration l2, Duration l3) {
    return new TtlConfig(l1, l2, l3);
  }

  public static TtlConfig ofSeconds(long l1, long l2, long l3) {
    return new TtlConfig(Duration.ofSeconds(l1), Duration.ofSeconds(l2), Duration.ofSeconds(l3));
  }

  public boolean hasL1() {
    return !l1.isZero();
  }

  public boolean hasL2() {
    return !l2.isZero();
  }

  public boolean hasL3() {
    return !l3.isZero();
  }

  public TtlConfig withoutL3() {
    return new TtlConfig(l1, l2, Duration.ZERO);
  }

  /** 설정된 계층끼리 짧은 계층이 긴 계층보다 오래 살지 않는지 */
  public boolean isMonotonic() {
    List<Duration> configured = new ArrayList<>(3);
    for (Duration ttl : List.of(l1, l2, l3)) {
      if (!ttl.isZero()) {
        configured.add(ttl);
      }
    }
    for (int i = 1; i < configured.size(); i++) {
      if (configured.get(i - 1).compareTo(configured.get(i)) > 0) {
        return false;
      }
    }
    return true;
  }

  private static Duration normalize(String tier, Duration ttl) {
    if (ttl == null) {
      return Duration.ZERO;
    }
    if (ttl.isNegative()) {
      throw new InvalidTtlConfigException(tier + " ttl must not be negative: " + ttl);
    }
    return ttl;
  }
}
