package tutoring.analytics.core.domain.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import tutoring.analytics.error.exception.InvalidTtlConfigException;

@Tag("unit")
class TtlConfigTest {

  @Test
  @DisplayName("null 또는 0 TTL은 해당 계층을 사용하지 않는다")
  void zeroOrNullDisablesTier() {
    TtlConfig config = new TtlConfig(Duration.ofSeconds(60), null, Duration.ZERO);

    assertThat(config.hasL1()).isTrue();
    assertThat(config.hasL2()).isFalse();
    assertThat(config.hasL3()).isFalse();
    assertThat(config.l2()).isEqualTo(Duration.ZERO);
  }

  @Test
  @DisplayName("음수 TTL은 거부된다")
  void rejectsNegative() {
    assertThatThrownBy(() -> TtlConfig.of(Duration.ofSeconds(-1), Duration.ofSeconds(10)))
        .isInstanceOf(InvalidTtlConfigException.class)
        .hasMessageContaining("l1");
  }

  @Test
  @DisplayName("권장 순서는 설정된 계층끼리만 비교한다")
  void monotonicIgnoresDisabledTiers() {
    assertThat(TtlConfig.ofSeconds(60, 3600, 604800).isMonotonic()).isTrue();
    assertThat(TtlConfig.ofSeconds(60, 3600, 0).isMonotonic()).isTrue();
    assertThat(TtlConfig.ofSeconds(0, 30, 20).isMonotonic()).isFalse();
    assertThat(TtlConfig.ofSeconds(600, 60, 0).isMonotonic()).isFalse();
  }

  @Test
  @DisplayName("withoutL3는 L3 TTL만 제거한다")
  void withoutL3() {
    TtlConfig config = TtlConfig.ofSeconds(60, 3600, 604800).withoutL3();

    assertThat(config).isEqualTo(TtlConfig.ofSeconds(60, 3600, 0));
  }
}
