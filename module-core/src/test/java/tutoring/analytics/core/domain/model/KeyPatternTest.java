package tutoring.analytics.core.domain.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import tutoring.analytics.error.exception.InvalidKeyPatternException;

@Tag("unit")
@DisplayName("KeyPattern 매칭 테스트")
class KeyPatternTest {

  @Test
  @DisplayName("세그먼트 범위 패턴은 기준 키와 하위 키만 매칭한다")
  void segmentScope() {
    KeyPattern pattern = KeyPattern.parse("analytics:student:42:*");

    assertThat(pattern.kind()).isEqualTo(KeyPattern.Kind.SEGMENT_SCOPE);
    assertThat(pattern.matches("analytics:student:42")).isTrue();
    assertThat(pattern.matches("analytics:student:42:weekly")).isTrue();
    assertThat(pattern.matches("analytics:student:420")).isFalse();
    assertThat(pattern.matches("analytics:student:4")).isFalse();
    assertThat(pattern.toRedisGlob()).isEqualTo("analytics:student:42:*");
  }

  @Test
  @DisplayName("ns:* 는 ns: 접두사를 가진 키만 매칭한다")
  void namespaceScope() {
    KeyPattern pattern = KeyPattern.parse("analytics:*");

    assertThat(pattern.matches("analytics:student:1")).isTrue();
    assertThat(pattern.matches("analyticsx:student:1")).isFalse();
    assertThat(pattern.matches("dashboard:user:1")).isFalse();
  }

  @Test
  @DisplayName("원시 접두사 패턴은 세그먼트 경계를 보지 않는다")
  void rawPrefix() {
    KeyPattern pattern = KeyPattern.parse("analytics:stud*");

    assertThat(pattern.kind()).isEqualTo(KeyPattern.Kind.PREFIX);
    assertThat(pattern.matches("analytics:student:1")).isTrue();
    assertThat(pattern.matches("analytics:studio:1")).isTrue();
    assertThat(pattern.includesBaseKey()).isFalse();
  }

  @Test
  @DisplayName("와일드카드가 없으면 정확히 일치하는 키만 매칭한다")
  void exact() {
    KeyPattern pattern = KeyPattern.parse("analytics:student:42");

    assertThat(pattern.isWildcard()).isFalse();
    assertThat(pattern.matches("analytics:student:42")).isTrue();
    assertThat(pattern.matches("analytics:student:42:weekly")).isFalse();
  }

  @Test
  @DisplayName("scope()는 세그먼트를 결합해 범위 패턴을 만든다")
  void scopeFactory() {
    assertThat(KeyPattern.scope("dashboard", "user", "7").value()).isEqualTo("dashboard:user:7:*");
    assertThat(KeyPattern.scope("analytics")).isEqualTo(KeyPattern.parse("analytics:*"));
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "*", ":*", "analytics:*:42", "*:student", "analytics::*", "a b:*"})
  @DisplayName("잘못된 패턴은 InvalidKeyPatternException")
  void rejectsInvalid(String raw) {
    assertThatThrownBy(() -> KeyPattern.parse(raw)).isInstanceOf(InvalidKeyPatternException.class);
  }
}
