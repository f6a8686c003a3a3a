package tutoring.analytics.error;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import tutoring.analytics.error.dto.ErrorResponse;
import tutoring.analytics.error.exception.CacheTierUnavailableException;
import tutoring.analytics.error.exception.InvalidCacheKeyException;
import tutoring.analytics.error.exception.base.ClientBaseException;
import tutoring.analytics.error.exception.base.ServerBaseException;

@Tag("unit")
class CommonErrorCodeTest {

  @Test
  @DisplayName("에러 코드는 중복되지 않는다")
  void codesAreUnique() {
    long distinct =
        Arrays.stream(CommonErrorCode.values()).map(CommonErrorCode::getCode).distinct().count();

    assertThat(distinct).isEqualTo(CommonErrorCode.values().length);
  }

  @Test
  @DisplayName("C 코드는 4xx, S 코드는 5xx 상태를 가진다")
  void prefixMatchesStatusSeries() {
    for (CommonErrorCode code : CommonErrorCode.values()) {
      HttpStatus status = code.getStatus();
      if (code.getCode().startsWith("C")) {
        assertThat(status.is4xxClientError()).as(code.name()).isTrue();
      } else {
        assertThat(status.is5xxServerError()).as(code.name()).isTrue();
      }
    }
  }

  @Test
  @DisplayName("동적 인자가 메시지에 포맷팅된다")
  void formatsArguments() {
    InvalidCacheKeyException e = new InvalidCacheKeyException("a:b", "too few segments");

    assertThat(e).isInstanceOf(ClientBaseException.class);
    assertThat(e.getMessage()).contains("a:b").contains("too few segments");
    assertThat(ErrorResponse.from(e).status()).isEqualTo(400);
    assertThat(ErrorResponse.from(e).code()).isEqualTo("C002");
  }

  @Test
  @DisplayName("서버 예외는 원인 예외를 보존한다")
  void serverExceptionKeepsCause() {
    IllegalStateException cause = new IllegalStateException("connection refused");

    CacheTierUnavailableException e = new CacheTierUnavailableException("L2", "get", cause);

    assertThat(e).isInstanceOf(ServerBaseException.class);
    assertThat(e.getCause()).isSameAs(cause);
    assertThat(e.getErrorCode()).isEqualTo(CommonErrorCode.CACHE_TIER_UNAVAILABLE);
  }
}
