package tutoring.analytics.core.domain.invalidation;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import tutoring.analytics.error.exception.InvalidInvalidationEventException;

/**
 * 무효화 이벤트 (도메인 사실)
 *
 * <p>파라미터 값은 키 세그먼트로 쓰이므로 식별자 문자만 허용됩니다.
 *
 * @param type 이벤트 유형
 * @param params 이벤트 파라미터 (예: assignment_id, student_id)
 */
public record InvalidationEvent(InvalidationEventType type, Map<String, String> params) {

  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9_.-]+");

  public InvalidationEvent {
    Objects.requireNonNull(type, "type");
    params = params == null ? Map.of() : Map.copyOf(params);
  }

  public static InvalidationEvent of(InvalidationEventType type, Map<String, String> params) {
    return new InvalidationEvent(type, params);
  }

  public String requireParam(String name) {
    return optionalParam(name)
        .orElseThrow(
            () ->
                new InvalidInvalidationEventException(
                    type.wireName(), "missing required param '" + name + "'"));
  }

  public Optional<String> optionalParam(String name) {
    String value = params.get(name);
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    if (!IDENTIFIER.matcher(value).matches()) {
      throw new InvalidInvalidationEventException(
          type.wireName(), "param '" + name + "' has illegal value '" + value + "'");
    }
    return Optional.of(value);
  }
}
