package tutoring.analytics.core.domain.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import tutoring.analytics.error.exception.InvalidCacheKeyException;

/**
 * 캐시 키 (Value Object)
 *
 * <h3>문법</h3>
 *
 * <pre>
 * key       := namespace ':' type ( ':' param )*
 * namespace := [a-z][a-z0-9_-]*
 * type      := [a-z][a-z0-9_-]*
 * param     := [A-Za-z0-9_.,-]+
 * </pre>
 *
 * <h3>불변식</h3>
 *
 * <ul>
 *   <li>동일한 논리 쿼리는 항상 동일한 키를 만든다 (컬렉션 파라미터는 정렬 후 {@code ,}로 결합)
 *   <li>세그먼트에 {@code :}와 {@code *}가 올 수 없으므로 서로 다른 쿼리는 충돌하지 않는다
 *   <li>생성 시점에 검증되며, 잘못된 키는 어떤 계층 I/O보다 먼저 {@link InvalidCacheKeyException}으로 거부된다
 * </ul>
 */
public record CacheKey(String namespace, String type, List<String> params) {

  public static final String SEPARATOR = ":";

  private static final Pattern NAME = Pattern.compile("[a-z][a-z0-9_-]*");
  private static final Pattern PARAM = Pattern.compile("[A-Za-z0-9_.,-]+");
  private static final Pattern ELEMENT = Pattern.compile("[A-Za-z0-9_.-]+");

  public CacheKey {
    String display = render(namespace, type, params);
    if (namespace == null || !NAME.matcher(namespace).matches()) {
      throw new InvalidCacheKeyException(display, "invalid namespace");
    }
    if (type == null || !NAME.matcher(type).matches()) {
      throw new InvalidCacheKeyException(display, "invalid query type");
    }
    if (params == null) {
      throw new InvalidCacheKeyException(display, "params must not be null");
    }
    for (String param : params) {
      if (param == null || !PARAM.matcher(param).matches()) {
        throw new InvalidCacheKeyException(display, "invalid param segment '" + param + "'");
      }
    }
    params = List.copyOf(params);
  }

  /**
   * 논리 쿼리 식별자로부터 키 생성
   *
   * <p>컬렉션 파라미터는 원소를 문자열로 변환해 정렬한 뒤 {@code ,}로 결합합니다. 그 외 값은 {@code toString()}을 사용하며,
   * 컬렉션 결합 결과와 겹치지 않도록 {@code ,}를 포함할 수 없습니다.
   */
  public static CacheKey of(String namespace, String type, Object... params) {
    List<String> segments = new ArrayList<>(params.length);
    for (Object param : params) {
      segments.add(serialize(namespace, type, param));
    }
    return new CacheKey(namespace, type, segments);
  }

  /** 문자열 키를 파싱하고 검증 */
  public static CacheKey parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new InvalidCacheKeyException(String.valueOf(raw), "key must not be blank");
    }
    String[] segments = raw.split(SEPARATOR, -1);
    if (segments.length < 2) {
      throw new InvalidCacheKeyException(raw, "expected namespace:type[:param...]");
    }
    List<String> params = Arrays.asList(segments).subList(2, segments.length);
    return new CacheKey(segments[0], segments[1], params);
  }

  public String value() {
    return render(namespace, type, params);
  }

  @Override
  public String toString() {
    return value();
  }

  private static String serialize(String namespace, String type, Object param) {
    if (param == null) {
      throw new InvalidCacheKeyException(namespace + SEPARATOR + type, "null param");
    }
    if (param instanceof Collection<?> values) {
      if (values.isEmpty()) {
        throw new InvalidCacheKeyException(namespace + SEPARATOR + type, "empty collection param");
      }
      if (values.stream().anyMatch(Objects::isNull)) {
        throw new InvalidCacheKeyException(namespace + SEPARATOR + type, "null collection element");
      }
      List<String> elements = values.stream().map(Object::toString).sorted().toList();
      for (String element : elements) {
        if (!ELEMENT.matcher(element).matches()) {
          throw new InvalidCacheKeyException(
              namespace + SEPARATOR + type, "invalid collection element '" + element + "'");
        }
      }
      return String.join(",", elements);
    }
    String scalar = param.toString();
    if (!ELEMENT.matcher(scalar).matches()) {
      throw new InvalidCacheKeyException(
          namespace + SEPARATOR + type, "invalid scalar param '" + scalar + "'");
    }
    return scalar;
  }

  private static String render(String namespace, String type, List<String> params) {
    String head = namespace + SEPARATOR + type;
    if (params == null || params.isEmpty()) {
      return head;
    }
    return head
        + SEPARATOR
        + params.stream().map(String::valueOf).collect(Collectors.joining(SEPARATOR));
  }
}
