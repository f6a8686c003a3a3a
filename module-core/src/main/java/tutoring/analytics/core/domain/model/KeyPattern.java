package tutoring.analytics.core.domain.model;

import java.util.regex.Pattern;
import tutoring.analytics.error.exception.InvalidKeyPatternException;

/**
 * 무효화 키 패턴
 *
 * <h3>지원 형태</h3>
 *
 * <ul>
 *   <li>{@code analytics:student:42} - 정확히 일치하는 키 하나
 *   <li>{@code analytics:student:42:*} - 세그먼트 범위: 기준 키 자체와 {@code analytics:student:42:}로 시작하는 모든 키
 *   <li>{@code analytics:stud*} - 원시 접두사
 * </ul>
 *
 * <p>와일드카드는 마지막 문자로만 허용됩니다. 매칭은 순수 함수이므로 캐시 없이 테스트할 수 있습니다.
 */
public final class KeyPattern {

  public static final String WILDCARD = "*";
  private static final String SCOPE_SUFFIX = CacheKey.SEPARATOR + WILDCARD;
  private static final Pattern BODY = Pattern.compile("[A-Za-z0-9_.,:-]+");

  public enum Kind {
    EXACT,
    PREFIX,
    SEGMENT_SCOPE
  }

  private final String raw;
  private final Kind kind;
  private final String base;

  private KeyPattern(String raw, Kind kind, String base) {
    this.raw = raw;
    this.kind = kind;
    this.base = base;
  }

  public static KeyPattern parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new InvalidKeyPatternException(String.valueOf(raw), "pattern must not be blank");
    }
    int star = raw.indexOf(WILDCARD);
    if (star >= 0 && star != raw.length() - 1) {
      throw new InvalidKeyPatternException(raw, "wildcard is only allowed at the end");
    }
    if (star < 0) {
      return new KeyPattern(raw, Kind.EXACT, validBody(raw, raw));
    }
    if (raw.endsWith(SCOPE_SUFFIX)) {
      String base = raw.substring(0, raw.length() - SCOPE_SUFFIX.length());
      return new KeyPattern(raw, Kind.SEGMENT_SCOPE, validBody(raw, base));
    }
    String base = raw.substring(0, raw.length() - 1);
    return new KeyPattern(raw, Kind.PREFIX, validBody(raw, base));
  }

  public static KeyPattern exact(CacheKey key) {
    return new KeyPattern(key.value(), Kind.EXACT, key.value());
  }

  /** {@code segments[0]:segments[1]:...:*} 형태의 세그먼트 범위 패턴 */
  public static KeyPattern scope(String... segments) {
    return parse(String.join(CacheKey.SEPARATOR, segments) + SCOPE_SUFFIX);
  }

  public boolean matches(String key) {
    if (key == null) {
      return false;
    }
    return switch (kind) {
      case EXACT -> key.equals(base);
      case PREFIX -> key.startsWith(base);
      case SEGMENT_SCOPE -> key.equals(base) || key.startsWith(base + CacheKey.SEPARATOR);
    };
  }

  /** SCAN MATCH 인자로 사용할 glob. 키 문법상 glob 특수문자가 올 수 없으므로 이스케이프가 필요 없다. */
  public String toRedisGlob() {
    return switch (kind) {
      case EXACT -> base;
      case PREFIX -> base + WILDCARD;
      case SEGMENT_SCOPE -> base + SCOPE_SUFFIX;
    };
  }

  /** 세그먼트 범위 패턴은 기준 키 자체도 포함하므로 별도 삭제가 필요하다. */
  public boolean includesBaseKey() {
    return kind != Kind.PREFIX;
  }

  public boolean isWildcard() {
    return kind != Kind.EXACT;
  }

  public Kind kind() {
    return kind;
  }

  public String base() {
    return base;
  }

  public String value() {
    return raw;
  }

  private static String validBody(String raw, String body) {
    if (body.isEmpty()) {
      throw new InvalidKeyPatternException(raw, "pattern must have a non-empty prefix");
    }
    if (!BODY.matcher(body).matches()) {
      throw new InvalidKeyPatternException(raw, "illegal character");
    }
    if (body.startsWith(CacheKey.SEPARATOR)
        || body.endsWith(CacheKey.SEPARATOR)
        || body.contains("::")) {
      throw new InvalidKeyPatternException(raw, "empty segment");
    }
    return body;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof KeyPattern other && raw.equals(other.raw);
  }

  @Override
  public int hashCode() {
    return raw.hashCode();
  }

  @Override
  public String toString() {
    return raw;
  }
}
