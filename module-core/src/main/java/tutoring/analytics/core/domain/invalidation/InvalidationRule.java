package tutoring.analytics.core.domain.invalidation;

import java.util.List;
import tutoring.analytics.core.domain.model.KeyPattern;

/**
 * 이벤트 → 키 패턴 매핑 규칙
 *
 * <p>구현은 부수효과와 I/O가 없어야 합니다. 같은 이벤트는 항상 같은 패턴 목록을 만듭니다.
 */
@FunctionalInterface
public interface InvalidationRule {

  List<KeyPattern> patternsFor(InvalidationEvent event);
}
