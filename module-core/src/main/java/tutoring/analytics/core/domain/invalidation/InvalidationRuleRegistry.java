package tutoring.analytics.core.domain.invalidation;

import static tutoring.analytics.core.domain.model.KeyPattern.scope;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import tutoring.analytics.core.domain.model.KeyPattern;
import tutoring.analytics.error.exception.InvalidInvalidationEventException;

/**
 * 이벤트 유형별 무효화 규칙 레지스트리
 *
 * <h3>기본 규칙</h3>
 *
 * <ul>
 *   <li>grade_updated → {@code analytics:assignment:<a>:*}, {@code analytics:student:<s>:*},
 *       {@code dashboard:user:<s>:*}
 *   <li>material_viewed → {@code analytics:progress:<m>:*}, {@code analytics:student:<s>:*}
 *   <li>user_progress_changed → {@code analytics:student:<u>:*}, {@code dashboard:user:<u>:*},
 *       {@code report:user:<u>:*}, {@code <module>:user:<u>:*}
 *   <li>report_generated → {@code report:<type>:*}, {@code analytics:*}
 *   <li>content_published → {@code analytics:subject:<id>:*}, {@code analytics:engagement:*}
 * </ul>
 */
public final class InvalidationRuleRegistry {

  public static final String ASSIGNMENT_ID = "assignment_id";
  public static final String STUDENT_ID = "student_id";
  public static final String MATERIAL_ID = "material_id";
  public static final String USER_ID = "user_id";
  public static final String MODULE = "module";
  public static final String REPORT_TYPE = "report_type";
  public static final String SUBJECT_ID = "subject_id";

  private static final Pattern MODULE_NAME = Pattern.compile("[a-z][a-z0-9_-]*");

  private final Map<InvalidationEventType, InvalidationRule> rules;

  public InvalidationRuleRegistry(Map<InvalidationEventType, InvalidationRule> rules) {
    this.rules = rules.isEmpty() ? new EnumMap<>(InvalidationEventType.class) : new EnumMap<>(rules);
  }

  public static InvalidationRuleRegistry withDefaults() {
    Map<InvalidationEventType, InvalidationRule> rules = new EnumMap<>(InvalidationEventType.class);
    rules.put(InvalidationEventType.GRADE_UPDATED, InvalidationRuleRegistry::gradeUpdated);
    rules.put(InvalidationEventType.MATERIAL_VIEWED, InvalidationRuleRegistry::materialViewed);
    rules.put(InvalidationEventType.USER_PROGRESS_CHANGED, InvalidationRuleRegistry::progressChanged);
    rules.put(InvalidationEventType.REPORT_GENERATED, InvalidationRuleRegistry::reportGenerated);
    rules.put(InvalidationEventType.CONTENT_PUBLISHED, InvalidationRuleRegistry::contentPublished);
    return new InvalidationRuleRegistry(rules);
  }

  /** 중복을 제거한, 결정적 순서의 패턴 목록 */
  public List<KeyPattern> patternsFor(InvalidationEvent event) {
    InvalidationRule rule = rules.get(event.type());
    if (rule == null) {
      throw new InvalidInvalidationEventException(event.type().wireName(), "no rule registered");
    }
    return new ArrayList<>(new LinkedHashSet<>(rule.patternsFor(event)));
  }

  public boolean supports(InvalidationEventType type) {
    return rules.containsKey(type);
  }

  private static List<KeyPattern> gradeUpdated(InvalidationEvent event) {
    List<KeyPattern> patterns = new ArrayList<>();
    patterns.add(scope("analytics", "assignment", event.requireParam(ASSIGNMENT_ID)));
    event
        .optionalParam(STUDENT_ID)
        .ifPresent(
            studentId -> {
              patterns.add(scope("analytics", "student", studentId));
              patterns.add(scope("dashboard", "user", studentId));
            });
    return patterns;
  }

  private static List<KeyPattern> materialViewed(InvalidationEvent event) {
    List<KeyPattern> patterns = new ArrayList<>();
    patterns.add(scope("analytics", "progress", event.requireParam(MATERIAL_ID)));
    event
        .optionalParam(STUDENT_ID)
        .ifPresent(studentId -> patterns.add(scope("analytics", "student", studentId)));
    return patterns;
  }

  private static List<KeyPattern> progressChanged(InvalidationEvent event) {
    String userId = event.requireParam(USER_ID);
    List<KeyPattern> patterns = new ArrayList<>();
    patterns.add(scope("analytics", "student", userId));
    patterns.add(scope("dashboard", "user", userId));
    patterns.add(scope("report", "user", userId));
    event
        .optionalParam(MODULE)
        .ifPresent(
            module -> {
              if (!MODULE_NAME.matcher(module).matches()) {
                throw new InvalidInvalidationEventException(
                    event.type().wireName(), "module must be a namespace name: " + module);
              }
              patterns.add(scope(module, "user", userId));
            });
    return patterns;
  }

  private static List<KeyPattern> reportGenerated(InvalidationEvent event) {
    return List.of(scope("report", event.requireParam(REPORT_TYPE)), scope("analytics"));
  }

  private static List<KeyPattern> contentPublished(InvalidationEvent event) {
    return List.of(
        scope("analytics", "subject", event.requireParam(SUBJECT_ID)),
        scope("analytics", "engagement"));
  }
}
