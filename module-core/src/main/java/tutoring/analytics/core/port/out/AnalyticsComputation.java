package tutoring.analytics.core.port.out;

import java.util.List;

/**
 * 쿼리 유형 하나의 집계 함수
 *
 * <p>영속 계층의 비싼 집계 쿼리를 캐시 입장에서는 불투명한 compute 함수로 다룹니다.
 */
public interface AnalyticsComputation {

  /** 처리하는 쿼리 유형 (예: student, assignment) */
  String queryType();

  Object compute(List<String> params) throws Exception;
}
