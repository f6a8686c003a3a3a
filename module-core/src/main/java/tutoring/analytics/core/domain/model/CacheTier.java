package tutoring.analytics.core.domain.model;

/** 값이 제공된 계층 */
public enum CacheTier {
  L1,
  L2,
  L3,
  COMPUTE;

  public boolean isHit() {
    return this != COMPUTE;
  }
}
