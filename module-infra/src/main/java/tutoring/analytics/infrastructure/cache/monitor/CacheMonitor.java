package tutoring.analytics.infrastructure.cache.monitor;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;
import tutoring.analytics.core.domain.model.CacheStats;
import tutoring.analytics.core.domain.model.CacheTier;

/**
 * 캐시 적중률 모니터
 *
 * <p>제어 흐름에 관여하지 않고 카운트만 관찰합니다. {@link #reset()}은 자체 카운터만 0으로 돌리며 캐시 데이터와 Micrometer 누적
 * 카운터({@code analytics.cache.*})는 건드리지 않습니다.
 */
public class CacheMonitor {

  private final Map<CacheTier, LongAdder> hits = new EnumMap<>(CacheTier.class);
  private final LongAdder misses = new LongAdder();
  private final LongAdder computed = new LongAdder();

  private final Map<CacheTier, Counter> hitCounters = new EnumMap<>(CacheTier.class);
  private final Map<CacheTier, Counter> failureCounters = new EnumMap<>(CacheTier.class);
  private final Counter missCounter;
  private final Counter computedCounter;

  public CacheMonitor(MeterRegistry meterRegistry) {
    for (CacheTier tier : new CacheTier[] {CacheTier.L1, CacheTier.L2, CacheTier.L3}) {
      hits.put(tier, new LongAdder());
      hitCounters.put(
          tier,
          Counter.builder("analytics.cache.hit").tag("tier", tier.name()).register(meterRegistry));
      failureCounters.put(
          tier,
          Counter.builder("analytics.cache.tier.failure")
              .tag("tier", tier.name())
              .register(meterRegistry));
    }
    this.missCounter = Counter.builder("analytics.cache.miss").register(meterRegistry);
    this.computedCounter = Counter.builder("analytics.cache.computed").register(meterRegistry);
  }

  public void recordHit(CacheTier tier) {
    LongAdder adder = hits.get(tier);
    if (adder == null) {
      throw new IllegalArgumentException("Not a cache tier: " + tier);
    }
    adder.increment();
    hitCounters.get(tier).increment();
  }

  public void recordMiss() {
    misses.increment();
    missCounter.increment();
  }

  public void recordComputed() {
    computed.increment();
    computedCounter.increment();
  }

  /** 계층 장애 (miss로 처리된 L2/L3 오류) */
  public void recordTierFailure(CacheTier tier) {
    Counter counter = failureCounters.get(tier);
    if (counter != null) {
      counter.increment();
    }
  }

  public CacheStats getStats() {
    return CacheStats.of(
        hits.get(CacheTier.L1).sum(),
        hits.get(CacheTier.L2).sum(),
        hits.get(CacheTier.L3).sum(),
        misses.sum(),
        computed.sum());
  }

  public void reset() {
    hits.values().forEach(LongAdder::reset);
    misses.reset();
    computed.reset();
  }
}
