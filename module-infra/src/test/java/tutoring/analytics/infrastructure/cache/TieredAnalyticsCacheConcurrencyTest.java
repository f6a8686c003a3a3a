package tutoring.analytics.infrastructure.cache;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import tutoring.analytics.core.domain.model.CacheResult;
import tutoring.analytics.core.domain.model.CacheStats;
import tutoring.analytics.core.domain.model.TtlConfig;
import tutoring.analytics.infrastructure.cache.codec.CacheEntryJsonCodec;
import tutoring.analytics.infrastructure.cache.flight.LocalSingleFlight;
import tutoring.analytics.infrastructure.cache.local.CaffeineLocalTier;
import tutoring.analytics.infrastructure.cache.monitor.CacheMonitor;
import tutoring.analytics.support.InMemoryRemoteTier;
import tutoring.analytics.support.MutableClock;
import tutoring.analytics.support.TestLogicExecutors;

/** Thundering herd: 같은 키의 동시 miss는 compute를 한 번만 호출한다. */
@Tag("unit")
class TieredAnalyticsCacheConcurrencyTest {

  private static final int THREADS = 10;
  private static final TtlConfig TTL = TtlConfig.ofSeconds(60, 3600, 0);

  private final ExecutorService pool = Executors.newFixedThreadPool(THREADS);

  @AfterEach
  void tearDown() {
    pool.shutdownNow();
  }

  @Test
  @DisplayName("동시 miss 10건에도 compute는 1회, follower는 miss로만 집계")
  void concurrentMissesComputeOnce() throws Exception {
    MutableClock clock = MutableClock.startingAt("2024-03-04T09:00:00Z");
    TieredAnalyticsCache cache =
        TieredAnalyticsCache.builder()
            .localTier(new CaffeineLocalTier(100, clock))
            .remoteTier(new InMemoryRemoteTier(clock))
            .coordinator(new LocalSingleFlight())
            .monitor(new CacheMonitor(new SimpleMeterRegistry()))
            .codec(new CacheEntryJsonCodec(new ObjectMapper()))
            .executor(TestLogicExecutors.passThrough())
            .clock(clock)
            .build();

    AtomicInteger computeCalls = new AtomicInteger();
    CountDownLatch started = new CountDownLatch(THREADS);
    CountDownLatch release = new CountDownLatch(1);

    List<Future<CacheResult<Integer>>> futures = new ArrayList<>();
    for (int i = 0; i < THREADS; i++) {
      futures.add(
          pool.submit(
              () -> {
                started.countDown();
                return cache.get(
                    "analytics:assignment:7",
                    Integer.class,
                    () -> {
                      computeCalls.incrementAndGet();
                      awaitQuietly(release);
                      return 88;
                    },
                    TTL);
              }));
    }
    assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
    Thread.sleep(200);
    release.countDown();

    for (Future<CacheResult<Integer>> future : futures) {
      assertThat(future.get(5, TimeUnit.SECONDS).value()).isEqualTo(88);
    }
    CacheStats stats = cache.getStats();
    assertThat(computeCalls).hasValue(1);
    assertThat(stats.computed()).isEqualTo(1);
    assertThat(stats.misses() + stats.hitsL1()).isEqualTo(THREADS);
  }

  private static void awaitQuietly(CountDownLatch latch) {
    try {
      latch.await(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
