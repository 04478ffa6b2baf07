package com.axonops.logstats.registry;

import com.axonops.logstats.api.StatsContractViolationException;
import com.axonops.logstats.api.StatsCounterItem;
import com.axonops.logstats.api.StatsCounterType;
import com.axonops.logstats.api.StatsSource;
import com.axonops.logstats.event.StatsEvent;
import com.axonops.logstats.test.TestUtils;
import com.axonops.logstats.test.TestUtils.CapturingEventSink;
import com.axonops.logstats.test.TestUtils.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

/**
 * Pruning of orphaned dynamic counters.
 */
class PruneTest {

    private static final int TCP_SOURCE = StatsSource.TCP | StatsSource.SOURCE;
    private static final long T = 1_700_000_000L;
    private static final long LIFETIME = 600;

    private MutableClock clock;
    private CapturingEventSink events;
    private StatsRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T);
        events = new CapturingEventSink();
        registry = new StatsRegistry(TestUtils.config(3, clock, events));
    }

    private CounterRecord bump(String instance, long timestamp) {
        try (StatsLock lock = registry.lock()) {
            lock.registerAndIncrementDynamicCounter(3, TCP_SOURCE, null, instance, timestamp);
            return lock.find(TCP_SOURCE, null, instance);
        }
    }

    private CounterRecord find(String instance) {
        try (StatsLock lock = registry.lock()) {
            return lock.find(TCP_SOURCE, null, instance);
        }
    }

    @Test
    void testStaleClientCounterIsPruned() {
        CounterRecord record = bump("10.0.0.1", T);
        assertThat(record.refCount()).isZero();
        assertThat(record.value(StatsCounterType.PROCESSED)).isEqualTo(1);
        assertThat(record.value(StatsCounterType.STAMP)).isEqualTo(T);

        clock.setEpochSecond(T + LIFETIME + 1);
        PruneResult result = registry.pruneOldCounters(LIFETIME);

        assertThat(result.dropped()).isEqualTo(1);
        assertThat(result.oldestTimestamp()).isEqualTo(T);
        assertThat(find("10.0.0.1")).isNull();
    }

    @Test
    void testFreshClientCounterIsKept() {
        bump("10.0.0.1", T);

        clock.setEpochSecond(T + LIFETIME - 1);
        PruneResult result = registry.pruneOldCounters(LIFETIME);

        assertThat(result.dropped()).isZero();
        assertThat(find("10.0.0.1")).isNotNull();
    }

    @Test
    void testStampExactlyAtCutoffIsPruned() {
        bump("10.0.0.1", T);

        clock.setEpochSecond(T + LIFETIME);
        assertThat(registry.pruneOldCounters(Duration.ofSeconds(LIFETIME)).dropped()).isEqualTo(1);
    }

    @Test
    void testReferencedDynamicCounterIsNeverPruned() {
        DynamicRegistration registration;
        try (StatsLock lock = registry.lock()) {
            registration = lock.registerDynamicCounter(3, TCP_SOURCE, null, "10.0.0.1", StatsCounterType.PROCESSED);
            StatsCounterItem stamp = lock.registerAssociatedCounter(registration.family(), StatsCounterType.STAMP);
            stamp.set(T);
        }

        clock.setEpochSecond(T + 100 * LIFETIME);
        assertThat(registry.pruneOldCounters(LIFETIME).dropped()).isZero();
        assertThat(find("10.0.0.1")).isSameAs(registration.family());
    }

    @Test
    void testStaticCounterIsNeverPruned() {
        try (StatsLock lock = registry.lock()) {
            StatsCounterItem stamp = lock.registerCounter(0, TCP_SOURCE, null, "static", StatsCounterType.STAMP);
            stamp.set(T);
            lock.unregisterCounter(TCP_SOURCE, null, "static", StatsCounterType.STAMP, stamp);
        }

        clock.setEpochSecond(T + 100 * LIFETIME);
        assertThat(registry.pruneOldCounters(LIFETIME).dropped()).isZero();
        assertThat(find("static")).isNotNull();
    }

    @Test
    void testDynamicCounterWithoutStampIsNeverPruned() {
        bump("10.0.0.1", -1);

        clock.setEpochSecond(T + 100 * LIFETIME);
        assertThat(registry.pruneOldCounters(LIFETIME).dropped()).isZero();
        assertThat(find("10.0.0.1")).isNotNull();
    }

    @Test
    void testOldestTimestampAcrossDroppedRecords() {
        bump("10.0.0.1", T - 50);
        bump("10.0.0.2", T - 200);
        bump("10.0.0.3", T);
        bump("10.0.0.4", T + 500);

        clock.setEpochSecond(T + LIFETIME);
        PruneResult result = registry.pruneOldCounters(LIFETIME);

        assertThat(result.dropped()).isEqualTo(3);
        assertThat(result.oldestTimestamp()).isEqualTo(T - 200);
        assertThat(find("10.0.0.4")).isNotNull();
    }

    @Test
    void testPruneSendsNoticeEvent() {
        bump("10.0.0.1", T - 10);
        bump("10.0.0.2", T);

        clock.setEpochSecond(T + LIFETIME);
        registry.pruneOldCounters(LIFETIME);

        assertThat(events.withMessage(StatsRegistry.PRUNE_FINISHED_MESSAGE)).hasSize(1);
        StatsEvent event = events.withMessage(StatsRegistry.PRUNE_FINISHED_MESSAGE).get(0);
        assertThat(event.severity()).isEqualTo(StatsEvent.Severity.NOTICE);
        assertThat(event.tagValue("dropped")).isEqualTo("2");
        assertThat(event.tagValue("oldest-timestamp")).isEqualTo(Long.toString(T - 10));
    }

    @Test
    void testEmptySweepStillSendsNotice() {
        PruneResult result = registry.pruneOldCounters(LIFETIME);

        assertThat(result.dropped()).isZero();
        assertThat(result.oldestTimestamp()).isZero();
        StatsEvent event = events.withMessage(StatsRegistry.PRUNE_FINISHED_MESSAGE).get(0);
        assertThat(event.tagValue("dropped")).isEqualTo("0");
        assertThat(event.tagValue("oldest-timestamp")).isEqualTo("0");
    }

    @Test
    void testStaleHandleDoesNotMatchRecreatedRecord() {
        DynamicRegistration old;
        try (StatsLock lock = registry.lock()) {
            old = lock.registerDynamicCounter(3, TCP_SOURCE, null, "10.0.0.1", StatsCounterType.PROCESSED);
            StatsCounterItem stamp = lock.registerAssociatedCounter(old.family(), StatsCounterType.STAMP);
            stamp.set(T);
            lock.unregisterDynamicCounter(old.family(), StatsCounterType.STAMP, stamp);
            lock.unregisterDynamicCounter(old.family(), StatsCounterType.PROCESSED, old.counter());
        }

        clock.setEpochSecond(T + LIFETIME);
        registry.pruneOldCounters(LIFETIME);

        CounterRecord recreated = bump("10.0.0.1", T + LIFETIME);
        assertThat(recreated).isNotSameAs(old.family());
        assertThat(recreated.counter(StatsCounterType.PROCESSED)).isNotSameAs(old.counter());
        assertThat(recreated.value(StatsCounterType.PROCESSED)).isEqualTo(1);
    }

    private CounterRecord prunedFamily() {
        DynamicRegistration registration;
        try (StatsLock lock = registry.lock()) {
            registration = lock.registerDynamicCounter(3, TCP_SOURCE, null, "10.0.0.1", StatsCounterType.PROCESSED);
            StatsCounterItem stamp = lock.registerAssociatedCounter(registration.family(), StatsCounterType.STAMP);
            stamp.set(T);
            lock.unregisterDynamicCounter(registration.family(), StatsCounterType.STAMP, stamp);
            lock.unregisterDynamicCounter(registration.family(), StatsCounterType.PROCESSED, registration.counter());
        }
        clock.setEpochSecond(T + LIFETIME + 1);
        assertThat(registry.pruneOldCounters(LIFETIME).dropped()).isEqualTo(1);
        return registration.family();
    }

    @Test
    void testAssociatedRegistrationOnPrunedFamilyIsContractViolation() {
        CounterRecord family = prunedFamily();
        int before = registry.size();

        try (StatsLock lock = registry.lock()) {
            assertThatThrownBy(() -> lock.registerAssociatedCounter(family, StatsCounterType.DROPPED))
                .isInstanceOf(StatsContractViolationException.class)
                .hasMessageContaining("pruned");
            assertThat(lock.size()).isEqualTo(before);
        }
        assertThat(family.refCount()).isZero();
    }

    @Test
    void testUnregisterOnPrunedFamilyIsContractViolation() {
        CounterRecord family = prunedFamily();
        StatsCounterItem processed = family.counter(StatsCounterType.PROCESSED);

        try (StatsLock lock = registry.lock()) {
            assertThatThrownBy(() -> lock.unregisterDynamicCounter(family, StatsCounterType.PROCESSED, processed))
                .isInstanceOf(StatsContractViolationException.class);
        }
    }

    @Test
    void testPrunedFamilyDoesNotMatchRecreatedRecord() {
        CounterRecord family = prunedFamily();
        bump("10.0.0.1", T + LIFETIME);

        try (StatsLock lock = registry.lock()) {
            assertThatThrownBy(() -> lock.registerAssociatedCounter(family, StatsCounterType.STAMP))
                .isInstanceOf(StatsContractViolationException.class);
        }
    }

    @Test
    void testStatisticsTrackSweeps() {
        bump("10.0.0.1", T);
        clock.setEpochSecond(T + LIFETIME);
        registry.pruneOldCounters(LIFETIME);
        registry.pruneOldCounters(LIFETIME);

        RegistryStatistics stats = registry.getStatistics();
        assertThat(stats.pruneSweeps()).isEqualTo(2);
        assertThat(stats.prunedRecords()).isEqualTo(1);
    }
}
