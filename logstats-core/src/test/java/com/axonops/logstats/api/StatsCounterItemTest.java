package com.axonops.logstats.api;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class StatsCounterItemTest {

    @Test
    void testOperations() {
        StatsCounterItem counter = new StatsCounterItem();

        counter.inc();
        counter.inc();
        counter.dec();
        counter.add(10);
        assertThat(counter.get()).isEqualTo(11);

        counter.set(1_700_000_000L);
        assertThat(counter.get()).isEqualTo(1_700_000_000L);
    }

    @Test
    void testStaticHelpersOnHandle() {
        StatsCounterItem counter = new StatsCounterItem();

        StatsCounterItem.increment(counter);
        StatsCounterItem.add(counter, 4);
        StatsCounterItem.decrement(counter);
        assertThat(StatsCounterItem.get(counter)).isEqualTo(4);

        StatsCounterItem.set(counter, 99);
        assertThat(counter.get()).isEqualTo(99);
    }

    @Test
    void testStaticHelpersIgnoreRejectedHandle() {
        assertThatCode(() -> {
            StatsCounterItem.increment(null);
            StatsCounterItem.decrement(null);
            StatsCounterItem.add(null, 5);
            StatsCounterItem.set(null, 5);
        }).doesNotThrowAnyException();
        assertThat(StatsCounterItem.get(null)).isZero();
    }
}
