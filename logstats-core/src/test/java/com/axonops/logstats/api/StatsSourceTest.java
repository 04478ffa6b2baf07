package com.axonops.logstats.api;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Source bitmask layout and component lookup.
 */
class StatsSourceTest {

    @Test
    void testDirectionFlags() {
        int src = StatsSource.TCP | StatsSource.SOURCE;
        int dst = StatsSource.TCP | StatsSource.DESTINATION;

        assertThat(StatsSource.isSource(src)).isTrue();
        assertThat(StatsSource.isDestination(src)).isFalse();
        assertThat(StatsSource.isDestination(dst)).isTrue();
        assertThat(StatsSource.isSource(StatsSource.CENTER)).isFalse();
        assertThat(StatsSource.isDestination(StatsSource.CENTER)).isFalse();
    }

    @Test
    void testGroup() {
        assertThat(StatsSource.isGroup(StatsSource.GROUP | StatsSource.SOURCE)).isTrue();
        assertThat(StatsSource.isGroup(StatsSource.GROUP)).isTrue();
        assertThat(StatsSource.isGroup(StatsSource.FILE | StatsSource.SOURCE)).isFalse();
    }

    @Test
    void testComponentLookupIgnoresFlags() {
        assertThat(StatsComponent.of(StatsSource.FILE | StatsSource.DESTINATION)).isEqualTo(StatsComponent.FILE);
        assertThat(StatsComponent.of(StatsSource.UNIX_STREAM)).isEqualTo(StatsComponent.UNIX_STREAM);
        assertThat(StatsComponent.of(StatsSource.SNMP).displayName()).isEqualTo("snmp");
    }

    @Test
    void testComponentDisplayNames() {
        assertThat(StatsComponent.NONE.displayName()).isEqualTo("none");
        assertThat(StatsComponent.UNIX_DGRAM.displayName()).isEqualTo("unix-dgram");
        assertThat(StatsComponent.SUN_STREAMS.displayName()).isEqualTo("sun-streams");
        assertThat(StatsComponent.RULE_ID.displayName()).isEqualTo("rule_id");
        assertThat(StatsComponent.values()).hasSize(33);
    }

    @Test
    void testComponentIndexesAreStable() {
        assertThat(StatsSource.FILE).isEqualTo(1);
        assertThat(StatsSource.GROUP).isEqualTo(17);
        assertThat(StatsSource.SEVERITY).isEqualTo(25);
        assertThat(StatsSource.FACILITY).isEqualTo(26);
        assertThat(StatsSource.SNMP).isEqualTo(32);
    }

    @Test
    void testUnknownComponentRejected() {
        assertThatThrownBy(() -> StatsComponent.of(33))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("33");
        assertThatThrownBy(() -> StatsComponent.of(0xff | StatsSource.SOURCE))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testCounterTypeTagsAndMasks() {
        assertThat(StatsCounterType.values())
            .extracting(StatsCounterType::tagName)
            .containsExactly("dropped", "processed", "stored", "suppressed", "stamp");
        assertThat(StatsCounterType.DROPPED.mask()).isEqualTo(1);
        assertThat(StatsCounterType.STAMP.mask()).isEqualTo(1 << 4);
    }

    @Test
    void testContractViolationMessage() {
        StatsException e = new StatsContractViolationException("bad handle");

        assertThat(e).isInstanceOf(RuntimeException.class);
        assertThat(e.getMessage()).isEqualTo("LogStats: Contract violation: bad handle");
    }
}
