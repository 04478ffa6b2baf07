package com.axonops.logstats.event;

import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class StatsEventTest {

    @Test
    void testRenderWithoutTags() {
        StatsEvent event = new StatsEvent(StatsEvent.Severity.INFO, "Log statistics", List.of());

        assertThat(event.render()).isEqualTo("Log statistics");
    }

    @Test
    void testRenderWithTags() {
        StatsEvent event = new StatsEvent(StatsEvent.Severity.NOTICE, "Pruning stats-counters have finished",
            List.of(StatsTag.of("dropped", 2), StatsTag.of("oldest-timestamp", 1_700_000_000L)));

        assertThat(event.render())
            .isEqualTo("Pruning stats-counters have finished; dropped='2', oldest-timestamp='1700000000'");
    }

    @Test
    void testTagValue() {
        StatsEvent event = new StatsEvent(StatsEvent.Severity.INFO, "m",
            List.of(new StatsTag("processed", "a"), new StatsTag("processed", "b")));

        assertThat(event.tagValue("processed")).isEqualTo("a");
        assertThat(event.tagValue("dropped")).isNull();
    }

    @Test
    void testTagsAreCopied() {
        List<StatsTag> tags = new ArrayList<>();
        tags.add(StatsTag.of("dropped", 1));
        StatsEvent event = new StatsEvent(StatsEvent.Severity.INFO, "m", tags);
        tags.clear();

        assertThat(event.tags()).hasSize(1);
        assertThatThrownBy(() -> event.tags().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testSlf4jSinkAcceptsEvents() {
        StatsEvent event = new StatsEvent(StatsEvent.Severity.INFO, "Log statistics", List.of());

        assertThatCode(() -> Slf4jStatsEventSink.INSTANCE.send(event)).doesNotThrowAnyException();
        assertThatCode(() -> new Slf4jStatsEventSink(LoggerFactory.getLogger(StatsEventTest.class)).send(event))
            .doesNotThrowAnyException();
    }
}
