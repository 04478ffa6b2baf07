/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.axonops.logstats.test;

import com.axonops.logstats.event.StatsEvent;
import com.axonops.logstats.event.StatsEventSink;
import com.axonops.logstats.registry.StatsConfig;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Test utilities for registry setup.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * MutableClock clock = new MutableClock(1_700_000_000L);
 * CapturingEventSink events = new CapturingEventSink();
 * StatsRegistry registry = new StatsRegistry(TestUtils.config(3, clock, events));
 * }</pre>
 */
public final class TestUtils {

    private TestUtils() {
        // Utility class
    }

    /**
     * Config with the given level, a controllable clock and a capturing sink.
     */
    public static StatsConfig config(int statsLevel, Clock clock, StatsEventSink sink) {
        return StatsConfig.builder()
            .statsLevel(statsLevel)
            .clock(clock)
            .eventSink(sink)
            .build();
    }

    /**
     * Splits one CSV line on separators that are not inside a quoted field.
     * A backslash inside quotes escapes the next character.
     */
    public static List<String> splitCsvLine(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted && c == '\\' && i + 1 < line.length()) {
                current.append(c).append(line.charAt(++i));
            } else if (c == '"') {
                quoted = !quoted;
                current.append(c);
            } else if (c == ';' && !quoted) {
                fields.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        fields.add(current.toString());
        return fields;
    }

    /**
     * Clock whose time only moves when told to.
     */
    public static final class MutableClock extends Clock {
        private volatile Instant now;

        public MutableClock(long epochSecond) {
            this.now = Instant.ofEpochSecond(epochSecond);
        }

        public void setEpochSecond(long epochSecond) {
            now = Instant.ofEpochSecond(epochSecond);
        }

        public void advanceSeconds(long seconds) {
            now = now.plusSeconds(seconds);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    /**
     * Sink that keeps every event it receives.
     */
    public static final class CapturingEventSink implements StatsEventSink {
        private final List<StatsEvent> events = new CopyOnWriteArrayList<>();

        @Override
        public void send(StatsEvent event) {
            events.add(event);
        }

        public List<StatsEvent> events() {
            return events;
        }

        public List<StatsEvent> withMessage(String message) {
            return events.stream()
                .filter(e -> e.message().equals(message))
                .collect(Collectors.toList());
        }

        public void clear() {
            events.clear();
        }
    }
}
