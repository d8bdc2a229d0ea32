package me.golemcore.orchestrator.adapter.outbound.monitoring;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.orchestrator.port.outbound.MetricSinkPort;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Mirrors orchestrator metrics into the Micrometer registry exposed by
 * actuator.
 *
 * <p>
 * Timing metrics ({@code *_time}) become distribution summaries in seconds,
 * everything else a counter incremented by the value. Only low-cardinality tags
 * are forwarded.
 */
@Component
@RequiredArgsConstructor
public class MicrometerMetricSink implements MetricSinkPort {

    static final String METER_PREFIX = "orchestrator.";
    private static final Set<String> FORWARDED_TAGS = Set.of("intent", "agent");
    private static final int MAX_TAG_LENGTH = 64;

    private final MeterRegistry meterRegistry;

    @Override
    public void record(String name, double value, Map<String, String> tags) {
        String meterName = METER_PREFIX + name;
        Tags meterTags = toTags(tags);
        if (name.endsWith("_time")) {
            DistributionSummary.builder(meterName)
                    .baseUnit("seconds")
                    .tags(meterTags)
                    .register(meterRegistry)
                    .record(value);
        } else {
            meterRegistry.counter(meterName, meterTags).increment(value);
        }
    }

    private static Tags toTags(Map<String, String> tags) {
        if (tags == null || tags.isEmpty()) {
            return Tags.empty();
        }
        List<Tag> result = new ArrayList<>();
        for (Map.Entry<String, String> entry : tags.entrySet()) {
            if (FORWARDED_TAGS.contains(entry.getKey())) {
                result.add(Tag.of(entry.getKey(), safeTag(entry.getValue())));
            }
        }
        return Tags.of(result);
    }

    private static String safeTag(String raw) {
        if (raw == null || raw.isBlank()) {
            return "none";
        }
        String value = raw.trim();
        if (value.length() > MAX_TAG_LENGTH) {
            value = value.substring(0, MAX_TAG_LENGTH);
        }
        return value.toLowerCase(Locale.ROOT).replace(' ', '_');
    }
}
