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

import me.golemcore.orchestrator.port.outbound.SystemResourcePort;
import org.springframework.stereotype.Component;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;

/**
 * Host CPU and memory usage from the platform {@link OperatingSystemMXBean}.
 * Returns {@code -1} when the JVM does not expose a figure.
 */
@Component
public class JvmSystemResourceAdapter implements SystemResourcePort {

    private static final double UNAVAILABLE = -1.0;

    @Override
    public double cpuUsagePercent() {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        if (os instanceof com.sun.management.OperatingSystemMXBean mx) {
            double load = mx.getCpuLoad();
            if (Double.isNaN(load) || load < 0) {
                return UNAVAILABLE;
            }
            return load * 100.0;
        }
        return UNAVAILABLE;
    }

    @Override
    public double memoryUsagePercent() {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        if (os instanceof com.sun.management.OperatingSystemMXBean mx) {
            long total = mx.getTotalMemorySize();
            if (total <= 0) {
                return UNAVAILABLE;
            }
            long used = total - mx.getFreeMemorySize();
            return used * 100.0 / total;
        }
        return UNAVAILABLE;
    }
}
