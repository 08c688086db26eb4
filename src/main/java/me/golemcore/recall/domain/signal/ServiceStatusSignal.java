package me.golemcore.recall.domain.signal;

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

import me.golemcore.recall.domain.service.SearchAggregatorService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryUsage;
import java.lang.management.OperatingSystemMXBean;
import java.time.Clock;

/**
 * Health of the running service: processors, load average, heap and the
 * number of enabled search backends.
 */
@Component
@RequiredArgsConstructor
public class ServiceStatusSignal implements LiveSignalSource {

    private final SearchAggregatorService searchAggregatorService;
    private final Clock clock;

    @Override
    public String getName() {
        return "serviceStatus";
    }

    @Override
    public int getOrder() {
        return 10;
    }

    @Override
    public ObjectNode collect(JsonNode context) {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        MemoryUsage heap = ManagementFactory.getMemoryMXBean().getHeapMemoryUsage();

        ObjectNode status = JsonNodeFactory.instance.objectNode();
        status.put("healthy", true);
        status.put("availableProcessors", os.getAvailableProcessors());
        // Negative when the platform does not report a load average
        status.put("systemLoad", os.getSystemLoadAverage());
        status.put("heapUsedBytes", heap.getUsed());
        if (heap.getMax() > 0) {
            status.put("heapUsage", (double) heap.getUsed() / heap.getMax());
        }
        status.put("enabledBackends", searchAggregatorService.enabledBackends().size());
        status.put("lastCheck", clock.instant().toString());
        return status;
    }
}
