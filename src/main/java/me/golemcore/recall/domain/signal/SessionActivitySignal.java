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

import me.golemcore.recall.domain.service.SessionStoreService;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Session cache activity: stored session count, business-hours indicator and a
 * coarse load level.
 */
@Component
@RequiredArgsConstructor
public class SessionActivitySignal implements LiveSignalSource {

    static final String PEAK_HOURS = "business-hours";
    static final String OFF_HOURS = "off-hours";

    private final SessionStoreService sessionStoreService;
    private final RecallProperties properties;
    private final Clock clock;

    @Override
    public String getName() {
        return "sessionActivity";
    }

    @Override
    public int getOrder() {
        return 20;
    }

    @Override
    public ObjectNode collect(JsonNode context) {
        RecallProperties.PipelineProperties config = properties.getPipeline();
        int activeSessions = sessionStoreService.countActive();

        ObjectNode activity = JsonNodeFactory.instance.objectNode();
        activity.put("activeSessions", activeSessions);
        activity.put("peakHour", peakHour(config));
        activity.put("currentLoad", activeSessions > config.getHighLoadSessionThreshold() ? "high" : "normal");
        return activity;
    }

    private String peakHour(RecallProperties.PipelineProperties config) {
        String zone = config.getTimeZone();
        ZoneId zoneId = zone == null || zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zone);
        int hour = clock.instant().atZone(zoneId).getHour();
        return hour >= config.getBusinessHoursStart() && hour <= config.getBusinessHoursEnd()
                ? PEAK_HOURS
                : OFF_HOURS;
    }
}
