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

package me.golemcore.calhelper.capabilities;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.calhelper.domain.component.CapabilityComponent;
import me.golemcore.calhelper.domain.model.CapabilityResult;
import me.golemcore.calhelper.port.outbound.CalendarPort;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Base for capabilities backed by the remote calendar. The call runs off the
 * caller thread and its result is rendered as JSON for the model; any failure
 * becomes a failed result rather than an exception.
 */
@Slf4j
abstract class CalendarCapability implements CapabilityComponent {

    protected final CalendarPort calendarPort;
    private final ObjectMapper objectMapper;

    protected CalendarCapability(CalendarPort calendarPort, ObjectMapper objectMapper) {
        this.calendarPort = calendarPort;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean isEnabled() {
        return calendarPort.isAvailable();
    }

    protected CompletableFuture<CapabilityResult> call(Supplier<Object> action) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                Object data = action.get();
                return CapabilityResult.success(toJson(data), data);
            } catch (Exception e) {
                log.error("[Calendar] {} failed", getCapabilityName(), e);
                return CapabilityResult.failure("Failed to " + getCapabilityName() + ": " + e.getMessage());
            }
        });
    }

    private String toJson(Object data) throws JsonProcessingException {
        return objectMapper.writeValueAsString(data);
    }

    protected static String stringArg(Map<String, Object> arguments, String name) {
        Object value = arguments.get(name);
        return value != null ? value.toString() : null;
    }

    protected static long longArg(Map<String, Object> arguments, String name) {
        Object value = arguments.get(name);
        if (value instanceof Number number) {
            return number.longValue();
        }
        throw new IllegalArgumentException(name + " must be an integer");
    }

    protected static Map<String, Object> stringProperty(String description) {
        return Map.of("type", "string", "description", description);
    }
}
