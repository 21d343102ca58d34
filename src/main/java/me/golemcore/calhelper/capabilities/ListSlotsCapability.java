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

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.calhelper.domain.model.CapabilityDefinition;
import me.golemcore.calhelper.domain.model.CapabilityResult;
import me.golemcore.calhelper.port.outbound.CalendarPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Lists free slots of an event type, grouped by date.
 */
@Component
public class ListSlotsCapability extends CalendarCapability {

    public ListSlotsCapability(CalendarPort calendarPort, ObjectMapper objectMapper) {
        super(calendarPort, objectMapper);
    }

    @Override
    public CapabilityDefinition getDefinition() {
        return CapabilityDefinition.builder()
                .name("listSlots")
                .description("List available time slots for an event type between start and end, grouped by date.")
                .inputSchema(CapabilityDefinition.objectSchema(
                        Map.of(
                                "eventTypeId", Map.of("type", "integer", "description", "Event type id"),
                                "start", stringProperty("Range start, ISO-8601"),
                                "end", stringProperty("Range end, ISO-8601")),
                        List.of("eventTypeId", "start", "end")))
                .build();
    }

    @Override
    public CompletableFuture<CapabilityResult> execute(Map<String, Object> arguments) {
        return call(() -> calendarPort.listSlots(
                longArg(arguments, "eventTypeId"),
                stringArg(arguments, "start"),
                stringArg(arguments, "end")));
    }
}
