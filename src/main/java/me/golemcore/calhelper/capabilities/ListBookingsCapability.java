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
 * Lists existing bookings, optionally within a date range.
 */
@Component
public class ListBookingsCapability extends CalendarCapability {

    public ListBookingsCapability(CalendarPort calendarPort, ObjectMapper objectMapper) {
        super(calendarPort, objectMapper);
    }

    @Override
    public CapabilityDefinition getDefinition() {
        return CapabilityDefinition.builder()
                .name("listBookings")
                .description("List bookings (scheduled events) of the current user, optionally between a start and "
                        + "an end date-time.")
                .inputSchema(CapabilityDefinition.objectSchema(
                        Map.of(
                                "startDate", stringProperty("Earliest booking start, ISO-8601 (optional)"),
                                "endDate", stringProperty("Latest booking end, ISO-8601 (optional)")),
                        List.of()))
                .build();
    }

    @Override
    public CompletableFuture<CapabilityResult> execute(Map<String, Object> arguments) {
        String start = stringArg(arguments, "startDate");
        String end = stringArg(arguments, "endDate");
        return call(() -> calendarPort.listBookings(start, end));
    }
}
