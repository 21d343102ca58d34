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
import me.golemcore.calhelper.domain.model.calendar.BookingRequest;
import me.golemcore.calhelper.port.outbound.CalendarPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Books an event for an attendee. Requires confirmation under the default
 * approval configuration.
 */
@Component
public class CreateBookingCapability extends CalendarCapability {

    public CreateBookingCapability(CalendarPort calendarPort, ObjectMapper objectMapper) {
        super(calendarPort, objectMapper);
    }

    @Override
    public CapabilityDefinition getDefinition() {
        return CapabilityDefinition.builder()
                .name("createBooking")
                .description("Create a booking of an event type at a given start time for an attendee. "
                        + "Optional guests receive the invitation as well.")
                .inputSchema(CapabilityDefinition.objectSchema(
                        Map.of(
                                "eventTypeId", Map.of("type", "integer", "description", "Event type id"),
                                "start", stringProperty("Start time, ISO-8601"),
                                "attendeeName", stringProperty("Attendee full name"),
                                "attendeeEmail", stringProperty("Attendee email"),
                                "attendeeTimeZone", stringProperty("Attendee IANA time zone, e.g. America/Los_Angeles"),
                                "attendeeLanguage", stringProperty("Attendee language code (optional, default en)"),
                                "location", stringProperty("Location integration (optional, default cal-video)"),
                                "guestEmails", Map.of(
                                        "type", "array",
                                        "description", "Additional guest emails (optional)",
                                        "items", Map.of("type", "string"))),
                        List.of("eventTypeId", "start", "attendeeName", "attendeeEmail",
                                "attendeeTimeZone")))
                .build();
    }

    @Override
    public CompletableFuture<CapabilityResult> execute(Map<String, Object> arguments) {
        return call(() -> calendarPort.createBooking(toRequest(arguments)));
    }

    private static BookingRequest toRequest(Map<String, Object> arguments) {
        return BookingRequest.builder()
                .eventTypeId(longArg(arguments, "eventTypeId"))
                .start(stringArg(arguments, "start"))
                .attendeeName(stringArg(arguments, "attendeeName"))
                .attendeeEmail(stringArg(arguments, "attendeeEmail"))
                .attendeeTimeZone(stringArg(arguments, "attendeeTimeZone"))
                .attendeeLanguage(stringArg(arguments, "attendeeLanguage"))
                .location(stringArg(arguments, "location"))
                .guestEmails(guestEmails(arguments.get("guestEmails")))
                .build();
    }

    private static List<String> guestEmails(Object value) {
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of();
    }
}
