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

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Lists the event types offered by the current user. The user is resolved on
 * every call so the capability stays stateless.
 */
@Component
public class ListEventTypesCapability extends CalendarCapability {

    public ListEventTypesCapability(CalendarPort calendarPort, ObjectMapper objectMapper) {
        super(calendarPort, objectMapper);
    }

    @Override
    public CapabilityDefinition getDefinition() {
        return CapabilityDefinition.simple("listEventTypes",
                "List the event types (meeting kinds) of the current user with id, length in minutes, title, "
                        + "slug, description and locations. Needed before creating a booking.");
    }

    @Override
    public CompletableFuture<CapabilityResult> execute(Map<String, Object> arguments) {
        return call(() -> calendarPort.listEventTypes(calendarPort.fetchProfile()));
    }
}
