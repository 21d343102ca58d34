package me.golemcore.calhelper.adapter.outbound.calendar;

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

import feign.Feign;
import feign.RequestInterceptor;
import feign.Response;
import feign.Util;
import feign.codec.ErrorDecoder;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.calhelper.domain.model.calendar.Booking;
import me.golemcore.calhelper.domain.model.calendar.BookingRequest;
import me.golemcore.calhelper.domain.model.calendar.CalendarProfile;
import me.golemcore.calhelper.domain.model.calendar.EventType;
import me.golemcore.calhelper.domain.model.calendar.TimeSlot;
import me.golemcore.calhelper.infrastructure.config.CalHelperProperties;
import me.golemcore.calhelper.infrastructure.http.FeignClientFactory;
import me.golemcore.calhelper.port.outbound.CalendarPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * cal.com API v2 client.
 *
 * <p>
 * Every request carries the API key in {@code Authorization} and the
 * {@code cal-api-version} header; the slots endpoint needs its own version.
 * Responses are unwrapped from the {@code {status, data}} envelope and reduced
 * to the fields the model needs. A missing API key does not fail startup: the
 * adapter reports itself unavailable and each call fails with a 401
 * {@link UpstreamException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CalComCalendarAdapter implements CalendarPort {

    static final String HEADER_API_VERSION = "cal-api-version";
    private static final int UNAUTHORIZED = 401;

    private final CalHelperProperties properties;
    private final FeignClientFactory feignClientFactory;

    private CalComApi api;

    @PostConstruct
    public void init() {
        CalHelperProperties.CalendarProperties calendar = properties.getCalendar();
        Feign.Builder builder = Feign.builder()
                .requestInterceptor(authInterceptor(calendar))
                .errorDecoder(new UpstreamErrorDecoder());
        this.api = feignClientFactory.create(CalComApi.class, calendar.getBaseUrl(), builder);
        if (!isAvailable()) {
            log.warn("[Calendar] No API key configured (calhelper.calendar.api-key), calendar capabilities disabled");
        }
    }

    @Override
    public boolean isAvailable() {
        String apiKey = properties.getCalendar().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public CalendarProfile fetchProfile() {
        requireApiKey();
        return api.me().getData();
    }

    @Override
    public List<EventType> listEventTypes(CalendarProfile user) {
        requireApiKey();
        String username = user != null ? user.getUsername() : null;
        return nullToEmpty(api.eventTypes(username).getData());
    }

    @Override
    public List<Booking> listBookings(String start, String end) {
        requireApiKey();
        Map<String, Object> query = new LinkedHashMap<>();
        query.put("take", properties.getCalendar().getBookingsPageSize());
        if (start != null && !start.isBlank()) {
            query.put("afterStart", start);
        }
        if (end != null && !end.isBlank()) {
            query.put("beforeEnd", end);
        }
        return nullToEmpty(api.bookings(query).getData());
    }

    @Override
    public Map<String, List<TimeSlot>> listSlots(long eventTypeId, String start, String end) {
        requireApiKey();
        Map<String, List<TimeSlot>> slots = api.slots(eventTypeId, start, end).getData();
        return slots != null ? slots : Map.of();
    }

    @Override
    public Booking createBooking(BookingRequest request) {
        requireApiKey();
        CalHelperProperties.CalendarProperties calendar = properties.getCalendar();

        Map<String, Object> attendee = new LinkedHashMap<>();
        attendee.put("name", request.getAttendeeName());
        attendee.put("email", request.getAttendeeEmail());
        attendee.put("timeZone", request.getAttendeeTimeZone());
        attendee.put("language", request.getAttendeeLanguage() != null
                ? request.getAttendeeLanguage()
                : calendar.getDefaultLanguage());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("start", request.getStart());
        body.put("eventTypeId", request.getEventTypeId());
        body.put("attendee", attendee);
        body.put("location", Map.of(
                "type", "integration",
                "integration", request.getLocation() != null ? request.getLocation() : calendar.getDefaultLocation()));
        if (request.getGuestEmails() != null && !request.getGuestEmails().isEmpty()) {
            body.put("bookingFieldsResponses", Map.of("guests", request.getGuestEmails()));
        }

        log.info("[Calendar] Creating booking: eventType={}, start={}", request.getEventTypeId(), request.getStart());
        return api.createBooking(body).getData();
    }

    @Override
    public Booking cancelBooking(String uid, String reason) {
        requireApiKey();
        Map<String, Object> body = new LinkedHashMap<>();
        if (reason != null && !reason.isBlank()) {
            body.put("cancellationReason", reason);
        }
        log.info("[Calendar] Cancelling booking: {}", uid);
        return api.cancelBooking(uid, body).getData();
    }

    private void requireApiKey() {
        if (!isAvailable()) {
            throw new UpstreamException(UNAUTHORIZED, "calendar API key is not configured");
        }
    }

    private RequestInterceptor authInterceptor(CalHelperProperties.CalendarProperties calendar) {
        return template -> {
            template.header("Authorization", calendar.getApiKey());
            boolean slots = template.methodMetadata() != null
                    && "slots".equals(template.methodMetadata().method().getName());
            template.header(HEADER_API_VERSION, slots ? calendar.getSlotsApiVersion() : calendar.getApiVersion());
        };
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list != null ? list : List.of();
    }

    static final class UpstreamErrorDecoder implements ErrorDecoder {

        @Override
        public Exception decode(String methodKey, Response response) {
            String body = null;
            if (response.body() != null) {
                try {
                    body = Util.toString(response.body().asReader(StandardCharsets.UTF_8));
                } catch (IOException e) {
                    body = "<unreadable body: " + e.getMessage() + ">";
                }
            }
            log.warn("[Calendar] {} failed with HTTP {}", methodKey, response.status());
            return new UpstreamException(response.status(), body);
        }
    }
}
