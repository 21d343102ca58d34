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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import feign.Headers;
import feign.Param;
import feign.QueryMap;
import feign.RequestLine;
import lombok.Data;
import me.golemcore.calhelper.domain.model.calendar.Booking;
import me.golemcore.calhelper.domain.model.calendar.CalendarProfile;
import me.golemcore.calhelper.domain.model.calendar.EventType;
import me.golemcore.calhelper.domain.model.calendar.TimeSlot;

import java.util.List;
import java.util.Map;

/**
 * cal.com API v2. Authorization and version headers are added by the
 * adapter's request interceptor.
 */
interface CalComApi {

    @RequestLine("GET /me")
    Envelope<CalendarProfile> me();

    @RequestLine("GET /event-types?username={username}")
    Envelope<List<EventType>> eventTypes(@Param("username") String username);

    @RequestLine("GET /bookings")
    Envelope<List<Booking>> bookings(@QueryMap Map<String, Object> query);

    @RequestLine("GET /slots?eventTypeId={eventTypeId}&start={start}&end={end}")
    Envelope<Map<String, List<TimeSlot>>> slots(@Param("eventTypeId") long eventTypeId,
            @Param("start") String start, @Param("end") String end);

    @RequestLine("POST /bookings")
    @Headers("Content-Type: application/json")
    Envelope<Booking> createBooking(Map<String, Object> body);

    @RequestLine("POST /bookings/{uid}/cancel")
    @Headers("Content-Type: application/json")
    Envelope<Booking> cancelBooking(@Param("uid") String uid, Map<String, Object> body);

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    class Envelope<T> {
        private String status;
        private T data;
    }
}
