package me.golemcore.calhelper.port.outbound;

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

import me.golemcore.calhelper.domain.model.calendar.Booking;
import me.golemcore.calhelper.domain.model.calendar.BookingRequest;
import me.golemcore.calhelper.domain.model.calendar.CalendarProfile;
import me.golemcore.calhelper.domain.model.calendar.EventType;
import me.golemcore.calhelper.domain.model.calendar.TimeSlot;

import java.util.List;
import java.util.Map;

/**
 * Port for the remote calendar. Every call is synchronous and fails with an
 * upstream exception carrying the HTTP status and body.
 */
public interface CalendarPort {

    CalendarProfile fetchProfile();

    List<EventType> listEventTypes(CalendarProfile user);

    /**
     * Lists bookings, optionally bounded by ISO-8601 start and end (either may be
     * null).
     */
    List<Booking> listBookings(String start, String end);

    /**
     * Lists available slots grouped by date.
     */
    Map<String, List<TimeSlot>> listSlots(long eventTypeId, String start, String end);

    Booking createBooking(BookingRequest request);

    Booking cancelBooking(String uid, String reason);

    /**
     * Checks if the calendar is configured (API key present).
     */
    boolean isAvailable();
}
