package me.golemcore.calhelper.domain.model.calendar;

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

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Parameters of a new booking as requested by the model.
 */
@Data
@Builder
public class BookingRequest {

    private long eventTypeId;
    private String start;
    private String attendeeName;
    private String attendeeEmail;
    private String attendeeTimeZone;
    private String attendeeLanguage;

    /**
     * Location integration, e.g. "cal-video".
     */
    private String location;

    private List<String> guestEmails;
}
