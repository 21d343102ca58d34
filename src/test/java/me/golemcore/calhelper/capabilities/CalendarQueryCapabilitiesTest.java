package me.golemcore.calhelper.capabilities;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.calhelper.domain.model.CapabilityResult;
import me.golemcore.calhelper.domain.model.calendar.Booking;
import me.golemcore.calhelper.domain.model.calendar.CalendarProfile;
import me.golemcore.calhelper.domain.model.calendar.EventType;
import me.golemcore.calhelper.domain.model.calendar.TimeSlot;
import me.golemcore.calhelper.infrastructure.config.CoreConfiguration;
import me.golemcore.calhelper.port.outbound.CalendarPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CalendarQueryCapabilitiesTest {

    private final ObjectMapper objectMapper = CoreConfiguration.objectMapper();
    private CalendarPort calendarPort;

    @BeforeEach
    void setUp() {
        calendarPort = mock(CalendarPort.class);
    }

    // ==================== fetchProfile / listEventTypes ====================

    @Test
    void shouldFetchProfile() {
        CalendarProfile profile = profile("ada");
        when(calendarPort.fetchProfile()).thenReturn(profile);

        CapabilityResult result = new FetchProfileCapability(calendarPort, objectMapper).execute(Map.of()).join();

        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().contains("\"username\":\"ada\""));
    }

    @Test
    void shouldListEventTypesOfCurrentUser() {
        CalendarProfile profile = profile("ada");
        EventType eventType = new EventType();
        eventType.setId(42L);
        eventType.setTitle("30 min");
        when(calendarPort.fetchProfile()).thenReturn(profile);
        when(calendarPort.listEventTypes(profile)).thenReturn(List.of(eventType));

        CapabilityResult result = new ListEventTypesCapability(calendarPort, objectMapper).execute(Map.of()).join();

        assertTrue(result.getOutput().contains("\"title\":\"30 min\""));
        verify(calendarPort).listEventTypes(profile);
    }

    // ==================== listBookings / listSlots ====================

    @Test
    void shouldPassOptionalRangeToListBookings() {
        Booking booking = new Booking();
        booking.setUid("b-1");
        when(calendarPort.listBookings("2025-07-10", null)).thenReturn(List.of(booking));

        CapabilityResult result = new ListBookingsCapability(calendarPort, objectMapper)
                .execute(Map.of("startDate", "2025-07-10"))
                .join();

        assertTrue(result.getOutput().startsWith("[{"));
        verify(calendarPort).listBookings("2025-07-10", null);
    }

    @Test
    void shouldListSlotsGroupedByDate() {
        TimeSlot slot = new TimeSlot();
        slot.setStart("2025-07-15T09:00:00Z");
        when(calendarPort.listSlots(42L, "2025-07-15", "2025-07-16"))
                .thenReturn(Map.of("2025-07-15", List.of(slot)));

        CapabilityResult result = new ListSlotsCapability(calendarPort, objectMapper)
                .execute(Map.of("eventTypeId", 42, "start", "2025-07-15", "end", "2025-07-16"))
                .join();

        assertEquals("{\"2025-07-15\":[{\"start\":\"2025-07-15T09:00:00Z\"}]}", result.getOutput());
    }

    // ==================== cancelBooking ====================

    @Test
    void shouldCancelWithOptionalReason() {
        Booking cancelled = new Booking();
        cancelled.setStatus("cancelled");
        when(calendarPort.cancelBooking("b-1", null)).thenReturn(cancelled);

        CapabilityResult result = new CancelBookingCapability(calendarPort, objectMapper)
                .execute(Map.of("bookingUid", "b-1"))
                .join();

        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().contains("\"status\":\"cancelled\""));
    }

    @Test
    void shouldReportCancelFailure() {
        when(calendarPort.cancelBooking("b-1", "moved")).thenThrow(new IllegalStateException("timeout"));

        CapabilityResult result = new CancelBookingCapability(calendarPort, objectMapper)
                .execute(Map.of("bookingUid", "b-1", "reason", "moved"))
                .join();

        assertFalse(result.isSuccess());
        assertEquals("Failed to cancelBooking: timeout", result.getError());
    }

    private static CalendarProfile profile(String username) {
        CalendarProfile profile = new CalendarProfile();
        profile.setUsername(username);
        return profile;
    }
}
