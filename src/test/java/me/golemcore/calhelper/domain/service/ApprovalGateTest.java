package me.golemcore.calhelper.domain.service;

import me.golemcore.calhelper.domain.model.ApprovalDecision;
import me.golemcore.calhelper.domain.model.ApprovalPolicy;
import me.golemcore.calhelper.domain.model.InvocationRequest;
import me.golemcore.calhelper.infrastructure.config.CalHelperProperties;
import me.golemcore.calhelper.port.outbound.ConfirmationPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ApprovalGateTest {

    private static final String THREAD_ID = "thread-1";

    private CalHelperProperties properties;
    private ConfirmationPort confirmationPort;
    private ApprovalGate gate;

    @BeforeEach
    void setUp() {
        properties = new CalHelperProperties();
        properties.getApproval().getPolicies().put("createBooking", ApprovalPolicy.REQUIRE_CONFIRMATION);
        properties.getApproval().getPolicies().put("cancelBooking", ApprovalPolicy.REQUIRE_CONFIRMATION);
        confirmationPort = mock(ConfirmationPort.class);
        when(confirmationPort.isAvailable()).thenReturn(true);
        gate = new ApprovalGate(properties, confirmationPort);
    }

    // ==================== policy ====================

    @Test
    void shouldResolveConfiguredPolicyAndFallback() {
        assertEquals(ApprovalPolicy.REQUIRE_CONFIRMATION, gate.policyFor("createBooking"));
        assertEquals(ApprovalPolicy.AUTO, gate.policyFor("listBookings"));

        properties.getApproval().setDefaultPolicy(ApprovalPolicy.REQUIRE_CONFIRMATION);
        assertTrue(gate.requiresConfirmation("listBookings"));
    }

    @Test
    void shouldApproveAutoCapabilitiesWithoutAskingPort() {
        InvocationRequest invocation = invocation("inv-1", "listBookings", Map.of());

        ApprovalDecision decision = gate.decide(THREAD_ID, invocation).join();

        assertTrue(decision.isApproved());
        assertEquals("inv-1", decision.getInvocationId());
        verify(confirmationPort, never()).requestConfirmation(anyString(), any(), anyString());
    }

    // ==================== confirmation ====================

    @Test
    void shouldAskPortForConfirmation() {
        InvocationRequest invocation = invocation("inv-2", "createBooking", Map.of("eventTypeId", 7));
        when(confirmationPort.requestConfirmation(eq(THREAD_ID), eq(invocation), anyString()))
                .thenReturn(CompletableFuture.completedFuture(ApprovalDecision.approve("inv-2")));

        ApprovalDecision decision = gate.decide(THREAD_ID, invocation).join();

        assertTrue(decision.isApproved());
    }

    @Test
    void shouldPassThroughRejectionWithFeedback() {
        InvocationRequest invocation = invocation("inv-3", "createBooking", Map.of());
        when(confirmationPort.requestConfirmation(anyString(), any(), anyString()))
                .thenReturn(CompletableFuture.completedFuture(
                        ApprovalDecision.reject("inv-3", "use Tuesday instead")));

        ApprovalDecision decision = gate.decide(THREAD_ID, invocation).join();

        assertFalse(decision.isApproved());
        assertEquals("use Tuesday instead", decision.getHumanFeedback());
    }

    @Test
    void shouldTreatTimeoutAsNoResponse() {
        properties.getApproval().setTimeout(Duration.ofMillis(50));
        InvocationRequest invocation = invocation("inv-4", "cancelBooking", Map.of("bookingUid", "abc"));
        when(confirmationPort.requestConfirmation(anyString(), any(), anyString()))
                .thenReturn(new CompletableFuture<>());

        ApprovalDecision decision = gate.decide(THREAD_ID, invocation).join();

        assertFalse(decision.isApproved());
        assertEquals(ApprovalDecision.NO_RESPONSE, decision.getHumanFeedback());
        assertEquals("inv-4", decision.getInvocationId());
    }

    @Test
    void shouldRejectWhenPortUnavailable() {
        when(confirmationPort.isAvailable()).thenReturn(false);

        ApprovalDecision decision = gate.decide(THREAD_ID, invocation("inv-5", "createBooking", Map.of())).join();

        assertFalse(decision.isApproved());
        assertEquals(ApprovalDecision.NO_RESPONSE, decision.getHumanFeedback());
    }

    @Test
    void shouldRejectWhenPortThrows() {
        when(confirmationPort.requestConfirmation(anyString(), any(), anyString()))
                .thenThrow(new IllegalStateException("channel down"));

        ApprovalDecision decision = gate.decide(THREAD_ID, invocation("inv-6", "createBooking", Map.of())).join();

        assertFalse(decision.isApproved());
    }

    @Test
    void shouldDeliverDecisionToPort() {
        ApprovalDecision decision = ApprovalDecision.approve("inv-7");

        gate.deliver(decision);

        verify(confirmationPort).deliverDecision(decision);
    }

    // ==================== describeAction ====================

    @Test
    void shouldDescribeBookingCreation() {
        String description = gate.describeAction(invocation("inv-8", "createBooking", Map.of(
                "eventTypeId", 42,
                "start", "2025-07-10T09:00:00-0700",
                "attendeeName", "Ada",
                "attendeeEmail", "ada@example.com",
                "guestEmails", List.of("bob@example.com"))));

        assertEquals("Create booking of event type 42 at 2025-07-10T09:00:00-0700 for Ada <ada@example.com>, "
                + "guests: [bob@example.com]", description);
    }

    @Test
    void shouldDescribeCancellationAndShortenLongValues() {
        String description = gate.describeAction(invocation("inv-9", "cancelBooking", Map.of(
                "bookingUid", "uid-1",
                "reason", "r".repeat(100))));

        assertTrue(description.startsWith("Cancel booking uid-1 (reason: "));
        assertTrue(description.endsWith("...)"));
    }

    @Test
    void shouldDescribeOtherCapabilitiesGenerically() {
        String description = gate.describeAction(invocation("inv-10", "listSlots", Map.of("eventTypeId", 3)));

        assertEquals("listSlots: {eventTypeId=3}", description);
    }

    private static InvocationRequest invocation(String id, String name, Map<String, Object> args) {
        return InvocationRequest.builder()
                .id(id)
                .capabilityName(name)
                .arguments(args)
                .build();
    }
}
