package me.golemcore.calhelper.adapter.outbound.confirmation;

import me.golemcore.calhelper.domain.model.ApprovalDecision;
import me.golemcore.calhelper.domain.model.InvocationRequest;
import me.golemcore.calhelper.infrastructure.config.CalHelperProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeferredConfirmationAdapterTest {

    private DeferredConfirmationAdapter adapter;

    @BeforeEach
    void setUp() {
        CalHelperProperties properties = new CalHelperProperties();
        properties.getApproval().setTimeout(Duration.ofMinutes(5));
        adapter = new DeferredConfirmationAdapter(properties);
    }

    @AfterEach
    void tearDown() {
        adapter.destroy();
    }

    @Test
    void shouldNotBlockAndReturnSameFutureUntilDecided() {
        CompletableFuture<ApprovalDecision> first = adapter.requestConfirmation("t", invocation("inv-1"), "desc");
        CompletableFuture<ApprovalDecision> second = adapter.requestConfirmation("t", invocation("inv-1"), "desc");

        assertFalse(first.isDone());
        assertSame(first, second);
        assertFalse(adapter.isInteractive());
        assertTrue(adapter.isAvailable());
    }

    @Test
    void shouldCompletePendingRequestOnDelivery() {
        CompletableFuture<ApprovalDecision> future = adapter.requestConfirmation("t", invocation("inv-1"), "desc");

        adapter.deliverDecision(ApprovalDecision.reject("inv-1", "not today"));

        assertTrue(future.isDone());
        assertEquals("not today", future.join().getHumanFeedback());
    }

    @Test
    void shouldHandOutDecisionDeliveredBeforeRequest() {
        adapter.deliverDecision(ApprovalDecision.approve("inv-1"));

        CompletableFuture<ApprovalDecision> future = adapter.requestConfirmation("t", invocation("inv-1"), "desc");

        assertTrue(future.join().isApproved());
        assertEquals(0, adapter.pendingCount());
    }

    @Test
    void shouldIgnoreSecondDelivery() {
        CompletableFuture<ApprovalDecision> future = adapter.requestConfirmation("t", invocation("inv-1"), "desc");

        adapter.deliverDecision(ApprovalDecision.approve("inv-1"));
        adapter.deliverDecision(ApprovalDecision.reject("inv-1", "too late"));

        assertTrue(future.join().isApproved());
    }

    @Test
    void shouldForgetEntryOnceHandedOut() {
        adapter.requestConfirmation("t", invocation("inv-1"), "desc");
        adapter.deliverDecision(ApprovalDecision.approve("inv-1"));

        adapter.requestConfirmation("t", invocation("inv-1"), "desc");

        assertEquals(0, adapter.pendingCount());
    }

    @Test
    void shouldKeyFeedbackByThread() {
        CompletableFuture<String> forA = adapter.requestFeedback("a", "What instead?");
        CompletableFuture<String> forB = adapter.requestFeedback("b", "What instead?");

        adapter.deliverFeedback("a", "Tuesday");

        assertEquals("Tuesday", forA.join());
        assertFalse(forB.isDone());
    }

    @Test
    void shouldKeepFreshEntriesOnCleanup() {
        CompletableFuture<ApprovalDecision> future = adapter.requestConfirmation("t", invocation("inv-1"), "desc");

        adapter.expireStale();

        assertFalse(future.isDone());
        assertEquals(1, adapter.pendingCount());
    }

    @Test
    void shouldExpireEntriesOlderThanTimeoutAndGrace() {
        CalHelperProperties properties = new CalHelperProperties();
        properties.getApproval().setTimeout(Duration.ofMinutes(-31));
        DeferredConfirmationAdapter expiring = new DeferredConfirmationAdapter(properties);
        CompletableFuture<String> future = expiring.requestFeedback("t", "What instead?");

        expiring.expireStale();

        assertTrue(future.isCompletedExceptionally());
        assertEquals(0, expiring.pendingCount());
    }

    private static InvocationRequest invocation(String id) {
        return InvocationRequest.builder()
                .id(id)
                .capabilityName("createBooking")
                .arguments(Map.of())
                .build();
    }
}
