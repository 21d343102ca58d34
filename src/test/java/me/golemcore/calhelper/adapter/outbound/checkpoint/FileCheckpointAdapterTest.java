package me.golemcore.calhelper.adapter.outbound.checkpoint;

import me.golemcore.calhelper.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.calhelper.domain.model.ApprovalDecision;
import me.golemcore.calhelper.domain.model.ConversationThread;
import me.golemcore.calhelper.domain.model.FailureKind;
import me.golemcore.calhelper.domain.model.InvocationRequest;
import me.golemcore.calhelper.domain.model.Message;
import me.golemcore.calhelper.domain.model.MessageKind;
import me.golemcore.calhelper.domain.model.TurnPhase;
import me.golemcore.calhelper.infrastructure.config.CalHelperProperties;
import me.golemcore.calhelper.infrastructure.config.CoreConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileCheckpointAdapterTest {

    @TempDir
    Path tempDir;

    private FileCheckpointAdapter adapter;

    @BeforeEach
    void setUp() {
        CalHelperProperties properties = new CalHelperProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        adapter = new FileCheckpointAdapter(storage, new ThreadJsonCodec(CoreConfiguration.objectMapper()),
                properties);
        adapter.init();
    }

    @Test
    void shouldCreateThreadDirectoryOnInit() {
        assertTrue(Files.isDirectory(tempDir.resolve("threads")));
    }

    @Test
    void shouldRoundTripSuspendedThread() {
        ConversationThread thread = suspendedThread("t-1");

        adapter.write(thread);
        ConversationThread loaded = adapter.read("t-1").orElseThrow();

        assertEquals(TurnPhase.APPROVING, loaded.getPhase());
        assertEquals(2, loaded.getRoundTrips());
        assertEquals(7, loaded.getVersion());
        assertEquals(Instant.parse("2025-07-10T16:00:00Z"), loaded.getCreatedAt());
        assertEquals(2, loaded.getMessages().size());
        assertEquals("inv-1", loaded.getPendingInvocations().get(0).getId());
        assertEquals(42, loaded.getPendingInvocations().get(0).getArguments().get("eventTypeId"));
        assertTrue(loaded.getDecisions().get("inv-2").isApproved());
        assertFalse(loaded.hasDecision("inv-1"));
    }

    @Test
    void shouldLoadThreadEqualToTheOneSaved() {
        ConversationThread thread = fullyPopulatedThread("t-full");

        adapter.write(thread);

        assertEquals(thread, adapter.read("t-full").orElseThrow());
    }

    @Test
    void shouldWriteOneJsonDocumentPerThread() {
        adapter.write(suspendedThread("t-1"));

        assertTrue(Files.exists(tempDir.resolve("threads").resolve("t-1.json")));
    }

    @Test
    void shouldReturnEmptyForUnknownThread() {
        assertTrue(adapter.read("missing").isEmpty());
    }

    @Test
    void shouldListAndDeleteThreads() {
        adapter.write(suspendedThread("b"));
        adapter.write(suspendedThread("a"));

        assertEquals(List.of("a", "b"), adapter.listThreadIds());

        assertTrue(adapter.delete("a"));
        assertFalse(adapter.delete("a"));
        assertEquals(List.of("b"), adapter.listThreadIds());
    }

    @Test
    void shouldRejectUnsafeThreadIds() {
        assertThrows(IllegalArgumentException.class, () -> adapter.read("../escape"));
        assertThrows(IllegalArgumentException.class, () -> adapter.read("a/b"));
        assertThrows(IllegalArgumentException.class, () -> adapter.delete(""));
    }

    static ConversationThread suspendedThread(String threadId) {
        InvocationRequest create = InvocationRequest.builder()
                .id("inv-1")
                .capabilityName("createBooking")
                .arguments(Map.of("eventTypeId", 42, "start", "2025-07-15T10:00:00-0700"))
                .build();
        InvocationRequest list = InvocationRequest.builder()
                .id("inv-2")
                .capabilityName("listBookings")
                .arguments(Map.of())
                .build();
        ConversationThread thread = ConversationThread.builder()
                .threadId(threadId)
                .phase(TurnPhase.APPROVING)
                .roundTrips(2)
                .version(7)
                .createdAt(Instant.parse("2025-07-10T16:00:00Z"))
                .updatedAt(Instant.parse("2025-07-10T16:05:00Z"))
                .pendingInvocations(new ArrayList<>(List.of(create, list)))
                .build();
        thread.addMessage(Message.builder().id("m1").kind(MessageKind.USER).content("Book Ada").build());
        thread.addMessage(Message.builder()
                .id("m2")
                .kind(MessageKind.INVOCATION_REQUEST)
                .invocation(create)
                .invocationId("inv-1")
                .capabilityName("createBooking")
                .build());
        thread.recordDecision(ApprovalDecision.approve("inv-2"));
        return thread;
    }

    /**
     * A thread stalled mid-round with every field set, including a staged
     * failed result and a rejection.
     */
    static ConversationThread fullyPopulatedThread(String threadId) {
        Instant at = Instant.parse("2025-07-10T16:00:00.123Z");
        InvocationRequest create = InvocationRequest.builder()
                .id("inv-1")
                .capabilityName("createBooking")
                .arguments(Map.of(
                        "eventTypeId", 42,
                        "start", "2025-07-15T10:00:00-0700",
                        "guestEmails", List.of("bob@example.com"),
                        "attendee", Map.of("name", "Ada", "notify", true)))
                .build();
        InvocationRequest list = InvocationRequest.builder()
                .id("inv-2")
                .capabilityName("listBookings")
                .arguments(Map.of("startDate", "2025-07-10"))
                .build();
        InvocationRequest cancel = InvocationRequest.builder()
                .id("inv-3")
                .capabilityName("cancelBooking")
                .arguments(Map.of("bookingUid", "b-1"))
                .build();

        ConversationThread thread = ConversationThread.builder()
                .threadId(threadId)
                .phase(TurnPhase.DISPATCHING)
                .roundTrips(3)
                .version(11)
                .createdAt(at)
                .updatedAt(at.plusSeconds(90))
                .pendingInvocations(new ArrayList<>(List.of(create, list, cancel)))
                .build();
        thread.addMessage(Message.builder().id("m0").kind(MessageKind.SYSTEM).content("You are a calendar assistant.")
                .timestamp(at).build());
        thread.addMessage(Message.builder().id("m1").kind(MessageKind.USER).content("Rebook my call")
                .timestamp(at.plusSeconds(1)).build());
        for (InvocationRequest invocation : List.of(create, list, cancel)) {
            thread.addMessage(Message.builder()
                    .id("req-" + invocation.getId())
                    .kind(MessageKind.INVOCATION_REQUEST)
                    .invocation(invocation)
                    .invocationId(invocation.getId())
                    .capabilityName(invocation.getCapabilityName())
                    .timestamp(at.plusSeconds(2))
                    .build());
        }
        thread.recordDecision(ApprovalDecision.approve("inv-1"));
        thread.recordDecision(ApprovalDecision.approve("inv-2"));
        thread.recordDecision(ApprovalDecision.reject("inv-3", "keep that one"));
        thread.recordResult(Message.builder()
                .id("res-inv-1")
                .kind(MessageKind.INVOCATION_RESULT)
                .content("Failed to createBooking: Calendar API returned 409: slot taken")
                .invocationId("inv-1")
                .capabilityName("createBooking")
                .failed(true)
                .failureKind(FailureKind.EXECUTION_FAILED)
                .timestamp(at.plusSeconds(30))
                .build());
        thread.recordResult(Message.builder()
                .id("res-inv-3")
                .kind(MessageKind.INVOCATION_RESULT)
                .content("Rejected by user: keep that one")
                .invocationId("inv-3")
                .capabilityName("cancelBooking")
                .failed(true)
                .failureKind(FailureKind.REJECTED)
                .timestamp(at.plusSeconds(31))
                .build());
        return thread;
    }
}
