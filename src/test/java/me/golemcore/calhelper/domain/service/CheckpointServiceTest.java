package me.golemcore.calhelper.domain.service;

import me.golemcore.calhelper.domain.exception.CheckpointException;
import me.golemcore.calhelper.domain.exception.ThreadBusyException;
import me.golemcore.calhelper.domain.exception.ThreadNotFoundException;
import me.golemcore.calhelper.domain.model.ConversationThread;
import me.golemcore.calhelper.port.outbound.CheckpointPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CheckpointServiceTest {

    private static final Instant NOW = Instant.parse("2025-07-10T16:00:00Z");
    private static final String THREAD_ID = "thread-1";

    private CheckpointPort checkpointPort;
    private CheckpointService service;

    @BeforeEach
    void setUp() {
        checkpointPort = mock(CheckpointPort.class);
        when(checkpointPort.getBackendId()).thenReturn("mock");
        service = new CheckpointService(checkpointPort, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // ==================== leases ====================

    @Test
    void shouldGrantSingleLeasePerThread() {
        try (ThreadLease lease = service.acquire(THREAD_ID)) {
            assertTrue(service.isBusy(THREAD_ID));
            assertThrows(ThreadBusyException.class, () -> service.acquire(THREAD_ID));
            assertFalse(lease.isReleased());
        }
        assertFalse(service.isBusy(THREAD_ID));
    }

    @Test
    void shouldAllowLeasesOnDifferentThreads() {
        try (ThreadLease first = service.acquire("a"); ThreadLease second = service.acquire("b")) {
            assertTrue(service.isBusy("a"));
            assertTrue(service.isBusy("b"));
        }
    }

    @Test
    void shouldIgnoreDoubleRelease() {
        ThreadLease lease = service.acquire(THREAD_ID);
        lease.close();
        ThreadLease next = service.acquire(THREAD_ID);

        lease.close();

        assertTrue(service.isBusy(THREAD_ID));
        next.close();
    }

    // ==================== save ====================

    @Test
    void shouldBumpVersionAndStampTimesOnSave() {
        ConversationThread thread = ConversationThread.builder().threadId(THREAD_ID).build();

        try (ThreadLease lease = service.acquire(THREAD_ID)) {
            service.save(lease, thread);
            service.save(lease, thread);
        }

        assertEquals(2, thread.getVersion());
        assertEquals(NOW, thread.getCreatedAt());
        assertEquals(NOW, thread.getUpdatedAt());
    }

    @Test
    void shouldRevertVersionWhenBackendFails() {
        ConversationThread thread = ConversationThread.builder().threadId(THREAD_ID).version(4).build();
        doThrow(new IllegalStateException("disk full")).when(checkpointPort).write(any());

        try (ThreadLease lease = service.acquire(THREAD_ID)) {
            CheckpointException ex = assertThrows(CheckpointException.class, () -> service.save(lease, thread));
            assertEquals("disk full", ex.getCause().getMessage());
        }

        assertEquals(4, thread.getVersion());
    }

    @Test
    void shouldRefuseSaveWithoutOwningLease() {
        ConversationThread thread = ConversationThread.builder().threadId(THREAD_ID).build();
        ThreadLease released = service.acquire(THREAD_ID);
        released.close();

        assertThrows(ThreadBusyException.class, () -> service.save(released, thread));
        assertThrows(ThreadBusyException.class, () -> service.save(null, thread));
        try (ThreadLease other = service.acquire("other")) {
            assertThrows(ThreadBusyException.class, () -> service.save(other, thread));
        }
        verify(checkpointPort, never()).write(any());
    }

    // ==================== load and delete ====================

    @Test
    void shouldThrowNotFoundForMissingThread() {
        when(checkpointPort.read(THREAD_ID)).thenReturn(Optional.empty());

        assertThrows(ThreadNotFoundException.class, () -> service.load(THREAD_ID));
        assertFalse(service.exists(THREAD_ID));
    }

    @Test
    void shouldWrapBackendReadFailure() {
        when(checkpointPort.read(THREAD_ID)).thenThrow(new IllegalStateException("corrupt"));

        assertThrows(CheckpointException.class, () -> service.load(THREAD_ID));
    }

    @Test
    void shouldPassThroughInvalidThreadId() {
        when(checkpointPort.read("../x")).thenThrow(new IllegalArgumentException("Invalid thread id: ../x"));

        assertThrows(IllegalArgumentException.class, () -> service.find("../x"));
    }

    @Test
    void shouldDeleteExistingThread() {
        when(checkpointPort.delete(THREAD_ID)).thenReturn(true);

        service.delete(THREAD_ID);

        verify(checkpointPort).delete(THREAD_ID);
        assertFalse(service.isBusy(THREAD_ID));
    }

    @Test
    void shouldFailDeletingMissingOrBusyThread() {
        when(checkpointPort.delete(THREAD_ID)).thenReturn(false);
        assertThrows(ThreadNotFoundException.class, () -> service.delete(THREAD_ID));

        try (ThreadLease ignored = service.acquire(THREAD_ID)) {
            assertThrows(ThreadBusyException.class, () -> service.delete(THREAD_ID));
        }
    }

    @Test
    void shouldListThreadIds() {
        when(checkpointPort.listThreadIds()).thenReturn(List.of("a", "b"));

        assertEquals(List.of("a", "b"), service.listThreadIds());
    }

    @Test
    void shouldGenerateDistinctThreadIds() {
        assertNotEquals(service.newThreadId(), service.newThreadId());
    }
}
