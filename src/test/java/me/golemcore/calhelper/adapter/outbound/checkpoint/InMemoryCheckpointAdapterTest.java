package me.golemcore.calhelper.adapter.outbound.checkpoint;

import me.golemcore.calhelper.domain.model.ConversationThread;
import me.golemcore.calhelper.domain.model.TurnPhase;
import me.golemcore.calhelper.infrastructure.config.CoreConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryCheckpointAdapterTest {

    private InMemoryCheckpointAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new InMemoryCheckpointAdapter(new ThreadJsonCodec(CoreConfiguration.objectMapper()));
    }

    @Test
    void shouldStoreSnapshotNotReference() {
        ConversationThread thread = FileCheckpointAdapterTest.suspendedThread("t-1");
        adapter.write(thread);

        thread.setPhase(TurnPhase.DONE);
        ConversationThread loaded = adapter.read("t-1").orElseThrow();

        assertNotSame(thread, loaded);
        assertEquals(TurnPhase.APPROVING, loaded.getPhase());
    }

    @Test
    void shouldLoadThreadEqualToTheOneSaved() {
        ConversationThread thread = FileCheckpointAdapterTest.fullyPopulatedThread("t-full");

        adapter.write(thread);
        ConversationThread loaded = adapter.read("t-full").orElseThrow();

        assertEquals(thread, loaded);
        assertNotSame(thread, loaded);
    }

    @Test
    void shouldListSortedAndDelete() {
        adapter.write(FileCheckpointAdapterTest.suspendedThread("b"));
        adapter.write(FileCheckpointAdapterTest.suspendedThread("a"));

        assertEquals(List.of("a", "b"), adapter.listThreadIds());
        assertTrue(adapter.delete("b"));
        assertFalse(adapter.delete("b"));
        assertTrue(adapter.read("b").isEmpty());
    }
}
