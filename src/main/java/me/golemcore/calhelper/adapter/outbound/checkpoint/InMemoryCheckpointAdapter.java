package me.golemcore.calhelper.adapter.outbound.checkpoint;

import me.golemcore.calhelper.domain.model.ConversationThread;
import me.golemcore.calhelper.port.outbound.CheckpointPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process checkpoint backend for tests and single-process demos. Stores JSON
 * so every read is an independent copy.
 */
@Component
@ConditionalOnProperty(name = "calhelper.checkpoint.backend", havingValue = "memory")
public class InMemoryCheckpointAdapter implements CheckpointPort {

    private final ThreadJsonCodec codec;
    private final Map<String, String> documents = new ConcurrentHashMap<>();

    public InMemoryCheckpointAdapter(ThreadJsonCodec codec) {
        this.codec = codec;
    }

    @Override
    public String getBackendId() {
        return "memory";
    }

    @Override
    public Optional<ConversationThread> read(String threadId) {
        return Optional.ofNullable(documents.get(threadId)).map(codec::decode);
    }

    @Override
    public void write(ConversationThread thread) {
        documents.put(thread.getThreadId(), codec.encode(thread));
    }

    @Override
    public boolean delete(String threadId) {
        return documents.remove(threadId) != null;
    }

    @Override
    public List<String> listThreadIds() {
        List<String> ids = new ArrayList<>(documents.keySet());
        ids.sort(null);
        return ids;
    }
}
