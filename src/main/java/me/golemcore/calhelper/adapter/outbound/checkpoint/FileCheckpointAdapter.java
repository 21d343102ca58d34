package me.golemcore.calhelper.adapter.outbound.checkpoint;

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

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.calhelper.domain.model.ConversationThread;
import me.golemcore.calhelper.infrastructure.config.CalHelperProperties;
import me.golemcore.calhelper.port.outbound.CheckpointPort;
import me.golemcore.calhelper.port.outbound.StoragePort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * File checkpoint backend: one JSON document per thread under
 * {@code <storage base>/threads/<threadId>.json}, written with the storage
 * port's crash-safe atomic write.
 */
@Component
@ConditionalOnProperty(name = "calhelper.checkpoint.backend", havingValue = "file", matchIfMissing = true)
@Slf4j
public class FileCheckpointAdapter implements CheckpointPort {

    private static final String JSON_EXTENSION = ".json";

    private final StoragePort storagePort;
    private final ThreadJsonCodec codec;
    private final String directory;
    private final boolean backup;

    public FileCheckpointAdapter(StoragePort storagePort, ThreadJsonCodec codec, CalHelperProperties properties) {
        this.storagePort = storagePort;
        this.codec = codec;
        this.directory = properties.getCheckpoint().getDirectory();
        this.backup = properties.getCheckpoint().isBackup();
    }

    @PostConstruct
    public void init() {
        storagePort.ensureDirectory(directory).join();
        log.debug("[Checkpoint] Thread directory ready: {}", directory);
    }

    @Override
    public String getBackendId() {
        return "file";
    }

    @Override
    public Optional<ConversationThread> read(String threadId) {
        String json = storagePort.getText(directory, fileName(threadId)).join();
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(codec.decode(json));
    }

    @Override
    public void write(ConversationThread thread) {
        storagePort.putTextAtomic(directory, fileName(thread.getThreadId()), codec.encode(thread), backup).join();
    }

    @Override
    public boolean delete(String threadId) {
        String file = fileName(threadId);
        boolean existed = Boolean.TRUE.equals(storagePort.exists(directory, file).join());
        if (existed) {
            storagePort.deleteObject(directory, file).join();
        }
        return existed;
    }

    @Override
    public List<String> listThreadIds() {
        return storagePort.listObjects(directory, "").join().stream()
                .filter(name -> name.endsWith(JSON_EXTENSION))
                .map(name -> name.substring(0, name.length() - JSON_EXTENSION.length()))
                .toList();
    }

    private String fileName(String threadId) {
        return ThreadJsonCodec.requireSafeId(threadId) + JSON_EXTENSION;
    }
}
