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

import me.golemcore.calhelper.domain.model.ConversationThread;

import java.util.List;
import java.util.Optional;

/**
 * Backend for thread checkpoints. Implementations store a serialized snapshot so
 * every read returns an independent copy. Locking is owned by the checkpoint
 * service, not by the backend.
 */
public interface CheckpointPort {

    /**
     * Returns the backend identifier (e.g., "file", "memory").
     */
    String getBackendId();

    Optional<ConversationThread> read(String threadId);

    void write(ConversationThread thread);

    boolean delete(String threadId);

    List<String> listThreadIds();
}
