package me.golemcore.calhelper.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.calhelper.domain.exception.CheckpointException;
import me.golemcore.calhelper.domain.exception.ThreadBusyException;
import me.golemcore.calhelper.domain.exception.ThreadNotFoundException;
import me.golemcore.calhelper.domain.model.ConversationThread;
import me.golemcore.calhelper.port.outbound.CheckpointPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Checkpoint store for conversation threads.
 *
 * <p>
 * Enforces the single-writer-per-thread discipline: a turn must hold the
 * thread's {@link ThreadLease} to save it, and a second turn on the same thread
 * fails with {@link ThreadBusyException}. Different threads never contend.
 * Loads always return an independent copy, because backends keep serialized
 * snapshots.
 */
@Service
@Slf4j
public class CheckpointService {

    private final CheckpointPort checkpointPort;
    private final Clock clock;
    private final Map<String, String> leases = new ConcurrentHashMap<>();

    public CheckpointService(CheckpointPort checkpointPort, Clock clock) {
        this.checkpointPort = checkpointPort;
        this.clock = clock;
        log.info("[Checkpoint] Using '{}' backend", checkpointPort.getBackendId());
    }

    public String newThreadId() {
        return UUID.randomUUID().toString();
    }

    public Optional<ConversationThread> find(String threadId) {
        try {
            return checkpointPort.read(threadId);
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CheckpointException("Failed to load thread " + threadId, e);
        }
    }

    /**
     * Loads a thread.
     *
     * @throws ThreadNotFoundException
     *             if no checkpoint exists for the id
     */
    public ConversationThread load(String threadId) {
        return find(threadId).orElseThrow(() -> new ThreadNotFoundException(threadId));
    }

    public boolean exists(String threadId) {
        return find(threadId).isPresent();
    }

    /**
     * Takes the single-writer lease for a thread.
     *
     * @throws ThreadBusyException
     *             if another turn holds the lease
     */
    public ThreadLease acquire(String threadId) {
        String token = UUID.randomUUID().toString();
        String existing = leases.putIfAbsent(threadId, token);
        if (existing != null) {
            log.warn("[Checkpoint] Thread {} is busy", threadId);
            throw new ThreadBusyException(threadId);
        }
        log.debug("[Checkpoint] Lease acquired: {}", threadId);
        return new ThreadLease(threadId, token, this);
    }

    public boolean isBusy(String threadId) {
        return leases.containsKey(threadId);
    }

    void release(ThreadLease lease) {
        if (leases.remove(lease.getThreadId(), lease.getToken())) {
            log.debug("[Checkpoint] Lease released: {}", lease.getThreadId());
        }
    }

    /**
     * Persists the complete thread. Bumps {@code version} and sets
     * {@code updatedAt} on success.
     *
     * @throws ThreadBusyException
     *             if the lease does not own the thread
     * @throws CheckpointException
     *             if the backend fails; the stored state is left untouched
     */
    public void save(ThreadLease lease, ConversationThread thread) {
        String threadId = thread.getThreadId();
        if (lease == null || lease.isReleased() || !lease.getThreadId().equals(threadId)
                || !lease.getToken().equals(leases.get(threadId))) {
            throw new ThreadBusyException(threadId);
        }

        long previousVersion = thread.getVersion();
        Instant previousUpdatedAt = thread.getUpdatedAt();
        Instant now = clock.instant();
        if (thread.getCreatedAt() == null) {
            thread.setCreatedAt(now);
        }
        thread.setUpdatedAt(now);
        thread.setVersion(previousVersion + 1);
        try {
            checkpointPort.write(thread);
            log.debug("[Checkpoint] Saved {} v{} in phase {}", threadId, thread.getVersion(), thread.getPhase());
        } catch (RuntimeException e) {
            thread.setVersion(previousVersion);
            thread.setUpdatedAt(previousUpdatedAt);
            log.error("[Checkpoint] Failed to save thread {}", threadId, e);
            throw new CheckpointException("Failed to save thread " + threadId, e);
        }
    }

    /**
     * Explicit cleanup. The core itself never deletes threads.
     *
     * @throws ThreadBusyException
     *             if a turn is running on the thread
     * @throws ThreadNotFoundException
     *             if there is nothing to delete
     */
    public void delete(String threadId) {
        try (ThreadLease ignored = acquire(threadId)) {
            boolean deleted;
            try {
                deleted = checkpointPort.delete(threadId);
            } catch (RuntimeException e) {
                throw new CheckpointException("Failed to delete thread " + threadId, e);
            }
            if (!deleted) {
                throw new ThreadNotFoundException(threadId);
            }
            log.info("[Checkpoint] Deleted thread {}", threadId);
        }
    }

    public List<String> listThreadIds() {
        try {
            return checkpointPort.listThreadIds();
        } catch (RuntimeException e) {
            throw new CheckpointException("Failed to list threads", e);
        }
    }
}
