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

import java.util.Objects;

/**
 * Single-writer lease on one thread, obtained from
 * {@link CheckpointService#acquire(String)}. Closing the lease releases it;
 * closing twice is harmless.
 */
public final class ThreadLease implements AutoCloseable {

    private final String threadId;
    private final String token;
    private final CheckpointService owner;
    private volatile boolean released;

    ThreadLease(String threadId, String token, CheckpointService owner) {
        this.threadId = Objects.requireNonNull(threadId, "threadId");
        this.token = Objects.requireNonNull(token, "token");
        this.owner = owner;
    }

    public String getThreadId() {
        return threadId;
    }

    String getToken() {
        return token;
    }

    public boolean isReleased() {
        return released;
    }

    @Override
    public void close() {
        if (!released) {
            released = true;
            owner.release(this);
        }
    }
}
