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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.calhelper.domain.model.ConversationThread;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.util.regex.Pattern;

/**
 * JSON form of a checkpointed thread, shared by the checkpoint backends.
 */
@Component
public class ThreadJsonCodec {

    private static final Pattern SAFE_THREAD_ID = Pattern.compile("[A-Za-z0-9._:-]{1,128}");

    private final ObjectMapper objectMapper;

    public ThreadJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(ConversationThread thread) {
        try {
            return objectMapper.writeValueAsString(thread);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize thread " + thread.getThreadId(), e);
        }
    }

    public ConversationThread decode(String json) {
        try {
            return objectMapper.readValue(json, ConversationThread.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to parse thread checkpoint", e);
        }
    }

    /**
     * Thread ids become file names, so only a conservative character set is
     * accepted.
     */
    public static String requireSafeId(String threadId) {
        if (threadId == null || !SAFE_THREAD_ID.matcher(threadId).matches() || threadId.contains("..")) {
            throw new IllegalArgumentException("Invalid thread id: " + threadId);
        }
        return threadId;
    }
}
