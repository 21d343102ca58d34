package me.golemcore.calhelper.infrastructure.config;

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

import lombok.Data;
import me.golemcore.calhelper.domain.model.ApprovalPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code calhelper.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - language-model provider settings</li>
 * <li>{@link CalendarProperties} - cal.com API access</li>
 * <li>{@link StorageProperties} - local workspace</li>
 * <li>{@link CheckpointProperties} - thread checkpoint backend</li>
 * <li>{@link TurnProperties} - turn budgets and capability execution</li>
 * <li>{@link ApprovalProperties} - per-capability approval policy</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "calhelper")
@Data
public class CalHelperProperties {

    private LlmProperties llm = new LlmProperties();
    private CalendarProperties calendar = new CalendarProperties();
    private HttpProperties http = new HttpProperties();
    private StorageProperties storage = new StorageProperties();
    private CheckpointProperties checkpoint = new CheckpointProperties();
    private TurnProperties turn = new TurnProperties();
    private ApprovalProperties approval = new ApprovalProperties();
    private PromptProperties prompt = new PromptProperties();

    /**
     * Active front end: "web" or "console".
     */
    private String frontend = "web";

    @Data
    public static class LlmProperties {
        private String provider = "openai";
        private String apiKey;
        private String baseUrl;
        private String model = "gpt-4o";
        private double temperature = 0.0;
        private Integer maxTokens;
        private Duration requestTimeout = Duration.ofSeconds(120);
    }

    @Data
    public static class CalendarProperties {
        private String baseUrl = "https://api.cal.com/v2";
        private String apiKey;
        private String apiVersion = "2024-08-13";
        private String slotsApiVersion = "2024-09-04";
        private int bookingsPageSize = 100;
        private String defaultLocation = "cal-video";
        private String defaultLanguage = "en";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.calhelper/workspace";
    }

    @Data
    public static class CheckpointProperties {
        /** Checkpoint backend: "file" or "memory". */
        private String backend = "file";
        private String directory = "threads";
        /** Keep the previous checkpoint as .bak on every save. */
        private boolean backup = true;
    }

    @Data
    public static class TurnProperties {
        /** Max number of dispatch rounds within a single user turn. */
        private int maxRoundTrips = 10;

        /** Max wall-clock time for one capability execution. */
        private Duration capabilityTimeout = Duration.ofSeconds(30);

        /** Capability output longer than this is truncated before the model sees it. */
        private int maxResultChars = 100000;
    }

    @Data
    public static class ApprovalProperties {
        private ApprovalPolicy defaultPolicy = ApprovalPolicy.AUTO;
        private Map<String, ApprovalPolicy> policies = new LinkedHashMap<>();

        /** How long a confirmation may stay unanswered before it counts as rejected. */
        private Duration timeout = Duration.ofMinutes(5);
    }

    @Data
    public static class PromptProperties {
        private String systemPrompt;

        /** Prefix user messages with the local date-time so relative dates resolve. */
        private boolean timestampUserMessages = true;

        /** Time zone used for the prompt and the timestamp prefix; system default when blank. */
        private String timeZone;
    }
}
