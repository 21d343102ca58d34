package me.golemcore.calhelper;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Calendar assistant: a language model that reads and changes a cal.com
 * calendar through capabilities, asking the user before it books or cancels.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters) around a resumable turn state
 * machine:
 *
 * <pre>
 * Input Layer        → REST API (/api/threads), console
 * Domain Layer       → TurnController, CapabilityRegistry, ApprovalGate, CheckpointService
 * Infrastructure     → LLM (langchain4j), cal.com (Feign), checkpoint and confirmation adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code calhelper.*} prefix. Run with the {@code console} profile for the
 * terminal front end.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CalHelperApplication {

    public static void main(String[] args) {
        SpringApplication.run(CalHelperApplication.class, args);
    }

}
