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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.calhelper.domain.service.CapabilityRegistry;
import me.golemcore.calhelper.infrastructure.console.ConsoleIO;
import me.golemcore.calhelper.port.inbound.ChannelPort;
import me.golemcore.calhelper.port.outbound.CheckpointPort;
import me.golemcore.calhelper.port.outbound.LlmPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;

/**
 * Shared beans (clock, JSON mapper, console) and startup of the configured
 * front end.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class CoreConfiguration {

    private final CalHelperProperties properties;
    private final List<ChannelPort> channelPorts;
    private final LlmPort llmPort;
    private final CheckpointPort checkpointPort;
    private final CapabilityRegistry capabilityRegistry;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    @ConditionalOnProperty(name = "calhelper.frontend", havingValue = "console")
    public static ConsoleIO consoleIO() {
        return new ConsoleIO(
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                System.out);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        log.info("Calendar assistant starting (frontend: {})", properties.getFrontend());
        log.info("LLM: {} / {} (available: {})", llmPort.getProviderId(), llmPort.getCurrentModel(),
                llmPort.isAvailable());
        log.info("Checkpoint backend: {}", checkpointPort.getBackendId());
        log.info("Capabilities: {}", capabilityRegistry.definitions().size());

        for (ChannelPort channel : channelPorts) {
            if (properties.getFrontend().equals(channel.getChannelType())) {
                log.info("Starting channel: {}", channel.getChannelType());
                channel.start();
            }
        }
    }
}
