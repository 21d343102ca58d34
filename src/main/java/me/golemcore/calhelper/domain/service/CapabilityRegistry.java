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

import com.networknt.schema.JsonSchema;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.calhelper.domain.component.CapabilityComponent;
import me.golemcore.calhelper.domain.exception.DuplicateCapabilityException;
import me.golemcore.calhelper.domain.exception.InvalidArgumentsException;
import me.golemcore.calhelper.domain.exception.UnknownCapabilityException;
import me.golemcore.calhelper.domain.model.CapabilityDefinition;
import me.golemcore.calhelper.domain.model.CapabilityDescriptor;
import me.golemcore.calhelper.domain.model.CapabilityResult;
import me.golemcore.calhelper.domain.model.FailureKind;
import me.golemcore.calhelper.infrastructure.config.CalHelperProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Registry of the capabilities advertised to the model, plus argument-validated
 * execution.
 *
 * <p>
 * All capability components found in the application context are registered
 * at construction, after which the registry is sealed: the advertised surface
 * never changes mid-conversation. Reads are safe without synchronization.
 *
 * <p>
 * {@link #execute} never throws for invocation-level failures. Unknown
 * capabilities, invalid arguments, executor exceptions and timeouts are folded
 * into a failed {@link CapabilityResult} with the matching {@link FailureKind}
 * so the model can self-correct. No automatic retry is attempted.
 */
@Service
@Slf4j
public class CapabilityRegistry {

    private final Map<String, CapabilityDescriptor> descriptors = new LinkedHashMap<>();
    private final Map<String, JsonSchema> argumentSchemas = new HashMap<>();
    private final CapabilityArgumentValidator validator;
    private final CalHelperProperties properties;
    private volatile boolean sealed;

    public CapabilityRegistry(List<CapabilityComponent> components, CapabilityArgumentValidator validator,
            CalHelperProperties properties) {
        this.validator = validator;
        this.properties = properties;
        if (components != null) {
            for (CapabilityComponent component : components) {
                register(CapabilityDescriptor.of(component));
            }
        }
        seal();
    }

    /**
     * Registers a capability.
     *
     * @throws DuplicateCapabilityException
     *             if the name is already registered
     * @throws IllegalStateException
     *             if the registry has been sealed
     */
    public synchronized void register(CapabilityDescriptor descriptor) {
        if (sealed) {
            throw new IllegalStateException("Capability registry is sealed, cannot register " + descriptor.name());
        }
        if (descriptors.containsKey(descriptor.name())) {
            throw new DuplicateCapabilityException(descriptor.name());
        }
        argumentSchemas.put(descriptor.name(), validator.compile(descriptor.inputSchema()));
        descriptors.put(descriptor.name(), descriptor);
        log.debug("[Capability] Registered '{}'", descriptor.name());
    }

    /**
     * Seals the registry. Further registration fails.
     */
    public synchronized void seal() {
        if (!sealed) {
            sealed = true;
            log.info("[Capability] Registry sealed with {} capabilities: {}", descriptors.size(),
                    descriptors.keySet());
        }
    }

    public boolean isSealed() {
        return sealed;
    }

    /**
     * Looks up a capability by name.
     *
     * @throws UnknownCapabilityException
     *             if no capability with that name is registered
     */
    public CapabilityDescriptor lookup(String name) {
        CapabilityDescriptor descriptor = descriptors.get(name);
        if (descriptor == null) {
            throw new UnknownCapabilityException(name);
        }
        return descriptor;
    }

    public boolean contains(String name) {
        return descriptors.containsKey(name);
    }

    public List<CapabilityDescriptor> descriptors() {
        return Collections.unmodifiableList(new ArrayList<>(descriptors.values()));
    }

    /**
     * Definitions advertised to the model, in registration order. Disabled
     * capabilities stay advertised so the surface never depends on runtime
     * availability; invoking one fails with an execution error.
     */
    public List<CapabilityDefinition> definitions() {
        return descriptors.values().stream()
                .map(CapabilityDescriptor::definition)
                .toList();
    }

    /**
     * Validates and executes a capability.
     *
     * @param name
     *            capability name as requested by the model
     * @param arguments
     *            decoded arguments
     * @return the execution result, failed with a {@link FailureKind} on any
     *         invocation-level error
     */
    public CapabilityResult execute(String name, Map<String, Object> arguments) {
        String capabilityName = sanitizeCapabilityName(name);
        CapabilityDescriptor descriptor;
        try {
            descriptor = lookup(capabilityName);
        } catch (UnknownCapabilityException e) {
            log.warn("[Capability] Unknown capability requested: {}", name);
            return CapabilityResult.failure(FailureKind.UNKNOWN_CAPABILITY,
                    "Unknown capability: " + name + ". Available capabilities: "
                            + String.join(", ", descriptors.keySet()));
        }

        Map<String, Object> args = arguments != null ? arguments : Map.of();
        try {
            validator.requireValid(capabilityName, argumentSchemas.get(capabilityName), args);
        } catch (InvalidArgumentsException e) {
            log.warn("[Capability] Invalid arguments for '{}': {}", capabilityName, e.getViolations());
            return CapabilityResult.failure(FailureKind.INVALID_ARGUMENTS,
                    "Invalid arguments: " + String.join("; ", e.getViolations()));
        }

        CapabilityComponent executor = descriptor.executor();
        if (!executor.isEnabled()) {
            return CapabilityResult.failure(FailureKind.EXECUTION_FAILED,
                    "Capability is not available: " + capabilityName);
        }

        log.debug("[Capability] Executing '{}' with {}", capabilityName, args);
        CapabilityResult result = runExecutor(capabilityName, executor, args);
        return truncate(result, capabilityName);
    }

    private CapabilityResult runExecutor(String capabilityName, CapabilityComponent executor,
            Map<String, Object> args) {
        long timeoutMillis = properties.getTurn().getCapabilityTimeout().toMillis();
        try {
            CompletableFuture<CapabilityResult> future = executor.execute(args);
            CapabilityResult result = awaitUninterruptibly(future, timeoutMillis);
            if (result == null) {
                return CapabilityResult.failure(FailureKind.EXECUTION_FAILED, "Capability returned no result");
            }
            if (!result.isSuccess() && result.getFailureKind() == null) {
                result.setFailureKind(FailureKind.EXECUTION_FAILED);
            }
            return result;
        } catch (TimeoutException e) {
            log.error("[Capability] '{}' timed out after {} ms", capabilityName, timeoutMillis);
            return CapabilityResult.failure(FailureKind.EXECUTION_FAILED,
                    "Capability timed out after " + timeoutMillis + " ms");
        } catch (ExecutionException | RuntimeException e) {
            log.error("[Capability] '{}' execution failed", capabilityName, e);
            return CapabilityResult.failure(FailureKind.EXECUTION_FAILED,
                    "Capability execution failed: " + safeCauseMessage(e));
        }
    }

    /**
     * Executions already in flight are not abandoned on cancellation: the wait
     * continues and the interrupt flag is restored afterwards, so the caller
     * records the real outcome and stops at its next boundary.
     */
    private static <T> T awaitUninterruptibly(CompletableFuture<T> future, long timeoutMillis)
            throws ExecutionException, TimeoutException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    return future.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static String safeCauseMessage(Throwable error) {
        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null && !cause.equals(cursor)) {
            cursor = cause;
            cause = cursor.getCause();
        }
        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }

    /**
     * Strip special tokens and garbage from capability names. Some models leak
     * special tokens like {@code <|channel|>} into tool call names.
     */
    String sanitizeCapabilityName(String name) {
        if (name == null) {
            return "";
        }
        String sanitized = name.replaceAll("[^a-zA-Z0-9_-].*", "");
        if (!sanitized.equals(name)) {
            log.warn("[Capability] Sanitized capability name: '{}' -> '{}'", name, sanitized);
        }
        return sanitized;
    }

    private CapabilityResult truncate(CapabilityResult result, String capabilityName) {
        int maxChars = properties.getTurn().getMaxResultChars();
        String output = result.getOutput();
        if (maxChars <= 0 || output == null || output.length() <= maxChars) {
            return result;
        }
        String suffix = "\n\n[OUTPUT TRUNCATED: " + output.length() + " chars total, showing first "
                + maxChars + " chars. Narrow the date range or filter the query.]";
        int cutPoint = Math.max(0, maxChars - suffix.length());
        log.warn("[Capability] Truncating '{}' result: {} chars -> ~{} chars",
                capabilityName, output.length(), cutPoint + suffix.length());
        result.setOutput(output.substring(0, cutPoint) + suffix);
        return result;
    }
}
