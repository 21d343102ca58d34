package me.golemcore.calhelper.domain.exception;

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

import java.util.List;

/**
 * Thrown when invocation arguments do not match the capability input schema.
 * Carries every violation found, not only the first one.
 */
public class InvalidArgumentsException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String capabilityName;
    private final List<String> violations;

    public InvalidArgumentsException(String capabilityName, List<String> violations) {
        super("Invalid arguments for " + capabilityName + ": " + String.join("; ", violations));
        this.capabilityName = capabilityName;
        this.violations = List.copyOf(violations);
    }

    public String getCapabilityName() {
        return capabilityName;
    }

    public List<String> getViolations() {
        return violations;
    }
}
