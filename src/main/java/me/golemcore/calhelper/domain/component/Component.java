package me.golemcore.calhelper.domain.component;

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

/**
 * Base interface for pluggable components. Each component type extends this
 * interface with its specialized contract while sharing one lifecycle.
 */
public interface Component {

    /**
     * Returns the type identifier for this component.
     *
     * @return the component type (e.g., "capability")
     */
    String getComponentType();

    /**
     * Checks whether this component is currently available for use. Components
     * with unmet requirements (missing credentials, disabled via configuration)
     * return false.
     *
     * @return true if the component is enabled, false otherwise
     */
    default boolean isEnabled() {
        return true;
    }
}
