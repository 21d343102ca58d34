package me.golemcore.calhelper.port.inbound;

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
 * Port for human-facing front ends (console, web). Implementations manage their
 * own lifecycle and feed user input into the turn controller.
 */
public interface ChannelPort {

    /**
     * Returns the channel type identifier (e.g., "console", "web").
     */
    String getChannelType();

    /**
     * Starts listening for user input.
     */
    void start();

    /**
     * Stops listening for user input.
     */
    void stop();

    /**
     * Checks if the channel is currently active and listening.
     */
    boolean isRunning();
}
