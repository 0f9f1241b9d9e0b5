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

package me.golemcore.warden.port.inbound;

/**
 * Inbound channel lifecycle (Telegram long polling, etc.).
 */
public interface ChannelPort {

    /**
     * Returns the channel type identifier (e.g., "telegram").
     */
    String getChannelType();

    /**
     * Starts receiving updates from the channel.
     */
    void start();

    /**
     * Stops receiving updates and disconnects from the channel.
     */
    void stop();

    /**
     * Checks if the channel is currently active and receiving.
     */
    boolean isRunning();
}
