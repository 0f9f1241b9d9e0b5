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

package me.golemcore.warden.domain.service;

import me.golemcore.warden.domain.exception.AdminRequiredException;
import me.golemcore.warden.domain.exception.ChatTransportException;
import me.golemcore.warden.port.outbound.ChatTransportPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Answers whether a user administers a group. Nothing is cached: status is
 * read from the platform on every check.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AdminGuard {

    private final ChatTransportPort transport;

    /**
     * @return true for the group's creator or administrators, false otherwise
     *         and when the platform cannot be queried
     */
    public boolean isAdmin(String chatId, long userId) {
        try {
            return transport.isChatAdmin(chatId, userId);
        } catch (ChatTransportException e) {
            log.warn("[Admin] Could not resolve status of user {} in chat {}: {}", userId, chatId, e.getMessage());
            return false;
        }
    }

    /**
     * @throws AdminRequiredException
     *             if the user is not an administrator of the group
     */
    public void requireAdmin(String chatId, long userId) {
        if (!isAdmin(chatId, userId)) {
            throw new AdminRequiredException(chatId, userId);
        }
    }
}
