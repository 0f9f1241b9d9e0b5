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

package me.golemcore.warden.port.outbound;

import me.golemcore.warden.domain.exception.ChatTransportException;
import me.golemcore.warden.domain.model.OutboundPost;

/**
 * Outbound operations against the chat platform. Every call is bounded by the
 * HTTP client timeouts and may fail with {@link ChatTransportException}.
 */
public interface ChatTransportPort {

    /**
     * Sends a composed post (text, or media with caption, plus URL buttons).
     *
     * @return id of the sent message
     */
    int sendPost(String chatId, OutboundPost post) throws ChatTransportException;

    /**
     * Sends plain text.
     *
     * @return id of the sent message
     */
    int sendText(String chatId, String text) throws ChatTransportException;

    /**
     * Replies to a message. Formatting markup is tried first, plain text is the
     * fallback when the platform rejects it.
     */
    void replyText(String chatId, int replyToMessageId, String text) throws ChatTransportException;

    void deleteMessage(String chatId, int messageId) throws ChatTransportException;

    void pinMessage(String chatId, int messageId) throws ChatTransportException;

    /**
     * Whether the user is the creator or an administrator of the chat.
     */
    boolean isChatAdmin(String chatId, long userId) throws ChatTransportException;
}
