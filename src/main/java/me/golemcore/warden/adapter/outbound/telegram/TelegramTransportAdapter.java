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

package me.golemcore.warden.adapter.outbound.telegram;

import me.golemcore.warden.domain.exception.ChatTransportException;
import me.golemcore.warden.domain.model.ButtonLink;
import me.golemcore.warden.domain.model.OutboundPost;
import me.golemcore.warden.infrastructure.config.BotProperties;
import me.golemcore.warden.port.outbound.ChatTransportPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.methods.groupadministration.GetChatMember;
import org.telegram.telegrambots.meta.api.methods.pinnedmessages.PinChatMessage;
import org.telegram.telegrambots.meta.api.methods.send.SendAnimation;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.send.SendPhoto;
import org.telegram.telegrambots.meta.api.methods.send.SendVideo;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.DeleteMessage;
import org.telegram.telegrambots.meta.api.objects.InputFile;
import org.telegram.telegrambots.meta.api.objects.chatmember.ChatMember;
import org.telegram.telegrambots.meta.api.objects.message.Message;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardRow;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * {@link ChatTransportPort} over the Telegram Bot API.
 *
 * <p>
 * Posts are sent with the configured parse mode
 * ({@code bot.broadcast.parse-mode}); text and captions are passed through as
 * the admin typed them. Each URL button occupies its own keyboard row.
 */
@Component
@Slf4j
@SuppressWarnings("PMD.LooseCoupling") // InlineKeyboardRow is required by Telegram API, no interface available
public class TelegramTransportAdapter implements ChatTransportPort {

    private static final Set<String> ADMIN_STATUSES = Set.of("creator", "administrator");

    private final TelegramClient telegramClient;
    private final String parseMode;

    public TelegramTransportAdapter(TelegramClient telegramClient, BotProperties properties) {
        this.telegramClient = telegramClient;
        String configured = properties.getBroadcast().getParseMode();
        this.parseMode = configured == null || configured.isBlank() ? null : configured;
    }

    @Override
    public int sendPost(String chatId, OutboundPost post) throws ChatTransportException {
        InlineKeyboardMarkup keyboard = buildKeyboard(post.buttons());
        try {
            Message sent;
            if (post.hasMedia()) {
                InputFile file = new InputFile(post.media());
                sent = switch (post.mediaType()) {
                case PHOTO -> telegramClient.execute(SendPhoto.builder()
                        .chatId(chatId)
                        .photo(file)
                        .caption(post.text())
                        .parseMode(parseMode)
                        .replyMarkup(keyboard)
                        .build());
                case VIDEO -> telegramClient.execute(SendVideo.builder()
                        .chatId(chatId)
                        .video(file)
                        .caption(post.text())
                        .parseMode(parseMode)
                        .replyMarkup(keyboard)
                        .build());
                case ANIMATION -> telegramClient.execute(SendAnimation.builder()
                        .chatId(chatId)
                        .animation(file)
                        .caption(post.text())
                        .parseMode(parseMode)
                        .replyMarkup(keyboard)
                        .build());
                };
            } else {
                sent = telegramClient.execute(SendMessage.builder()
                        .chatId(chatId)
                        .text(post.text())
                        .parseMode(parseMode)
                        .replyMarkup(keyboard)
                        .build());
            }
            return sent.getMessageId();
        } catch (TelegramApiException e) {
            throw new ChatTransportException("Failed to send post to chat " + chatId, e);
        }
    }

    @Override
    public int sendText(String chatId, String text) throws ChatTransportException {
        try {
            Message sent = telegramClient.execute(SendMessage.builder()
                    .chatId(chatId)
                    .text(text)
                    .build());
            return sent.getMessageId();
        } catch (TelegramApiException e) {
            throw new ChatTransportException("Failed to send message to chat " + chatId, e);
        }
    }

    @Override
    public void replyText(String chatId, int replyToMessageId, String text) throws ChatTransportException {
        try {
            telegramClient.execute(SendMessage.builder()
                    .chatId(chatId)
                    .text(text)
                    .parseMode(parseMode)
                    .replyToMessageId(replyToMessageId)
                    .build());
        } catch (TelegramApiRequestException formatted) {
            // Fallback: retry without formatting if markup parsing fails
            log.debug("Reply markup rejected in chat {}, retrying as plain text: {}", chatId,
                    formatted.getMessage());
            try {
                telegramClient.execute(SendMessage.builder()
                        .chatId(chatId)
                        .text(text)
                        .replyToMessageId(replyToMessageId)
                        .build());
            } catch (TelegramApiException e) {
                throw new ChatTransportException("Failed to reply in chat " + chatId, e);
            }
        } catch (TelegramApiException e) {
            throw new ChatTransportException("Failed to reply in chat " + chatId, e);
        }
    }

    @Override
    public void deleteMessage(String chatId, int messageId) throws ChatTransportException {
        try {
            telegramClient.execute(DeleteMessage.builder()
                    .chatId(chatId)
                    .messageId(messageId)
                    .build());
        } catch (TelegramApiException e) {
            throw new ChatTransportException("Failed to delete message " + messageId + " in chat " + chatId, e);
        }
    }

    @Override
    public void pinMessage(String chatId, int messageId) throws ChatTransportException {
        try {
            telegramClient.execute(PinChatMessage.builder()
                    .chatId(chatId)
                    .messageId(messageId)
                    .disableNotification(true)
                    .build());
        } catch (TelegramApiException e) {
            throw new ChatTransportException("Failed to pin message " + messageId + " in chat " + chatId, e);
        }
    }

    @Override
    public boolean isChatAdmin(String chatId, long userId) throws ChatTransportException {
        try {
            ChatMember member = telegramClient.execute(GetChatMember.builder()
                    .chatId(chatId)
                    .userId(userId)
                    .build());
            return member != null && ADMIN_STATUSES.contains(member.getStatus());
        } catch (TelegramApiException e) {
            throw new ChatTransportException("Failed to resolve member " + userId + " of chat " + chatId, e);
        }
    }

    static InlineKeyboardMarkup buildKeyboard(List<ButtonLink> buttons) {
        if (buttons == null || buttons.isEmpty()) {
            return null;
        }
        List<InlineKeyboardRow> rows = new ArrayList<>();
        for (ButtonLink link : buttons) {
            rows.add(new InlineKeyboardRow(InlineKeyboardButton.builder()
                    .text(link.getLabel())
                    .url(link.getUrl())
                    .build()));
        }
        return InlineKeyboardMarkup.builder().keyboard(rows).build();
    }
}
