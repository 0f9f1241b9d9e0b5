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

package me.golemcore.warden.adapter.inbound.telegram;

import me.golemcore.warden.domain.model.GroupMessage;
import me.golemcore.warden.domain.model.MediaType;
import me.golemcore.warden.domain.model.WizardResult;
import me.golemcore.warden.domain.service.ModerationEngine;
import me.golemcore.warden.domain.service.WizardEngine;
import me.golemcore.warden.infrastructure.config.BotProperties;
import me.golemcore.warden.infrastructure.i18n.MessageService;
import me.golemcore.warden.port.inbound.ChannelPort;
import me.golemcore.warden.port.inbound.CommandPort;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.longpolling.util.LongPollingSingleThreadUpdateConsumer;
import org.telegram.telegrambots.meta.api.methods.AnswerCallbackQuery;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.PhotoSize;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.message.Message;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Telegram channel adapter using long polling.
 *
 * <p>
 * This adapter implements both {@link ChannelPort} for the polling lifecycle
 * and {@link LongPollingSingleThreadUpdateConsumer} for inbound updates.
 *
 * <p>
 * Routing:
 * <ul>
 * <li>Callback queries go to {@link TelegramMenuHandler}
 * <li>Private chat: /start and /menu open the control panel, /cancel stops the
 * wizard, other slash commands go to the CommandPort, anything else feeds the
 * wizard
 * <li>Groups: slash commands go to the CommandPort, every other message with
 * text or a caption goes to the {@link ModerationEngine}
 * </ul>
 *
 * <p>
 * Each update is handled in isolation: a failure is logged and polling goes on.
 *
 * @see me.golemcore.warden.port.inbound.ChannelPort
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TelegramAdapter implements ChannelPort, LongPollingSingleThreadUpdateConsumer {

    private static final String CHANNEL_TYPE = "telegram";

    private final BotProperties properties;
    private final TelegramBotsLongPollingApplication botsApplication;
    private final TelegramClient telegramClient;
    private final MessageService messageService;
    private final ObjectProvider<CommandPort> commandRouter;
    private final TelegramMenuHandler menuHandler;
    private final WizardEngine wizardEngine;
    private final ModerationEngine moderationEngine;

    private volatile boolean running = false;
    private final Object lifecycleLock = new Object();

    @Override
    public String getChannelType() {
        return CHANNEL_TYPE;
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                log.debug("Telegram adapter already running");
                return;
            }
            if (!properties.getTelegram().isEnabled()) {
                log.info("Telegram channel disabled");
                return;
            }
            try {
                botsApplication.registerBot(properties.getTelegram().getToken(), this);
                running = true;
                log.info("Telegram adapter started");
            } catch (TelegramApiException e) {
                log.error("Failed to start Telegram adapter", e);
            }
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            running = false;
            try {
                botsApplication.close();
                log.info("Telegram adapter stopped");
            } catch (Exception e) {
                log.error("Error stopping Telegram adapter", e);
            }
        }
    }

    @PreDestroy
    public void destroy() {
        stop();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public void consume(Update update) {
        try {
            if (update.hasCallbackQuery()) {
                handleCallback(update.getCallbackQuery());
            } else if (update.hasMessage()) {
                handleMessage(update.getMessage());
            }
        } catch (Exception e) {
            log.error("Failed to process update {}", update.getUpdateId(), e);
        }
    }

    private void handleCallback(CallbackQuery callback) {
        answerCallback(callback.getId());
        if (callback.getMessage() == null) {
            log.warn("Callback query without associated message, ignoring");
            return;
        }
        String chatId = callback.getMessage().getChatId().toString();
        Integer messageId = callback.getMessage().getMessageId();
        long userId = callback.getFrom().getId();
        String data = callback.getData();

        log.debug("Callback: {}", data);

        if (data == null || !menuHandler.handleCallback(chatId, messageId, userId, data)) {
            log.debug("Unhandled callback data: {}", data);
        }
    }

    private void handleMessage(Message telegramMessage) {
        if (telegramMessage.getFrom() == null) {
            return;
        }
        String chatId = telegramMessage.getChatId().toString();
        long userId = telegramMessage.getFrom().getId();
        boolean privateChat = telegramMessage.getChat() != null && telegramMessage.getChat().isUserChat();
        String text = telegramMessage.hasText() ? telegramMessage.getText() : null;

        if (text != null && text.startsWith("/")) {
            handleCommand(chatId, userId, privateChat, text);
            return;
        }

        if (privateChat) {
            handlePrivateInput(chatId, userId, telegramMessage, text);
            return;
        }

        String body = text != null ? text : telegramMessage.getCaption();
        if (body == null || body.isEmpty()) {
            return;
        }
        moderationEngine.moderate(new GroupMessage(chatId, telegramMessage.getMessageId(), userId, body));
    }

    private void handleCommand(String chatId, long userId, boolean privateChat, String text) {
        String[] parts = text.trim().split("\\s+", 2);
        String cmd = parts[0].substring(1).split("@")[0]; // strip / and @botname

        if (privateChat && ("start".equals(cmd) || "menu".equals(cmd))) {
            menuHandler.sendMainMenu(chatId);
            return;
        }
        if (privateChat && "cancel".equals(cmd)) {
            menuHandler.cancelWizard(chatId, userId);
            return;
        }

        CommandPort router = commandRouter.getIfAvailable();
        if (router == null || !router.hasCommand(cmd)) {
            if (privateChat) {
                sendMessage(chatId, messageService.getMessage("command.unknown", cmd));
            }
            return;
        }

        List<String> args = parts.length > 1
                ? Arrays.asList(parts[1].trim().split("\\s+"))
                : List.of();
        Map<String, Object> ctx = Map.<String, Object>of(
                "chatId", chatId,
                "userId", userId,
                "privateChat", privateChat);
        try {
            var result = router.execute(cmd, args, ctx).join();
            sendMessage(chatId, result.output());
        } catch (Exception e) {
            log.error("Command execution failed: /{}", cmd, e);
            sendMessage(chatId, messageService.getMessage("command.failed"));
        }
    }

    private void handlePrivateInput(String chatId, long userId, Message telegramMessage, String text) {
        WizardResult result;
        if (telegramMessage.hasAnimation()) {
            result = wizardEngine.onMedia(userId, telegramMessage.getAnimation().getFileId(), MediaType.ANIMATION);
        } else if (telegramMessage.hasPhoto()) {
            List<PhotoSize> sizes = telegramMessage.getPhoto();
            String fileId = sizes.get(sizes.size() - 1).getFileId();
            result = wizardEngine.onMedia(userId, fileId, MediaType.PHOTO);
        } else if (telegramMessage.hasVideo()) {
            result = wizardEngine.onMedia(userId, telegramMessage.getVideo().getFileId(), MediaType.VIDEO);
        } else if (text != null) {
            result = wizardEngine.onText(userId, text);
        } else {
            return;
        }
        menuHandler.renderWizardResult(chatId, result);
    }

    private void answerCallback(String callbackId) {
        try {
            telegramClient.execute(AnswerCallbackQuery.builder()
                    .callbackQueryId(callbackId)
                    .build());
        } catch (TelegramApiException e) {
            log.debug("Failed to answer callback {}: {}", callbackId, e.getMessage());
        }
    }

    private void sendMessage(String chatId, String text) {
        try {
            telegramClient.execute(SendMessage.builder()
                    .chatId(chatId)
                    .text(text)
                    .build());
        } catch (TelegramApiException e) {
            log.error("Failed to send message to chat {}", chatId, e);
        }
    }
}
