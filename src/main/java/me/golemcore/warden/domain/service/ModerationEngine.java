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

import me.golemcore.warden.domain.exception.ChatTransportException;
import me.golemcore.warden.domain.model.DeleteReason;
import me.golemcore.warden.domain.model.GroupMessage;
import me.golemcore.warden.domain.model.ModerationDecision;
import me.golemcore.warden.domain.model.TenantPolicy;
import me.golemcore.warden.infrastructure.config.BotProperties;
import me.golemcore.warden.infrastructure.i18n.MessageService;
import me.golemcore.warden.port.outbound.ChatTransportPort;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Group message filter: auto replies for everyone, then removal of links,
 * mentions and banned words posted by non-administrators.
 *
 * <p>
 * Classification is pure ({@link #classify}); {@link #moderate} resolves the
 * sender's status and performs the side effects. A removal is followed by a
 * short-lived warning in the group, deleted after
 * {@code bot.moderation.warning-ttl-seconds} on a background thread so the
 * update loop never waits for it.
 */
@Service
@Slf4j
public class ModerationEngine {

    private static final Pattern URL_PATTERN = Pattern.compile("https?://\\S+", Pattern.CASE_INSENSITIVE);
    private static final Pattern TELEGRAM_LINK_PATTERN = Pattern.compile("t\\.me/|telegram\\.me/|telegram\\.dog/",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern MENTION_PATTERN = Pattern.compile("@\\w+", Pattern.UNICODE_CHARACTER_CLASS);

    private final ConfigStore configStore;
    private final AdminGuard adminGuard;
    private final ChatTransportPort transport;
    private final MessageService messageService;
    private final ScheduledExecutorService warningCleaner;
    private final long warningTtlSeconds;

    @Autowired
    public ModerationEngine(ConfigStore configStore, AdminGuard adminGuard, ChatTransportPort transport,
            MessageService messageService, BotProperties properties) {
        this(configStore, adminGuard, transport, messageService, properties,
                Executors.newSingleThreadScheduledExecutor(runnable -> {
                    Thread thread = new Thread(runnable, "moderation-warnings");
                    thread.setDaemon(true);
                    return thread;
                }));
    }

    ModerationEngine(ConfigStore configStore, AdminGuard adminGuard, ChatTransportPort transport,
            MessageService messageService, BotProperties properties, ScheduledExecutorService warningCleaner) {
        this.configStore = configStore;
        this.adminGuard = adminGuard;
        this.transport = transport;
        this.messageService = messageService;
        this.warningCleaner = warningCleaner;
        this.warningTtlSeconds = properties.getModeration().getWarningTtlSeconds();
    }

    /**
     * Decide what to do with a message.
     *
     * @param text
     *            message text or media caption, may be null
     * @param senderIsAdmin
     *            administrators are never subject to removal
     */
    public static ModerationDecision classify(String text, boolean senderIsAdmin, TenantPolicy policy) {
        String body = text != null ? text : "";
        String lower = body.toLowerCase(Locale.ROOT);

        String autoReply = null;
        for (Map.Entry<String, String> entry : policy.autoReplies().entrySet()) {
            if (lower.contains(entry.getKey())) {
                autoReply = entry.getValue();
                break;
            }
        }

        DeleteReason reason = null;
        if (!senderIsAdmin) {
            reason = findViolation(body, lower, policy);
        }
        if (autoReply == null && reason == null) {
            return ModerationDecision.allow();
        }
        return new ModerationDecision(autoReply, reason);
    }

    private static DeleteReason findViolation(String body, String lower, TenantPolicy policy) {
        if (policy.blockLinks()
                && (URL_PATTERN.matcher(body).find() || TELEGRAM_LINK_PATTERN.matcher(body).find())) {
            return DeleteReason.LINKS;
        }
        if (policy.blockMentions() && MENTION_PATTERN.matcher(body).find()) {
            return DeleteReason.MENTIONS;
        }
        for (String word : policy.bannedWords()) {
            if (lower.contains(word)) {
                return DeleteReason.BANNED_WORD;
            }
        }
        return null;
    }

    /**
     * Classify a group message and apply the outcome. Transport failures are
     * logged; nothing is retried.
     */
    public ModerationDecision moderate(GroupMessage message) {
        TenantPolicy policy = configStore.getPolicy(message.chatId());
        boolean admin = adminGuard.isAdmin(message.chatId(), message.senderId());
        ModerationDecision decision = classify(message.text(), admin, policy);
        if (decision.isAllow()) {
            return decision;
        }

        if (decision.hasAutoReply() && message.messageId() != null) {
            try {
                transport.replyText(message.chatId(), message.messageId(), decision.autoReply());
            } catch (ChatTransportException e) {
                log.warn("[Moderation] Failed to send auto reply in chat {}: {}", message.chatId(), e.getMessage());
            }
        }

        if (decision.shouldDelete() && message.messageId() != null) {
            removeAndWarn(message, decision.deleteReason());
        }
        return decision;
    }

    private void removeAndWarn(GroupMessage message, DeleteReason reason) {
        try {
            transport.deleteMessage(message.chatId(), message.messageId());
        } catch (ChatTransportException e) {
            log.warn("[Moderation] Failed to delete message {} in chat {}: {}",
                    message.messageId(), message.chatId(), e.getMessage());
            return;
        }
        log.info("[Moderation] Deleted message {} from user {} in chat {} ({})",
                message.messageId(), message.senderId(), message.chatId(), reason);

        String warning = messageService.getMessage("moderation.warning",
                messageService.getMessage(reason.getMessageKey()));
        int warningId;
        try {
            warningId = transport.sendText(message.chatId(), warning);
        } catch (ChatTransportException e) {
            log.warn("[Moderation] Failed to send warning in chat {}: {}", message.chatId(), e.getMessage());
            return;
        }
        warningCleaner.schedule(() -> deleteWarning(message.chatId(), warningId),
                warningTtlSeconds, TimeUnit.SECONDS);
    }

    private void deleteWarning(String chatId, int warningId) {
        try {
            transport.deleteMessage(chatId, warningId);
        } catch (ChatTransportException e) {
            log.debug("[Moderation] Warning {} in chat {} already gone: {}", warningId, chatId, e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        warningCleaner.shutdownNow();
    }
}
