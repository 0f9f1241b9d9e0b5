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
import me.golemcore.warden.domain.model.ButtonLink;
import me.golemcore.warden.domain.model.MediaType;
import me.golemcore.warden.domain.model.RecurringItem;
import me.golemcore.warden.domain.model.WizardResult;
import me.golemcore.warden.domain.model.WizardSession;
import me.golemcore.warden.domain.model.WizardStep;
import me.golemcore.warden.infrastructure.config.BotProperties;
import me.golemcore.warden.port.outbound.ChatTransportPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-user conversation that builds one recurring message field by field:
 * target group, text, media, buttons, delete-previous, pin, interval, then a
 * live preview and an explicit save.
 *
 * <p>
 * Sessions live in memory only. One session per user; starting again replaces
 * the open draft. A session idle for longer than
 * {@code bot.wizard.session-ttl-minutes} is dropped on next access.
 *
 * <p>
 * Invalid input never throws: it yields a {@link WizardResult.Status#REJECTED}
 * result with the message key of the re-prompt, leaving the step unchanged.
 */
@Service
@Slf4j
public class WizardEngine {

    public static final String SKIP = "skip";

    public static final String KEY_RESTARTED = "wizard.restarted";
    public static final String KEY_CHAT_ID_INVALID = "wizard.chat-id.invalid";
    public static final String KEY_NOT_ADMIN = "wizard.chat-id.not-admin";
    public static final String KEY_MEDIA_EXPECTED = "wizard.media.expected";
    public static final String KEY_CONTENT_REQUIRED = "wizard.content.required";
    public static final String KEY_INTERVAL_INVALID = "wizard.interval.invalid";
    public static final String KEY_PREVIEW_FAILED = "wizard.preview.failed";

    private final Map<Long, WizardSession> sessions = new ConcurrentHashMap<>();

    private final ConfigStore configStore;
    private final AdminGuard adminGuard;
    private final ChatTransportPort transport;
    private final Clock clock;
    private final Duration sessionTtl;

    public WizardEngine(ConfigStore configStore, AdminGuard adminGuard, ChatTransportPort transport,
            BotProperties properties, Clock clock) {
        this.configStore = configStore;
        this.adminGuard = adminGuard;
        this.transport = transport;
        this.clock = clock;
        this.sessionTtl = Duration.ofMinutes(properties.getWizard().getSessionTtlMinutes());
    }

    /**
     * Open a fresh session for the user, replacing any open draft.
     */
    public WizardResult start(long userId) {
        WizardSession session = WizardSession.builder()
                .userId(userId)
                .updatedAt(clock.instant())
                .build();
        WizardSession previous = sessions.put(userId, session);
        if (previous != null && !isExpired(previous)) {
            log.info("[Wizard] User {} restarted, draft at step {} discarded", userId, previous.getStep());
            return new WizardResult(WizardResult.Status.ADVANCED, session.getStep(), KEY_RESTARTED, session, null);
        }
        log.debug("[Wizard] Session started for user {}", userId);
        return WizardResult.advanced(session);
    }

    /**
     * The user's open session, if any.
     */
    public Optional<WizardSession> getSession(long userId) {
        return Optional.ofNullable(activeSession(userId));
    }

    /**
     * Destroy the user's session. Accepted in every step.
     *
     * @return true if a session was open
     */
    public boolean cancel(long userId) {
        WizardSession removed = sessions.remove(userId);
        if (removed != null) {
            log.debug("[Wizard] Session of user {} cancelled at step {}", userId, removed.getStep());
        }
        return removed != null && !isExpired(removed);
    }

    /**
     * Feed free text into the current step.
     */
    public WizardResult onText(long userId, String input) {
        WizardSession session = activeSession(userId);
        if (session == null) {
            return WizardResult.noSession();
        }
        String value = input != null ? input : "";
        return switch (session.getStep()) {
        case AWAITING_CHAT_ID -> acceptChatId(session, value.trim());
        case AWAITING_TEXT -> acceptText(session, value);
        case AWAITING_MEDIA -> acceptMediaSkip(session, value.trim());
        case AWAITING_BUTTONS -> acceptButtons(session, value);
        case AWAITING_INTERVAL -> acceptInterval(session, value.trim());
        default -> WizardResult.ignored(session);
        };
    }

    /**
     * Feed a photo, video or animation into the media step.
     *
     * @param fileId
     *            opaque platform reference to the uploaded file
     */
    public WizardResult onMedia(long userId, String fileId, MediaType mediaType) {
        WizardSession session = activeSession(userId);
        if (session == null) {
            return WizardResult.noSession();
        }
        if (session.getStep() != WizardStep.AWAITING_MEDIA || fileId == null || mediaType == null) {
            return WizardResult.ignored(session);
        }
        session.setMedia(fileId);
        session.setMediaType(mediaType);
        return advance(session, WizardStep.AWAITING_BUTTONS);
    }

    public WizardResult onDeleteOption(long userId, boolean deletePrevious) {
        WizardSession session = activeSession(userId);
        if (session == null) {
            return WizardResult.noSession();
        }
        if (session.getStep() != WizardStep.AWAITING_DELETE_OPTION) {
            return WizardResult.ignored(session);
        }
        session.setDeletePrevious(deletePrevious);
        return advance(session, WizardStep.AWAITING_PIN_OPTION);
    }

    public WizardResult onPinOption(long userId, boolean pinMessage) {
        WizardSession session = activeSession(userId);
        if (session == null) {
            return WizardResult.noSession();
        }
        if (session.getStep() != WizardStep.AWAITING_PIN_OPTION) {
            return WizardResult.ignored(session);
        }
        session.setPinMessage(pinMessage);
        return advance(session, WizardStep.AWAITING_INTERVAL);
    }

    /**
     * Convert a previewed session into a stored recurring message and close
     * it. The new item has never been sent.
     *
     * @throws me.golemcore.warden.domain.exception.ConfigPersistenceException
     *             if the store cannot be flushed; the session stays open
     */
    public WizardResult save(long userId) {
        WizardSession session = activeSession(userId);
        if (session == null) {
            return WizardResult.noSession();
        }
        if (session.getStep() != WizardStep.PREVIEW) {
            return WizardResult.ignored(session);
        }
        if (!session.hasContent()) {
            return WizardResult.rejected(session, KEY_CONTENT_REQUIRED);
        }
        RecurringItem item = RecurringItem.builder()
                .text(session.getText())
                .media(session.getMedia())
                .mediaType(session.getMediaType())
                .buttons(new ArrayList<>(session.getButtons()))
                .intervalMinutes(session.getIntervalMinutes())
                .deletePrevious(session.isDeletePrevious())
                .pinMessage(session.isPinMessage())
                .lastSentAt(0)
                .lastMessageId(null)
                .build();
        RecurringItem stored = configStore.addRecurringItem(session.getChatId(), item);
        sessions.remove(userId);
        session.setStep(WizardStep.FINALIZED);
        log.info("[Wizard] User {} saved recurring message {} for group {}",
                userId, stored.getId(), session.getChatId());
        return WizardResult.saved(session, stored);
    }

    /**
     * Parse newline-separated {@code label|url} lines. Lines without a
     * separator, or with an empty label or url, are dropped.
     */
    public static List<ButtonLink> parseButtons(String input) {
        List<ButtonLink> buttons = new ArrayList<>();
        if (input == null || input.isBlank() || SKIP.equalsIgnoreCase(input.trim())) {
            return buttons;
        }
        for (String line : input.split("\\R")) {
            int separator = line.indexOf('|');
            if (separator < 0) {
                continue;
            }
            String label = line.substring(0, separator).trim();
            String url = line.substring(separator + 1).trim();
            if (!label.isEmpty() && !url.isEmpty()) {
                buttons.add(new ButtonLink(label, url));
            }
        }
        return buttons;
    }

    private WizardResult acceptChatId(WizardSession session, String input) {
        String chatId;
        try {
            chatId = ConfigStore.canonicalChatId(input);
        } catch (IllegalArgumentException e) {
            return WizardResult.rejected(session, KEY_CHAT_ID_INVALID);
        }
        if (!adminGuard.isAdmin(chatId, session.getUserId())) {
            log.info("[Wizard] User {} is not an admin of {}", session.getUserId(), chatId);
            return WizardResult.rejected(session, KEY_NOT_ADMIN);
        }
        session.setChatId(chatId);
        return advance(session, WizardStep.AWAITING_TEXT);
    }

    private WizardResult acceptText(WizardSession session, String input) {
        session.setText(SKIP.equalsIgnoreCase(input.trim()) ? null : input);
        return advance(session, WizardStep.AWAITING_MEDIA);
    }

    private WizardResult acceptMediaSkip(WizardSession session, String input) {
        if (!SKIP.equalsIgnoreCase(input)) {
            return WizardResult.rejected(session, KEY_MEDIA_EXPECTED);
        }
        if (session.getText() == null || session.getText().isEmpty()) {
            return WizardResult.rejected(session, KEY_CONTENT_REQUIRED);
        }
        return advance(session, WizardStep.AWAITING_BUTTONS);
    }

    private WizardResult acceptButtons(WizardSession session, String input) {
        session.setButtons(parseButtons(input));
        return advance(session, WizardStep.AWAITING_DELETE_OPTION);
    }

    private WizardResult acceptInterval(WizardSession session, String input) {
        int interval;
        try {
            interval = Integer.parseInt(input);
        } catch (NumberFormatException e) {
            return WizardResult.rejected(session, KEY_INTERVAL_INVALID);
        }
        if (interval < 1) {
            return WizardResult.rejected(session, KEY_INTERVAL_INVALID);
        }
        session.setIntervalMinutes(interval);
        advance(session, WizardStep.PREVIEW);

        try {
            transport.sendPost(String.valueOf(session.getUserId()), session.toPost());
        } catch (ChatTransportException e) {
            log.warn("[Wizard] Failed to render preview for user {}: {}", session.getUserId(), e.getMessage());
            return new WizardResult(WizardResult.Status.ADVANCED, WizardStep.PREVIEW, KEY_PREVIEW_FAILED,
                    session, null);
        }
        return WizardResult.advanced(session);
    }

    private WizardResult advance(WizardSession session, WizardStep next) {
        session.setStep(next);
        session.setUpdatedAt(clock.instant());
        return WizardResult.advanced(session);
    }

    private WizardSession activeSession(long userId) {
        WizardSession session = sessions.get(userId);
        if (session == null) {
            return null;
        }
        if (isExpired(session)) {
            sessions.remove(userId, session);
            log.debug("[Wizard] Session of user {} expired", userId);
            return null;
        }
        return session;
    }

    private boolean isExpired(WizardSession session) {
        Instant updatedAt = session.getUpdatedAt();
        return updatedAt != null && updatedAt.plus(sessionTtl).isBefore(clock.instant());
    }
}
