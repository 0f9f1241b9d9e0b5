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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.warden.domain.exception.ConfigPersistenceException;
import me.golemcore.warden.domain.model.RecurringItem;
import me.golemcore.warden.domain.model.WizardResult;
import me.golemcore.warden.domain.model.WizardSession;
import me.golemcore.warden.domain.model.WizardStep;
import me.golemcore.warden.domain.service.AdminGuard;
import me.golemcore.warden.domain.service.ConfigStore;
import me.golemcore.warden.domain.service.WizardEngine;
import me.golemcore.warden.infrastructure.i18n.MessageService;
import me.golemcore.warden.port.inbound.CommandPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageText;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardRow;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Handles the /start and /menu commands, all menu:* and wizard:* callback
 * queries, and renders wizard prompts.
 *
 * <p>
 * Provides a centralized inline-keyboard control panel for group admins with:
 * <ul>
 * <li>Main menu</li>
 * <li>Recurring messages: start the wizard, list and delete items</li>
 * <li>Banned words and auto replies: command reference</li>
 * <li>Link and mention blocking: per-group toggles</li>
 * <li>Help built from the registered commands via CommandPort</li>
 * </ul>
 *
 * <p>
 * Destructive actions re-check that the pressing user administers the group.
 */
@Component
@Slf4j
@SuppressWarnings("PMD.LooseCoupling") // InlineKeyboardRow is required by Telegram API, no interface available
public class TelegramMenuHandler {

    private static final String MENU_PREFIX = "menu:";
    private static final String WIZARD_PREFIX = "wizard:";
    private static final String PARSE_MODE = "HTML";
    private static final String ACTION_YES = "yes";
    private static final String ACTION_TOGGLE = "toggle";
    private static final String HTML_BOLD_OPEN = "<b>";
    private static final String HTML_BOLD_CLOSE_NL = "</b>\n\n";
    private static final int ITEM_PREVIEW_MAX_LEN = 30;

    private final TelegramClient telegramClient;
    private final ConfigStore configStore;
    private final AdminGuard adminGuard;
    private final WizardEngine wizardEngine;
    private final MessageService messageService;
    private final ObjectProvider<CommandPort> commandRouter;

    public TelegramMenuHandler(
            TelegramClient telegramClient,
            ConfigStore configStore,
            AdminGuard adminGuard,
            WizardEngine wizardEngine,
            MessageService messageService,
            ObjectProvider<CommandPort> commandRouter) {
        this.telegramClient = telegramClient;
        this.configStore = configStore;
        this.adminGuard = adminGuard;
        this.wizardEngine = wizardEngine;
        this.messageService = messageService;
        this.commandRouter = commandRouter;
    }

    // ==================== Public API ====================

    /**
     * Send the main menu as a new message. Called from /start and /menu.
     */
    void sendMainMenu(String chatId) {
        sendHtml(chatId, buildMainMenuText(), buildMainMenuKeyboard());
        log.debug("[Menu] Sent main menu to chat: {}", chatId);
    }

    /**
     * Handle a menu:* or wizard:* callback query. Returns true if the callback
     * was handled.
     */
    boolean handleCallback(String chatId, Integer messageId, long userId, String data) {
        if (data.startsWith(WIZARD_PREFIX)) {
            handleWizardCallback(chatId, userId, data.substring(WIZARD_PREFIX.length()));
            return true;
        }
        if (!data.startsWith(MENU_PREFIX)) {
            return false;
        }

        String payload = data.substring(MENU_PREFIX.length());
        int colonIdx = payload.indexOf(':');
        String section = colonIdx >= 0 ? payload.substring(0, colonIdx) : payload;
        String action = colonIdx >= 0 ? payload.substring(colonIdx + 1) : null;

        dispatchSection(chatId, messageId, userId, section, action);
        return true;
    }

    /**
     * Show the outcome of a wizard input: an optional notice followed by the
     * prompt of the step the session is in.
     */
    void renderWizardResult(String chatId, WizardResult result) {
        switch (result.status()) {
        case NO_SESSION -> sendHtml(chatId, msg("wizard.no-session"), null);
        case SAVED -> {
            sendHtml(chatId, buildSavedText(result.session()), null);
            sendHtml(chatId, buildRecurringMenuText(), buildRecurringMenuKeyboard());
        }
        default -> {
            StringBuilder sb = new StringBuilder();
            if (result.messageKey() != null) {
                sb.append(msg(result.messageKey())).append("\n\n");
            }
            sb.append(buildPromptText(result.session()));
            sendHtml(chatId, sb.toString(), buildPromptKeyboard(result.step()));
        }
        }
    }

    /**
     * Cancel the user's wizard session and confirm it.
     */
    void cancelWizard(String chatId, long userId) {
        boolean cancelled = wizardEngine.cancel(userId);
        sendHtml(chatId, msg(cancelled ? "wizard.cancelled" : "wizard.no-session"), null);
    }

    private void dispatchSection(String chatId, Integer messageId, long userId, String section, String action) {
        switch (section) {
        case "main":
            editMessage(chatId, messageId, buildMainMenuText(), buildMainMenuKeyboard());
            break;
        case "recurring":
            handleRecurringCallback(chatId, messageId, userId, action);
            break;
        case "words":
            editMessage(chatId, messageId, msg("menu.words.text"), backKeyboard("menu:main"));
            break;
        case "replies":
            editMessage(chatId, messageId, msg("menu.replies.text"), backKeyboard("menu:main"));
            break;
        case "links":
            handleToggleCallback(chatId, messageId, userId, action, true);
            break;
        case "mentions":
            handleToggleCallback(chatId, messageId, userId, action, false);
            break;
        case "help":
            editMessage(chatId, messageId, buildHelpText(), backKeyboard("menu:main"));
            break;
        default:
            log.debug("[Menu] Unknown menu section: {}", section);
            break;
        }
    }

    // ==================== Recurring messages ====================

    private void handleRecurringCallback(String chatId, Integer messageId, long userId, String action) {
        if (action == null) {
            editMessage(chatId, messageId, buildRecurringMenuText(), buildRecurringMenuKeyboard());
        } else if ("add".equals(action)) {
            renderWizardResult(chatId, wizardEngine.start(userId));
        } else if ("list".equals(action)) {
            editMessage(chatId, messageId, buildRecurringListText(), buildRecurringListKeyboard());
        } else if (action.startsWith("del:")) {
            handleRecurringDelete(chatId, messageId, userId, action.substring("del:".length()));
        } else {
            log.debug("[Menu] Unknown recurring action: {}", action);
        }
    }

    private void handleRecurringDelete(String chatId, Integer messageId, long userId, String args) {
        // Format: <groupId>:<index>:<itemId>
        String[] parts = args.split(":");
        if (parts.length != 3) {
            log.warn("[Menu] Invalid recurring delete data: {}", args);
            return;
        }
        String groupId = parts[0];
        int index;
        try {
            index = Integer.parseInt(parts[1]);
        } catch (NumberFormatException e) {
            log.warn("[Menu] Invalid recurring index: {}", parts[1]);
            return;
        }
        if (!adminGuard.isAdmin(groupId, userId)) {
            sendHtml(chatId, msg("menu.not-admin", escapeHtml(groupId)), null);
            return;
        }
        List<RecurringItem> items = configStore.getRecurringItems(groupId);
        if (index < 0 || index >= items.size() || !parts[2].equals(items.get(index).getId())) {
            sendHtml(chatId, msg("menu.recurring.stale"), null);
        } else {
            try {
                configStore.removeRecurringItem(groupId, index);
                log.info("[Menu] User {} deleted recurring message {} from {}", userId, parts[2], groupId);
            } catch (ConfigPersistenceException e) {
                sendHtml(chatId, msg("menu.save-failed"), null);
            }
        }
        editMessage(chatId, messageId, buildRecurringListText(), buildRecurringListKeyboard());
    }

    private String buildRecurringMenuText() {
        return HTML_BOLD_OPEN + msg("menu.recurring.title") + HTML_BOLD_CLOSE_NL + msg("menu.recurring.text");
    }

    private InlineKeyboardMarkup buildRecurringMenuKeyboard() {
        List<InlineKeyboardRow> rows = new ArrayList<>();
        rows.add(row(button(msg("menu.btn.recurring.add"), "menu:recurring:add")));
        rows.add(row(button(msg("menu.btn.recurring.list"), "menu:recurring:list")));
        rows.add(row(button(msg("menu.btn.back"), "menu:main")));
        return InlineKeyboardMarkup.builder().keyboard(rows).build();
    }

    private String buildRecurringListText() {
        StringBuilder sb = new StringBuilder();
        sb.append(HTML_BOLD_OPEN).append(msg("menu.recurring.list.title")).append(HTML_BOLD_CLOSE_NL);
        boolean any = false;
        for (Map.Entry<String, List<RecurringItem>> entry : configStore.snapshotRecurringItems().entrySet()) {
            List<RecurringItem> items = entry.getValue();
            if (items.isEmpty()) {
                continue;
            }
            any = true;
            sb.append(msg("menu.recurring.list.group", escapeHtml(entry.getKey()))).append('\n');
            for (int i = 0; i < items.size(); i++) {
                RecurringItem item = items.get(i);
                sb.append(msg("menu.recurring.list.item",
                        String.valueOf(i + 1),
                        markers(item),
                        String.valueOf(item.getIntervalMinutes()),
                        escapeHtml(preview(item)))).append('\n');
            }
            sb.append('\n');
        }
        if (any) {
            sb.append(msg("menu.recurring.list.legend"));
        } else {
            sb.append(msg("menu.recurring.list.empty"));
        }
        return sb.toString();
    }

    private InlineKeyboardMarkup buildRecurringListKeyboard() {
        List<InlineKeyboardRow> rows = new ArrayList<>();
        for (Map.Entry<String, List<RecurringItem>> entry : configStore.snapshotRecurringItems().entrySet()) {
            List<RecurringItem> items = entry.getValue();
            for (int i = 0; i < items.size(); i++) {
                String label = msg("menu.btn.recurring.delete", String.valueOf(i + 1), entry.getKey());
                String data = "menu:recurring:del:" + entry.getKey() + ":" + i + ":" + items.get(i).getId();
                rows.add(row(button(label, data)));
            }
        }
        rows.add(row(button(msg("menu.btn.back"), "menu:recurring")));
        return InlineKeyboardMarkup.builder().keyboard(rows).build();
    }

    private String markers(RecurringItem item) {
        StringBuilder sb = new StringBuilder();
        sb.append(item.hasMedia() ? "📸" : "📝");
        if (item.getButtons() != null && !item.getButtons().isEmpty()) {
            sb.append("🔘");
        }
        if (item.isDeletePrevious()) {
            sb.append("🗑");
        }
        if (item.isPinMessage()) {
            sb.append("📌");
        }
        return sb.toString();
    }

    private String preview(RecurringItem item) {
        if (!item.hasText()) {
            return msg("menu.recurring.media-only");
        }
        return truncate(item.getText(), ITEM_PREVIEW_MAX_LEN);
    }

    // ==================== Link / mention toggles ====================

    private void handleToggleCallback(String chatId, Integer messageId, long userId, String action, boolean links) {
        if (action != null && action.startsWith(ACTION_TOGGLE + ":")) {
            String groupId = action.substring(ACTION_TOGGLE.length() + 1);
            if (!adminGuard.isAdmin(groupId, userId)) {
                sendHtml(chatId, msg("menu.not-admin", escapeHtml(groupId)), null);
                return;
            }
            try {
                if (links) {
                    configStore.setBlockLinks(groupId, !configStore.isBlockLinks(groupId));
                } else {
                    configStore.setBlockMentions(groupId, !configStore.isBlockMentions(groupId));
                }
                log.info("[Menu] User {} toggled {} blocking in {}", userId, links ? "link" : "mention", groupId);
            } catch (ConfigPersistenceException e) {
                sendHtml(chatId, msg("menu.save-failed"), null);
            }
        }
        String prefix = links ? "links" : "mentions";
        Map<String, Boolean> settings = links
                ? configStore.getLinkBlockingSettings()
                : configStore.getMentionBlockingSettings();

        StringBuilder sb = new StringBuilder();
        sb.append(HTML_BOLD_OPEN).append(msg("menu." + prefix + ".title")).append(HTML_BOLD_CLOSE_NL);
        sb.append(msg("menu." + prefix + ".text"));

        List<InlineKeyboardRow> rows = new ArrayList<>();
        for (Map.Entry<String, Boolean> entry : settings.entrySet()) {
            String status = Boolean.TRUE.equals(entry.getValue()) ? msg("menu.on") : msg("menu.off");
            rows.add(row(button(msg("menu.btn.toggle", entry.getKey(), status),
                    "menu:" + prefix + ":toggle:" + entry.getKey())));
        }
        rows.add(row(button(msg("menu.btn.back"), "menu:main")));
        editMessage(chatId, messageId, sb.toString(), InlineKeyboardMarkup.builder().keyboard(rows).build());
    }

    // ==================== Wizard ====================

    private void handleWizardCallback(String chatId, long userId, String action) {
        switch (action) {
        case "delete:yes", "delete:no" -> renderWizardResult(chatId,
                wizardEngine.onDeleteOption(userId, action.endsWith(ACTION_YES)));
        case "pin:yes", "pin:no" -> renderWizardResult(chatId,
                wizardEngine.onPinOption(userId, action.endsWith(ACTION_YES)));
        case "save" -> {
            try {
                renderWizardResult(chatId, wizardEngine.save(userId));
            } catch (ConfigPersistenceException e) {
                sendHtml(chatId, msg("menu.save-failed"), null);
            }
        }
        case "cancel" -> cancelWizard(chatId, userId);
        default -> log.debug("[Menu] Unknown wizard action: {}", action);
        }
    }

    private String buildPromptText(WizardSession session) {
        WizardStep step = session.getStep();
        return switch (step) {
        case AWAITING_CHAT_ID -> msg("wizard.prompt.chat-id");
        case AWAITING_TEXT -> msg("wizard.prompt.text");
        case AWAITING_MEDIA -> msg("wizard.prompt.media");
        case AWAITING_BUTTONS -> msg("wizard.prompt.buttons");
        case AWAITING_DELETE_OPTION -> msg("wizard.prompt.delete");
        case AWAITING_PIN_OPTION -> msg("wizard.prompt.pin");
        case AWAITING_INTERVAL -> msg("wizard.prompt.interval");
        case PREVIEW -> buildPreviewSummary(session);
        case FINALIZED -> buildSavedText(session);
        };
    }

    private String buildPreviewSummary(WizardSession session) {
        return msg("wizard.preview.summary",
                escapeHtml(session.getChatId()),
                String.valueOf(session.getIntervalMinutes()),
                session.getMediaType() != null ? session.getMediaType().name().toLowerCase(Locale.ROOT)
                        : msg("menu.none"),
                String.valueOf(session.getButtons().size()),
                yesNo(session.isDeletePrevious()),
                yesNo(session.isPinMessage()));
    }

    private String buildSavedText(WizardSession session) {
        return msg("wizard.saved",
                escapeHtml(session.getChatId()),
                String.valueOf(session.getIntervalMinutes()),
                yesNo(session.isDeletePrevious()),
                yesNo(session.isPinMessage()));
    }

    private InlineKeyboardMarkup buildPromptKeyboard(WizardStep step) {
        List<InlineKeyboardRow> rows = new ArrayList<>();
        if (step == WizardStep.AWAITING_DELETE_OPTION) {
            rows.add(row(button(msg("wizard.btn.delete.yes"), "wizard:delete:yes")));
            rows.add(row(button(msg("wizard.btn.delete.no"), "wizard:delete:no")));
        } else if (step == WizardStep.AWAITING_PIN_OPTION) {
            rows.add(row(button(msg("wizard.btn.pin.yes"), "wizard:pin:yes")));
            rows.add(row(button(msg("wizard.btn.pin.no"), "wizard:pin:no")));
        } else if (step == WizardStep.PREVIEW) {
            rows.add(row(button(msg("wizard.btn.save"), "wizard:save")));
        }
        if (step == WizardStep.FINALIZED) {
            return null;
        }
        rows.add(row(button(msg("wizard.btn.cancel"), "wizard:cancel")));
        return InlineKeyboardMarkup.builder().keyboard(rows).build();
    }

    // ==================== Menu screens ====================

    private String buildMainMenuText() {
        return HTML_BOLD_OPEN + msg("menu.title") + HTML_BOLD_CLOSE_NL + msg("menu.main.text");
    }

    private InlineKeyboardMarkup buildMainMenuKeyboard() {
        List<InlineKeyboardRow> rows = new ArrayList<>();
        rows.add(row(button(msg("menu.btn.recurring"), "menu:recurring")));
        rows.add(row(button(msg("menu.btn.words"), "menu:words")));
        rows.add(row(button(msg("menu.btn.replies"), "menu:replies")));
        rows.add(row(button(msg("menu.btn.links"), "menu:links")));
        rows.add(row(button(msg("menu.btn.mentions"), "menu:mentions")));
        rows.add(row(button(msg("menu.btn.help"), "menu:help")));
        return InlineKeyboardMarkup.builder().keyboard(rows).build();
    }

    private String buildHelpText() {
        StringBuilder sb = new StringBuilder();
        sb.append(HTML_BOLD_OPEN).append(msg("menu.help.title")).append(HTML_BOLD_CLOSE_NL);
        CommandPort router = commandRouter.getIfAvailable();
        if (router != null) {
            for (CommandPort.CommandDefinition definition : router.listCommands()) {
                sb.append("<code>").append(escapeHtml(definition.usage())).append("</code>\n")
                        .append(escapeHtml(definition.description())).append("\n\n");
            }
        }
        sb.append(msg("menu.help.footer"));
        return sb.toString();
    }

    private InlineKeyboardMarkup backKeyboard(String target) {
        return InlineKeyboardMarkup.builder()
                .keyboard(List.of(row(button(msg("menu.btn.back"), target))))
                .build();
    }

    // ==================== Helpers ====================

    private InlineKeyboardButton button(String text, String callbackData) {
        return InlineKeyboardButton.builder()
                .text(text)
                .callbackData(callbackData)
                .build();
    }

    private InlineKeyboardRow row(InlineKeyboardButton... buttons) {
        return new InlineKeyboardRow(buttons);
    }

    private void sendHtml(String chatId, String text, InlineKeyboardMarkup keyboard) {
        try {
            SendMessage message = SendMessage.builder()
                    .chatId(chatId)
                    .text(text)
                    .parseMode(PARSE_MODE)
                    .replyMarkup(keyboard)
                    .build();
            telegramClient.execute(message);
        } catch (Exception e) {
            log.error("[Menu] Failed to send message to chat {}", chatId, e);
        }
    }

    private void editMessage(String chatId, Integer messageId, String text, InlineKeyboardMarkup keyboard) {
        try {
            EditMessageText edit = EditMessageText.builder()
                    .chatId(chatId)
                    .messageId(messageId)
                    .text(text)
                    .parseMode(PARSE_MODE)
                    .replyMarkup(keyboard)
                    .build();
            telegramClient.execute(edit);
        } catch (Exception e) {
            log.error("[Menu] Failed to edit message", e);
        }
    }

    private String yesNo(boolean value) {
        return value ? msg("menu.yes") : msg("menu.no");
    }

    private String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength - 3) + "...";
    }

    private String escapeHtml(String value) {
        if (value == null) {
            return "";
        }
        return value
                .replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;");
    }

    private String msg(String key, Object... args) {
        return messageService.getMessage(key, args);
    }
}
