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

package me.golemcore.warden.adapter.inbound.command;

import me.golemcore.warden.domain.exception.AdminRequiredException;
import me.golemcore.warden.domain.exception.ConfigPersistenceException;
import me.golemcore.warden.domain.service.AdminGuard;
import me.golemcore.warden.domain.service.ConfigStore;
import me.golemcore.warden.infrastructure.i18n.MessageService;
import me.golemcore.warden.port.inbound.CommandPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Routes slash commands to the configuration store.
 *
 * <ul>
 * <li>/chatid - Show the id of the current chat (works anywhere)
 * <li>/addword, /delword, /listwords - Manage banned words
 * <li>/addreply, /delreply, /listreplies - Manage auto replies
 * <li>/setlinks, /setmentions - Toggle link and mention blocking
 * </ul>
 *
 * <p>
 * Every command except /chatid must be issued in a private chat and re-checks
 * that the caller administers the target group before reading or changing its
 * settings.
 *
 * @see me.golemcore.warden.port.inbound.CommandPort
 */
@Component
@Slf4j
public class CommandRouter implements CommandPort {

    private static final String CMD_CHATID = "chatid";
    private static final String CMD_ADDWORD = "addword";
    private static final String CMD_DELWORD = "delword";
    private static final String CMD_LISTWORDS = "listwords";
    private static final String CMD_ADDREPLY = "addreply";
    private static final String CMD_DELREPLY = "delreply";
    private static final String CMD_LISTREPLIES = "listreplies";
    private static final String CMD_SETLINKS = "setlinks";
    private static final String CMD_SETMENTIONS = "setmentions";
    private static final String REPLY_SEPARATOR = "|";
    private static final int REPLY_PREVIEW_MAX_LEN = 50;

    private static final List<String> KNOWN_COMMANDS = List.of(
            CMD_CHATID, CMD_ADDWORD, CMD_DELWORD, CMD_LISTWORDS, CMD_ADDREPLY, CMD_DELREPLY, CMD_LISTREPLIES,
            CMD_SETLINKS, CMD_SETMENTIONS);

    private static final Set<String> KNOWN_COMMAND_SET = Set.copyOf(KNOWN_COMMANDS);
    private static final Set<String> TRUTHY = Set.of("on", "true", "1", "yes", "enable");

    private final ConfigStore configStore;
    private final AdminGuard adminGuard;
    private final MessageService messageService;

    public CommandRouter(ConfigStore configStore, AdminGuard adminGuard, MessageService messageService) {
        this.configStore = configStore;
        this.adminGuard = adminGuard;
        this.messageService = messageService;
        log.info("CommandRouter initialized with commands: {}", KNOWN_COMMANDS);
    }

    @Override
    public CompletableFuture<CommandResult> execute(String command, List<String> args, Map<String, Object> context) {
        return CompletableFuture.supplyAsync(() -> {
            String chatId = (String) context.get("chatId");
            long userId = ((Number) context.get("userId")).longValue();
            boolean privateChat = Boolean.TRUE.equals(context.get("privateChat"));
            log.debug("Executing command: /{} (chat={}, user={})", command, chatId, userId);
            if (!hasCommand(command)) {
                return CommandResult.failure(msg("command.unknown", command));
            }
            if (CMD_CHATID.equals(command)) {
                return handleChatId(chatId, userId, privateChat);
            }
            if (!privateChat) {
                return CommandResult.failure(msg("command.private-only"));
            }
            if (args.isEmpty()) {
                return usage(command);
            }

            String target;
            try {
                target = ConfigStore.canonicalChatId(args.get(0));
            } catch (IllegalArgumentException e) {
                return CommandResult.failure(msg("command.invalid-chat-id", args.get(0)));
            }
            List<String> rest = args.subList(1, args.size());

            try {
                adminGuard.requireAdmin(target, userId);
                return switch (command) {
                case CMD_ADDWORD -> handleAddWord(target, rest);
                case CMD_DELWORD -> handleDelWord(target, rest);
                case CMD_LISTWORDS -> handleListWords(target);
                case CMD_ADDREPLY -> handleAddReply(target, rest);
                case CMD_DELREPLY -> handleDelReply(target, rest);
                case CMD_LISTREPLIES -> handleListReplies(target);
                case CMD_SETLINKS -> handleSetLinks(target, rest);
                case CMD_SETMENTIONS -> handleSetMentions(target, rest);
                default -> CommandResult.failure(msg("command.unknown", command));
                };
            } catch (AdminRequiredException e) {
                log.info("User {} denied /{} on chat {}: not an admin", userId, command, target);
                return CommandResult.failure(msg("command.not-admin", target));
            } catch (ConfigPersistenceException e) {
                log.error("Command /{} failed to persist", command, e);
                return CommandResult.failure(msg("command.save-failed"));
            }
        });
    }

    @Override
    public boolean hasCommand(String command) {
        return KNOWN_COMMAND_SET.contains(command);
    }

    @Override
    public List<CommandDefinition> listCommands() {
        return KNOWN_COMMANDS.stream()
                .map(cmd -> new CommandDefinition(cmd, msg("command." + cmd + ".desc"), msg("command." + cmd + ".usage")))
                .toList();
    }

    /**
     * Whether a setting token means "enabled".
     */
    static boolean isTruthy(String token) {
        return token != null && TRUTHY.contains(token.toLowerCase(Locale.ROOT));
    }

    private CommandResult handleChatId(String chatId, long userId, boolean privateChat) {
        if (privateChat) {
            return CommandResult.success(msg("command.chatid.private", String.valueOf(userId)));
        }
        return CommandResult.success(msg("command.chatid.group", chatId));
    }

    private CommandResult handleAddWord(String target, List<String> rest) {
        String word = String.join(" ", rest).trim();
        if (word.isEmpty()) {
            return usage(CMD_ADDWORD);
        }
        if (!configStore.addBannedWord(target, word)) {
            return CommandResult.success(msg("command.addword.exists", word.toLowerCase(Locale.ROOT), target));
        }
        log.info("Banned word added to chat {}", target);
        return CommandResult.success(msg("command.addword.done", word.toLowerCase(Locale.ROOT), target));
    }

    private CommandResult handleDelWord(String target, List<String> rest) {
        String word = String.join(" ", rest).trim();
        if (word.isEmpty()) {
            return usage(CMD_DELWORD);
        }
        if (!configStore.removeBannedWord(target, word)) {
            return CommandResult.success(msg("command.delword.missing", word, target));
        }
        log.info("Banned word removed from chat {}", target);
        return CommandResult.success(msg("command.delword.done", word, target));
    }

    private CommandResult handleListWords(String target) {
        List<String> words = configStore.getBannedWords(target);
        if (words.isEmpty()) {
            return CommandResult.success(msg("command.listwords.empty", target));
        }
        StringBuilder sb = new StringBuilder();
        sb.append(msg("command.listwords.title", target)).append("\n\n");
        for (int i = 0; i < words.size(); i++) {
            sb.append(i + 1).append(". ").append(words.get(i)).append('\n');
        }
        sb.append('\n').append(msg("command.listwords.total", String.valueOf(words.size())));
        return CommandResult.success(sb.toString());
    }

    private CommandResult handleAddReply(String target, List<String> rest) {
        String joined = String.join(" ", rest);
        int separator = joined.indexOf(REPLY_SEPARATOR);
        if (separator < 0) {
            return usage(CMD_ADDREPLY);
        }
        String trigger = joined.substring(0, separator).trim();
        String reply = joined.substring(separator + 1).trim();
        if (trigger.isEmpty() || reply.isEmpty()) {
            return usage(CMD_ADDREPLY);
        }
        configStore.addAutoReply(target, trigger, reply);
        log.info("Auto reply added to chat {}", target);
        return CommandResult.success(msg("command.addreply.done", trigger.toLowerCase(Locale.ROOT), reply, target));
    }

    private CommandResult handleDelReply(String target, List<String> rest) {
        String trigger = String.join(" ", rest).trim();
        if (trigger.isEmpty()) {
            return usage(CMD_DELREPLY);
        }
        if (!configStore.removeAutoReply(target, trigger)) {
            return CommandResult.success(msg("command.delreply.missing", trigger, target));
        }
        log.info("Auto reply removed from chat {}", target);
        return CommandResult.success(msg("command.delreply.done", trigger, target));
    }

    private CommandResult handleListReplies(String target) {
        Map<String, String> replies = configStore.getAutoReplies(target);
        if (replies.isEmpty()) {
            return CommandResult.success(msg("command.listreplies.empty", target));
        }
        StringBuilder sb = new StringBuilder();
        sb.append(msg("command.listreplies.title", target)).append("\n\n");
        int index = 1;
        for (Map.Entry<String, String> entry : replies.entrySet()) {
            sb.append(index++).append(". ").append(entry.getKey())
                    .append(" → ").append(truncate(entry.getValue(), REPLY_PREVIEW_MAX_LEN))
                    .append('\n');
        }
        sb.append('\n').append(msg("command.listreplies.total", String.valueOf(replies.size())));
        return CommandResult.success(sb.toString());
    }

    private CommandResult handleSetLinks(String target, List<String> rest) {
        if (rest.isEmpty()) {
            return usage(CMD_SETLINKS);
        }
        boolean enabled = isTruthy(rest.get(0));
        configStore.setBlockLinks(target, enabled);
        log.info("Link blocking in chat {} set to {}", target, enabled);
        return CommandResult.success(msg(enabled ? "command.setlinks.on" : "command.setlinks.off", target));
    }

    private CommandResult handleSetMentions(String target, List<String> rest) {
        if (rest.isEmpty()) {
            return usage(CMD_SETMENTIONS);
        }
        boolean enabled = isTruthy(rest.get(0));
        configStore.setBlockMentions(target, enabled);
        log.info("Mention blocking in chat {} set to {}", target, enabled);
        return CommandResult.success(msg(enabled ? "command.setmentions.on" : "command.setmentions.off", target));
    }

    private CommandResult usage(String command) {
        return CommandResult.failure(msg("command.usage", msg("command." + command + ".usage")));
    }

    private String truncate(String value, int maxLength) {
        if (value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength) + "...";
    }

    private String msg(String key, Object... args) {
        return messageService.getMessage(key, args);
    }
}
