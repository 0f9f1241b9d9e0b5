package me.golemcore.warden.adapter.inbound.command;

import me.golemcore.warden.domain.exception.AdminRequiredException;
import me.golemcore.warden.domain.exception.ConfigPersistenceException;
import me.golemcore.warden.domain.service.AdminGuard;
import me.golemcore.warden.domain.service.ConfigStore;
import me.golemcore.warden.infrastructure.i18n.MessageService;
import me.golemcore.warden.port.inbound.CommandPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CommandRouterTest {

    private static final String GROUP = "-100123";
    private static final long ADMIN = 42L;
    private static final long STRANGER = 43L;

    private ConfigStore configStore;
    private AdminGuard adminGuard;
    private CommandRouter router;

    @BeforeEach
    void setUp() {
        configStore = mock(ConfigStore.class);
        adminGuard = mock(AdminGuard.class);
        router = new CommandRouter(configStore, adminGuard, new MessageService());
        doThrow(new AdminRequiredException(GROUP, STRANGER)).when(adminGuard).requireAdmin(GROUP, STRANGER);
    }

    private static Map<String, Object> privateCtx(long userId) {
        return Map.of("chatId", String.valueOf(userId), "userId", userId, "privateChat", true);
    }

    private static Map<String, Object> groupCtx(long userId) {
        return Map.of("chatId", GROUP, "userId", userId, "privateChat", false);
    }

    private CommandPort.CommandResult run(String command, Map<String, Object> ctx, String... args) {
        return router.execute(command, List.of(args), ctx).join();
    }

    @Test
    void shouldListAllCommands() {
        List<CommandPort.CommandDefinition> commands = router.listCommands();

        assertEquals(9, commands.size());
        assertEquals("chatid", commands.get(0).name());
        assertEquals("/addword <chat_id> <word>", commands.get(1).usage());
        assertTrue(router.hasCommand("setmentions"));
        assertFalse(router.hasCommand("ban"));
    }

    @Test
    void shouldReportUnknownCommand() {
        CommandPort.CommandResult result = run("ban", privateCtx(ADMIN), GROUP);

        assertFalse(result.success());
        assertEquals("Unknown command: /ban", result.output());
    }

    @Test
    void shouldShowGroupIdInGroup() {
        CommandPort.CommandResult result = run("chatid", groupCtx(ADMIN));

        assertTrue(result.success());
        assertTrue(result.output().contains(GROUP));
    }

    @Test
    void shouldShowUserIdInPrivateChat() {
        CommandPort.CommandResult result = run("chatid", privateCtx(ADMIN));

        assertTrue(result.success());
        assertTrue(result.output().startsWith("Your user id: 42"));
    }

    @Test
    void shouldRefuseConfigCommandsInGroups() {
        CommandPort.CommandResult result = run("addword", groupCtx(ADMIN), GROUP, "scam");

        assertFalse(result.success());
        assertTrue(result.output().contains("private chat"));
        verify(configStore, never()).addBannedWord(anyString(), anyString());
    }

    @Test
    void shouldShowUsageWithoutArguments() {
        CommandPort.CommandResult result = run("listwords", privateCtx(ADMIN));

        assertFalse(result.success());
        assertEquals("❌ Usage: /listwords <chat_id>", result.output());
    }

    @Test
    void shouldRejectInvalidChatId() {
        CommandPort.CommandResult result = run("listwords", privateCtx(ADMIN), "mygroup");

        assertFalse(result.success());
        assertEquals("❌ Invalid chat id: mygroup", result.output());
    }

    @Test
    void shouldRejectNonAdmin() {
        CommandPort.CommandResult result = run("addword", privateCtx(STRANGER), GROUP, "scam");

        assertFalse(result.success());
        assertTrue(result.output().contains("admin"));
        verify(configStore, never()).addBannedWord(anyString(), anyString());
    }

    @Test
    void shouldAddBannedWordLowerCased() {
        when(configStore.addBannedWord(GROUP, "Free Money")).thenReturn(true);

        CommandPort.CommandResult result = run("addword", privateCtx(ADMIN), GROUP, "Free", "Money");

        assertTrue(result.success());
        assertTrue(result.output().contains("Word: free money"));
        verify(configStore).addBannedWord(GROUP, "Free Money");
    }

    @Test
    void shouldReportDuplicateBannedWord() {
        when(configStore.addBannedWord(GROUP, "scam")).thenReturn(false);

        CommandPort.CommandResult result = run("addword", privateCtx(ADMIN), GROUP, "scam");

        assertTrue(result.success());
        assertEquals("Word scam is already banned in group -100123.", result.output());
    }

    @Test
    void shouldReportMissingWordOnDelete() {
        when(configStore.removeBannedWord(GROUP, "spam")).thenReturn(false);

        CommandPort.CommandResult result = run("delword", privateCtx(ADMIN), GROUP, "spam");

        assertEquals("Word spam is not banned in group -100123.", result.output());
    }

    @Test
    void shouldListBannedWords() {
        when(configStore.getBannedWords(GROUP)).thenReturn(List.of("scam", "spam"));

        CommandPort.CommandResult result = run("listwords", privateCtx(ADMIN), GROUP);

        assertTrue(result.output().contains("1. scam\n2. spam"));
        assertTrue(result.output().endsWith("Total: 2 words"));
    }

    @Test
    void shouldNormalizeTargetChatId() {
        when(configStore.getBannedWords(GROUP)).thenReturn(List.of());

        CommandPort.CommandResult result = run("listwords", privateCtx(ADMIN), "-0100123");

        assertEquals("No banned words for group -100123.", result.output());
        verify(adminGuard).requireAdmin(GROUP, ADMIN);
    }

    @Test
    void shouldAddAutoReplySplittingOnFirstSeparator() {
        CommandPort.CommandResult result = run("addreply", privateCtx(ADMIN), GROUP, "Price", "list", "|", "See",
                "a|b");

        assertTrue(result.success());
        verify(configStore).addAutoReply(GROUP, "Price list", "See a|b");
    }

    @Test
    void shouldRequireSeparatorForAutoReply() {
        CommandPort.CommandResult result = run("addreply", privateCtx(ADMIN), GROUP, "hello", "world");

        assertFalse(result.success());
        assertTrue(result.output().startsWith("❌ Usage: /addreply"));
        verify(configStore, never()).addAutoReply(anyString(), anyString(), anyString());
    }

    @Test
    void shouldListAutoRepliesTruncated() {
        Map<String, String> replies = new LinkedHashMap<>();
        replies.put("hello", "Hi");
        replies.put("rules", "r".repeat(60));
        when(configStore.getAutoReplies(GROUP)).thenReturn(replies);

        CommandPort.CommandResult result = run("listreplies", privateCtx(ADMIN), GROUP);

        assertTrue(result.output().contains("1. hello → Hi\n"));
        assertTrue(result.output().contains("2. rules → " + "r".repeat(50) + "...\n"));
    }

    @Test
    void shouldDeleteAutoReply() {
        when(configStore.removeAutoReply(GROUP, "hello")).thenReturn(true);

        CommandPort.CommandResult result = run("delreply", privateCtx(ADMIN), GROUP, "hello");

        assertTrue(result.output().startsWith("✅ Auto reply removed!"));
    }

    @Test
    void shouldToggleLinkAndMentionBlocking() {
        run("setlinks", privateCtx(ADMIN), GROUP, "ON");
        run("setmentions", privateCtx(ADMIN), GROUP, "off");
        run("setmentions", privateCtx(ADMIN), GROUP, "maybe");

        verify(configStore).setBlockLinks(GROUP, true);
        verify(configStore, times(2)).setBlockMentions(GROUP, false);
    }

    @Test
    void shouldRequireSettingValue() {
        CommandPort.CommandResult result = run("setlinks", privateCtx(ADMIN), GROUP);

        assertFalse(result.success());
        verify(configStore, never()).setBlockLinks(anyString(), anyBoolean());
    }

    @Test
    void shouldReportPersistenceFailure() {
        doThrow(new ConfigPersistenceException("disk full", new RuntimeException()))
                .when(configStore).setBlockLinks(GROUP, true);

        CommandPort.CommandResult result = run("setlinks", privateCtx(ADMIN), GROUP, "on");

        assertFalse(result.success());
        assertTrue(result.output().contains("Could not save"));
    }

    @Test
    void shouldRecognizeTruthyTokens() {
        for (String token : List.of("on", "TRUE", "1", "yes", "Enable")) {
            assertTrue(CommandRouter.isTruthy(token), token);
        }
        for (String token : List.of("off", "false", "0", "no", "")) {
            assertFalse(CommandRouter.isTruthy(token), token);
        }
        assertFalse(CommandRouter.isTruthy(null));
    }
}
