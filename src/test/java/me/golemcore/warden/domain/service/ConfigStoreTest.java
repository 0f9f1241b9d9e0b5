package me.golemcore.warden.domain.service;

import me.golemcore.warden.domain.exception.ConfigPersistenceException;
import me.golemcore.warden.domain.model.ButtonLink;
import me.golemcore.warden.domain.model.MediaType;
import me.golemcore.warden.domain.model.RecurringItem;
import me.golemcore.warden.domain.model.TenantPolicy;
import me.golemcore.warden.infrastructure.config.BotProperties;
import me.golemcore.warden.port.outbound.StoragePort;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConfigStoreTest {

    private static final String GROUP = "-100123";
    private static final String OTHER_GROUP = "-100999";
    private static final String SNAPSHOT_KEY = "config/bot_data.json";

    private Map<String, String> files;
    private StoragePort storagePort;
    private ObjectMapper objectMapper;
    private BotProperties properties;
    private ConfigStore store;

    @BeforeEach
    void setUp() {
        files = new HashMap<>();
        storagePort = mock(StoragePort.class);
        objectMapper = new ObjectMapper();
        properties = new BotProperties();

        when(storagePort.getText(anyString(), anyString()))
                .thenAnswer(inv -> CompletableFuture.completedFuture(
                        files.get(inv.getArgument(0) + "/" + inv.getArgument(1))));
        when(storagePort.putTextAtomic(anyString(), anyString(), anyString(), anyBoolean()))
                .thenAnswer(inv -> {
                    files.put(inv.getArgument(0) + "/" + inv.getArgument(1), inv.getArgument(2));
                    return CompletableFuture.completedFuture(null);
                });

        store = new ConfigStore(storagePort, objectMapper, properties);
        store.load();
    }

    private RecurringItem item(String text, int interval) {
        return RecurringItem.builder()
                .text(text)
                .intervalMinutes(interval)
                .build();
    }

    @Test
    void shouldStartEmptyWhenNoSnapshotExists() {
        assertTrue(store.snapshotRecurringItems().isEmpty());
        assertTrue(store.getBannedWords(GROUP).isEmpty());
        assertFalse(store.isBlockLinks(GROUP));
        assertFalse(store.isBlockMentions(GROUP));
        assertTrue(store.getAutoReplies(GROUP).isEmpty());
        verify(storagePort, never()).putTextAtomic(anyString(), anyString(), anyString(), anyBoolean());
    }

    @Test
    void shouldLeaveBannedWordsEmptyAfterCaseVaryingAddAndRemove() {
        store.addBannedWord(GROUP, "Scam");
        assertEquals(List.of("scam"), store.getBannedWords(GROUP));

        assertTrue(store.removeBannedWord(GROUP, "SCAM"));

        assertTrue(store.getBannedWords(GROUP).isEmpty());
    }

    @Test
    void shouldIgnoreDuplicateBannedWord() {
        assertTrue(store.addBannedWord(GROUP, "spam"));
        assertFalse(store.addBannedWord(GROUP, "SPAM"));

        assertEquals(List.of("spam"), store.getBannedWords(GROUP));
        verify(storagePort, times(1)).putTextAtomic(anyString(), anyString(), anyString(), anyBoolean());
    }

    @Test
    void shouldIgnoreOutOfRangeRecurringRemoval() {
        store.addRecurringItem(GROUP, item("Hello", 10));

        assertTrue(store.removeRecurringItem(GROUP, 5).isEmpty());
        assertTrue(store.removeRecurringItem(GROUP, -1).isEmpty());
        assertTrue(store.removeRecurringItem(OTHER_GROUP, 0).isEmpty());

        assertEquals(1, store.getRecurringItems(GROUP).size());
    }

    @Test
    void shouldRemoveRecurringItemByIndex() {
        store.addRecurringItem(GROUP, item("first", 10));
        store.addRecurringItem(GROUP, item("second", 20));

        Optional<RecurringItem> removed = store.removeRecurringItem(GROUP, 0);

        assertEquals("first", removed.orElseThrow().getText());
        List<RecurringItem> remaining = store.getRecurringItems(GROUP);
        assertEquals(1, remaining.size());
        assertEquals("second", remaining.get(0).getText());
    }

    @Test
    void shouldCanonicalizeChatIds() {
        assertEquals(GROUP, ConfigStore.canonicalChatId(" -100123 "));
        assertEquals(GROUP, ConfigStore.canonicalChatId("-0100123"));
        assertEquals(GROUP, ConfigStore.canonicalChatId(-100123L));
        assertThrows(IllegalArgumentException.class, () -> ConfigStore.canonicalChatId("group"));
        assertThrows(IllegalArgumentException.class, () -> ConfigStore.canonicalChatId(" "));
    }

    @Test
    void shouldNotSplitTenantWhenCallersCanonicalizeIds() {
        store.addBannedWord(ConfigStore.canonicalChatId(" -100123"), "scam");
        store.setBlockLinks(ConfigStore.canonicalChatId("-100123 "), true);

        TenantPolicy policy = store.getPolicy(GROUP);
        assertEquals(List.of("scam"), policy.bannedWords());
        assertTrue(policy.blockLinks());
        assertEquals(1, store.getLinkBlockingSettings().size());
    }

    @Test
    void shouldPersistAndReloadWholeConfiguration() {
        RecurringItem rich = RecurringItem.builder()
                .text("Promo")
                .media("file-1")
                .mediaType(MediaType.PHOTO)
                .buttons(List.of(new ButtonLink("Visit", "https://x.com")))
                .intervalMinutes(15)
                .deletePrevious(true)
                .pinMessage(true)
                .build();
        RecurringItem stored = store.addRecurringItem(GROUP, rich);
        store.addBannedWord(GROUP, "scam");
        store.setBlockLinks(GROUP, true);
        store.setBlockMentions(OTHER_GROUP, false);
        store.addAutoReply(GROUP, "Price", "See website");

        ConfigStore reloaded = new ConfigStore(storagePort, objectMapper, properties);
        reloaded.load();

        List<RecurringItem> items = reloaded.getRecurringItems(GROUP);
        assertEquals(1, items.size());
        assertEquals(stored, items.get(0));
        assertEquals(MediaType.PHOTO, items.get(0).getMediaType());
        assertEquals(List.of("scam"), reloaded.getBannedWords(GROUP));
        assertTrue(reloaded.isBlockLinks(GROUP));
        assertEquals(Map.of(OTHER_GROUP, false), reloaded.getMentionBlockingSettings());
        assertEquals(Map.of("price", "See website"), reloaded.getAutoReplies(GROUP));
        assertTrue(files.get(SNAPSHOT_KEY).contains("\"recurringMessages\""));
        assertTrue(files.get(SNAPSHOT_KEY).contains("\"photo\""));
    }

    @Test
    void shouldAssignIdsToItemsLoadedWithoutOne() {
        files.put(SNAPSHOT_KEY, "{\"recurringMessages\":{\"-100123\":[{\"text\":\"Hi\",\"intervalMinutes\":5}]}}");

        ConfigStore legacy = new ConfigStore(storagePort, objectMapper, properties);
        legacy.load();

        RecurringItem loaded = legacy.getRecurringItems(GROUP).get(0);
        assertNotNull(loaded.getId());
        assertEquals(8, loaded.getId().length());
        assertTrue(loaded.getButtons().isEmpty());
        assertTrue(legacy.getBannedWords(GROUP).isEmpty());
        assertTrue(files.get(SNAPSHOT_KEY).contains(loaded.getId()));
    }

    @Test
    void shouldFailToLoadMalformedSnapshot() {
        files.put(SNAPSHOT_KEY, "{ not json");

        ConfigStore broken = new ConfigStore(storagePort, objectMapper, properties);

        assertThrows(ConfigPersistenceException.class, broken::load);
    }

    @Test
    void shouldPropagateFlushFailure() {
        when(storagePort.putTextAtomic(anyString(), anyString(), anyString(), anyBoolean()))
                .thenReturn(CompletableFuture.failedFuture(new UncheckedIOException(new IOException("disk full"))));

        assertThrows(ConfigPersistenceException.class, () -> store.addBannedWord(GROUP, "scam"));
    }

    @Test
    void shouldMarkSentOnlyForExistingItem() {
        RecurringItem stored = store.addRecurringItem(GROUP, item("Hello", 10));

        assertTrue(store.markSent(GROUP, stored.getId(), 1_000L, 42));
        assertFalse(store.markSent(GROUP, "missing", 1_000L, 43));

        RecurringItem updated = store.getRecurringItems(GROUP).get(0);
        assertEquals(1_000L, updated.getLastSentAt());
        assertEquals(42, updated.getLastMessageId());
    }

    @Test
    void shouldKeepPreviousMessageIdWhenNoneGiven() {
        RecurringItem stored = store.addRecurringItem(GROUP, item("Hello", 10));
        store.markSent(GROUP, stored.getId(), 1_000L, 42);

        store.markSent(GROUP, stored.getId(), 2_000L, null);

        RecurringItem updated = store.getRecurringItems(GROUP).get(0);
        assertEquals(2_000L, updated.getLastSentAt());
        assertEquals(42, updated.getLastMessageId());
    }

    @Test
    void shouldStoreNewItemAsNeverSent() {
        RecurringItem stored = store.addRecurringItem(GROUP, item("Hello", 10));

        assertNotNull(stored.getId());
        assertEquals(0L, stored.getLastSentAt());
        assertNull(stored.getLastMessageId());
    }

    @Test
    void shouldReturnDetachedCopies() {
        store.addRecurringItem(GROUP, item("Hello", 10));

        Map<String, List<RecurringItem>> copy = store.snapshotRecurringItems();
        copy.get(GROUP).get(0).setText("changed");
        copy.get(GROUP).get(0).getButtons().add(new ButtonLink("x", "y"));

        RecurringItem original = store.getRecurringItems(GROUP).get(0);
        assertEquals("Hello", original.getText());
        assertTrue(original.getButtons().isEmpty());
    }

    @Test
    void shouldKeepAutoReplyInsertionOrderAndOverwriteTrigger() {
        store.addAutoReply(GROUP, "hello", "Hi!");
        store.addAutoReply(GROUP, "price", "Cheap");
        store.addAutoReply(GROUP, "HELLO", "Welcome!");

        Map<String, String> replies = store.getAutoReplies(GROUP);
        assertEquals(List.of("hello", "price"), List.copyOf(replies.keySet()));
        assertEquals("Welcome!", replies.get("hello"));

        assertTrue(store.removeAutoReply(GROUP, "Price"));
        assertFalse(store.removeAutoReply(GROUP, "price"));
        assertEquals(List.of("hello"), List.copyOf(store.getAutoReplies(GROUP).keySet()));
    }

    @Test
    void shouldIsolateTenants() {
        store.addBannedWord(GROUP, "scam");
        store.setBlockMentions(GROUP, true);

        TenantPolicy other = store.getPolicy(OTHER_GROUP);
        assertTrue(other.bannedWords().isEmpty());
        assertFalse(other.blockMentions());
        assertTrue(other.autoReplies().isEmpty());
    }
}
