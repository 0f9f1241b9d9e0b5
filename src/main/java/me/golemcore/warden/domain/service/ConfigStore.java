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

import me.golemcore.warden.domain.exception.ConfigPersistenceException;
import me.golemcore.warden.domain.model.ConfigSnapshot;
import me.golemcore.warden.domain.model.RecurringItem;
import me.golemcore.warden.domain.model.TenantPolicy;
import me.golemcore.warden.infrastructure.config.BotProperties;
import me.golemcore.warden.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable per-group configuration: recurring messages, banned words, link and
 * mention blocking, auto replies. Persisted as one JSON document via
 * {@link StoragePort}.
 *
 * <p>
 * This is the only component that mutates durable state. Every mutator is
 * {@code synchronized} and rewrites the whole snapshot before returning, so a
 * read-modify-flush is one critical section across the update loop, the
 * scheduler thread and command executions. Readers get detached copies.
 *
 * <p>
 * Group ids are canonical decimal strings (see {@link #canonicalChatId}).
 * Callers must pass ids through it so {@code "-100123"} and {@code " -100123"}
 * never become two tenants.
 */
@Service
@Slf4j
public class ConfigStore {

    private static final int ITEM_ID_LENGTH = 8;

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final String directory;
    private final String snapshotFile;
    private final boolean backup;

    private ConfigSnapshot snapshot = new ConfigSnapshot();

    public ConfigStore(StoragePort storagePort, ObjectMapper objectMapper, BotProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        BotProperties.StorageProperties storage = properties.getStorage();
        this.directory = storage.getDirectory();
        this.snapshotFile = storage.getSnapshotFile();
        this.backup = storage.isBackup();
    }

    /**
     * Normalize a platform chat id to the canonical tenant key.
     *
     * @throws IllegalArgumentException
     *             if the value is not an integer
     */
    public static String canonicalChatId(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Chat id is empty");
        }
        try {
            return Long.toString(Long.parseLong(raw.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid chat id: " + raw, e);
        }
    }

    public static String canonicalChatId(long chatId) {
        return Long.toString(chatId);
    }

    // ==================== Lifecycle ====================

    /**
     * Load the snapshot. A missing file yields an empty configuration; an
     * unreadable one is fatal so that it is never overwritten with nothing.
     */
    @PostConstruct
    public synchronized void load() {
        String json;
        try {
            json = storagePort.getText(directory, snapshotFile).join();
        } catch (RuntimeException e) {
            log.error("[Config] Failed to read snapshot {}/{}", directory, snapshotFile, e);
            throw new ConfigPersistenceException("Failed to read configuration snapshot", e);
        }
        if (json == null || json.isBlank()) {
            snapshot = new ConfigSnapshot();
            log.info("[Config] No snapshot found, starting with empty configuration");
            return;
        }
        try {
            ConfigSnapshot loaded = objectMapper.readValue(json, ConfigSnapshot.class);
            snapshot = loaded != null ? loaded.normalize() : new ConfigSnapshot();
        } catch (JsonProcessingException e) {
            log.error("[Config] Snapshot {}/{} is not valid JSON", directory, snapshotFile, e);
            throw new ConfigPersistenceException("Malformed configuration snapshot", e);
        }
        int assigned = assignMissingIds();
        log.info("[Config] Loaded configuration for {} groups with recurring messages",
                snapshot.getRecurringMessages().size());
        if (assigned > 0) {
            log.info("[Config] Assigned ids to {} recurring messages", assigned);
            save();
        }
    }

    /**
     * Rewrite the whole snapshot.
     *
     * @throws ConfigPersistenceException
     *             if serialization or the write fails
     */
    public synchronized void save() {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot);
            storagePort.putTextAtomic(directory, snapshotFile, json, backup).join();
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("[Config] Failed to save configuration snapshot", e);
            throw new ConfigPersistenceException("Failed to save configuration snapshot", e);
        }
    }

    // ==================== Recurring messages ====================

    public synchronized List<RecurringItem> getRecurringItems(String chatId) {
        return snapshot.getRecurringMessages().getOrDefault(chatId, List.of()).stream()
                .map(RecurringItem::copy)
                .toList();
    }

    /**
     * Detached copy of every group's recurring messages, in stored order.
     */
    public synchronized Map<String, List<RecurringItem>> snapshotRecurringItems() {
        Map<String, List<RecurringItem>> copy = new LinkedHashMap<>();
        snapshot.getRecurringMessages().forEach((chatId, items) -> copy.put(chatId,
                items.stream().map(RecurringItem::copy).toList()));
        return copy;
    }

    /**
     * Append an item to the group's list. An id is assigned if missing.
     *
     * @return the stored copy
     */
    public synchronized RecurringItem addRecurringItem(String chatId, RecurringItem item) {
        RecurringItem stored = item.copy();
        if (stored.getId() == null || stored.getId().isBlank()) {
            stored.setId(newItemId());
        }
        snapshot.getRecurringMessages().computeIfAbsent(chatId, key -> new ArrayList<>()).add(stored);
        save();
        log.info("[Config] Added recurring message {} to group {} (every {} min)",
                stored.getId(), chatId, stored.getIntervalMinutes());
        return stored.copy();
    }

    /**
     * Remove the item at {@code index}. Out-of-range indexes are ignored.
     *
     * @return the removed item, if any
     */
    public synchronized Optional<RecurringItem> removeRecurringItem(String chatId, int index) {
        List<RecurringItem> items = snapshot.getRecurringMessages().get(chatId);
        if (items == null || index < 0 || index >= items.size()) {
            log.debug("[Config] No recurring message #{} in group {}", index, chatId);
            return Optional.empty();
        }
        RecurringItem removed = items.remove(index);
        save();
        log.info("[Config] Removed recurring message {} from group {}", removed.getId(), chatId);
        return Optional.of(removed.copy());
    }

    /**
     * Record a delivery of item {@code itemId}.
     *
     * @param messageId
     *            id of the new message, or null to keep the previous one
     * @return false if the item no longer exists
     */
    public synchronized boolean markSent(String chatId, String itemId, long sentAtEpochSeconds, Integer messageId) {
        Optional<RecurringItem> target = snapshot.getRecurringMessages().getOrDefault(chatId, List.of()).stream()
                .filter(item -> itemId.equals(item.getId()))
                .findFirst();
        if (target.isEmpty()) {
            return false;
        }
        RecurringItem item = target.get();
        item.setLastSentAt(sentAtEpochSeconds);
        if (messageId != null) {
            item.setLastMessageId(messageId);
        }
        save();
        return true;
    }

    // ==================== Banned words ====================

    public synchronized List<String> getBannedWords(String chatId) {
        return List.copyOf(snapshot.getBannedWords().getOrDefault(chatId, List.of()));
    }

    /**
     * Add a lower-cased banned word.
     *
     * @return false if the word was already banned
     */
    public synchronized boolean addBannedWord(String chatId, String word) {
        String normalized = word.toLowerCase(Locale.ROOT);
        List<String> words = snapshot.getBannedWords().computeIfAbsent(chatId, key -> new ArrayList<>());
        if (words.stream().anyMatch(existing -> existing.equalsIgnoreCase(normalized))) {
            return false;
        }
        words.add(normalized);
        save();
        return true;
    }

    /**
     * Remove a banned word, case-insensitively.
     *
     * @return false if the word was not banned
     */
    public synchronized boolean removeBannedWord(String chatId, String word) {
        List<String> words = snapshot.getBannedWords().get(chatId);
        if (words == null) {
            return false;
        }
        boolean removed = words.removeIf(existing -> existing.equalsIgnoreCase(word));
        if (removed) {
            save();
        }
        return removed;
    }

    // ==================== Link / mention blocking ====================

    public synchronized boolean isBlockLinks(String chatId) {
        return Boolean.TRUE.equals(snapshot.getBlockLinks().get(chatId));
    }

    public synchronized void setBlockLinks(String chatId, boolean enabled) {
        snapshot.getBlockLinks().put(chatId, enabled);
        save();
    }

    public synchronized boolean isBlockMentions(String chatId) {
        return Boolean.TRUE.equals(snapshot.getBlockMentions().get(chatId));
    }

    public synchronized void setBlockMentions(String chatId, boolean enabled) {
        snapshot.getBlockMentions().put(chatId, enabled);
        save();
    }

    /**
     * Groups that have a link blocking setting stored, with its value.
     */
    public synchronized Map<String, Boolean> getLinkBlockingSettings() {
        return new LinkedHashMap<>(snapshot.getBlockLinks());
    }

    /**
     * Groups that have a mention blocking setting stored, with its value.
     */
    public synchronized Map<String, Boolean> getMentionBlockingSettings() {
        return new LinkedHashMap<>(snapshot.getBlockMentions());
    }

    // ==================== Auto replies ====================

    /**
     * Trigger to reply, in insertion order.
     */
    public synchronized Map<String, String> getAutoReplies(String chatId) {
        return new LinkedHashMap<>(snapshot.getAutoReplies().getOrDefault(chatId, Map.of()));
    }

    /**
     * Add or replace the reply for a lower-cased trigger. Replacing keeps the
     * trigger's original position.
     */
    public synchronized void addAutoReply(String chatId, String trigger, String reply) {
        snapshot.getAutoReplies().computeIfAbsent(chatId, key -> new LinkedHashMap<>())
                .put(trigger.toLowerCase(Locale.ROOT), reply);
        save();
    }

    /**
     * @return false if no reply was registered for the trigger
     */
    public synchronized boolean removeAutoReply(String chatId, String trigger) {
        Map<String, String> replies = snapshot.getAutoReplies().get(chatId);
        if (replies == null || replies.remove(trigger.toLowerCase(Locale.ROOT)) == null) {
            return false;
        }
        save();
        return true;
    }

    // ==================== Policy view ====================

    public synchronized TenantPolicy getPolicy(String chatId) {
        return new TenantPolicy(
                snapshot.getBannedWords().getOrDefault(chatId, List.of()),
                isBlockLinks(chatId),
                isBlockMentions(chatId),
                snapshot.getAutoReplies().getOrDefault(chatId, Map.of()));
    }

    private int assignMissingIds() {
        int assigned = 0;
        for (List<RecurringItem> items : snapshot.getRecurringMessages().values()) {
            for (RecurringItem item : items) {
                if (item.getId() == null || item.getId().isBlank()) {
                    item.setId(newItemId());
                    assigned++;
                }
                if (item.getButtons() == null) {
                    item.setButtons(new ArrayList<>());
                }
            }
        }
        return assigned;
    }

    private static String newItemId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, ITEM_ID_LENGTH);
    }
}
