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

package me.golemcore.warden.broadcast;

import me.golemcore.warden.domain.exception.ChatTransportException;
import me.golemcore.warden.domain.model.RecurringItem;
import me.golemcore.warden.domain.service.ConfigStore;
import me.golemcore.warden.infrastructure.config.BotProperties;
import me.golemcore.warden.port.outbound.ChatTransportPort;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic driver that re-sends recurring messages to their groups.
 *
 * <p>
 * This component runs a background thread that:
 * <ul>
 * <li>Ticks at a fixed cadence (default 30 seconds), independent of item
 * intervals</li>
 * <li>Sends every item whose interval has elapsed since its last delivery</li>
 * <li>Optionally deletes the previous instance and pins the new one</li>
 * <li>Records the delivery through {@link ConfigStore#markSent}</li>
 * </ul>
 *
 * <p>
 * Due-ness is computed from absolute elapsed time, so ticks missed while the
 * process was down are absorbed on the next one. A failed send leaves the item
 * due and it is retried on the next tick. Execution is non-interruptible: if a
 * tick is still running, the next one is skipped.
 *
 * @since 1.0
 * @see ConfigStore
 */
@Component
@Slf4j
public class BroadcastScheduler {

    private final ConfigStore configStore;
    private final ChatTransportPort transport;
    private final BotProperties properties;
    private final Clock clock;
    private final AtomicBoolean executing = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    public BroadcastScheduler(ConfigStore configStore, ChatTransportPort transport, BotProperties properties,
            Clock clock) {
        this.configStore = configStore;
        this.transport = transport;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        BotProperties.BroadcastProperties broadcast = properties.getBroadcast();
        if (!broadcast.isEnabled()) {
            log.info("[Broadcast] Recurring messages disabled");
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "broadcast-scheduler");
            t.setDaemon(true);
            return t;
        });

        tickTask = scheduler.scheduleAtFixedRate(
                this::tick,
                broadcast.getInitialDelaySeconds(),
                broadcast.getTickIntervalSeconds(),
                TimeUnit.SECONDS);

        log.info("[Broadcast] Started with tick interval: {}s", broadcast.getTickIntervalSeconds());
    }

    @PreDestroy
    public void shutdown() {
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[Broadcast] Shut down");
    }

    void tick() {
        if (!executing.compareAndSet(false, true)) {
            log.debug("[Broadcast] Tick skipped: previous execution still in progress");
            return;
        }
        try {
            long now = clock.instant().getEpochSecond();
            Map<String, List<RecurringItem>> items = configStore.snapshotRecurringItems();
            for (Map.Entry<String, List<RecurringItem>> entry : items.entrySet()) {
                for (RecurringItem item : entry.getValue()) {
                    processItem(entry.getKey(), item, now);
                }
            }
        } catch (Exception e) {
            log.error("[Broadcast] Tick failed: {}", e.getMessage(), e);
        } finally {
            executing.set(false);
        }
    }

    private void processItem(String chatId, RecurringItem item, long now) {
        try {
            if (!item.isDue(now)) {
                return;
            }
            if (!item.hasText() && !item.hasMedia()) {
                log.warn("[Broadcast] Item {} in chat {} has neither text nor media, skipping", item.getId(), chatId);
                return;
            }

            if (item.isDeletePrevious() && item.getLastMessageId() != null) {
                try {
                    transport.deleteMessage(chatId, item.getLastMessageId());
                } catch (ChatTransportException e) {
                    log.warn("[Broadcast] Failed to delete previous message {} in chat {}: {}",
                            item.getLastMessageId(), chatId, e.getMessage());
                }
            }

            int messageId;
            try {
                messageId = transport.sendPost(chatId, item.toPost());
            } catch (ChatTransportException e) {
                log.error("[Broadcast] Failed to send item {} to chat {}, will retry: {}",
                        item.getId(), chatId, e.getMessage());
                return;
            }

            if (item.isPinMessage()) {
                try {
                    transport.pinMessage(chatId, messageId);
                } catch (ChatTransportException e) {
                    log.warn("[Broadcast] Failed to pin message {} in chat {}: {}", messageId, chatId, e.getMessage());
                }
            }

            if (!configStore.markSent(chatId, item.getId(), now, messageId)) {
                log.debug("[Broadcast] Item {} removed from chat {} during send", item.getId(), chatId);
                return;
            }
            log.info("[Broadcast] Sent item {} to chat {} (message {})", item.getId(), chatId, messageId);
        } catch (Exception e) {
            log.error("[Broadcast] Failed to process item {} in chat {}: {}", item.getId(), chatId,
                    e.getMessage(), e);
        }
    }
}
