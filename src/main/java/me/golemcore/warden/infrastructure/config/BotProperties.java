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

package me.golemcore.warden.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Centralized configuration properties for the bot, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code bot.*} prefix:
 * <ul>
 * <li>{@link TelegramProperties} - bot token and polling switch</li>
 * <li>{@link StorageProperties} - snapshot location</li>
 * <li>{@link BroadcastProperties} - recurring message scheduler</li>
 * <li>{@link ModerationProperties} - group filter side effects</li>
 * <li>{@link WizardProperties} - recurring message wizard</li>
 * <li>{@link HttpProperties} - transport timeouts</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private TelegramProperties telegram = new TelegramProperties();
    private StorageProperties storage = new StorageProperties();
    private BroadcastProperties broadcast = new BroadcastProperties();
    private ModerationProperties moderation = new ModerationProperties();
    private WizardProperties wizard = new WizardProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class TelegramProperties {
        private boolean enabled = true;
        private String token;
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
        private String directory = "config";
        private String snapshotFile = "bot_data.json";
        private boolean backup = true;
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "data";
    }

    @Data
    public static class BroadcastProperties {
        private boolean enabled = true;
        private int initialDelaySeconds = 10;
        private int tickIntervalSeconds = 30;
        private String parseMode = "Markdown";
    }

    @Data
    public static class ModerationProperties {
        private int warningTtlSeconds = 3;
    }

    @Data
    public static class WizardProperties {
        private int sessionTtlMinutes = 60;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private long callTimeout = 90000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
