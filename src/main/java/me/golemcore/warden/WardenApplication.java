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

package me.golemcore.warden;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Warden.
 *
 * <p>
 * Warden is a multi-tenant Telegram bot for group moderation and scheduled
 * broadcasting, built with Spring Boot 3.4.2. Any admin of a group configures
 * it from a private chat with the bot.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Recurring Messages</b> - text, photo, video or GIF with URL buttons,
 * re-sent on an interval, optionally replacing and pinning the previous
 * one</li>
 * <li><b>Wizard</b> - step-by-step private conversation with a live preview
 * before saving</li>
 * <li><b>Moderation</b> - banned words, link and mention blocking for
 * non-admins</li>
 * <li><b>Auto Replies</b> - keyword triggered answers for everyone</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → TelegramAdapter, TelegramMenuHandler, CommandRouter
 * Domain Layer       → ConfigStore, ModerationEngine, WizardEngine, AdminGuard
 * Scheduling         → BroadcastScheduler
 * Infrastructure     → Telegram transport, local storage
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code bot.*}
 * prefix. The bot token comes from the {@code BOT_TOKEN} environment variable.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class WardenApplication {

    public static void main(String[] args) {
        SpringApplication.run(WardenApplication.class, args);
    }

}
