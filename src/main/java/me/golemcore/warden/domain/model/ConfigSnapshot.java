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

package me.golemcore.warden.domain.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Whole-document persisted state, keyed by tenant (group chat) id in canonical
 * string form. Fields absent from an older snapshot default to empty.
 */
@Data
@NoArgsConstructor
public class ConfigSnapshot {

    private Map<String, List<RecurringItem>> recurringMessages = new LinkedHashMap<>();
    private Map<String, List<String>> bannedWords = new LinkedHashMap<>();
    private Map<String, Boolean> blockLinks = new LinkedHashMap<>();
    private Map<String, Boolean> blockMentions = new LinkedHashMap<>();
    private Map<String, Map<String, String>> autoReplies = new LinkedHashMap<>();

    /**
     * Replaces null collections left by a partial document with empty ones.
     */
    public ConfigSnapshot normalize() {
        if (recurringMessages == null) {
            recurringMessages = new LinkedHashMap<>();
        }
        if (bannedWords == null) {
            bannedWords = new LinkedHashMap<>();
        }
        if (blockLinks == null) {
            blockLinks = new LinkedHashMap<>();
        }
        if (blockMentions == null) {
            blockMentions = new LinkedHashMap<>();
        }
        if (autoReplies == null) {
            autoReplies = new LinkedHashMap<>();
        }
        recurringMessages.replaceAll((chatId, items) -> items != null ? new ArrayList<>(items) : new ArrayList<>());
        bannedWords.replaceAll((chatId, words) -> words != null ? new ArrayList<>(words) : new ArrayList<>());
        autoReplies.replaceAll((chatId, replies) -> replies != null
                ? new LinkedHashMap<>(replies)
                : new LinkedHashMap<>());
        return this;
    }
}
