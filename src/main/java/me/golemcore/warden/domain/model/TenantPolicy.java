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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of one tenant's moderation settings.
 *
 * @param bannedWords
 *            lower-cased banned words in insertion order
 * @param autoReplies
 *            lower-cased trigger to reply, in insertion order
 */
public record TenantPolicy(List<String> bannedWords, boolean blockLinks, boolean blockMentions,
        Map<String, String> autoReplies) {

    public TenantPolicy {
        bannedWords = bannedWords != null ? List.copyOf(bannedWords) : List.of();
        autoReplies = autoReplies != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(autoReplies))
                : Map.of();
    }

    public static TenantPolicy empty() {
        return new TenantPolicy(List.of(), false, false, Map.of());
    }
}
