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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * In-memory draft of a recurring message, owned by one user. Never persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WizardSession {

    private long userId;

    @Builder.Default
    private WizardStep step = WizardStep.AWAITING_CHAT_ID;

    private String chatId;
    private String text;
    private String media;
    private MediaType mediaType;

    @Builder.Default
    private List<ButtonLink> buttons = new ArrayList<>();

    private Integer intervalMinutes;
    private boolean deletePrevious;
    private boolean pinMessage;
    private Instant updatedAt;

    public boolean hasContent() {
        boolean hasText = text != null && !text.isEmpty();
        boolean hasMedia = media != null && mediaType != null;
        return hasText || hasMedia;
    }

    public OutboundPost toPost() {
        return new OutboundPost(text, media, mediaType, buttons);
    }
}
