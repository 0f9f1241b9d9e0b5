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

import java.util.List;

/**
 * Fully composed message as it appears in a chat: text (or caption), optional
 * media and URL buttons. Shared by the scheduler and the wizard preview so both
 * render identically.
 */
public record OutboundPost(String text, String media, MediaType mediaType, List<ButtonLink> buttons) {

    public OutboundPost {
        buttons = buttons != null ? List.copyOf(buttons) : List.of();
    }

    public boolean hasMedia() {
        return media != null && !media.isBlank() && mediaType != null;
    }

    public boolean hasText() {
        return text != null && !text.isEmpty();
    }
}
