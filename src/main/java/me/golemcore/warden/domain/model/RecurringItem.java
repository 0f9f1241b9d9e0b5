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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A persisted broadcast definition that the scheduler re-sends to its group
 * every {@code intervalMinutes}.
 *
 * <p>
 * {@code lastSentAt} is epoch seconds, {@code 0} meaning never sent. Only the
 * scheduler advances {@code lastSentAt} and {@code lastMessageId}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RecurringItem {

    private String id;
    private String text;
    private String media;
    private MediaType mediaType;

    @Builder.Default
    private List<ButtonLink> buttons = new ArrayList<>();

    private int intervalMinutes;
    private boolean deletePrevious;
    private boolean pinMessage;
    private long lastSentAt;
    private Integer lastMessageId;

    @JsonIgnore
    public boolean hasMedia() {
        return media != null && !media.isBlank() && mediaType != null;
    }

    @JsonIgnore
    public boolean hasText() {
        return text != null && !text.isEmpty();
    }

    /**
     * Whether the item is due at {@code nowEpochSeconds}. Items never sent are
     * always due.
     */
    @JsonIgnore
    public boolean isDue(long nowEpochSeconds) {
        long elapsed = nowEpochSeconds - lastSentAt;
        return elapsed >= (long) intervalMinutes * 60;
    }

    public OutboundPost toPost() {
        return new OutboundPost(text, media, mediaType, buttons);
    }

    /**
     * Deep copy, detached from the stored list.
     */
    public RecurringItem copy() {
        return toBuilder()
                .buttons(buttons != null ? new ArrayList<>(buttons) : new ArrayList<>())
                .build();
    }
}
