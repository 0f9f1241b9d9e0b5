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

/**
 * Outcome of classifying one group message. An auto reply and a deletion are
 * independent: a member's message can trigger a reply and still be removed.
 *
 * @param autoReply
 *            reply text of the first matching trigger, or null
 * @param deleteReason
 *            the policy that requires removal, or null
 */
public record ModerationDecision(String autoReply, DeleteReason deleteReason) {

    private static final ModerationDecision ALLOW = new ModerationDecision(null, null);

    public static ModerationDecision allow() {
        return ALLOW;
    }

    public boolean hasAutoReply() {
        return autoReply != null;
    }

    public boolean shouldDelete() {
        return deleteReason != null;
    }

    public boolean isAllow() {
        return autoReply == null && deleteReason == null;
    }
}
