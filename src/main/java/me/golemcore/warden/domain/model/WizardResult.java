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
 * What happened to a wizard input and which prompt to show next.
 *
 * @param status
 *            outcome of the input
 * @param step
 *            step the session is in after the input (null when there is no
 *            session)
 * @param messageKey
 *            localized prompt or error to show, null when the renderer picks the
 *            prompt of {@code step}
 * @param session
 *            snapshot of the session after the input, or null
 * @param savedItem
 *            the persisted item when {@code status} is {@link Status#SAVED}
 */
public record WizardResult(Status status, WizardStep step, String messageKey, WizardSession session,
        RecurringItem savedItem) {

    public enum Status {
        /** Input accepted, session moved to {@code step}. */
        ADVANCED,
        /** Input invalid, same step must be prompted again. */
        REJECTED,
        /** Input is not the kind the current step waits for. */
        IGNORED,
        /** No open session for the user. */
        NO_SESSION,
        /** Session converted into a stored item and closed. */
        SAVED
    }

    public static WizardResult advanced(WizardSession session) {
        return new WizardResult(Status.ADVANCED, session.getStep(), null, session, null);
    }

    public static WizardResult rejected(WizardSession session, String messageKey) {
        return new WizardResult(Status.REJECTED, session.getStep(), messageKey, session, null);
    }

    public static WizardResult ignored(WizardSession session) {
        return new WizardResult(Status.IGNORED, session.getStep(), null, session, null);
    }

    public static WizardResult noSession() {
        return new WizardResult(Status.NO_SESSION, null, null, null, null);
    }

    public static WizardResult saved(WizardSession session, RecurringItem item) {
        return new WizardResult(Status.SAVED, WizardStep.FINALIZED, null, session, item);
    }
}
