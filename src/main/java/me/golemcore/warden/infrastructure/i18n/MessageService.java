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

package me.golemcore.warden.infrastructure.i18n;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Localized bot messages.
 *
 * <p>
 * Messages are loaded from the {@code messages_<lang>.properties} bundle.
 * Parametric messages use {@link MessageFormat} syntax; pass identifiers and
 * counts as strings so they are not number-formatted.
 *
 * <p>
 * If a key is missing, the key itself is returned.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class MessageService {

    public static final String DEFAULT_LANG = "en";

    private final ResourceBundle bundle;

    public MessageService() {
        this(DEFAULT_LANG);
    }

    MessageService(String lang) {
        this.bundle = loadBundle(lang);
    }

    private static ResourceBundle loadBundle(String lang) {
        try {
            ResourceBundle loaded = ResourceBundle.getBundle("messages", Locale.forLanguageTag(lang));
            log.info("Loaded message bundle for language: {}", lang);
            return loaded;
        } catch (MissingResourceException e) {
            log.warn("Failed to load message bundle for language: {}", lang);
            return null;
        }
    }

    /**
     * Get a message, formatting {@code args} into it when present.
     */
    public String getMessage(String key, Object... args) {
        if (bundle == null) {
            return key;
        }
        try {
            String message = bundle.getString(key);
            if (args != null && args.length > 0) {
                return MessageFormat.format(message, args);
            }
            return message;
        } catch (MissingResourceException e) {
            log.warn("Missing message key: {}", key);
            return key;
        }
    }
}
