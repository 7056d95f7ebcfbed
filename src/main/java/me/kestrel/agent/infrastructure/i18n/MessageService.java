package me.kestrel.agent.infrastructure.i18n;

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

import me.kestrel.agent.infrastructure.config.BotProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.Map;
import java.util.MissingResourceException;
import java.util.Optional;
import java.util.ResourceBundle;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Localized user-facing strings: command replies, fallbacks and tool error
 * messages, from {@code messages_<lang>.properties}.
 *
 * <p>
 * Lookup goes to the active language first, then to English. A key that
 * neither has is returned unchanged so a missing translation shows up in the
 * chat instead of failing the turn.
 */
@Service
@Slf4j
public class MessageService {

    public static final String LANG_EN = "en";
    public static final String LANG_RU = "ru";
    public static final String DEFAULT_LANG = LANG_EN;

    private static final String BUNDLE_NAME = "messages";
    private static final Set<String> SUPPORTED_LANGUAGES = Set.of(LANG_EN, LANG_RU);
    private static final ResourceBundle.Control NO_FALLBACK = ResourceBundle.Control
            .getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES);

    private final Map<String, Optional<ResourceBundle>> bundles = new ConcurrentHashMap<>();
    private volatile String language = DEFAULT_LANG;

    public MessageService(BotProperties properties) {
        setLanguage(properties.getPrompts().getLanguage());
    }

    public String getMessage(String key, Object... args) {
        String pattern = lookup(language, key)
                .or(() -> LANG_EN.equals(language) ? Optional.<String>empty() : lookup(LANG_EN, key))
                .orElse(null);
        if (pattern == null) {
            log.warn("Missing message key: {} (language {})", key, language);
            return key;
        }
        return args == null || args.length == 0 ? pattern : MessageFormat.format(pattern, args);
    }

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String lang) {
        String normalized = lang != null ? lang.trim().toLowerCase(Locale.ROOT) : null;
        if (normalized == null || !SUPPORTED_LANGUAGES.contains(normalized)) {
            log.warn("Unsupported language: {}, using {}", lang, DEFAULT_LANG);
            normalized = DEFAULT_LANG;
        }
        language = normalized;
    }

    private Optional<String> lookup(String lang, String key) {
        return bundles.computeIfAbsent(lang, MessageService::loadBundle)
                .filter(bundle -> bundle.containsKey(key))
                .map(bundle -> bundle.getString(key));
    }

    private static Optional<ResourceBundle> loadBundle(String lang) {
        try {
            return Optional.of(ResourceBundle.getBundle(BUNDLE_NAME, Locale.forLanguageTag(lang), NO_FALLBACK));
        } catch (MissingResourceException e) {
            log.warn("No message bundle for language: {}", lang);
            return Optional.empty();
        }
    }
}
