package me.golemcore.calendar.infrastructure.i18n;

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

import me.golemcore.calendar.infrastructure.config.BotProperties;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.text.MessageFormat;
import java.time.DayOfWeek;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Localized texts for reminders, commands and the rendered calendar.
 *
 * <p>
 * Bundles are {@code messages.properties} (English) and
 * {@code messages_zh.properties}. The bot speaks one language, chosen by
 * {@code bot.reminder.language}; an unknown value falls back to English. A
 * missing key renders as the key itself.
 */
@Service
@Slf4j
public class MessageService {

    public static final String LANG_EN = "en";
    public static final String LANG_ZH = "zh";
    public static final String DEFAULT_LANG = LANG_EN;

    private static final List<String> SUPPORTED_LANGUAGES = List.of(LANG_EN, LANG_ZH);

    private final Map<String, ResourceBundle> bundles = new LinkedHashMap<>();

    @Getter
    private final String language;

    public MessageService(BotProperties properties) {
        for (String lang : SUPPORTED_LANGUAGES) {
            try {
                bundles.put(lang, ResourceBundle.getBundle("messages", Locale.forLanguageTag(lang),
                        ResourceBundle.Control.getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES)));
            } catch (MissingResourceException e) {
                log.warn("[I18n] No message bundle for {}", lang);
            }
        }
        String configured = properties.getReminder().getLanguage();
        if (configured != null && SUPPORTED_LANGUAGES.contains(configured)) {
            language = configured;
        } else {
            log.warn("[I18n] Unsupported language {}, using {}", configured, DEFAULT_LANG);
            language = DEFAULT_LANG;
        }
    }

    public String getMessage(String key, Object... args) {
        return getMessage(key, language, args);
    }

    public String getMessage(String key, String lang, Object... args) {
        ResourceBundle bundle = bundles.getOrDefault(lang, bundles.get(DEFAULT_LANG));
        if (bundle == null) {
            return key;
        }
        try {
            String pattern = bundle.getString(key);
            return args != null && args.length > 0 ? MessageFormat.format(pattern, args) : pattern;
        } catch (MissingResourceException e) {
            log.warn("[I18n] Missing message key {} for {}", key, lang);
            return key;
        }
    }

    /**
     * Localized weekday name, e.g. "Monday" or "星期一".
     */
    public String weekdayName(DayOfWeek day) {
        return getMessage("calendar.weekday." + day.name());
    }
}
