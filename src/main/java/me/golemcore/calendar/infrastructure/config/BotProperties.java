package me.golemcore.calendar.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the bot, bound from
 * application.properties.
 *
 * <p>
 * All bot configuration is organized under the {@code bot.*} prefix:
 * <ul>
 * <li>{@link ChannelProperties} - input channels (Telegram)</li>
 * <li>{@link StorageProperties} - persistence configuration</li>
 * <li>{@link ReminderProperties} - catalog location, timer pool, timeouts</li>
 * <li>{@link RenderProperties} - headless browser used for calendar images</li>
 * </ul>
 *
 * <p>
 * Lead time and rollover time are fixed constants of
 * {@link me.golemcore.calendar.auto.ReminderScheduler} and are not configurable.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private Map<String, ChannelProperties> channels = new HashMap<>();
    private StorageProperties storage = new StorageProperties();
    private ReminderProperties reminder = new ReminderProperties();
    private RenderProperties render = new RenderProperties();

    @Data
    public static class ChannelProperties {
        private boolean enabled = false;
        private String token;

        /** User ids always treated as admins, regardless of chat role. */
        private List<String> admins = new ArrayList<>();
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/calendar";
    }

    // ==================== REMINDER ====================

    @Data
    public static class ReminderProperties {
        private String directory = "reminder";
        private String catalogFile = "activities.json";
        private String configFile = "groups.json";
        private int schedulerPoolSize = 2;
        private Duration renderTimeout = Duration.ofSeconds(30);
        private Duration sendTimeout = Duration.ofSeconds(20);
        private String language = "en";
    }

    // ==================== RENDER ====================

    @Data
    public static class RenderProperties {
        private boolean enabled = true;
        private boolean headless = true;

        /** Page operation timeout in milliseconds. */
        private int timeout = 15000;
        private String watermark = "";
    }
}
