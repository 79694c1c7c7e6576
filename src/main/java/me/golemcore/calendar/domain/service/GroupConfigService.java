package me.golemcore.calendar.domain.service;

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

import me.golemcore.calendar.domain.model.GroupConfig;
import me.golemcore.calendar.infrastructure.config.BotProperties;
import me.golemcore.calendar.port.outbound.StoragePort;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Persists per-group reminder settings in {@code reminder/groups.json}.
 *
 * <p>
 * Files are always written in the canonical shape:
 *
 * <pre>
 * {"-100123": {"event_reminder": {"enabled": true}}}
 * </pre>
 *
 * <p>
 * Older files are accepted in legacy shapes and normalized on read: the flag
 * under {@code event_reminder} next to other feature objects such as
 * {@code scheduled_send}, a bare {@code enabled} field, or a bare boolean.
 * Flags of other features are ignored and anything else reads as disabled. An
 * unreadable file yields an empty configuration.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GroupConfigService {

    static final String EVENT_REMINDER_KEY = "event_reminder";
    static final String ENABLED_KEY = "enabled";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final BotProperties properties;

    private final Map<String, GroupConfig> configs = new ConcurrentHashMap<>();

    @PostConstruct
    public void init() {
        configs.clear();
        configs.putAll(load());
        log.info("[GroupConfig] Loaded {} groups, {} enabled", configs.size(), getEnabledGroupIds().size());
    }

    @PreDestroy
    public void shutdown() {
        save(snapshot());
    }

    public boolean isEnabled(String groupId) {
        GroupConfig config = configs.get(groupId);
        return config != null && config.isEnabled();
    }

    /**
     * Enabled group ids in a stable order.
     */
    public List<String> getEnabledGroupIds() {
        return configs.entrySet().stream()
                .filter(e -> e.getValue().isEnabled())
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }

    /**
     * Update the flag for one group and persist the whole configuration.
     */
    public synchronized void setEnabled(String groupId, boolean enabled) {
        configs.put(groupId, GroupConfig.of(enabled));
        save(snapshot());
        log.debug("[GroupConfig] Group {} reminders {}", groupId, enabled ? "enabled" : "disabled");
    }

    public Map<String, GroupConfig> snapshot() {
        Map<String, GroupConfig> copy = new TreeMap<>();
        configs.forEach((groupId, config) -> copy.put(groupId, GroupConfig.of(config.isEnabled())));
        return copy;
    }

    /**
     * Read the configuration file, normalizing legacy shapes.
     */
    public Map<String, GroupConfig> load() {
        try {
            String json = storagePort.getText(directory(), configFile()).join();
            if (json == null || json.isBlank()) {
                return new LinkedHashMap<>();
            }
            return parse(json);
        } catch (IOException | RuntimeException e) { // NOSONAR - corrupt config falls back to empty
            log.error("[GroupConfig] Failed to load {}/{}, starting with no enabled groups: {}",
                    directory(), configFile(), e.getMessage());
            return new LinkedHashMap<>();
        }
    }

    /**
     * Write the configuration in canonical form. Failures are logged.
     */
    public synchronized void save(Map<String, GroupConfig> toSave) {
        try {
            ObjectNode root = objectMapper.createObjectNode();
            toSave.forEach((groupId, config) -> root.putObject(groupId)
                    .putObject(EVENT_REMINDER_KEY)
                    .put(ENABLED_KEY, config.isEnabled()));
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
            storagePort.putTextAtomic(directory(), configFile(), json, true).join();
        } catch (Exception e) { // NOSONAR - intentionally catch all for persistence fallback
            log.error("[GroupConfig] Failed to save group configuration", e);
        }
    }

    Map<String, GroupConfig> parse(String json) throws IOException {
        JsonNode root = objectMapper.readTree(json);
        if (root == null || !root.isObject()) {
            throw new IOException("expected a JSON object keyed by group id");
        }
        Map<String, GroupConfig> result = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            result.put(entry.getKey(), GroupConfig.of(readEnabledFlag(entry.getValue())));
        }
        return result;
    }

    static boolean readEnabledFlag(JsonNode entry) {
        if (entry.isBoolean()) {
            return entry.booleanValue();
        }
        if (!entry.isObject()) {
            return false;
        }
        JsonNode canonical = entry.get(EVENT_REMINDER_KEY);
        if (canonical != null) {
            return isTrue(canonical.get(ENABLED_KEY));
        }
        // flags of sibling features such as scheduled_send never enable reminders
        return isTrue(entry.get(ENABLED_KEY));
    }

    private static boolean isTrue(JsonNode node) {
        return node != null && node.isBoolean() && node.booleanValue();
    }

    private String directory() {
        return properties.getReminder().getDirectory();
    }

    private String configFile() {
        return properties.getReminder().getConfigFile();
    }
}
