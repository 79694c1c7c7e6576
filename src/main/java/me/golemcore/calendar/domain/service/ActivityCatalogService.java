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

import me.golemcore.calendar.domain.model.Activity;
import me.golemcore.calendar.domain.model.ActivityCatalog;
import me.golemcore.calendar.infrastructure.config.BotProperties;
import me.golemcore.calendar.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionException;

/**
 * Domain service that loads the recurring activity catalog from
 * {@code reminder/activities.json} via {@link StoragePort}.
 *
 * <p>
 * The file maps activity names to definitions:
 *
 * <pre>
 * {
 *   "Standup": {"days": ["Everyday"], "start_times": ["09:00"], "duration_minutes": 30},
 *   "Review":  {"days": ["Monday", "Thursday"], "start_times": ["14:00", "18:30"], "duration_minutes": null}
 * }
 * </pre>
 *
 * <p>
 * A malformed activity is skipped with a warning. A document that cannot be
 * read as a JSON object fails the whole load with {@link CatalogLoadException};
 * at startup this aborts the application instead of silently running with an
 * empty calendar.
 */
@Service
@Slf4j
public class ActivityCatalogService {

    static final String EVERYDAY = "Everyday";
    private static final String DAYS_FIELD = "days";
    private static final String START_TIMES_FIELD = "start_times";
    private static final String DURATION_FIELD = "duration_minutes";
    private static final DateTimeFormatter TIME_INPUT = DateTimeFormatter.ofPattern("H:mm");
    private static final DateTimeFormatter TIME_OUTPUT = DateTimeFormatter.ofPattern("HH:mm");

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final BotProperties properties;

    private volatile ActivityCatalog catalog = ActivityCatalog.empty();

    public ActivityCatalogService(StoragePort storagePort, ObjectMapper objectMapper, BotProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        catalog = loadCatalog();
        log.info("[Catalog] Loaded {} activities", catalog.size());
    }

    public ActivityCatalog getCatalog() {
        return catalog;
    }

    /**
     * Re-read the catalog file. On failure the previously loaded catalog stays
     * in place.
     *
     * @throws CatalogLoadException
     *             if the file cannot be read or is not a JSON object
     */
    public synchronized ActivityCatalog reload() {
        ActivityCatalog loaded = loadCatalog();
        catalog = loaded;
        log.info("[Catalog] Reloaded {} activities", loaded.size());
        return loaded;
    }

    /**
     * Persist the catalog in canonical form and make it the active catalog.
     */
    public synchronized void saveCatalog(ActivityCatalog newCatalog) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(newCatalog));
            storagePort.putTextAtomic(directory(), catalogFile(), json, true).join();
            catalog = newCatalog;
            log.info("[Catalog] Saved {} activities", newCatalog.size());
        } catch (Exception e) { // NOSONAR - intentionally catch all for persistence fallback
            log.error("[Catalog] Failed to save catalog", e);
        }
    }

    ActivityCatalog loadCatalog() {
        String json;
        try {
            json = storagePort.getText(directory(), catalogFile()).join();
        } catch (CompletionException e) {
            throw new CatalogLoadException("Failed to read catalog " + directory() + "/" + catalogFile(), e);
        }
        if (json == null || json.isBlank()) {
            log.warn("[Catalog] No catalog found at {}/{}, no reminders will be scheduled",
                    directory(), catalogFile());
            return ActivityCatalog.empty();
        }
        return parseCatalog(json);
    }

    /**
     * Parse catalog JSON, skipping activities with invalid definitions.
     *
     * @throws CatalogLoadException
     *             if the document is not valid JSON or not an object
     */
    public ActivityCatalog parseCatalog(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new CatalogLoadException("Malformed catalog JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new CatalogLoadException("Catalog must be a JSON object mapping activity names to definitions");
        }

        List<Activity> activities = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            parseActivity(entry.getKey(), entry.getValue()).ifPresent(activities::add);
        }
        return new ActivityCatalog(activities);
    }

    private Optional<Activity> parseActivity(String name, JsonNode node) {
        try {
            return Optional.of(toActivity(name, node));
        } catch (IllegalArgumentException e) {
            log.warn("[Catalog] Skipping activity '{}': {}", name, e.getMessage());
            return Optional.empty();
        }
    }

    private Activity toActivity(String name, JsonNode node) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("activity name is blank");
        }
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("definition must be an object");
        }

        Activity.ActivityBuilder builder = Activity.builder().name(name);

        for (String day : requireTextList(node, DAYS_FIELD)) {
            if (EVERYDAY.equalsIgnoreCase(day)) {
                builder.everyday(true);
            } else {
                builder.day(parseDay(day));
            }
        }

        Set<LocalTime> startTimes = new LinkedHashSet<>();
        for (String time : requireTextList(node, START_TIMES_FIELD)) {
            startTimes.add(parseTime(time));
        }
        builder.startTimes(startTimes);

        JsonNode duration = node.get(DURATION_FIELD);
        if (duration != null && !duration.isNull()) {
            if (!duration.isIntegralNumber() || duration.asInt() < 0) {
                throw new IllegalArgumentException("'" + DURATION_FIELD + "' must be a non-negative integer or null");
            }
            builder.duration(Duration.ofMinutes(duration.asInt()));
        }
        return builder.build();
    }

    private List<String> requireTextList(JsonNode node, String field) {
        JsonNode array = node.get(field);
        if (array == null || !array.isArray() || array.isEmpty()) {
            throw new IllegalArgumentException("'" + field + "' must be a non-empty list");
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : array) {
            if (!item.isTextual()) {
                throw new IllegalArgumentException("'" + field + "' must contain strings");
            }
            values.add(item.asText().trim());
        }
        return values;
    }

    private static DayOfWeek parseDay(String day) {
        try {
            return DayOfWeek.valueOf(day.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown day '" + day + "'", e);
        }
    }

    private static LocalTime parseTime(String time) {
        try {
            return LocalTime.parse(time, TIME_INPUT);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("invalid start time '" + time + "', expected HH:MM", e);
        }
    }

    private ObjectNode toJson(ActivityCatalog source) {
        ObjectNode root = objectMapper.createObjectNode();
        for (Activity activity : source.activities()) {
            ObjectNode node = root.putObject(activity.getName());
            ArrayNode days = node.putArray(DAYS_FIELD);
            if (activity.isEveryday()) {
                days.add(EVERYDAY);
            }
            activity.getDays().stream()
                    .sorted()
                    .forEach(day -> days.add(day.getDisplayName(TextStyle.FULL, Locale.ENGLISH)));
            ArrayNode starts = node.putArray(START_TIMES_FIELD);
            activity.getStartTimes().forEach(time -> starts.add(TIME_OUTPUT.format(time)));
            if (activity.getDuration() != null) {
                node.put(DURATION_FIELD, activity.getDuration().toMinutes());
            } else {
                node.putNull(DURATION_FIELD);
            }
        }
        return root;
    }

    private String directory() {
        return properties.getReminder().getDirectory();
    }

    private String catalogFile() {
        return properties.getReminder().getCatalogFile();
    }

    /**
     * Raised when the catalog as a whole cannot be loaded.
     */
    public static class CatalogLoadException extends RuntimeException {
        private static final long serialVersionUID = 1L;

        public CatalogLoadException(String message) {
            super(message);
        }

        public CatalogLoadException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
