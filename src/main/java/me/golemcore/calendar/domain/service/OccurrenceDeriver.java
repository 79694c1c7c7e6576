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
import me.golemcore.calendar.domain.model.Occurrence;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Flattens the activity catalog into the concrete, time-ordered occurrences
 * of a single day. Stateless.
 */
@Service
public class OccurrenceDeriver {

    private static final LocalTime LAST_MINUTE = LocalTime.of(23, 59);

    /**
     * Derive the occurrences for the given weekday, sorted by start time. Ties
     * keep catalog order.
     */
    public List<Occurrence> deriveDay(ActivityCatalog catalog, DayOfWeek day) {
        List<Occurrence> occurrences = new ArrayList<>();
        for (Activity activity : catalog.activities()) {
            if (!activity.occursOn(day)) {
                continue;
            }
            for (LocalTime start : activity.getStartTimes()) {
                occurrences.add(Occurrence.builder()
                        .name(activity.getName())
                        .start(start)
                        .end(computeEnd(start, activity.getDuration()))
                        .build());
            }
        }
        // List.sort is stable
        occurrences.sort(Comparator.comparing(Occurrence::getStart));
        return List.copyOf(occurrences);
    }

    /**
     * Display helper: substitutes a single placeholder entry for an empty day.
     * Never used for scheduling.
     */
    public List<Occurrence> withPlaceholder(List<Occurrence> occurrences, String placeholderName) {
        if (!occurrences.isEmpty()) {
            return occurrences;
        }
        return List.of(Occurrence.builder()
                .name(placeholderName)
                .start(LocalTime.MIDNIGHT)
                .build());
    }

    /**
     * End of an occurrence, clamped to 23:59 so it never wraps past midnight.
     */
    static LocalTime computeEnd(LocalTime start, Duration duration) {
        if (duration == null) {
            return null;
        }
        if (!start.isBefore(LAST_MINUTE)) {
            return start;
        }
        long minutesLeft = Duration.between(start, LAST_MINUTE).toMinutes();
        if (duration.toMinutes() > minutesLeft) {
            return LAST_MINUTE;
        }
        return start.plus(duration);
    }
}
