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

import me.golemcore.calendar.domain.model.Occurrence;
import me.golemcore.calendar.domain.model.ReminderJob;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Turns a day's occurrences into reminder jobs for one group.
 *
 * <p>
 * Each occurrence is due {@link #LEAD_TIME} before its start. Occurrences whose
 * due minute is not strictly in the future are dropped, and occurrences that
 * share a due minute are merged into one job.
 */
@Service
public class ReminderPlanner {

    public static final Duration LEAD_TIME = Duration.ofMinutes(10);

    private static final DateTimeFormatter ID_TIME = DateTimeFormatter.ofPattern("HHmm");
    private static final int ID_SUFFIX_LENGTH = 8;

    public List<ReminderJob> buildReminderJobs(String groupId, LocalDate date, List<Occurrence> occurrences,
            Instant now, ZoneId zone) {
        Map<Instant, List<Occurrence>> byDueTime = new TreeMap<>();
        for (Occurrence occurrence : occurrences) {
            Instant dueAt = dueAt(date, occurrence.getStart(), zone);
            if (!dueAt.isAfter(now)) {
                continue;
            }
            byDueTime.computeIfAbsent(dueAt, k -> new ArrayList<>()).add(occurrence);
        }

        List<Occurrence> daySchedule = List.copyOf(occurrences);
        List<ReminderJob> jobs = new ArrayList<>(byDueTime.size());
        byDueTime.forEach((dueAt, group) -> jobs.add(ReminderJob.builder()
                .id(newJobId(groupId, dueAt, zone))
                .groupId(groupId)
                .dueAt(dueAt)
                .occurrences(group)
                .daySchedule(daySchedule)
                .build()));
        return List.copyOf(jobs);
    }

    /**
     * Minute-aligned instant at which a reminder for the given start is due.
     */
    public static Instant dueAt(LocalDate date, LocalTime start, ZoneId zone) {
        return ZonedDateTime.of(date, start, zone)
                .minus(LEAD_TIME)
                .truncatedTo(ChronoUnit.MINUTES)
                .toInstant();
    }

    static String newJobId(String groupId, Instant dueAt, ZoneId zone) {
        return groupId + "-" + ID_TIME.format(dueAt.atZone(zone)) + "-" + randomSuffix();
    }

    public static String randomSuffix() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, ID_SUFFIX_LENGTH);
    }
}
