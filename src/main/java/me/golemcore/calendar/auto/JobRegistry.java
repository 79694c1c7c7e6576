package me.golemcore.calendar.auto;

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

import me.golemcore.calendar.domain.model.ReminderJob;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Job ids currently registered for one group: its daily rollover job and its
 * pending reminder jobs. Not thread-safe; always accessed under the group's
 * lock in {@link ReminderScheduler}.
 */
class JobRegistry {

    @Getter
    @Setter
    private String rolloverJobId;

    private final Map<String, ReminderJob> reminderJobs = new LinkedHashMap<>();

    void addReminderJob(ReminderJob job) {
        reminderJobs.put(job.getId(), job);
    }

    boolean removeReminderJob(String jobId) {
        return reminderJobs.remove(jobId) != null;
    }

    void clearReminderJobs() {
        reminderJobs.clear();
    }

    List<String> reminderJobIds() {
        return new ArrayList<>(reminderJobs.keySet());
    }

    List<ReminderJob> reminderJobs() {
        return new ArrayList<>(reminderJobs.values());
    }

    /**
     * All registered ids, rollover job last.
     */
    Set<String> allJobIds() {
        Set<String> ids = new LinkedHashSet<>(reminderJobs.keySet());
        if (rolloverJobId != null) {
            ids.add(rolloverJobId);
        }
        return ids;
    }
}
