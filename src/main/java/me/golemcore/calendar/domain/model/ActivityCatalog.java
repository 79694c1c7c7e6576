package me.golemcore.calendar.domain.model;

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

import java.util.List;
import java.util.Optional;

/**
 * Ordered, read-only set of activities. Iteration order is the order of the
 * catalog file and defines tie-breaking when occurrences share a start time.
 */
public record ActivityCatalog(List<Activity> activities) {

    public ActivityCatalog {
        activities = activities == null ? List.of() : List.copyOf(activities);
    }

    public static ActivityCatalog empty() {
        return new ActivityCatalog(List.of());
    }

    public boolean isEmpty() {
        return activities.isEmpty();
    }

    public int size() {
        return activities.size();
    }

    public Optional<Activity> find(String name) {
        return activities.stream()
                .filter(a -> a.getName().equals(name))
                .findFirst();
    }
}
