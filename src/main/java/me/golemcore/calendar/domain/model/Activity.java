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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.util.List;
import java.util.Set;

/**
 * A recurring weekly activity loaded from the catalog file.
 *
 * <p>
 * Immutable once loaded. The name is the unique key within a catalog. An
 * activity either applies to a fixed set of weekdays or to every day.
 */
@Value
@Builder
public class Activity {

    String name;

    @Singular
    Set<DayOfWeek> days;

    boolean everyday;

    /** Start-of-day times in catalog order. */
    @Singular
    List<LocalTime> startTimes;

    /** Optional duration; {@code null} when the activity has no fixed end. */
    Duration duration;

    public boolean occursOn(DayOfWeek day) {
        return everyday || days.contains(day);
    }
}
