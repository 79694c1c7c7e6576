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

import java.time.Instant;
import java.util.List;

/**
 * A one-shot reminder scheduled for a group. All occurrences sharing the same
 * due minute are merged into a single job so they produce one notification.
 *
 * <p>
 * The occurrence list is a snapshot taken when the job is built; it is not
 * re-derived when the job fires. {@code daySchedule} holds the full day the
 * job was planned from and is what the calendar image shows.
 */
@Value
@Builder
public class ReminderJob {

    String id;
    String groupId;
    Instant dueAt;

    @Singular
    List<Occurrence> occurrences;

    List<Occurrence> daySchedule;
}
