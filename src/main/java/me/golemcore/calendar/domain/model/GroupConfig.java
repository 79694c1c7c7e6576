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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-group reminder settings. Persisted in {@code reminder/groups.json} under
 * the {@code event_reminder} key of each group. A group without an entry is
 * treated as disabled.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GroupConfig {

    private boolean enabled;

    public static GroupConfig of(boolean enabled) {
        return new GroupConfig(enabled);
    }
}
