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

/**
 * Event published when a channel transport has connected and can deliver
 * messages.
 *
 * <p>
 * Published by channel adapters after a successful start. Consumed by
 * ReminderScheduler to restore the reminder jobs of every enabled group.
 *
 * @since 1.0
 */
public record ChannelConnectedEvent(String channelType) {
}
