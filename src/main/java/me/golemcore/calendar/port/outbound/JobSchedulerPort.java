package me.golemcore.calendar.port.outbound;

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

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;

/**
 * Port for the underlying timer facility. Jobs are addressed by caller-chosen
 * ids; cancellation is idempotent and never fails for unknown ids.
 */
public interface JobSchedulerPort {

    /**
     * Register a one-shot job that runs exactly once at {@code dueAt}.
     *
     * @throws IllegalStateException
     *             if the timer facility rejects the registration
     */
    ScheduledJobHandle scheduleOnce(String jobId, Instant dueAt, Runnable task);

    /**
     * Register a recurring job that runs every day at {@code timeOfDay} in the
     * given zone.
     *
     * @throws IllegalStateException
     *             if the timer facility rejects the registration
     */
    ScheduledJobHandle scheduleDaily(String jobId, LocalTime timeOfDay, ZoneId zone, Runnable task);

    /**
     * Cancel a job.
     *
     * @return {@code true} if a live job was cancelled, {@code false} if the id
     *         is unknown, already fired or already cancelled
     */
    boolean cancel(String jobId);

    /**
     * Whether a job with the given id is still pending.
     */
    boolean isScheduled(String jobId);

    /**
     * Opaque handle returned on registration.
     */
    record ScheduledJobHandle(String jobId, Instant firstRunAt) {
    }
}
