package me.golemcore.calendar.adapter.outbound.scheduling;

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

import me.golemcore.calendar.port.outbound.JobSchedulerPort;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * {@link JobSchedulerPort} backed by Spring's {@link TaskScheduler}.
 *
 * <p>
 * Keeps the {@link ScheduledFuture} of every live job keyed by id. One-shot
 * jobs drop their entry after running; daily jobs use a {@link CronTrigger} in
 * the requested zone.
 */
@Component
@Slf4j
public class SpringTaskSchedulerAdapter implements JobSchedulerPort {

    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final Map<String, ScheduledFuture<?>> futures = new ConcurrentHashMap<>();

    public SpringTaskSchedulerAdapter(TaskScheduler taskScheduler, Clock clock) {
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    @Override
    public ScheduledJobHandle scheduleOnce(String jobId, Instant dueAt, Runnable task) {
        AtomicReference<ScheduledFuture<?>> self = new AtomicReference<>();
        AtomicBoolean finished = new AtomicBoolean();
        Runnable wrapped = () -> {
            try {
                task.run();
            } catch (Exception e) { // NOSONAR - keep the timer thread alive
                log.error("[Timer] Job {} failed: {}", jobId, e.getMessage(), e);
            } finally {
                finished.set(true);
                ScheduledFuture<?> own = self.get();
                if (own != null) {
                    futures.remove(jobId, own);
                }
            }
        };
        ScheduledFuture<?> future = register(jobId, () -> taskScheduler.schedule(wrapped, dueAt));
        self.set(future);
        // a job due immediately may finish before its future was published
        if (finished.get()) {
            futures.remove(jobId, future);
        }
        log.debug("[Timer] Scheduled job {} at {}", jobId, dueAt);
        return new ScheduledJobHandle(jobId, dueAt);
    }

    @Override
    public ScheduledJobHandle scheduleDaily(String jobId, LocalTime timeOfDay, ZoneId zone, Runnable task) {
        String cron = String.format("%d %d %d * * *", timeOfDay.getSecond(), timeOfDay.getMinute(),
                timeOfDay.getHour());
        Runnable wrapped = () -> {
            try {
                task.run();
            } catch (Exception e) { // NOSONAR - keep the recurring job alive
                log.error("[Timer] Daily job {} failed: {}", jobId, e.getMessage(), e);
            }
        };
        register(jobId, () -> taskScheduler.schedule(wrapped, new CronTrigger(cron, zone)));
        ZonedDateTime next = CronExpression.parse(cron).next(ZonedDateTime.now(clock.withZone(zone)));
        Instant firstRunAt = next != null ? next.toInstant() : null;
        log.debug("[Timer] Scheduled daily job {} at {} {}, first run {}", jobId, timeOfDay, zone, firstRunAt);
        return new ScheduledJobHandle(jobId, firstRunAt);
    }

    @Override
    public boolean cancel(String jobId) {
        ScheduledFuture<?> future = futures.remove(jobId);
        if (future == null || future.isDone()) {
            return false;
        }
        boolean cancelled = future.cancel(false);
        if (cancelled) {
            log.debug("[Timer] Cancelled job {}", jobId);
        }
        return cancelled;
    }

    @Override
    public boolean isScheduled(String jobId) {
        ScheduledFuture<?> future = futures.get(jobId);
        return future != null && !future.isDone();
    }

    boolean isTracked(String jobId) {
        return futures.containsKey(jobId);
    }

    @PreDestroy
    public void shutdown() {
        int count = futures.size();
        futures.values().forEach(future -> future.cancel(false));
        futures.clear();
        log.info("[Timer] Cancelled {} pending jobs", count);
    }

    private ScheduledFuture<?> register(String jobId, Supplier<ScheduledFuture<?>> scheduling) {
        ScheduledFuture<?> future;
        try {
            future = scheduling.get();
        } catch (TaskRejectedException | IllegalStateException e) {
            throw new IllegalStateException("Timer rejected job " + jobId, e);
        }
        if (future == null) {
            throw new IllegalStateException("Trigger for job " + jobId + " never fires");
        }
        ScheduledFuture<?> previous = futures.put(jobId, future);
        if (previous != null) {
            previous.cancel(false);
            log.debug("[Timer] Replaced existing job {}", jobId);
        }
        return future;
    }
}
