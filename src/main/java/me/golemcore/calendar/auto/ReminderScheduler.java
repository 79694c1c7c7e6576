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

import me.golemcore.calendar.domain.model.ChannelConnectedEvent;
import me.golemcore.calendar.domain.model.Occurrence;
import me.golemcore.calendar.domain.model.ReminderJob;
import me.golemcore.calendar.domain.service.ActivityCatalogService;
import me.golemcore.calendar.domain.service.GroupConfigService;
import me.golemcore.calendar.domain.service.NotificationDispatcher;
import me.golemcore.calendar.domain.service.OccurrenceDeriver;
import me.golemcore.calendar.domain.service.ReminderPlanner;
import me.golemcore.calendar.port.outbound.JobSchedulerPort;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Owns the per-group reminder lifecycle on top of {@link JobSchedulerPort}.
 *
 * <p>
 * For every enabled group it keeps one daily rollover job at
 * {@link #ROLLOVER_TIME} and one one-shot job per distinct reminder minute of
 * the current day. All mutations of a group's {@link JobRegistry} happen under
 * that group's lock, so enable, disable, rollover and job firing never
 * interleave for the same group. Delivery runs after the lock is released.
 *
 * <p>
 * On shutdown all timer jobs are cancelled; persisted settings are untouched
 * and the jobs are rebuilt by {@link #restoreEnabledGroups()} on the next
 * channel connection.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReminderScheduler {

    public static final Duration LEAD_TIME = ReminderPlanner.LEAD_TIME;
    public static final LocalTime ROLLOVER_TIME = LocalTime.of(0, 1);

    private final JobSchedulerPort jobScheduler;
    private final ActivityCatalogService catalogService;
    private final OccurrenceDeriver occurrenceDeriver;
    private final ReminderPlanner reminderPlanner;
    private final GroupConfigService groupConfigService;
    private final NotificationDispatcher notificationDispatcher;
    private final Clock clock;

    private final Map<String, JobRegistry> registries = new ConcurrentHashMap<>();
    private final Map<String, GroupLock> groupLocks = new ConcurrentHashMap<>();

    /**
     * Enable reminders for a group, persist the flag and rebuild its jobs.
     * Calling it for an already enabled group replaces the existing jobs.
     *
     * @return number of reminder jobs registered for the rest of today
     */
    public int enable(String groupId) {
        return withGroupLock(groupId, () -> {
            groupConfigService.setEnabled(groupId, true);
            int scheduled = rebuild(groupId);
            log.info("[Reminder] Enabled group {}: {} reminders pending today", groupId, scheduled);
            return scheduled;
        });
    }

    /**
     * Cancel every job of a group and persist the disabled flag. Safe for groups
     * that were never enabled.
     */
    public void disable(String groupId) {
        withGroupLock(groupId, () -> {
            JobRegistry registry = registries.remove(groupId);
            int cancelled = registry != null ? cancelAll(registry.allJobIds()) : 0;
            groupConfigService.setEnabled(groupId, false);
            log.info("[Reminder] Disabled group {}: {} jobs cancelled", groupId, cancelled);
            return cancelled;
        });
    }

    /**
     * Replace a group's reminder jobs with those derived for the current day.
     * The rollover job itself stays. No-op for disabled groups.
     */
    public void rollover(String groupId) {
        withGroupLock(groupId, () -> {
            if (!groupConfigService.isEnabled(groupId)) {
                log.debug("[Reminder] Rollover skipped, group {} is disabled", groupId);
                return 0;
            }
            JobRegistry registry = registries.computeIfAbsent(groupId, id -> new JobRegistry());
            int scheduled = replaceReminders(groupId, registry);
            if (registry.getRolloverJobId() == null) {
                scheduleRollover(groupId, registry);
            }
            log.info("[Reminder] Rollover for group {}: {} reminders pending today", groupId, scheduled);
            return scheduled;
        });
    }

    /**
     * Rebuild jobs for every persisted enabled group. Invoked on channel
     * connection; any jobs left from an earlier connection are replaced.
     *
     * @return number of groups restored
     */
    public int restoreEnabledGroups() {
        List<String> groupIds = groupConfigService.getEnabledGroupIds();
        int restored = 0;
        for (String groupId : groupIds) {
            boolean done = withGroupLock(groupId, () -> {
                if (!groupConfigService.isEnabled(groupId)) {
                    return false;
                }
                rebuild(groupId);
                return true;
            });
            if (done) {
                restored++;
            }
        }
        log.info("[Reminder] Restored reminders for {} enabled groups", restored);
        return restored;
    }

    @EventListener
    public void onChannelConnected(ChannelConnectedEvent event) {
        log.info("[Reminder] Channel {} connected, restoring scheduled reminders", event.channelType());
        restoreEnabledGroups();
    }

    /**
     * Re-derive today's reminders for every enabled group, e.g. after the
     * catalog was reloaded.
     */
    public void regenerateAll() {
        for (String groupId : groupConfigService.getEnabledGroupIds()) {
            rollover(groupId);
        }
    }

    public List<ReminderJob> getPendingJobs(String groupId) {
        return withGroupLock(groupId, () -> {
            JobRegistry registry = registries.get(groupId);
            if (registry == null) {
                return List.<ReminderJob>of();
            }
            return registry.reminderJobs().stream()
                    .sorted(Comparator.comparing(ReminderJob::getDueAt))
                    .toList();
        });
    }

    public Set<String> getRegisteredJobIds(String groupId) {
        return withGroupLock(groupId, () -> {
            JobRegistry registry = registries.get(groupId);
            return registry == null ? Set.<String>of() : Set.copyOf(registry.allJobIds());
        });
    }

    public Optional<String> getRolloverJobId(String groupId) {
        return withGroupLock(groupId, () -> {
            JobRegistry registry = registries.get(groupId);
            return Optional.ofNullable(registry != null ? registry.getRolloverJobId() : null);
        });
    }

    @PreDestroy
    public void shutdown() {
        int cancelled = 0;
        for (String groupId : Set.copyOf(registries.keySet())) {
            cancelled += withGroupLock(groupId, () -> {
                JobRegistry registry = registries.remove(groupId);
                return registry != null ? cancelAll(registry.allJobIds()) : 0;
            });
        }
        log.info("[Reminder] Scheduler stopped, {} jobs cancelled", cancelled);
    }

    void onReminderFired(ReminderJob job) {
        String groupId = job.getGroupId();
        boolean current = withGroupLock(groupId, () -> {
            JobRegistry registry = registries.get(groupId);
            return registry != null && registry.removeReminderJob(job.getId());
        });
        if (!current) {
            log.debug("[Reminder] Job {} is no longer registered, skipping", job.getId());
            return;
        }
        try {
            notificationDispatcher.dispatch(job);
        } catch (Exception e) { // NOSONAR - a failed delivery must not break the timer thread
            log.error("[Reminder] Dispatch failed for job {}: {}", job.getId(), e.getMessage(), e);
        }
    }

    void onRolloverFired(String groupId, String rolloverJobId) {
        boolean current = withGroupLock(groupId, () -> {
            JobRegistry registry = registries.get(groupId);
            return registry != null && rolloverJobId.equals(registry.getRolloverJobId());
        });
        if (!current) {
            log.debug("[Reminder] Stale rollover job {} for group {}, skipping", rolloverJobId, groupId);
            return;
        }
        rollover(groupId);
    }

    // Callers hold the group lock.
    private int rebuild(String groupId) {
        JobRegistry previous = registries.remove(groupId);
        if (previous != null) {
            cancelAll(previous.allJobIds());
        }
        JobRegistry registry = new JobRegistry();
        registries.put(groupId, registry);
        int scheduled = scheduleReminders(groupId, registry);
        scheduleRollover(groupId, registry);
        return scheduled;
    }

    private int replaceReminders(String groupId, JobRegistry registry) {
        cancelAll(registry.reminderJobIds());
        registry.clearReminderJobs();
        return scheduleReminders(groupId, registry);
    }

    private int scheduleReminders(String groupId, JobRegistry registry) {
        ZonedDateTime now = ZonedDateTime.now(clock);
        LocalDate today = now.toLocalDate();
        List<Occurrence> occurrences = occurrenceDeriver.deriveDay(catalogService.getCatalog(),
                today.getDayOfWeek());
        List<ReminderJob> jobs = reminderPlanner.buildReminderJobs(groupId, today, occurrences,
                now.toInstant(), clock.getZone());

        int scheduled = 0;
        for (ReminderJob job : jobs) {
            try {
                jobScheduler.scheduleOnce(job.getId(), job.getDueAt(), () -> onReminderFired(job));
                registry.addReminderJob(job);
                scheduled++;
            } catch (IllegalStateException e) {
                log.error("[Reminder] Timer rejected job {} for group {}: {}", job.getId(), groupId,
                        e.getMessage());
            }
        }
        return scheduled;
    }

    private void scheduleRollover(String groupId, JobRegistry registry) {
        String jobId = groupId + "-rollover-" + ReminderPlanner.randomSuffix();
        try {
            jobScheduler.scheduleDaily(jobId, ROLLOVER_TIME, clock.getZone(),
                    () -> onRolloverFired(groupId, jobId));
            registry.setRolloverJobId(jobId);
        } catch (IllegalStateException e) {
            log.error("[Reminder] Timer rejected rollover job for group {}: {}", groupId, e.getMessage());
        }
    }

    private int cancelAll(Collection<String> jobIds) {
        int cancelled = 0;
        for (String jobId : jobIds) {
            try {
                if (jobScheduler.cancel(jobId)) {
                    cancelled++;
                } else {
                    log.debug("[Reminder] Job {} already fired or removed", jobId);
                }
            } catch (RuntimeException e) {
                log.warn("[Reminder] Failed to cancel job {}: {}", jobId, e.getMessage());
            }
        }
        return cancelled;
    }

    int groupLockCount() {
        return groupLocks.size();
    }

    private <T> T withGroupLock(String groupId, Supplier<T> action) {
        GroupLock lock = groupLocks.compute(groupId, (id, existing) -> {
            GroupLock acquired = existing != null ? existing : new GroupLock();
            acquired.users++;
            return acquired;
        });
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
            groupLocks.computeIfPresent(groupId, (id, held) -> --held.users == 0 ? null : held);
        }
    }

    /**
     * Group lock that counts holders and waiters; it is dropped from the map once
     * nobody uses it. {@code users} is only touched inside map compute calls.
     */
    private static final class GroupLock extends ReentrantLock {
        private int users;
    }
}
