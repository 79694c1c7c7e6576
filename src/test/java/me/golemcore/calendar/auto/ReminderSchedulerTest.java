package me.golemcore.calendar.auto;

import me.golemcore.calendar.domain.model.Activity;
import me.golemcore.calendar.domain.model.ActivityCatalog;
import me.golemcore.calendar.domain.model.ChannelConnectedEvent;
import me.golemcore.calendar.domain.model.ReminderJob;
import me.golemcore.calendar.domain.service.ActivityCatalogService;
import me.golemcore.calendar.domain.service.GroupConfigService;
import me.golemcore.calendar.domain.service.NotificationDispatcher;
import me.golemcore.calendar.domain.service.OccurrenceDeriver;
import me.golemcore.calendar.domain.service.ReminderPlanner;
import me.golemcore.calendar.infrastructure.config.BotProperties;
import me.golemcore.calendar.port.outbound.StoragePort;
import me.golemcore.calendar.testsupport.FakeJobScheduler;
import me.golemcore.calendar.testsupport.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ReminderSchedulerTest {

    private static final String GROUP_ID = "-100123";
    private static final String OTHER_GROUP_ID = "-100456";

    private MutableClock clock;
    private FakeJobScheduler jobScheduler;
    private ActivityCatalogService catalogService;
    private StoragePort storagePort;
    private GroupConfigService groupConfigService;
    private NotificationDispatcher dispatcher;
    private ReminderScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-10-19T08:45:00Z"), ZoneOffset.UTC);
        jobScheduler = new FakeJobScheduler();

        catalogService = mock(ActivityCatalogService.class);
        when(catalogService.getCatalog()).thenReturn(catalog(activity("Standup", 9, 0)));

        storagePort = mock(StoragePort.class);
        when(storagePort.getText(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(null));
        when(storagePort.putTextAtomic(anyString(), anyString(), anyString(), anyBoolean()))
                .thenReturn(CompletableFuture.completedFuture(null));
        groupConfigService = new GroupConfigService(storagePort, new ObjectMapper(), new BotProperties());
        groupConfigService.init();

        dispatcher = mock(NotificationDispatcher.class);

        scheduler = new ReminderScheduler(jobScheduler, catalogService, new OccurrenceDeriver(),
                new ReminderPlanner(), groupConfigService, dispatcher, clock);
    }

    @Test
    void shouldScheduleRemindersAndRolloverOnEnable() {
        int scheduled = scheduler.enable(GROUP_ID);

        assertEquals(1, scheduled);
        assertTrue(groupConfigService.isEnabled(GROUP_ID));
        List<ReminderJob> pending = scheduler.getPendingJobs(GROUP_ID);
        assertEquals(1, pending.size());
        assertEquals(Instant.parse("2026-10-19T08:50:00Z"), pending.get(0).getDueAt());
        assertEquals(Instant.parse("2026-10-19T08:50:00Z"), jobScheduler.dueTime(pending.get(0).getId()));

        String rolloverId = scheduler.getRolloverJobId(GROUP_ID).orElseThrow();
        assertEquals(ReminderScheduler.ROLLOVER_TIME, jobScheduler.dailyTime(rolloverId));
        assertEquals(Set.of(pending.get(0).getId(), rolloverId), scheduler.getRegisteredJobIds(GROUP_ID));
        assertEquals(scheduler.getRegisteredJobIds(GROUP_ID), jobScheduler.liveJobIds());
    }

    @Test
    void shouldNotScheduleStartedActivities() {
        clock.setInstant(Instant.parse("2026-10-19T10:00:00Z"));

        assertEquals(0, scheduler.enable(GROUP_ID));
        assertTrue(scheduler.getPendingJobs(GROUP_ID).isEmpty());
        assertTrue(scheduler.getRolloverJobId(GROUP_ID).isPresent());
    }

    @Test
    void shouldLeaveOnlyLatestJobsAfterEnableDisableEnable() {
        scheduler.enable(GROUP_ID);
        Set<String> firstIds = scheduler.getRegisteredJobIds(GROUP_ID);

        scheduler.disable(GROUP_ID);
        assertTrue(scheduler.getRegisteredJobIds(GROUP_ID).isEmpty());
        assertTrue(jobScheduler.liveJobIds().isEmpty());

        scheduler.enable(GROUP_ID);
        Set<String> secondIds = scheduler.getRegisteredJobIds(GROUP_ID);

        assertEquals(2, secondIds.size());
        assertTrue(Collections.disjoint(firstIds, secondIds));
        assertEquals(secondIds, jobScheduler.liveJobIds());
    }

    @Test
    void shouldReplaceJobsWhenEnabledTwice() {
        scheduler.enable(GROUP_ID);
        Set<String> firstIds = scheduler.getRegisteredJobIds(GROUP_ID);

        scheduler.enable(GROUP_ID);

        assertTrue(Collections.disjoint(firstIds, jobScheduler.liveJobIds()));
        assertEquals(2, jobScheduler.liveJobIds().size());
    }

    @Test
    void shouldDisableGroupThatWasNeverEnabled() {
        assertDoesNotThrow(() -> scheduler.disable(GROUP_ID));

        assertFalse(groupConfigService.isEnabled(GROUP_ID));
        assertTrue(jobScheduler.liveJobIds().isEmpty());
    }

    @Test
    void shouldIgnoreRolloverForDisabledGroup() {
        scheduler.enable(GROUP_ID);
        Set<String> before = scheduler.getRegisteredJobIds(GROUP_ID);
        groupConfigService.setEnabled(GROUP_ID, false);

        scheduler.rollover(GROUP_ID);
        scheduler.rollover(OTHER_GROUP_ID);

        assertEquals(before, scheduler.getRegisteredJobIds(GROUP_ID));
        assertEquals(before, jobScheduler.liveJobIds());
        assertTrue(jobScheduler.cancelledIds().isEmpty());
    }

    @Test
    void shouldRegenerateRemindersOnRollover() {
        scheduler.enable(GROUP_ID);
        String rolloverId = scheduler.getRolloverJobId(GROUP_ID).orElseThrow();
        String staleId = scheduler.getPendingJobs(GROUP_ID).get(0).getId();

        clock.setInstant(Instant.parse("2026-10-20T00:01:00Z"));
        jobScheduler.fireDaily(rolloverId);

        List<ReminderJob> pending = scheduler.getPendingJobs(GROUP_ID);
        assertEquals(1, pending.size());
        assertEquals(Instant.parse("2026-10-20T08:50:00Z"), pending.get(0).getDueAt());
        assertNotEquals(staleId, pending.get(0).getId());
        assertFalse(jobScheduler.isScheduled(staleId));
        assertEquals(rolloverId, scheduler.getRolloverJobId(GROUP_ID).orElseThrow());
        assertTrue(jobScheduler.isScheduled(rolloverId));
    }

    @Test
    void shouldIgnoreStaleRolloverJob() {
        scheduler.enable(GROUP_ID);
        String oldRolloverId = scheduler.getRolloverJobId(GROUP_ID).orElseThrow();
        Runnable oldRollover = jobScheduler.taskFor(oldRolloverId);
        scheduler.enable(GROUP_ID);
        Set<String> current = scheduler.getRegisteredJobIds(GROUP_ID);

        oldRollover.run();

        assertEquals(current, scheduler.getRegisteredJobIds(GROUP_ID));
    }

    @Test
    void shouldDispatchAndUnregisterFiredJob() {
        scheduler.enable(GROUP_ID);
        ReminderJob job = scheduler.getPendingJobs(GROUP_ID).get(0);

        jobScheduler.fire(job.getId());

        verify(dispatcher).dispatch(job);
        assertTrue(scheduler.getPendingJobs(GROUP_ID).isEmpty());
        assertEquals(Set.of(scheduler.getRolloverJobId(GROUP_ID).orElseThrow()),
                scheduler.getRegisteredJobIds(GROUP_ID));
    }

    @Test
    void shouldNotDispatchJobCancelledWhileFiring() {
        scheduler.enable(GROUP_ID);
        ReminderJob job = scheduler.getPendingJobs(GROUP_ID).get(0);
        Runnable task = jobScheduler.taskFor(job.getId());

        scheduler.disable(GROUP_ID);
        task.run();

        verify(dispatcher, never()).dispatch(any());
    }

    @Test
    void shouldKeepTimerThreadAliveWhenDispatchFails() {
        doThrow(new IllegalStateException("boom")).when(dispatcher).dispatch(any());
        scheduler.enable(GROUP_ID);
        ReminderJob job = scheduler.getPendingJobs(GROUP_ID).get(0);

        assertDoesNotThrow(() -> jobScheduler.fire(job.getId()));
    }

    @Test
    void shouldContinueCancellingAfterFailure() {
        when(catalogService.getCatalog()).thenReturn(catalog(
                activity("Standup", 9, 0), activity("Review", 14, 0), activity("Retro", 17, 0)));
        scheduler.enable(GROUP_ID);
        List<ReminderJob> pending = scheduler.getPendingJobs(GROUP_ID);
        assertEquals(3, pending.size());
        jobScheduler.failCancelOf(pending.get(0).getId());

        assertDoesNotThrow(() -> scheduler.disable(GROUP_ID));

        assertEquals(Set.of(pending.get(0).getId()), jobScheduler.liveJobIds());
        assertFalse(groupConfigService.isEnabled(GROUP_ID));
    }

    @Test
    void shouldTolerateCancellingAlreadyFiredJob() {
        when(catalogService.getCatalog()).thenReturn(catalog(activity("Standup", 9, 0), activity("Review", 14, 0)));
        scheduler.enable(GROUP_ID);
        ReminderJob first = scheduler.getPendingJobs(GROUP_ID).get(0);
        ReminderJob second = scheduler.getPendingJobs(GROUP_ID).get(1);
        Runnable firstTask = jobScheduler.taskFor(first.getId());
        jobScheduler.cancel(first.getId());

        scheduler.rollover(GROUP_ID);

        assertTrue(jobScheduler.cancelledIds().contains(second.getId()));
        assertFalse(jobScheduler.isScheduled(second.getId()));
        firstTask.run();
        verify(dispatcher, never()).dispatch(first);
    }

    @Test
    void shouldSkipJobsRejectedByTimer() {
        jobScheduler.setRejectRegistrations(true);

        assertEquals(0, scheduler.enable(GROUP_ID));
        assertTrue(scheduler.getRegisteredJobIds(GROUP_ID).isEmpty());
        assertTrue(groupConfigService.isEnabled(GROUP_ID));
    }

    @Test
    void shouldRestoreEnabledGroupsWhenChannelConnects() {
        when(storagePort.getText(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture("""
                {"-100123": {"event_reminder": {"enabled": true}},
                 "-100456": {"event_reminder": {"enabled": false}}}
                """));
        groupConfigService.init();

        scheduler.onChannelConnected(new ChannelConnectedEvent("telegram"));

        assertEquals(2, scheduler.getRegisteredJobIds(GROUP_ID).size());
        assertTrue(scheduler.getRegisteredJobIds(OTHER_GROUP_ID).isEmpty());
    }

    @Test
    void shouldNotDuplicateJobsWhenRestoredTwice() {
        scheduler.enable(GROUP_ID);

        assertEquals(1, scheduler.restoreEnabledGroups());
        assertEquals(1, scheduler.restoreEnabledGroups());

        assertEquals(2, jobScheduler.liveJobIds().size());
        assertEquals(scheduler.getRegisteredJobIds(GROUP_ID), jobScheduler.liveJobIds());
    }

    @Test
    void shouldPickUpReloadedCatalog() {
        scheduler.enable(GROUP_ID);
        scheduler.enable(OTHER_GROUP_ID);
        when(catalogService.getCatalog()).thenReturn(catalog(activity("Standup", 9, 0), activity("Review", 14, 0)));

        scheduler.regenerateAll();

        assertEquals(2, scheduler.getPendingJobs(GROUP_ID).size());
        assertEquals(2, scheduler.getPendingJobs(OTHER_GROUP_ID).size());
        assertEquals(6, jobScheduler.liveJobIds().size());
    }

    @Test
    void shouldCancelEverythingOnShutdownAndKeepConfig() {
        scheduler.enable(GROUP_ID);
        scheduler.enable(OTHER_GROUP_ID);

        scheduler.shutdown();

        assertTrue(jobScheduler.liveJobIds().isEmpty());
        assertTrue(groupConfigService.isEnabled(GROUP_ID));
        assertTrue(groupConfigService.isEnabled(OTHER_GROUP_ID));
    }

    @Test
    void shouldKeepGroupsIsolated() {
        scheduler.enable(GROUP_ID);
        scheduler.enable(OTHER_GROUP_ID);

        scheduler.disable(GROUP_ID);

        Set<String> other = new HashSet<>(scheduler.getRegisteredJobIds(OTHER_GROUP_ID));
        assertEquals(2, other.size());
        assertEquals(other, jobScheduler.liveJobIds());
    }

    @Test
    void shouldReleaseGroupLocksAfterOperations() {
        scheduler.enable(GROUP_ID);
        scheduler.getPendingJobs(OTHER_GROUP_ID);
        scheduler.disable(GROUP_ID);

        assertEquals(0, scheduler.groupLockCount());
    }

    @Test
    void shouldKeepJobsConsistentUnderConcurrentToggles() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> toggles = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                boolean enable = i % 2 == 0;
                toggles.add(executor.submit(() -> {
                    if (enable) {
                        scheduler.enable(GROUP_ID);
                    } else {
                        scheduler.disable(GROUP_ID);
                    }
                }));
            }
            for (Future<?> toggle : toggles) {
                toggle.get(5, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        scheduler.enable(GROUP_ID);

        assertEquals(2, jobScheduler.liveJobIds().size());
        assertEquals(scheduler.getRegisteredJobIds(GROUP_ID), jobScheduler.liveJobIds());
        assertEquals(0, scheduler.groupLockCount());
    }

    @Test
    void shouldUseTenMinuteLeadTime() {
        assertEquals(Duration.ofMinutes(10), ReminderScheduler.LEAD_TIME);
        assertEquals(LocalTime.of(0, 1), ReminderScheduler.ROLLOVER_TIME);
    }

    private static Activity activity(String name, int hour, int minute) {
        return Activity.builder()
                .name(name)
                .everyday(true)
                .startTime(LocalTime.of(hour, minute))
                .duration(Duration.ofMinutes(30))
                .build();
    }

    private static ActivityCatalog catalog(Activity... activities) {
        return new ActivityCatalog(List.of(activities));
    }
}
