package me.golemcore.calendar.adapter.inbound.command;

import me.golemcore.calendar.auto.ReminderScheduler;
import me.golemcore.calendar.domain.model.ActivityCatalog;
import me.golemcore.calendar.domain.model.Occurrence;
import me.golemcore.calendar.domain.model.ReminderJob;
import me.golemcore.calendar.domain.service.ActivityCatalogService;
import me.golemcore.calendar.domain.service.CalendarViewService;
import me.golemcore.calendar.domain.service.GroupConfigService;
import me.golemcore.calendar.infrastructure.config.BotProperties;
import me.golemcore.calendar.infrastructure.i18n.MessageService;
import me.golemcore.calendar.port.inbound.CommandPort.CommandResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class CommandRouterTest {

    private static final String CHAT_ID = "-100123";
    private static final Map<String, Object> ADMIN_CTX = Map.of("chatId", CHAT_ID, "channelType", "telegram",
            "admin", true);
    private static final Map<String, Object> MEMBER_CTX = Map.of("chatId", CHAT_ID, "channelType", "telegram",
            "admin", false);

    private ReminderScheduler reminderScheduler;
    private GroupConfigService groupConfigService;
    private CalendarViewService calendarViewService;
    private ActivityCatalogService catalogService;
    private CommandRouter router;

    @BeforeEach
    void setUp() {
        reminderScheduler = mock(ReminderScheduler.class);
        groupConfigService = mock(GroupConfigService.class);
        calendarViewService = mock(CalendarViewService.class);
        catalogService = mock(ActivityCatalogService.class);
        BotProperties properties = new BotProperties();

        when(calendarViewService.today()).thenReturn(LocalDate.of(2026, 10, 19));
        when(calendarViewService.todayOccurrences()).thenReturn(List.of(
                Occurrence.builder().name("Standup").start(LocalTime.of(9, 0)).end(LocalTime.of(9, 30)).build(),
                Occurrence.builder().name("Lunch").start(LocalTime.NOON).build()));

        router = new CommandRouter(reminderScheduler, groupConfigService, calendarViewService, catalogService,
                new MessageService(properties), properties);
    }

    @Test
    void shouldKnowItsCommands() {
        assertTrue(router.hasCommand("schedule"));
        assertTrue(router.hasCommand("reminder"));
        assertTrue(router.hasCommand("help"));
        assertFalse(router.hasCommand("status"));
        assertEquals(3, router.listCommands().size());
    }

    @Test
    void shouldReturnScheduleTextAndImage() {
        byte[] image = new byte[] { 7 };
        when(calendarViewService.renderToday()).thenReturn(CompletableFuture.completedFuture(image));

        CommandResult result = execute("schedule", List.of(), MEMBER_CTX);

        assertTrue(result.success());
        assertEquals("Today (2026-10-19):\n• 09:00–09:30 Standup\n• 12:00 Lunch", result.output());
        assertSame(image, result.data());
    }

    @Test
    void shouldReturnTextOnlyWhenRenderFails() {
        when(calendarViewService.renderToday())
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("no browser")));

        CommandResult result = execute("schedule", List.of(), MEMBER_CTX);

        assertTrue(result.success());
        assertNull(result.data());
        assertTrue(result.output().endsWith("Could not render the schedule image."));
    }

    @Test
    void shouldReportReminderStatus() {
        when(groupConfigService.isEnabled(CHAT_ID)).thenReturn(true);
        when(reminderScheduler.getPendingJobs(CHAT_ID))
                .thenReturn(List.of(ReminderJob.builder().id("job-1").groupId(CHAT_ID).build()));

        CommandResult result = execute("reminder", List.of(), MEMBER_CTX);

        assertEquals("Reminders are ON for this chat. Pending today: 1", result.output());
    }

    @Test
    void shouldEnableRemindersForAdmin() {
        when(reminderScheduler.enable(CHAT_ID)).thenReturn(3);

        CommandResult result = execute("reminder", List.of("ON"), ADMIN_CTX);

        assertTrue(result.success());
        assertEquals("Reminders enabled. Pending today: 3", result.output());
        verify(reminderScheduler).enable(CHAT_ID);
    }

    @Test
    void shouldDisableRemindersForAdmin() {
        CommandResult result = execute("reminder", List.of("off"), ADMIN_CTX);

        assertTrue(result.success());
        verify(reminderScheduler).disable(CHAT_ID);
    }

    @Test
    void shouldRejectTogglesFromNonAdmins() {
        CommandResult result = execute("reminder", List.of("on"), MEMBER_CTX);

        assertFalse(result.success());
        verify(reminderScheduler, never()).enable(anyString());
        verify(reminderScheduler, never()).disable(anyString());
    }

    @Test
    void shouldShowUsageForUnknownArgument() {
        CommandResult result = execute("reminder", List.of("maybe"), ADMIN_CTX);

        assertFalse(result.success());
        assertEquals("Usage: /reminder [on|off|reload]", result.output());
    }

    @Test
    void shouldReloadCatalogAndRegenerate() {
        when(catalogService.reload()).thenReturn(ActivityCatalog.empty());

        CommandResult result = execute("reminder", List.of("reload"), ADMIN_CTX);

        assertTrue(result.success());
        assertEquals("Catalog reloaded: 0 activities.", result.output());
        verify(reminderScheduler).regenerateAll();
    }

    @Test
    void shouldKeepJobsWhenReloadFails() {
        when(catalogService.reload()).thenThrow(new ActivityCatalogService.CatalogLoadException("bad json"));

        CommandResult result = execute("reminder", List.of("reload"), ADMIN_CTX);

        assertFalse(result.success());
        assertTrue(result.output().contains("bad json"));
        verify(reminderScheduler, never()).regenerateAll();
    }

    @Test
    void shouldListCommandsInHelp() {
        CommandResult result = execute("help", List.of(), MEMBER_CTX);

        assertTrue(result.output().startsWith("Available commands:"));
        assertTrue(result.output().contains("/reminder [on|off|reload] - "));
    }

    @Test
    void shouldRejectUnknownCommand() {
        CommandResult result = execute("status", List.of(), MEMBER_CTX);

        assertFalse(result.success());
    }

    private CommandResult execute(String command, List<String> args, Map<String, Object> ctx) {
        return router.execute(command, args, ctx).join();
    }
}
