package me.golemcore.calendar.adapter.inbound.command;

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

import me.golemcore.calendar.auto.ReminderScheduler;
import me.golemcore.calendar.domain.model.ActivityCatalog;
import me.golemcore.calendar.domain.model.Occurrence;
import me.golemcore.calendar.domain.service.ActivityCatalogService;
import me.golemcore.calendar.domain.service.CalendarViewService;
import me.golemcore.calendar.domain.service.GroupConfigService;
import me.golemcore.calendar.infrastructure.config.BotProperties;
import me.golemcore.calendar.infrastructure.i18n.MessageService;
import me.golemcore.calendar.port.inbound.CommandPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Slash command router for the calendar bot.
 *
 * <p>
 * Supported commands:
 * <ul>
 * <li>{@code /schedule} - today's schedule as text plus a rendered image
 * <li>{@code /reminder} - reminder status for the current chat
 * <li>{@code /reminder on|off} - toggle reminders (admins only)
 * <li>{@code /reminder reload} - re-read the activity catalog and rebuild
 * today's reminders (admins only)
 * <li>{@code /help} - list commands
 * </ul>
 *
 * <p>
 * Expects {@code chatId} and {@code admin} in the execution context.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CommandRouter implements CommandPort {

    private static final String CMD_SCHEDULE = "schedule";
    private static final String CMD_REMINDER = "reminder";
    private static final String CMD_HELP = "help";
    private static final String SUBCMD_ON = "on";
    private static final String SUBCMD_OFF = "off";
    private static final String SUBCMD_RELOAD = "reload";
    private static final Set<String> KNOWN_COMMANDS = Set.of(CMD_SCHEDULE, CMD_REMINDER, CMD_HELP);
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    private final ReminderScheduler reminderScheduler;
    private final GroupConfigService groupConfigService;
    private final CalendarViewService calendarViewService;
    private final ActivityCatalogService catalogService;
    private final MessageService messageService;
    private final BotProperties properties;

    @Override
    public CompletableFuture<CommandResult> execute(String command, List<String> args, Map<String, Object> context) {
        return CompletableFuture.supplyAsync(() -> {
            String chatId = (String) context.get("chatId");
            boolean admin = Boolean.TRUE.equals(context.get("admin"));
            log.debug("Executing command: /{} (chat={})", command, chatId);
            if (!hasCommand(command)) {
                return CommandResult.failure(msg("command.unknown", command));
            }

            return switch (command) {
            case CMD_SCHEDULE -> handleSchedule();
            case CMD_REMINDER -> handleReminder(args, chatId, admin);
            case CMD_HELP -> handleHelp();
            default -> CommandResult.failure(msg("command.unknown", command));
            };
        });
    }

    @Override
    public boolean hasCommand(String command) {
        return KNOWN_COMMANDS.contains(command);
    }

    @Override
    public List<CommandDefinition> listCommands() {
        return List.of(
                new CommandDefinition(CMD_SCHEDULE, msg("command.help.schedule"), "/schedule"),
                new CommandDefinition(CMD_REMINDER, msg("command.help.reminder"), "/reminder [on|off|reload]"),
                new CommandDefinition(CMD_HELP, msg("command.help.help"), "/help"));
    }

    private CommandResult handleSchedule() {
        List<Occurrence> occurrences = calendarViewService.todayOccurrences();
        StringBuilder sb = new StringBuilder(msg("command.schedule.title", calendarViewService.today().toString()));
        for (Occurrence occurrence : occurrences) {
            sb.append('\n').append(msg("command.schedule.item", timeLabel(occurrence), occurrence.getName()));
        }

        try {
            byte[] image = calendarViewService.renderToday()
                    .get(properties.getReminder().getRenderTimeout().toMillis(), TimeUnit.MILLISECONDS);
            return CommandResult.success(sb.toString(), image);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Schedule render failed: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        }
        sb.append("\n\n").append(msg("command.schedule.renderFailed"));
        return CommandResult.success(sb.toString());
    }

    private CommandResult handleReminder(List<String> args, String chatId, boolean admin) {
        if (chatId == null) {
            return CommandResult.failure(msg("command.reminder.usage"));
        }
        if (args.isEmpty()) {
            boolean enabled = groupConfigService.isEnabled(chatId);
            String state = msg(enabled ? "command.reminder.on" : "command.reminder.off");
            return CommandResult.success(msg("command.reminder.status", state,
                    reminderScheduler.getPendingJobs(chatId).size()));
        }

        String subcommand = args.get(0).toLowerCase(Locale.ROOT);
        if (!Set.of(SUBCMD_ON, SUBCMD_OFF, SUBCMD_RELOAD).contains(subcommand)) {
            return CommandResult.failure(msg("command.reminder.usage"));
        }
        if (!admin) {
            return CommandResult.failure(msg("command.reminder.adminOnly"));
        }

        return switch (subcommand) {
        case SUBCMD_ON -> CommandResult.success(msg("command.reminder.enabled", reminderScheduler.enable(chatId)));
        case SUBCMD_OFF -> {
            reminderScheduler.disable(chatId);
            yield CommandResult.success(msg("command.reminder.disabled"));
        }
        default -> handleReload();
        };
    }

    private CommandResult handleReload() {
        try {
            ActivityCatalog catalog = catalogService.reload();
            reminderScheduler.regenerateAll();
            return CommandResult.success(msg("command.reminder.reloaded", catalog.size()));
        } catch (ActivityCatalogService.CatalogLoadException e) {
            log.warn("Catalog reload failed: {}", e.getMessage());
            return CommandResult.failure(msg("command.reminder.reloadFailed", e.getMessage()));
        }
    }

    private CommandResult handleHelp() {
        StringBuilder sb = new StringBuilder(msg("command.help.title"));
        for (CommandDefinition command : listCommands()) {
            sb.append('\n').append(msg("command.help.item", command.usage(), command.description()));
        }
        return CommandResult.success(sb.toString());
    }

    private String timeLabel(Occurrence occurrence) {
        String start = TIME_FORMAT.format(occurrence.getStart());
        if (!occurrence.hasEnd()) {
            return start;
        }
        return msg("reminder.time.range", start, TIME_FORMAT.format(occurrence.getEnd()));
    }

    private String msg(String key, Object... args) {
        return messageService.getMessage(key, args);
    }
}
