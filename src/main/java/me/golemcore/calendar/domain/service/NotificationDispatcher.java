package me.golemcore.calendar.domain.service;

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

import me.golemcore.calendar.domain.model.Occurrence;
import me.golemcore.calendar.domain.model.ReminderJob;
import me.golemcore.calendar.infrastructure.config.BotProperties;
import me.golemcore.calendar.infrastructure.i18n.MessageService;
import me.golemcore.calendar.port.outbound.NotifierPort;
import me.golemcore.calendar.port.outbound.ScheduleRendererPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Delivers a fired reminder job: renders the day's calendar, composes the
 * reminder text and sends both through {@link NotifierPort}.
 *
 * <p>
 * The group's enabled flag is checked again at delivery time. A failed render
 * degrades to a text-only message. Send failures are logged and dropped; they
 * never reach the scheduler.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationDispatcher {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    /**
     * Shift applied to the clock when drawing the calendar for a reminder, so
     * the upcoming activity shows as running even if the timer fires slightly
     * early.
     */
    static final Duration DISPLAY_OFFSET = ReminderPlanner.LEAD_TIME.plusMinutes(1);

    private final GroupConfigService groupConfigService;
    private final ScheduleRendererPort rendererPort;
    private final NotifierPort notifierPort;
    private final MessageService messageService;
    private final BotProperties properties;

    public void dispatch(ReminderJob job) {
        String groupId = job.getGroupId();
        if (!groupConfigService.isEnabled(groupId)) {
            log.debug("[Reminder] Group {} disabled, dropping job {}", groupId, job.getId());
            return;
        }

        String text = composeText(job.getOccurrences());
        byte[] image = renderCalendar(job);
        deliver(job, text, image);
    }

    /**
     * Build the reminder text for occurrences sharing one start minute.
     */
    public String composeText(List<Occurrence> occurrences) {
        long leadMinutes = ReminderPlanner.LEAD_TIME.toMinutes();
        if (occurrences.size() == 1) {
            Occurrence occurrence = occurrences.get(0);
            return messageService.getMessage("reminder.single",
                    occurrence.getName(), formatTimeRange(occurrence), leadMinutes);
        }

        StringBuilder text = new StringBuilder(messageService.getMessage("reminder.multiple",
                formatTime(occurrences.get(0).getStart()), leadMinutes));
        for (Occurrence occurrence : occurrences) {
            text.append('\n').append(messageService.getMessage("reminder.item",
                    occurrence.getName(), formatTimeRange(occurrence)));
        }
        return text.toString();
    }

    private byte[] renderCalendar(ReminderJob job) {
        List<Occurrence> schedule = job.getDaySchedule() != null && !job.getDaySchedule().isEmpty()
                ? job.getDaySchedule()
                : job.getOccurrences();
        int offset = (int) DISPLAY_OFFSET.toMinutes();
        try {
            return rendererPort.render(schedule, offset)
                    .get(properties.getReminder().getRenderTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Reminder] Render interrupted for job {}", job.getId());
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[Reminder] Calendar render failed for job {}, sending text only: {}",
                    job.getId(), rootMessage(e));
        }
        return null;
    }

    private void deliver(ReminderJob job, String text, byte[] image) {
        try {
            notifierPort.send(job.getGroupId(), text, image)
                    .get(properties.getReminder().getSendTimeout().toMillis(), TimeUnit.MILLISECONDS);
            log.info("[Reminder] Sent job {} to group {} ({} activities{})", job.getId(), job.getGroupId(),
                    job.getOccurrences().size(), image != null ? ", with image" : "");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Reminder] Send interrupted for job {}", job.getId());
        } catch (ExecutionException | TimeoutException e) {
            log.error("[Reminder] Failed to send job {} to group {}: {}", job.getId(), job.getGroupId(),
                    rootMessage(e));
        }
    }

    private String formatTimeRange(Occurrence occurrence) {
        if (!occurrence.hasEnd()) {
            return formatTime(occurrence.getStart());
        }
        return messageService.getMessage("reminder.time.range",
                formatTime(occurrence.getStart()), formatTime(occurrence.getEnd()));
    }

    private static String formatTime(LocalTime time) {
        return TIME_FORMAT.format(time);
    }

    private static String rootMessage(Throwable e) {
        Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
