package me.golemcore.calendar.adapter.outbound.render;

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
import me.golemcore.calendar.infrastructure.config.BotProperties;
import me.golemcore.calendar.infrastructure.i18n.MessageService;
import lombok.Value;
import org.springframework.stereotype.Component;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the HTML page of a day's schedule from the {@code templates/schedule.html}
 * Thymeleaf template: a dated title and two columns of event cards, the first
 * holding the earlier half.
 *
 * <p>
 * A card is highlighted while "now" (shifted by the display offset) lies
 * within its time span; events without an end count as lasting five minutes.
 * The last session of each activity is emphasized.
 */
@Component
public class ScheduleHtmlBuilder {

    private static final String TEMPLATE = "schedule";
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");
    private static final int OPEN_ENDED_SECONDS = 300;

    private final MessageService messageService;
    private final BotProperties properties;
    private final Clock clock;
    private final TemplateEngine templateEngine;

    public ScheduleHtmlBuilder(MessageService messageService, BotProperties properties, Clock clock) {
        this.messageService = messageService;
        this.properties = properties;
        this.clock = clock;

        ClassLoaderTemplateResolver resolver = new ClassLoaderTemplateResolver();
        resolver.setPrefix("templates/");
        resolver.setSuffix(".html");
        resolver.setTemplateMode(TemplateMode.HTML);
        resolver.setCharacterEncoding("UTF-8");
        resolver.setCacheable(true);

        this.templateEngine = new TemplateEngine();
        this.templateEngine.setTemplateResolver(resolver);
    }

    /**
     * @param events
     *            time-ordered events
     * @param displayOffsetMinutes
     *            shift applied to the current time before highlighting, may be
     *            {@code null}
     */
    public String build(List<Occurrence> events, Integer displayOffsetMinutes) {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalTime shiftedNow = displayOffsetMinutes != null
                ? now.plusMinutes(displayOffsetMinutes).toLocalTime()
                : now.toLocalTime();

        Map<String, LocalTime> lastSessions = new HashMap<>();
        for (Occurrence event : events) {
            lastSessions.merge(event.getName(), event.getStart(), (a, b) -> a.isAfter(b) ? a : b);
        }
        List<Card> cards = events.stream()
                .map(event -> new Card(timeLabel(event), event.getName(), isActive(event, shiftedNow),
                        event.getStart().equals(lastSessions.get(event.getName()))))
                .toList();
        int midpoint = (cards.size() + 1) / 2;

        Context context = new Context(Locale.ROOT);
        context.setVariable("title", title(now));
        context.setVariable("firstColumn", messageService.getMessage("calendar.column.first"));
        context.setVariable("secondColumn", messageService.getMessage("calendar.column.second"));
        context.setVariable("firstCards", cards.subList(0, midpoint));
        context.setVariable("secondCards", cards.subList(midpoint, cards.size()));
        context.setVariable("watermark", watermark());
        return templateEngine.process(TEMPLATE, context);
    }

    static boolean isActive(Occurrence event, LocalTime now) {
        int nowSeconds = now.toSecondOfDay();
        int startSeconds = event.getStart().toSecondOfDay();
        int endSeconds = event.hasEnd() ? event.getEnd().toSecondOfDay() : startSeconds + OPEN_ENDED_SECONDS;
        return startSeconds <= nowSeconds && nowSeconds <= endSeconds;
    }

    private String title(LocalDateTime now) {
        String date = DateTimeFormatter.ofPattern(messageService.getMessage("calendar.date.pattern"))
                .format(now);
        String weekday = messageService.weekdayName(now.getDayOfWeek());
        return messageService.getMessage("calendar.title", date, weekday);
    }

    private String watermark() {
        String text = properties.getRender().getWatermark();
        return text == null || text.isBlank() ? null : text;
    }

    private static String timeLabel(Occurrence event) {
        String start = TIME_FORMAT.format(event.getStart());
        return event.hasEnd() ? start + " - " + TIME_FORMAT.format(event.getEnd()) : start;
    }

    /**
     * One event card as seen by the template.
     */
    @Value
    public static class Card {
        String time;
        String name;
        boolean highlighted;
        boolean lastSession;
    }
}
