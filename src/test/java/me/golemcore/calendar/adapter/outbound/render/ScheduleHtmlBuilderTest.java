package me.golemcore.calendar.adapter.outbound.render;

import me.golemcore.calendar.domain.model.Occurrence;
import me.golemcore.calendar.infrastructure.config.BotProperties;
import me.golemcore.calendar.infrastructure.i18n.MessageService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleHtmlBuilderTest {

    private static final Pattern CARD = Pattern.compile("<div class=\"card( highlight)?\">");

    private BotProperties properties;
    private ScheduleHtmlBuilder builder;

    @BeforeEach
    void setUp() {
        properties = new BotProperties();
        Clock clock = Clock.fixed(Instant.parse("2026-10-19T08:55:00Z"), ZoneOffset.UTC);
        builder = new ScheduleHtmlBuilder(new MessageService(properties), properties, clock);
    }

    @Test
    void shouldRenderDatedTitle() {
        String html = builder.build(List.of(event("Standup", 9, 0, 9, 30)), null);

        assertTrue(html.contains("2026-10-19 · Monday"));
    }

    @Test
    void shouldPutEarlierHalfInFirstColumn() {
        List<Occurrence> events = List.of(
                event("A", 9, 0, 9, 30),
                event("B", 12, 0, 12, 30),
                event("C", 15, 0, 15, 30));

        String html = builder.build(events, null);

        int secondColumn = html.indexOf("<div class=\"section-title\">Later</div>");
        assertTrue(secondColumn > 0);
        assertEquals(2, countCards(html.substring(0, secondColumn)));
        assertEquals(1, countCards(html.substring(secondColumn)));
    }

    @Test
    void shouldHighlightEventRunningAtShiftedTime() {
        List<Occurrence> events = List.of(event("Standup", 9, 0, 9, 30), event("Lunch", 12, 0, 13, 0));

        assertFalse(builder.build(events, null).contains("card highlight"));

        String shifted = builder.build(events, 10);
        int highlight = shifted.indexOf("card highlight");
        assertTrue(highlight > 0);
        assertTrue(shifted.indexOf("Standup", highlight) < shifted.indexOf("Lunch", highlight));
        assertEquals(1, Pattern.compile("card highlight").matcher(shifted).results().count());
    }

    @Test
    void shouldHighlightUpcomingEventWhenReminderFiresSlightlyEarly() {
        Clock early = Clock.fixed(Instant.parse("2026-10-19T08:49:59.999Z"), ZoneOffset.UTC);
        ScheduleHtmlBuilder earlyBuilder = new ScheduleHtmlBuilder(new MessageService(properties), properties, early);

        String html = earlyBuilder.build(List.of(event("Standup", 9, 0, 9, 30)), 11);

        assertTrue(html.contains("<div class=\"card highlight\"><div class=\"time\">09:00 - 09:30</div>"));
    }

    @Test
    void shouldTreatOpenEndedEventAsFiveMinutes() {
        Occurrence open = Occurrence.builder().name("Roll call").start(LocalTime.of(9, 0)).build();

        assertTrue(ScheduleHtmlBuilder.isActive(open, LocalTime.of(9, 5)));
        assertFalse(ScheduleHtmlBuilder.isActive(open, LocalTime.of(9, 5, 1)));
        assertFalse(ScheduleHtmlBuilder.isActive(open, LocalTime.of(8, 59, 59)));
    }

    @Test
    void shouldEmphasizeLastSessionOfActivity() {
        List<Occurrence> events = List.of(
                event("Drill", 9, 0, 9, 30),
                event("Lunch", 12, 0, 13, 0),
                event("Drill", 17, 0, 17, 30));

        String html = builder.build(events, null);

        assertEquals(2, Pattern.compile("name last-session\">(Lunch|Drill)<").matcher(html).results().count());
        assertTrue(html.contains("<div class=\"time\">09:00 - 09:30</div><div class=\"name\">Drill</div>"));
        assertTrue(html.contains("<div class=\"time\">17:00 - 17:30</div><div class=\"name last-session\">Drill</div>"));
    }

    @Test
    void shouldEscapeActivityNames() {
        String html = builder.build(List.of(event("<b>Q&A</b>", 9, 0, 9, 30)), null);

        assertTrue(html.contains("&lt;b&gt;Q&amp;A&lt;/b&gt;"));
        assertFalse(html.contains("<b>Q&A</b>"));
    }

    @Test
    void shouldKeepExpressionLikeNamesAsPlainText() {
        String html = builder.build(List.of(event("${title} & [[x]]", 9, 0, 9, 30)), null);

        assertTrue(html.contains("<div class=\"name last-session\">${title} &amp; [[x]]</div>"));
    }

    @Test
    void shouldRenderOpenEndedEventWithStartOnly() {
        Occurrence open = Occurrence.builder().name("Roll call").start(LocalTime.of(9, 0)).build();

        String html = builder.build(List.of(open), 6);

        assertTrue(html.contains("<div class=\"card highlight\"><div class=\"time\">09:00</div>"));
    }

    @Test
    void shouldRenderWatermarkOnlyWhenConfigured() {
        assertFalse(builder.build(List.of(), null).contains("class=\"watermark\""));

        properties.getRender().setWatermark("@calendar_bot");

        assertTrue(builder.build(List.of(), null).contains("<div class=\"watermark\">@calendar_bot</div>"));
    }

    private static int countCards(String html) {
        Matcher matcher = CARD.matcher(html);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    private static Occurrence event(String name, int startHour, int startMinute, int endHour, int endMinute) {
        return Occurrence.builder()
                .name(name)
                .start(LocalTime.of(startHour, startMinute))
                .end(LocalTime.of(endHour, endMinute))
                .build();
    }
}
