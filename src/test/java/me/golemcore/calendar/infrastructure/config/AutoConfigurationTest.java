package me.golemcore.calendar.infrastructure.config;

import me.golemcore.calendar.port.inbound.ChannelPort;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class AutoConfigurationTest {

    @Test
    void shouldStartOnlyEnabledChannels() {
        BotProperties properties = new BotProperties();
        BotProperties.ChannelProperties telegram = new BotProperties.ChannelProperties();
        telegram.setEnabled(true);
        properties.getChannels().put("telegram", telegram);

        ChannelPort enabled = mock(ChannelPort.class);
        when(enabled.getChannelType()).thenReturn("telegram");
        ChannelPort unconfigured = mock(ChannelPort.class);
        when(unconfigured.getChannelType()).thenReturn("discord");

        new AutoConfiguration(properties, List.of(enabled, unconfigured)).startChannels();

        verify(enabled).start();
        verify(unconfigured, never()).start();
    }

    @Test
    void shouldConfigureReminderTaskScheduler() {
        BotProperties properties = new BotProperties();
        properties.getReminder().setSchedulerPoolSize(0);

        ThreadPoolTaskScheduler scheduler = new AutoConfiguration(properties, List.of()).reminderTaskScheduler();

        assertEquals("reminder-", scheduler.getThreadNamePrefix());
        assertTrue(scheduler.isDaemon());
    }

    @Test
    void shouldSerializeDatesAsText() throws Exception {
        ObjectMapper mapper = AutoConfiguration.objectMapper();

        assertEquals("\"2026-10-19\"", mapper.writeValueAsString(LocalDate.of(2026, 10, 19)));
    }

    @Test
    void shouldExposeDefaultReminderSettings() {
        BotProperties properties = new BotProperties();

        assertEquals("reminder", properties.getReminder().getDirectory());
        assertEquals("activities.json", properties.getReminder().getCatalogFile());
        assertEquals("groups.json", properties.getReminder().getConfigFile());
        assertTrue(properties.getRender().isEnabled());
    }
}
