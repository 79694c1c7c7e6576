package me.golemcore.calendar.adapter.inbound.telegram;

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
import me.golemcore.calendar.infrastructure.config.BotProperties;
import me.golemcore.calendar.infrastructure.i18n.MessageService;
import me.golemcore.calendar.port.inbound.ChannelPort;
import me.golemcore.calendar.port.inbound.CommandPort;
import me.golemcore.calendar.port.outbound.NotifierPort;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.client.okhttp.OkHttpTelegramClient;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.longpolling.util.LongPollingSingleThreadUpdateConsumer;
import org.telegram.telegrambots.meta.api.methods.groupadministration.GetChatMember;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.send.SendPhoto;
import org.telegram.telegrambots.meta.api.objects.InputFile;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.chatmember.ChatMember;
import org.telegram.telegrambots.meta.api.objects.message.Message;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.io.ByteArrayInputStream;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Telegram channel adapter using long polling.
 *
 * <p>
 * Implements {@link ChannelPort} for command replies, {@link NotifierPort} for
 * reminder delivery and {@link LongPollingSingleThreadUpdateConsumer} for
 * inbound updates. Group ids are Telegram chat ids.
 *
 * <p>
 * Features:
 * <ul>
 * <li>Slash command routing via {@link CommandPort}
 * <li>Admin detection: configured admins, private chats, chat creators and
 * administrators
 * <li>Photo with caption, or photo followed by text when the caption would
 * exceed Telegram's limit
 * </ul>
 *
 * <p>
 * The adapter is always available as a Spring bean but only starts polling if
 * {@code bot.channels.telegram.enabled=true} and a token is configured. A
 * {@link ChannelConnectedEvent} is published once polling starts.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TelegramAdapter implements ChannelPort, NotifierPort, LongPollingSingleThreadUpdateConsumer {

    static final String CHANNEL_TYPE = "telegram";
    static final String SCHEDULE_FILENAME = "schedule.png";
    private static final int TELEGRAM_MAX_MESSAGE_LENGTH = 4096;
    private static final int TELEGRAM_MAX_CAPTION_LENGTH = 1024;
    private static final Set<String> ADMIN_STATUSES = Set.of("creator", "administrator");

    private final BotProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final TelegramBotsLongPollingApplication botsApplication;
    private final MessageService messageService;
    private final ObjectProvider<CommandPort> commandRouter;

    private TelegramClient telegramClient;
    private volatile boolean running = false;
    private volatile boolean initialized = false;
    private final Object lifecycleLock = new Object();

    /**
     * Package-private setter for testing, allows injecting a mock TelegramClient.
     */
    void setTelegramClient(TelegramClient client) {
        this.telegramClient = client;
        this.initialized = true;
    }

    private BotProperties.ChannelProperties channelProperties() {
        return properties.getChannels().get(CHANNEL_TYPE);
    }

    private boolean isEnabled() {
        BotProperties.ChannelProperties channel = channelProperties();
        return channel != null && channel.isEnabled();
    }

    private String token() {
        BotProperties.ChannelProperties channel = channelProperties();
        return channel != null ? channel.getToken() : null;
    }

    private synchronized void ensureInitialized() {
        if (initialized || !isEnabled()) {
            return;
        }
        String token = token();
        if (token == null || token.isBlank()) {
            log.warn("Telegram token not configured, adapter will not start");
            return;
        }
        this.telegramClient = new OkHttpTelegramClient(token);
        initialized = true;
    }

    @Override
    public String getChannelType() {
        return CHANNEL_TYPE;
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                log.debug("Telegram adapter already running");
                return;
            }
            if (!isEnabled()) {
                log.info("Telegram channel disabled");
                return;
            }
            ensureInitialized();
            if (telegramClient == null) {
                log.warn("Telegram client not initialized, cannot start");
                return;
            }

            try {
                botsApplication.registerBot(token(), this);
                running = true;
                log.info("Telegram adapter started");
            } catch (TelegramApiException e) {
                if (e.getMessage() != null && e.getMessage().contains("already registered")) {
                    running = true;
                    log.warn("Telegram bot already registered; keeping existing polling session active");
                } else {
                    log.error("Failed to start Telegram adapter", e);
                    return;
                }
            }
        }
        eventPublisher.publishEvent(new ChannelConnectedEvent(CHANNEL_TYPE));
    }

    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            running = false;
            try {
                botsApplication.close();
                log.info("Telegram adapter stopped");
            } catch (Exception e) {
                log.error("Error stopping Telegram adapter", e);
            }
        }
    }

    @PreDestroy
    public void destroy() {
        stop();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public void consume(Update update) {
        if (update.hasMessage() && update.getMessage().hasText()) {
            handleMessage(update.getMessage());
        }
    }

    private void handleMessage(Message telegramMessage) {
        String text = telegramMessage.getText().trim();
        if (!text.startsWith("/")) {
            return;
        }

        String chatId = telegramMessage.getChatId().toString();
        String userId = telegramMessage.getFrom() != null ? telegramMessage.getFrom().getId().toString() : null;

        String[] parts = text.split("\\s+", 2);
        String cmd = parts[0].substring(1).split("@")[0]; // strip / and @botname

        CommandPort router = commandRouter.getIfAvailable();
        if (router == null || !router.hasCommand(cmd)) {
            log.debug("Ignoring unknown command /{} in chat {}", cmd, chatId);
            return;
        }

        List<String> args = parts.length > 1
                ? Arrays.asList(parts[1].split("\\s+"))
                : List.of();
        boolean privateChat = telegramMessage.getChat() != null && telegramMessage.getChat().isUserChat();
        Map<String, Object> ctx = Map.<String, Object>of(
                "chatId", chatId,
                "channelType", CHANNEL_TYPE,
                "admin", isAdmin(chatId, userId, privateChat));

        try {
            CommandPort.CommandResult result = router.execute(cmd, args, ctx).join();
            if (result.data() instanceof byte[] image && image.length > 0) {
                send(chatId, result.output(), image).join();
            } else {
                sendMessage(chatId, result.output());
            }
        } catch (Exception e) {
            log.error("Command execution failed: /{}", cmd, e);
            sendMessage(chatId, messageService.getMessage("command.failed", e.getMessage()));
        }
    }

    /**
     * Whether the user may change reminder settings in this chat.
     */
    boolean isAdmin(String chatId, String userId, boolean privateChat) {
        if (userId == null) {
            return false;
        }
        BotProperties.ChannelProperties channel = channelProperties();
        if (channel != null && channel.getAdmins().contains(userId)) {
            return true;
        }
        if (privateChat) {
            return true;
        }
        try {
            ChatMember member = telegramClient.execute(GetChatMember.builder()
                    .chatId(chatId)
                    .userId(Long.parseLong(userId))
                    .build());
            return member != null && ADMIN_STATUSES.contains(member.getStatus());
        } catch (TelegramApiException | NumberFormatException e) {
            log.warn("Failed to resolve chat role of user {} in chat {}: {}", userId, chatId, e.getMessage());
            return false;
        }
    }

    @Override
    public CompletableFuture<Void> send(String groupId, String text, byte[] image) {
        if (image == null || image.length == 0) {
            return sendMessage(groupId, text);
        }
        if (text == null || text.length() <= TELEGRAM_MAX_CAPTION_LENGTH) {
            return sendPhoto(groupId, image, SCHEDULE_FILENAME, text);
        }
        return sendPhoto(groupId, image, SCHEDULE_FILENAME, null)
                .thenCompose(ignored -> sendMessage(groupId, text));
    }

    @Override
    public CompletableFuture<Void> sendMessage(String chatId, String content) {
        return CompletableFuture.runAsync(() -> {
            String text = content;
            if (text.length() > TELEGRAM_MAX_MESSAGE_LENGTH) {
                text = text.substring(0, TELEGRAM_MAX_MESSAGE_LENGTH - 3) + "...";
            }
            try {
                telegramClient.execute(SendMessage.builder()
                        .chatId(chatId)
                        .text(text)
                        .build());
            } catch (TelegramApiException e) {
                log.error("Failed to send message to chat: {}", chatId, e);
                throw new IllegalStateException("Failed to send message", e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> sendPhoto(String chatId, byte[] imageData,
            String filename, String caption) {
        return CompletableFuture.runAsync(() -> {
            try {
                SendPhoto.SendPhotoBuilder<?, ?> builder = SendPhoto.builder()
                        .chatId(chatId)
                        .photo(new InputFile(new ByteArrayInputStream(imageData), filename));

                if (caption != null && !caption.isBlank()) {
                    builder.caption(caption);
                }

                telegramClient.execute(builder.build());
                log.debug("Sent photo '{}' ({} bytes) to chat: {}", filename, imageData.length, chatId);
            } catch (TelegramApiException e) {
                log.error("Failed to send photo '{}' to chat: {}", filename, chatId, e);
                throw new IllegalStateException("Failed to send photo", e);
            }
        });
    }
}
