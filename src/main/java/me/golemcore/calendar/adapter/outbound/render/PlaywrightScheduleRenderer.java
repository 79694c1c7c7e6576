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
import me.golemcore.calendar.port.outbound.ScheduleRendererPort;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.options.ScreenshotType;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Playwright implementation of {@link ScheduleRendererPort}.
 *
 * <p>
 * Loads the page from {@link ScheduleHtmlBuilder} into headless Chromium,
 * sizes the viewport to the {@code .page} element and returns a PNG
 * screenshot of it.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code bot.render.enabled} - Enable/disable rendering
 * <li>{@code bot.render.headless} - Run in headless mode
 * <li>{@code bot.render.timeout} - Page operation timeout (ms)
 * </ul>
 *
 * <p>
 * Lazy initialization: Browser is only launched on first use. Playwright
 * objects are not thread-safe, so pages are rendered one at a time.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PlaywrightScheduleRenderer implements ScheduleRendererPort {

    private static final String PAGE_SELECTOR = ".page";
    private static final String PAGE_SIZE_SCRIPT = """
            () => {
                const rect = document.querySelector('.page').getBoundingClientRect();
                return { width: Math.ceil(rect.width), height: Math.ceil(rect.height) };
            }
            """;

    private final BotProperties properties;
    private final ScheduleHtmlBuilder htmlBuilder;

    private Playwright playwright;
    private Browser browser;
    private volatile boolean initialized = false;

    @Override
    public CompletableFuture<byte[]> render(List<Occurrence> events, Integer displayOffsetMinutes) {
        return CompletableFuture.supplyAsync(() -> {
            if (!properties.getRender().isEnabled()) {
                throw new IllegalStateException("Calendar rendering is disabled");
            }
            String html = htmlBuilder.build(events, displayOffsetMinutes);
            return screenshot(html);
        });
    }

    @SuppressWarnings("PMD.UseTryWithResources")
    private synchronized byte[] screenshot(String html) {
        ensureInitialized();
        if (!isAvailable()) {
            throw new IllegalStateException("Browser not available");
        }

        Page page = browser.newPage();
        try {
            page.setDefaultTimeout(properties.getRender().getTimeout());
            page.setContent(html);
            page.waitForSelector(PAGE_SELECTOR);

            Object size = page.evaluate(PAGE_SIZE_SCRIPT);
            if (size instanceof Map<?, ?> dimensions) {
                int width = toInt(dimensions.get("width"));
                int height = toInt(dimensions.get("height"));
                if (width > 0 && height > 0) {
                    page.setViewportSize(width, height);
                }
            }
            return page.screenshot(new Page.ScreenshotOptions()
                    .setType(ScreenshotType.PNG)
                    .setFullPage(false));
        } finally {
            page.close();
        }
    }

    @SuppressWarnings("PMD.CloseResource")
    private void ensureInitialized() {
        if (initialized) {
            return;
        }

        Playwright pw = null;
        try {
            pw = Playwright.create();
            Browser br = pw.chromium().launch(new BrowserType.LaunchOptions()
                    .setHeadless(properties.getRender().isHeadless()));
            this.browser = br;
            this.playwright = pw;
            initialized = true;
            log.info("[Render] Playwright browser initialized (headless: {})", properties.getRender().isHeadless());
        } catch (Exception e) {
            log.warn("[Render] Failed to initialize Playwright: {}", e.getMessage());
            if (pw != null) {
                try {
                    pw.close();
                } catch (Exception ex) {
                    log.trace("Error closing browser resource: {}", ex.getMessage());
                }
            }
        }
    }

    public boolean isAvailable() {
        return properties.getRender().isEnabled() && browser != null && browser.isConnected();
    }

    @PreDestroy
    public synchronized void close() {
        try {
            if (browser != null) {
                browser.close();
            }
            if (playwright != null) {
                playwright.close();
            }
            if (initialized) {
                log.info("[Render] Playwright browser closed");
            }
        } catch (Exception e) {
            log.error("[Render] Error closing Playwright browser", e);
        } finally {
            browser = null;
            playwright = null;
            initialized = false;
        }
    }

    private static int toInt(Object value) {
        return value instanceof Number number ? number.intValue() : 0;
    }
}
