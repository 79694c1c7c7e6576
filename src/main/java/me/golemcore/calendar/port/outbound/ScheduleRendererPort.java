package me.golemcore.calendar.port.outbound;

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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for rendering a day's calendar view as an image.
 */
public interface ScheduleRendererPort {

    /**
     * Render the given events as a PNG image.
     *
     * @param events
     *            time-ordered events to display
     * @param displayOffsetMinutes
     *            signed shift applied to the "now" marker, or {@code null} for
     *            the current time
     * @return PNG bytes; completes exceptionally when rendering is unavailable
     */
    CompletableFuture<byte[]> render(List<Occurrence> events, Integer displayOffsetMinutes);
}
