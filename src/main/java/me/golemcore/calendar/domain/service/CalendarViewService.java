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
import me.golemcore.calendar.infrastructure.i18n.MessageService;
import me.golemcore.calendar.port.outbound.ScheduleRendererPort;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Read-only view of today's calendar for commands.
 */
@Service
@RequiredArgsConstructor
public class CalendarViewService {

    private final ActivityCatalogService catalogService;
    private final OccurrenceDeriver occurrenceDeriver;
    private final ScheduleRendererPort rendererPort;
    private final MessageService messageService;
    private final Clock clock;

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    /**
     * Today's occurrences, or a single placeholder entry when the day is empty.
     */
    public List<Occurrence> todayOccurrences() {
        List<Occurrence> occurrences = occurrenceDeriver.deriveDay(catalogService.getCatalog(),
                today().getDayOfWeek());
        return occurrenceDeriver.withPlaceholder(occurrences, messageService.getMessage("calendar.placeholder"));
    }

    public CompletableFuture<byte[]> renderToday() {
        return rendererPort.render(todayOccurrences(), null);
    }
}
