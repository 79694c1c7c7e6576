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

import java.util.concurrent.CompletableFuture;

/**
 * Port for delivering a reminder to a single destination.
 */
public interface NotifierPort {

    /**
     * Deliver a text with an optional image to the given group.
     *
     * @param groupId
     *            destination chat id
     * @param text
     *            message text
     * @param image
     *            PNG bytes, or {@code null} for a text-only message
     * @return completes normally on success, exceptionally on delivery failure
     */
    CompletableFuture<Void> send(String groupId, String text, byte[] image);
}
