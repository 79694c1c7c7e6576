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
 * Text file storage for reminder data: the activity catalog and the per-group
 * settings. Paths are relative to a storage directory such as
 * {@code reminder}.
 */
public interface StoragePort {

    /**
     * Read a UTF-8 text file. Completes with {@code null} when the file does not
     * exist.
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * Replace a text file so that readers see either the old or the new content,
     * never a partial write.
     *
     * @param directory
     *            storage directory
     * @param path
     *            file name within the directory
     * @param content
     *            new content
     * @param backup
     *            keep the replaced content next to the file as {@code <path>.bak}
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup);
}
