package me.golemcore.loom.port.outbound;

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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Durable text records grouped in sub-directories of the data directory.
 *
 * <p>
 * Implementations own the data directory exclusively for their lifetime.
 */
public interface StoragePort {

    /**
     * Atomically write text content to a record.
     *
     * <p>
     * Guarantees crash-safe writes via:
     * <ol>
     * <li>Write to temporary file (.tmp suffix)</li>
     * <li>fsync to ensure data is on disk</li>
     * <li>Atomic rename of .tmp to target</li>
     * </ol>
     * A reader sees either the old content or the new content, never a mix.
     *
     * @param directory
     *            subdirectory (e.g., "nodes", "roots", "journal")
     * @param path
     *            relative path within directory
     * @param content
     *            text content to write
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content);

    /**
     * Read text content of a record, or {@code null} when it does not exist.
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * Delete a record. Deleting a missing record is not an error.
     */
    CompletableFuture<Void> deleteObject(String directory, String path);

    /**
     * List record paths by prefix, relative to the directory.
     */
    CompletableFuture<List<String>> listObjects(String directory, String prefix);
}
