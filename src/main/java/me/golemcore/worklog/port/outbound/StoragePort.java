package me.golemcore.worklog.port.outbound;

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
import java.util.function.UnaryOperator;

/**
 * Port for persistent storage operations within the local workspace. Provides
 * text file operations organized by directory (journal, hooks, ...) plus a
 * locked read-modify-write primitive for records that must be merged rather
 * than overwritten.
 */
public interface StoragePort {

    /**
     * Write text content to file.
     *
     * @param directory
     *            subdirectory (e.g., "journal")
     * @param path
     *            relative path within directory
     * @param content
     *            text content
     */
    CompletableFuture<Void> putText(String directory, String path, String content);

    /**
     * Read text content from file. Completes with null when the file does not
     * exist.
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * Check if file exists.
     */
    CompletableFuture<Boolean> exists(String directory, String path);

    /**
     * Delete a file.
     */
    CompletableFuture<Void> deleteObject(String directory, String path);

    /**
     * Delete a directory and everything below it. Missing directories are
     * ignored.
     */
    CompletableFuture<Void> deleteDirectory(String directory, String path);

    /**
     * List files by prefix, as paths relative to {@code directory}.
     */
    CompletableFuture<List<String>> listObjects(String directory, String prefix);

    /**
     * List the immediate subdirectory names of {@code directory}.
     */
    CompletableFuture<List<String>> listDirectories(String directory);

    /**
     * Total size in bytes of the regular files below {@code directory}.
     */
    CompletableFuture<Long> sizeOf(String directory);

    /**
     * Atomically write text content to file with optional backup.
     *
     * <p>
     * Guarantees crash-safe writes via:
     * <ol>
     * <li>Write to temporary file (.tmp suffix)</li>
     * <li>fsync to ensure data is on disk</li>
     * <li>If backup enabled: copy existing file to .bak</li>
     * <li>Atomic rename of .tmp to target</li>
     * </ol>
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup);

    /**
     * Read, transform and atomically rewrite one file while holding an
     * exclusive lock scoped to that file. The lock excludes other threads and
     * other processes using the same storage, so concurrent updates of one file
     * are serialized and none is lost. Updates of different files do not
     * contend.
     *
     * <p>
     * The updater receives the current content (null when the file does not
     * exist) and returns the content to write.
     *
     * @return future completing with the written content, or failing with
     *         {@link StorageLockException} when the lock could not be acquired
     *         within the configured attempts
     */
    CompletableFuture<String> updateTextLocked(String directory, String path, UnaryOperator<String> updater);

    /**
     * Ensure directory exists.
     */
    CompletableFuture<Void> ensureDirectory(String directory);
}
