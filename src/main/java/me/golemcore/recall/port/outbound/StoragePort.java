package me.golemcore.recall.port.outbound;

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

import me.golemcore.recall.domain.model.StoredObjectInfo;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for persistent storage of session files and project state within the
 * local workspace. Files are organized by directory ({@code context_cache},
 * {@code projects}, {@code archive}); every write replaces the target
 * atomically so readers observe either the old or the new content.
 */
public interface StoragePort {

    /**
     * Atomically write text content to a file.
     *
     * <p>
     * Content goes to a uniquely named temporary sibling first, is fsynced, and
     * is then renamed over the target. Concurrent readers never see a partially
     * written file.
     *
     * @param directory
     *            subdirectory (e.g., "context_cache", "projects")
     * @param path
     *            relative path within directory
     * @param content
     *            text content to write
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content);

    /**
     * Read text content from file, or {@code null} if it does not exist.
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * Delete a file. Deleting a missing file is not an error.
     */
    CompletableFuture<Void> deleteObject(String directory, String path);

    /**
     * Copy a file, replacing the target atomically.
     */
    CompletableFuture<Void> copyObject(String sourceDirectory, String sourcePath,
            String targetDirectory, String targetPath);

    /**
     * List regular files under a subpath (empty for the whole directory), as
     * paths relative to the directory.
     * Temporary write files are never listed.
     */
    CompletableFuture<List<String>> listObjects(String directory, String prefix);

    /**
     * Size and modification time of a file, or {@code null} if it does not
     * exist.
     */
    CompletableFuture<StoredObjectInfo> stat(String directory, String path);

    /**
     * Set the modification time of an existing file.
     */
    CompletableFuture<Void> setLastModified(String directory, String path, Instant instant);

    /**
     * Absolute location of a file, for diagnostics and acknowledgements.
     */
    String resolveLocation(String directory, String path);
}
